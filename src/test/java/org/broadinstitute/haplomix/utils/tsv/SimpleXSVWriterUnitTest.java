package org.broadinstitute.haplomix.utils.tsv;

import org.broadinstitute.haplomix.HaplomixBaseTest;
import org.broadinstitute.haplomix.exceptions.HaplomixException;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public final class SimpleXSVWriterUnitTest extends HaplomixBaseTest {

    @Test
    public void testWriteByIndexAndHeading() throws IOException {
        final StringWriter out = new StringWriter();
        try (final SimpleXSVWriter writer = new SimpleXSVWriter(out, TableUtils.COLUMN_SEPARATOR)) {
            writer.setHeaderLine(Arrays.asList("A", "B", "C"));
            writer.getNewLineBuilder().setColumn("B", "2").setColumn(0, "1").setColumn("C", "3").write();
            writer.getNewLineBuilder().setRow(Arrays.asList("x", "y", "z")).write();
            Assert.assertEquals(writer.getIndexForColumn("C"), 2);
        }
        Assert.assertEquals(out.toString(), "A\tB\tC\n1\t2\t3\nx\ty\tz\n");
    }

    @Test
    public void testPendingLineIsWrittenOnNextLineAndClose() throws IOException {
        final Path path = createTempFile("pending", ".tsv").toPath();
        try (final SimpleXSVWriter writer = new SimpleXSVWriter(path, ',')) {
            writer.setHeaderLine(Arrays.asList("A", "B"));
            writer.getNewLineBuilder().setColumn("A", "1").fill("NA");
            writer.getNewLineBuilder().setRow(Arrays.asList("2", "3"));
        }
        final List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        Assert.assertEquals(lines, Arrays.asList("A,B", "1,NA", "2,3"));
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testIncompleteLine() throws IOException {
        try (final SimpleXSVWriter writer = new SimpleXSVWriter(new StringWriter(), TableUtils.COLUMN_SEPARATOR)) {
            writer.setHeaderLine(Arrays.asList("A", "B"));
            writer.getNewLineBuilder().setColumn("A", "1").write();
        }
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testAlterationAfterWrite() {
        final SimpleXSVWriter writer = new SimpleXSVWriter(new StringWriter(), TableUtils.COLUMN_SEPARATOR);
        writer.setHeaderLine(Collections.singletonList("A"));
        final SimpleXSVWriter.LineBuilder line = writer.getNewLineBuilder().setColumn(0, "1");
        line.write();
        line.setColumn(0, "2");
    }

    @Test(expectedExceptions = HaplomixException.class)
    public void testDuplicateColumnNames() {
        new SimpleXSVWriter(new StringWriter(), TableUtils.COLUMN_SEPARATOR).setHeaderLine(Arrays.asList("A", "A"));
    }

    @Test(expectedExceptions = HaplomixException.class)
    public void testHeaderSetTwice() {
        final SimpleXSVWriter writer = new SimpleXSVWriter(new StringWriter(), TableUtils.COLUMN_SEPARATOR);
        writer.setHeaderLine(Collections.singletonList("A"));
        writer.setHeaderLine(Collections.singletonList("B"));
    }

    @Test(expectedExceptions = HaplomixException.class)
    public void testLineBeforeHeader() {
        new SimpleXSVWriter(new StringWriter(), TableUtils.COLUMN_SEPARATOR).getNewLineBuilder();
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testUnknownColumn() {
        final SimpleXSVWriter writer = new SimpleXSVWriter(new StringWriter(), TableUtils.COLUMN_SEPARATOR);
        writer.setHeaderLine(Collections.singletonList("A"));
        writer.getNewLineBuilder().setColumn("B", "1");
    }
}
