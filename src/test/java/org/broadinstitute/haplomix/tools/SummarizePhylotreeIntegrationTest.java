package org.broadinstitute.haplomix.tools;

import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.haplomix.CommandLineProgramTest;
import org.broadinstitute.haplomix.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.haplomix.exceptions.UserException;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

public final class SummarizePhylotreeIntegrationTest extends CommandLineProgramTest {

    private static final File TREE = new File(getTestDataDir(), "phylotree.csv");

    private static List<String> readLines(final File file) throws IOException {
        return Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
    }

    @Test
    public void testHaplogroupTable() throws IOException {
        final File output = createTempFile("haplogroups", ".tsv");
        runCommandLine("-" + StandardArgumentDefinitions.INPUT_SHORT_NAME, TREE.getAbsolutePath(),
                "-" + StandardArgumentDefinitions.OUTPUT_SHORT_NAME, output.getAbsolutePath());

        Assert.assertEquals(readLines(output), Arrays.asList(
                "HAPLOGROUP\tVARIANTS",
                "mt-MRCA\t",
                "L0\tA263G,C16129T",
                "L0a\tA263G,G3010A,C16129T,(T16519C)",
                "L0a1\tT152C!,A263G,G3010A,C16129T,(T16519C)",
                "L0a2\tC150T,A263G,G3010A,C16129T,(T16519C)",
                "L0b\tG263A!,C16129T",
                "L1\tC150T,G3010A",
                "L1[1]\tC150T,A200G,T204C,G3010A"));
    }

    @Test
    public void testFiltersAndDiagnostics() throws IOException {
        final File output = createTempFile("haplogroups", ".tsv");
        final File positions = createTempFile("positions", ".tsv");
        final File counts = createTempFile("counts", ".tsv");
        final File dump = createTempFile("dump", ".txt");
        runCommandLine("--" + StandardArgumentDefinitions.INPUT_LONG_NAME, TREE.getAbsolutePath(),
                "--" + StandardArgumentDefinitions.OUTPUT_LONG_NAME, output.getAbsolutePath(),
                "--" + SummarizePhylotree.LEAVES_ONLY_LONG_NAME, "true",
                "--" + SummarizePhylotree.REMOVE_UNSTABLE_LONG_NAME, "true",
                "--" + SummarizePhylotree.REMOVE_BACK_MUTATIONS_LONG_NAME, "true",
                "--" + SummarizePhylotree.VARIANT_POSITIONS_OUTPUT_LONG_NAME, positions.getAbsolutePath(),
                "--" + SummarizePhylotree.MUTATION_COUNTS_OUTPUT_LONG_NAME, counts.getAbsolutePath(),
                "--" + SummarizePhylotree.TREE_DUMP_OUTPUT_LONG_NAME, dump.getAbsolutePath());

        Assert.assertEquals(readLines(output), Arrays.asList(
                "HAPLOGROUP\tVARIANTS",
                "L0a1\tG3010A,C16129T",
                "L0a2\tC150T,G3010A,C16129T",
                "L0b\tC16129T",
                "L1[1]\tC150T,A200G,T204C,G3010A"));
        Assert.assertEquals(readLines(positions), Arrays.asList("POSITION", "150", "200", "204", "3010", "16129"));
        Assert.assertEquals(readLines(counts), Arrays.asList(
                "POSITION\tALLELE\tCOUNT",
                "150\tT\t2",
                "152\tC\t1",
                "200\tG\t1",
                "204\tC\t1",
                "263\tA\t1",
                "263\tG\t1",
                "3010\tA\t2",
                "16129\tT\t1",
                "16519\tC\t1"));

        final List<String> dumpLines = readLines(dump);
        Assert.assertEquals(dumpLines.subList(0, 6), Arrays.asList(
                "Node: mt-MRCA", "Variants: ", "Children: 2", "  Node: L0", "  Variants: C16129T", "  Children: 2"));
        Assert.assertEquals(dumpLines.size(), 8 * 3);
        Assert.assertTrue(dumpLines.contains("    Node: L1[1]"));
    }

    @Test(expectedExceptions = UserException.MalformedFile.class)
    public void testMalformedTree() {
        final Path tree = writeTempFile("malformed", ".csv", "A,", ",B,A10G", "C,");
        runCommandLine("-I", tree.toString(), "-O", createTempFile("out", ".tsv").getAbsolutePath());
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testMissingTree() {
        runCommandLine("-I", new File(getTestDataDir(), "no-such-tree.csv").getAbsolutePath(),
                "-O", createTempFile("out", ".tsv").getAbsolutePath());
    }

    @Test(expectedExceptions = CommandLineException.class)
    public void testMissingOutputArgument() {
        runCommandLine("-I", TREE.getAbsolutePath());
    }
}
