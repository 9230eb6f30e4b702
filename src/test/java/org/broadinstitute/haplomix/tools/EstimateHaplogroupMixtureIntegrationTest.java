package org.broadinstitute.haplomix.tools;

import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.haplomix.CommandLineProgramTest;
import org.broadinstitute.haplomix.cmdline.argumentcollections.MixtureModelArgumentCollection;
import org.broadinstitute.haplomix.exceptions.UserException;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public final class EstimateHaplogroupMixtureIntegrationTest extends CommandLineProgramTest {

    private static final File MATRIX = new File(getTestDataDir(), "read-likelihoods.tsv");

    private static String[] split(final String line) {
        return line.split("\t", -1);
    }

    @Test
    public void testProportionsAndPosteriors() throws IOException {
        final File output = createTempFile("proportions", ".tsv");
        final File posteriors = createTempFile("posteriors", ".tsv");
        runCommandLine("-I", MATRIX.getAbsolutePath(),
                "-O", output.getAbsolutePath(),
                "--" + EstimateHaplogroupMixture.POSTERIORS_OUTPUT_LONG_NAME, posteriors.getAbsolutePath(),
                "--" + MixtureModelArgumentCollection.TOLERANCE_LONG_NAME, "1e-8");

        final List<String> proportions = Files.readAllLines(output.toPath(), StandardCharsets.UTF_8);
        Assert.assertEquals(proportions.size(), 3);
        Assert.assertEquals(proportions.get(0), "HAPLOGROUP\tPROPORTION");
        Assert.assertEquals(split(proportions.get(1))[0], "H1");
        Assert.assertEquals(Double.parseDouble(split(proportions.get(1))[1]), 6.0 / 9, 1e-3);
        Assert.assertEquals(split(proportions.get(2))[0], "H2");
        Assert.assertEquals(Double.parseDouble(split(proportions.get(2))[1]), 3.0 / 9, 1e-3);

        final List<String> posteriorLines = Files.readAllLines(posteriors.toPath(), StandardCharsets.UTF_8);
        Assert.assertEquals(posteriorLines.size(), 4);
        Assert.assertEquals(posteriorLines.get(0), "READ\tH1\tH2");
        Assert.assertEquals(split(posteriorLines.get(1))[0], "read1");
        Assert.assertEquals(Double.parseDouble(split(posteriorLines.get(1))[1]), 1.0, 1e-3);
        Assert.assertEquals(split(posteriorLines.get(3))[0], "read3");
        Assert.assertEquals(Double.parseDouble(split(posteriorLines.get(3))[1]), 0.0);
        Assert.assertEquals(Double.parseDouble(split(posteriorLines.get(3))[2]), 1.0, 1e-12);
    }

    @Test
    public void testMultipleRestartsAreReproducible() throws IOException {
        final File first = createTempFile("first", ".tsv");
        final File second = createTempFile("second", ".tsv");
        for (final File output : new File[] {first, second}) {
            runCommandLine("-I", MATRIX.getAbsolutePath(), "-O", output.getAbsolutePath(),
                    "--" + MixtureModelArgumentCollection.NUM_RESTARTS_LONG_NAME, "4",
                    "--" + MixtureModelArgumentCollection.SEED_LONG_NAME, "123",
                    "--" + MixtureModelArgumentCollection.VERBOSE_EM_LONG_NAME, "true");
        }
        Assert.assertEquals(Files.readAllLines(first.toPath(), StandardCharsets.UTF_8),
                Files.readAllLines(second.toPath(), StandardCharsets.UTF_8));
    }

    @Test(expectedExceptions = CommandLineException.class)
    public void testInvalidAlpha() {
        runCommandLine("-I", MATRIX.getAbsolutePath(), "-O", createTempFile("out", ".tsv").getAbsolutePath(),
                "--" + MixtureModelArgumentCollection.INIT_ALPHA_LONG_NAME, "0");
    }

    @Test(expectedExceptions = CommandLineException.class)
    public void testInvalidRestarts() {
        runCommandLine("-I", MATRIX.getAbsolutePath(), "-O", createTempFile("out", ".tsv").getAbsolutePath(),
                "--" + MixtureModelArgumentCollection.NUM_RESTARTS_LONG_NAME, "0");
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testMalformedMatrix() {
        final Path matrix = writeTempFile("malformed", ".tsv", "READ\tWEIGHT\tH1", "read1\t-2\t0");
        runCommandLine("-I", matrix.toString(), "-O", createTempFile("out", ".tsv").getAbsolutePath());
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testHaplogroupNamedLikeReadColumn() {
        final Path matrix = writeTempFile("reserved", ".tsv", "READ\tWEIGHT\tH1\tREAD", "read1\t1\t0\t-1");
        runCommandLine("-I", matrix.toString(), "-O", createTempFile("out", ".tsv").getAbsolutePath(),
                "--" + EstimateHaplogroupMixture.POSTERIORS_OUTPUT_LONG_NAME, createTempFile("posteriors", ".tsv").getAbsolutePath());
    }
}
