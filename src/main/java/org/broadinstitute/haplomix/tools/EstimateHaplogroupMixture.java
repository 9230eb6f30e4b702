package org.broadinstitute.haplomix.tools;

import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.ArgumentCollection;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.haplomix.cmdline.CommandLineProgram;
import org.broadinstitute.haplomix.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.haplomix.cmdline.argumentcollections.MixtureModelArgumentCollection;
import org.broadinstitute.haplomix.cmdline.programgroups.HaplogroupAnalysisProgramGroup;
import org.broadinstitute.haplomix.exceptions.UserException;
import org.broadinstitute.haplomix.mixture.HaplogroupMixtureModel;
import org.broadinstitute.haplomix.mixture.LogLikelihoodMatrix;
import org.broadinstitute.haplomix.mixture.LogLikelihoodMatrixReader;
import org.broadinstitute.haplomix.mixture.MixtureEstimate;
import org.broadinstitute.haplomix.utils.tsv.SimpleXSVWriter;
import org.broadinstitute.haplomix.utils.tsv.TableUtils;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Estimates the proportions of the haplogroups that contributed to a sample from a precomputed table of per-read
 * log likelihoods, by fitting a mixture model with Expectation-Maximization.
 *
 * <p>The input table has a header {@code READ WEIGHT <haplogroup>...} and one row per read holding its weight (how many
 * times it was observed) and its natural-log likelihood under each haplogroup. The output lists each haplogroup with its
 * estimated proportion; optionally the posterior probability of each read under each haplogroup is written too.</p>
 *
 * <h3>Usage example</h3>
 * <pre>
 *     haplomix EstimateHaplogroupMixture \
 *          -I read-likelihoods.tsv \
 *          -O proportions.tsv \
 *          --num-restarts 10
 * </pre>
 */
@CommandLineProgramProperties(
        summary = "Fits a mixture of haplogroups to reads with Expectation-Maximization, starting from a table of " +
                "per-read natural-log likelihoods under each haplogroup, and writes the estimated proportion of each " +
                "haplogroup and optionally the per-read posterior probabilities.",
        oneLineSummary = "Estimates haplogroup mixture proportions from per-read log likelihoods",
        programGroup = HaplogroupAnalysisProgramGroup.class
)
public final class EstimateHaplogroupMixture extends CommandLineProgram {

    public static final String POSTERIORS_OUTPUT_LONG_NAME = "posteriors-output";

    public static final String HAPLOGROUP_COLUMN = "HAPLOGROUP";
    public static final String PROPORTION_COLUMN = "PROPORTION";

    @Argument(fullName = StandardArgumentDefinitions.INPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.INPUT_SHORT_NAME,
            doc = "Table of read weights and per-haplogroup natural-log likelihoods")
    public File inputFile;

    @Argument(fullName = StandardArgumentDefinitions.OUTPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.OUTPUT_SHORT_NAME,
            doc = "Output table of haplogroup proportions")
    public File outputFile;

    @Argument(fullName = POSTERIORS_OUTPUT_LONG_NAME,
            doc = "Output table of the posterior probability of each read under each haplogroup",
            optional = true)
    public File posteriorsFile = null;

    @ArgumentCollection
    public MixtureModelArgumentCollection mixtureArguments = new MixtureModelArgumentCollection();

    private HaplogroupMixtureModel model;

    @Override
    protected void onStartup() {
        model = mixtureArguments.buildModel();
        logger.debug("Using " + model);
    }

    @Override
    protected Object doWork() {
        final LogLikelihoodMatrix matrix = LogLikelihoodMatrixReader.read(inputFile.toPath());
        logger.info(String.format("Read log likelihoods of %d reads under %d haplogroups.",
                matrix.getNumReads(), matrix.getNumHaplogroups()));

        final MixtureEstimate estimate = matrix.fit(model);
        logger.info(String.format("%d of %d restart(s) converged.", estimate.getNumConvergedRestarts(), estimate.getNumRestarts()));

        writeProportions(matrix, estimate, outputFile.toPath());
        if (posteriorsFile != null) {
            writePosteriors(matrix, estimate, posteriorsFile.toPath());
        }
        return null;
    }

    private static void writeProportions(final LogLikelihoodMatrix matrix, final MixtureEstimate estimate, final Path path) {
        try (final SimpleXSVWriter writer = new SimpleXSVWriter(path, TableUtils.COLUMN_SEPARATOR)) {
            writer.setHeaderLine(Arrays.asList(HAPLOGROUP_COLUMN, PROPORTION_COLUMN));
            for (int g = 0; g < matrix.getNumHaplogroups(); g++) {
                writer.getNewLineBuilder()
                        .setColumn(HAPLOGROUP_COLUMN, matrix.getHaplogroups().get(g))
                        .setColumn(PROPORTION_COLUMN, formatProbability(estimate.getProportion(g)))
                        .write();
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(path, e);
        }
    }

    private static void writePosteriors(final LogLikelihoodMatrix matrix, final MixtureEstimate estimate, final Path path) {
        final List<String> header = new ArrayList<>();
        header.add(LogLikelihoodMatrixReader.READ_COLUMN);
        header.addAll(matrix.getHaplogroups());
        try (final SimpleXSVWriter writer = new SimpleXSVWriter(path, TableUtils.COLUMN_SEPARATOR)) {
            writer.setHeaderLine(header);
            for (int j = 0; j < matrix.getNumReads(); j++) {
                final SimpleXSVWriter.LineBuilder line = writer.getNewLineBuilder();
                line.setColumn(0, matrix.getReadNames().get(j));
                for (int g = 0; g < matrix.getNumHaplogroups(); g++) {
                    line.setColumn(g + 1, formatProbability(estimate.getPosterior(j, g)));
                }
                line.write();
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(path, e);
        }
    }

    private static String formatProbability(final double p) {
        return String.format("%.6g", p);
    }
}
