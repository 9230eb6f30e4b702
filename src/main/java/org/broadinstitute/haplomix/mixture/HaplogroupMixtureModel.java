package org.broadinstitute.haplomix.mixture;

import com.google.common.annotations.VisibleForTesting;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.RandomGeneratorFactory;
import org.apache.commons.math3.util.FastMath;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.haplomix.utils.Dirichlet;
import org.broadinstitute.haplomix.utils.MathUtils;
import org.broadinstitute.haplomix.utils.NaturalLogUtils;
import org.broadinstitute.haplomix.utils.Utils;

import java.util.Random;

/**
 * Estimates which haplogroups contributed to a sample, and in what proportions, by fitting a mixture of haplogroups
 * to a set of independent reads with Expectation-Maximization.
 *
 * <p>The input is a reads x haplogroups matrix of natural-log likelihoods, log P(read j | haplogroup g), and a weight
 * per read (the number of times that read, or sub-haplotype, was observed). Each EM iteration runs in log space:</p>
 * <ul>
 *     <li>E-step: log z[j][g] = log theta[g] + L[j][g], normalized over g for each read.</li>
 *     <li>M-step: log theta[g] = log sum_j w[j] z[j][g], normalized over g.</li>
 * </ul>
 * <p>An iteration has converged when sum_g |theta_new[g] - theta[g]| is below the tolerance. Each restart starts from
 * proportions drawn from a flat Dirichlet; the log results of all restarts are averaged before exponentiating.</p>
 *
 * Use the {@link Builder} to construct instances.
 */
public final class HaplogroupMixtureModel {

    private static final Logger logger = LogManager.getLogger(HaplogroupMixtureModel.class);

    static final int PROGRESS_INTERVAL = 10;

    private final double initAlpha;
    private final double tolerance;
    private final int maxIter;
    private final int nMulti;
    private final boolean verbose;
    private final int seed;

    private HaplogroupMixtureModel(final double initAlpha,
                                   final double tolerance,
                                   final int maxIter,
                                   final int nMulti,
                                   final boolean verbose,
                                   final int seed) {
        this.initAlpha = initAlpha;
        this.tolerance = tolerance;
        this.maxIter = maxIter;
        this.nMulti = nMulti;
        this.verbose = verbose;
        this.seed = seed;
    }

    /**
     * Fits the mixture.
     *
     * @param logLikelihoods reads x haplogroups natural-log likelihoods; entries may be {@code -Infinity} but not NaN
     *                       or {@code +Infinity}. Not modified.
     * @param weights        non-negative weight per read
     * @throws IllegalArgumentException if the matrix is empty or ragged, or the weights do not match its rows
     */
    public MixtureEstimate fit(final double[][] logLikelihoods, final double[] weights) {
        validateInputs(logLikelihoods, weights);

        final int nReads = logLikelihoods.length;
        final int nHaplogroups = logLikelihoods[0].length;
        logger.info(String.format("Fitting a mixture of %d haplogroups to %d reads with %d restart(s)...",
                nHaplogroups, nReads, nMulti));

        final RandomGenerator rng = RandomGeneratorFactory.createRandomGenerator(new Random(seed));
        final Dirichlet initialDistribution = Dirichlet.flat(nHaplogroups, initAlpha);

        final double[] summedLogProportions = new double[nHaplogroups];
        final double[][] summedLogPosteriors = new double[nReads][nHaplogroups];
        final int[] iterationsPerRestart = new int[nMulti];
        int numConverged = 0;

        for (int restart = 0; restart < nMulti; restart++) {
            if (verbose) {
                logger.info(String.format("Starting EM restart %d...", restart + 1));
            }

            double[] logProportions = MathUtils.applyToArrayInPlace(initialDistribution.sample(rng), FastMath::log);
            final double[][] logPosteriors = new double[nReads][nHaplogroups];
            boolean converged = false;
            int nIter = 0;

            while (nIter < maxIter) {
                nIter++;
                eStep(logLikelihoods, logProportions, logPosteriors);
                final double[] newLogProportions = mStep(logPosteriors, weights);
                converged = converged(logProportions, newLogProportions, tolerance);
                logProportions = newLogProportions;

                if (verbose && nIter % PROGRESS_INTERVAL == 0) {
                    logger.info(String.format("Restart %d, iteration %d...", restart + 1, nIter));
                }
                if (converged) {
                    break;
                }
            }

            iterationsPerRestart[restart] = nIter;
            if (converged) {
                numConverged++;
            }
            if (verbose) {
                logger.info(String.format("Restart %d %s after %d iterations.",
                        restart + 1, converged ? "converged" : "did not converge", nIter));
            }

            accumulate(summedLogProportions, logProportions);
            for (int j = 0; j < nReads; j++) {
                accumulate(summedLogPosteriors[j], logPosteriors[j]);
            }
        }

        if (numConverged == 0) {
            Utils.warnUser(logger, "No EM restart converged. Consider raising the maximum number of iterations " +
                    "or the tolerance, and check the input for reads that no haplogroup explains.");
        }

        final double[] proportions = MathUtils.applyToArrayInPlace(summedLogProportions, x -> FastMath.exp(x / nMulti));
        for (final double[] row : summedLogPosteriors) {
            MathUtils.applyToArrayInPlace(row, x -> FastMath.exp(x / nMulti));
        }
        return new MixtureEstimate(proportions, summedLogPosteriors, numConverged, iterationsPerRestart);
    }

    private static void validateInputs(final double[][] logLikelihoods, final double[] weights) {
        Utils.nonNull(logLikelihoods, "the log-likelihood matrix cannot be null");
        Utils.nonNull(weights, "the read weights cannot be null");
        Utils.validateArg(logLikelihoods.length > 0, "the log-likelihood matrix must have at least one read");
        Utils.nonNull(logLikelihoods[0], "the log-likelihood matrix cannot contain null rows");
        final int nHaplogroups = logLikelihoods[0].length;
        Utils.validateArg(nHaplogroups > 0, "the log-likelihood matrix must have at least one haplogroup");
        Utils.validateArg(weights.length == logLikelihoods.length,
                () -> String.format("number of weights (%d) does not match number of reads (%d)", weights.length, logLikelihoods.length));
        for (int j = 0; j < logLikelihoods.length; j++) {
            final int row = j;
            Utils.nonNull(logLikelihoods[j], "the log-likelihood matrix cannot contain null rows");
            Utils.validateArg(logLikelihoods[j].length == nHaplogroups,
                    () -> String.format("read %d has %d log likelihoods but read 0 has %d", row, logLikelihoods[row].length, nHaplogroups));
            Utils.validateArg(MathUtils.allMatch(logLikelihoods[j], x -> !Double.isNaN(x) && x != Double.POSITIVE_INFINITY),
                    () -> String.format("read %d has a NaN or positive infinite log likelihood", row));
            Utils.validateArg(weights[j] >= 0.0 && Double.isFinite(weights[j]),
                    () -> String.format("read %d has weight %f but weights must be finite and non-negative", row, weights[row]));
        }
    }

    private static void accumulate(final double[] sums, final double[] values) {
        for (int i = 0; i < sums.length; i++) {
            sums[i] += values[i];
        }
    }

    /**
     * Fills {@code logPosteriors[j][g]} with log P(haplogroup g | read j) given the current log proportions.
     * Rows that are {@code -Infinity} for every haplogroup stay that way.
     */
    @VisibleForTesting
    static void eStep(final double[][] logLikelihoods, final double[] logProportions, final double[][] logPosteriors) {
        for (int j = 0; j < logLikelihoods.length; j++) {
            final double[] row = logPosteriors[j];
            for (int g = 0; g < logProportions.length; g++) {
                row[g] = logProportions[g] + logLikelihoods[j][g];
            }
            NaturalLogUtils.normalizeLog(row);
        }
    }

    /**
     * @return new log proportions: the weighted log-sum-exp of each posterior column, normalized over haplogroups
     */
    @VisibleForTesting
    static double[] mStep(final double[][] logPosteriors, final double[] weights) {
        final int nHaplogroups = logPosteriors[0].length;
        final double[] column = new double[logPosteriors.length];
        final double[] newLogProportions = new double[nHaplogroups];
        for (int g = 0; g < nHaplogroups; g++) {
            for (int j = 0; j < logPosteriors.length; j++) {
                column[j] = logPosteriors[j][g];
            }
            newLogProportions[g] = NaturalLogUtils.logSumExp(column, weights);
        }
        return NaturalLogUtils.normalizeLog(newLogProportions);
    }

    /**
     * @return true if the summed absolute change in natural-space proportions is strictly below the tolerance
     */
    @VisibleForTesting
    static boolean converged(final double[] logProportions, final double[] newLogProportions, final double tolerance) {
        return MathUtils.sumOfAbsoluteDifferences(
                MathUtils.applyToArray(newLogProportions, FastMath::exp),
                MathUtils.applyToArray(logProportions, FastMath::exp)) < tolerance;
    }

    public double getInitAlpha() {
        return initAlpha;
    }

    public double getTolerance() {
        return tolerance;
    }

    public int getMaxIter() {
        return maxIter;
    }

    public int getNMulti() {
        return nMulti;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public int getSeed() {
        return seed;
    }

    @Override
    public String toString() {
        return "HaplogroupMixtureModel{" +
                "initAlpha=" + initAlpha +
                ", tolerance=" + tolerance +
                ", maxIter=" + maxIter +
                ", nMulti=" + nMulti +
                ", verbose=" + verbose +
                ", seed=" + seed +
                '}';
    }

    public static final class Builder {
        private double initAlpha = 1.0;
        private double tolerance = 1E-4;
        private int maxIter = 1000;
        private int nMulti = 1;
        private boolean verbose = false;
        private int seed = 0;                                   // fixed by default for reproducible fits

        public Builder() {
        }

        public Builder initAlpha(final double initAlpha) {
            Utils.validateArg(initAlpha > 0. && Double.isFinite(initAlpha), "initAlpha must be finite and > 0.");
            this.initAlpha = initAlpha;
            return this;
        }

        public Builder tolerance(final double tolerance) {
            Utils.validateArg(tolerance > 0., "tolerance must be > 0.");
            this.tolerance = tolerance;
            return this;
        }

        public Builder maxIter(final int maxIter) {
            Utils.validateArg(maxIter >= 1, "maxIter must be >= 1.");
            this.maxIter = maxIter;
            return this;
        }

        public Builder nMulti(final int nMulti) {
            Utils.validateArg(nMulti >= 1, "nMulti must be >= 1.");
            this.nMulti = nMulti;
            return this;
        }

        public Builder verbose(final boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Builder seed(final int seed) {
            this.seed = seed;
            return this;
        }

        public HaplogroupMixtureModel build() {
            return new HaplogroupMixtureModel(initAlpha, tolerance, maxIter, nMulti, verbose, seed);
        }
    }
}
