package org.broadinstitute.haplomix.mixture;

import org.broadinstitute.haplomix.utils.Utils;

import java.util.Arrays;

/**
 * The result of {@link HaplogroupMixtureModel#fit(double[][], double[])}: mixture proportions per haplogroup and
 * the posterior probability that each read came from each haplogroup, both in natural (not log) space.
 *
 * When several restarts were run these are geometric means over the restarts and need not sum to exactly one.
 */
public final class MixtureEstimate {
    private final double[] proportions;
    private final double[][] posteriors;
    private final int numConvergedRestarts;
    private final int[] iterationsPerRestart;

    MixtureEstimate(final double[] proportions, final double[][] posteriors,
                    final int numConvergedRestarts, final int[] iterationsPerRestart) {
        this.proportions = Utils.nonNull(proportions);
        this.posteriors = Utils.nonNull(posteriors);
        this.numConvergedRestarts = numConvergedRestarts;
        this.iterationsPerRestart = Utils.nonNull(iterationsPerRestart);
    }

    /**
     * @return a copy of the proportions, indexed by haplogroup column
     */
    public double[] getProportions() {
        return proportions.clone();
    }

    public double getProportion(final int haplogroupIndex) {
        return proportions[haplogroupIndex];
    }

    /**
     * @return a copy of the reads x haplogroups posterior matrix
     */
    public double[][] getPosteriors() {
        return Arrays.stream(posteriors).map(double[]::clone).toArray(double[][]::new);
    }

    public double getPosterior(final int readIndex, final int haplogroupIndex) {
        return posteriors[readIndex][haplogroupIndex];
    }

    public int getNumReads() {
        return posteriors.length;
    }

    public int getNumHaplogroups() {
        return proportions.length;
    }

    public int getNumRestarts() {
        return iterationsPerRestart.length;
    }

    public int getNumConvergedRestarts() {
        return numConvergedRestarts;
    }

    /**
     * @return the number of EM iterations run by each restart, in order
     */
    public int[] getIterationsPerRestart() {
        return iterationsPerRestart.clone();
    }

    @Override
    public String toString() {
        return "MixtureEstimate{" +
                "proportions=" + Arrays.toString(proportions) +
                ", numReads=" + posteriors.length +
                ", numConvergedRestarts=" + numConvergedRestarts +
                ", iterationsPerRestart=" + Arrays.toString(iterationsPerRestart) +
                '}';
    }
}
