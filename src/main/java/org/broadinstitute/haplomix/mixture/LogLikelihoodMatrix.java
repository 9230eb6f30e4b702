package org.broadinstitute.haplomix.mixture;

import org.broadinstitute.haplomix.utils.Utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A reads x haplogroups matrix of natural-log likelihoods together with a weight per read, as produced by the
 * external matrix builder and consumed by {@link HaplogroupMixtureModel}.
 */
public final class LogLikelihoodMatrix {
    private final List<String> readNames;
    private final List<String> haplogroups;
    private final double[] weights;
    private final double[][] logLikelihoods;

    public LogLikelihoodMatrix(final List<String> readNames, final List<String> haplogroups,
                               final double[] weights, final double[][] logLikelihoods) {
        Utils.nonNull(readNames);
        Utils.nonNull(haplogroups);
        Utils.nonNull(weights);
        Utils.nonNull(logLikelihoods);
        Utils.validateArg(readNames.size() == logLikelihoods.length && weights.length == logLikelihoods.length,
                "read names, weights and matrix rows must agree in number");
        Utils.validateArg(Arrays.stream(logLikelihoods).allMatch(row -> row.length == haplogroups.size()),
                "every matrix row must have one entry per haplogroup");
        this.readNames = Collections.unmodifiableList(new ArrayList<>(readNames));
        this.haplogroups = Collections.unmodifiableList(new ArrayList<>(haplogroups));
        this.weights = weights.clone();
        this.logLikelihoods = Arrays.stream(logLikelihoods).map(double[]::clone).toArray(double[][]::new);
    }

    public List<String> getReadNames() {
        return readNames;
    }

    public List<String> getHaplogroups() {
        return haplogroups;
    }

    public int getNumReads() {
        return readNames.size();
    }

    public int getNumHaplogroups() {
        return haplogroups.size();
    }

    /**
     * @return the weights; not a copy, do not modify
     */
    public double[] getWeights() {
        return weights;
    }

    /**
     * @return the matrix; not a copy, do not modify
     */
    public double[][] getLogLikelihoods() {
        return logLikelihoods;
    }

    /**
     * Fits the given model to this matrix.
     */
    public MixtureEstimate fit(final HaplogroupMixtureModel model) {
        return Utils.nonNull(model).fit(logLikelihoods, weights);
    }
}
