package org.broadinstitute.haplomix.utils;

import org.apache.commons.math3.distribution.GammaDistribution;
import org.apache.commons.math3.random.RandomGenerator;

import java.util.Arrays;

/**
 * The Dirichlet distribution is a distribution on multinomial distributions: if pi is a vector of positive multinomial weights
 * such that sum_i pi[i] = 1, the Dirichlet pdf is P(pi) = [prod_i Gamma(alpha[i]) / Gamma(sum_i alpha[i])] * prod_i pi[i]^(alpha[i] - 1)
 *
 * The vector alpha comprises the sufficient statistics for the Dirichlet distribution.
 *
 * Used here to draw random starting mixture proportions for the EM restarts.
 */
public class Dirichlet {
    final double[] alpha;

    public Dirichlet(final double... alpha) {
        Utils.nonNull(alpha);
        Utils.validateArg(alpha.length >= 1, "Dirichlet parameters must have at least one element");
        Utils.validateArg(MathUtils.allMatch(alpha, x -> x > 0), "Dirichlet parameters must be positive");
        Utils.validateArg(MathUtils.allMatch(alpha, Double::isFinite), "Dirichlet parameters must be finite");
        this.alpha = alpha.clone();
    }

    /**
     * Create the distribution Dir(a, a, a . . .) where every one of the K states has parameter a.
     */
    public static Dirichlet flat(final int numStates, final double alpha) {
        Utils.validateArg(numStates > 0, "Must have at least one state");
        final double[] params = new double[numStates];
        Arrays.fill(params, alpha);
        return new Dirichlet(params);
    }

    /**
     * Draw one probability vector by normalizing independent Gamma(alpha[i], 1) variates.
     *
     * When every variate underflows to zero, which only happens for very small alphas, the mass goes to a
     * single state chosen uniformly.
     */
    public double[] sample(final RandomGenerator rng) {
        Utils.nonNull(rng);
        final double[] draws = new double[alpha.length];
        for (int i = 0; i < alpha.length; i++) {
            draws[i] = new GammaDistribution(rng, alpha[i], 1.0).sample();
        }
        if (MathUtils.sum(draws) == 0.0) {
            draws[rng.nextInt(draws.length)] = 1.0;
        }
        return MathUtils.normalizeSumToOne(draws);
    }

    public double[] meanWeights() {
        final double sum = MathUtils.sum(alpha);
        return MathUtils.applyToArray(alpha, x -> x / sum);
    }

    public int size() { return alpha.length; }
}
