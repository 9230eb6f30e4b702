package org.broadinstitute.haplomix.utils;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.RandomGeneratorFactory;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Random;

public class DirichletUnitTest {

    @Test
    public void testFlat() {
        for (final int numStates : new int[] {1, 3, 10}) {
            final Dirichlet dirichlet = Dirichlet.flat(numStates, 0.5);
            Assert.assertEquals(dirichlet.size(), numStates);
            Arrays.stream(dirichlet.meanWeights()).forEach(w -> Assert.assertEquals(w, 1.0 / numStates, 1e-12));
        }
    }

    @Test
    public void testSamplesAreProbabilityVectors() {
        final RandomGenerator rng = RandomGeneratorFactory.createRandomGenerator(new Random(13));
        for (final double alpha : new double[] {0.01, 1.0, 50.0}) {
            final Dirichlet dirichlet = Dirichlet.flat(4, alpha);
            for (int n = 0; n < 100; n++) {
                final double[] sample = dirichlet.sample(rng);
                Assert.assertEquals(sample.length, 4);
                Assert.assertTrue(MathUtils.allMatch(sample, x -> x >= 0.0 && x <= 1.0));
                Assert.assertEquals(MathUtils.sum(sample), 1.0, 1e-10);
            }
        }
    }

    @Test
    public void testSampleIsReproducible() {
        final Dirichlet dirichlet = new Dirichlet(1.0, 2.0, 3.0);
        final double[] first = dirichlet.sample(RandomGeneratorFactory.createRandomGenerator(new Random(7)));
        final double[] second = dirichlet.sample(RandomGeneratorFactory.createRandomGenerator(new Random(7)));
        Assert.assertEquals(first, second);
    }

    @Test
    public void testSampleMeanConvergesToMeanWeights() {
        final Dirichlet dirichlet = new Dirichlet(1.0, 2.0, 3.0);
        final RandomGenerator rng = RandomGeneratorFactory.createRandomGenerator(new Random(42));
        final int numSamples = 20000;
        final double[] totals = new double[dirichlet.size()];
        for (int n = 0; n < numSamples; n++) {
            final double[] sample = dirichlet.sample(rng);
            for (int i = 0; i < totals.length; i++) {
                totals[i] += sample[i];
            }
        }
        final double[] expected = dirichlet.meanWeights();
        for (int i = 0; i < totals.length; i++) {
            Assert.assertEquals(totals[i] / numSamples, expected[i], 0.01);
        }
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNonPositiveParameter() {
        new Dirichlet(1.0, 0.0);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testInfiniteParameter() {
        Dirichlet.flat(2, Double.POSITIVE_INFINITY);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNoStates() {
        Dirichlet.flat(0, 1.0);
    }
}
