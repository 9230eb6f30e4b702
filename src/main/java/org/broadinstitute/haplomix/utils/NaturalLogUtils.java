package org.broadinstitute.haplomix.utils;

import org.apache.commons.math3.util.FastMath;

public class NaturalLogUtils {

    private NaturalLogUtils() { }

    /**
     * normalizes the log-probability array in-place.
     *
     * @param array             the array to be normalized
     * @return the normalized-in-place array, maybe log transformed
     */
    public static double[] normalizeLog(final double[] array) {
        return normalizeLog(Utils.nonNull(array), true, true);
    }

    /**
     * Shifts a log-space array so that its exponentiated entries sum to one.
     *
     * An array whose entries are all {@code -Infinity} has no mass to normalize and is returned unchanged
     * (all {@code -Infinity}, or all zero when {@code takeLogOfOutput} is false), never NaN.
     *
     * @param array the array to be normalized
     * @param takeLogOfOutput if false the result is exponentiated
     * @param inPlace           if true, modify the input array in-place
     */
    public static double[] normalizeLog(final double[] array, final boolean takeLogOfOutput, final boolean inPlace) {
        final double logSum = logSumExp(Utils.nonNull(array));
        final double shift = logSum == Double.NEGATIVE_INFINITY ? 0.0 : logSum;
        final double[] result = inPlace ? MathUtils.applyToArrayInPlace(array, x -> x - shift) : MathUtils.applyToArray(array, x -> x - shift);
        return takeLogOfOutput ? result : MathUtils.applyToArrayInPlace(result, Math::exp);
    }

    /**
     * Computes $\log(\sum_i e^{a_i})$ trying to avoid underflow issues by using the log-sum-exp trick.
     *
     * <p>
     * This trick consists of shifting all the log values by the maximum so that exponent values are
     * much larger (close to 1) before they are summed. Then the result is shifted back down by
     * the same amount in order to obtain the correct value.
     * </p>
     * @return any double value.
     */
    public static double logSumExp(final double... logValues) {
        Utils.nonNull(logValues);
        final int maxElementIndex = MathUtils.maxElementIndex(logValues);
        final double maxValue = logValues[maxElementIndex];
        if(maxValue == Double.NEGATIVE_INFINITY) {
            return maxValue;
        }
        double sum = 1.0;
        for (int i = 0; i < logValues.length; i++) {
            final double curVal = logValues[i];
            if (i == maxElementIndex || curVal == Double.NEGATIVE_INFINITY) {
                continue;
            } else {
                final double scaled_val = curVal - maxValue;
                sum += Math.exp(scaled_val);
            }
        }
        if ( Double.isNaN(sum) || sum == Double.POSITIVE_INFINITY ) {
            throw new IllegalArgumentException("logValues must be non-infinite and non-NAN");
        }
        return maxValue + (sum != 1.0 ? Math.log(sum) : 0.0);
    }

    /**
     * Computes $\log(\sum_i w_i e^{a_i})$ with the same max-shifting trick as {@link #logSumExp(double...)}.
     *
     * <p>
     * Entries with a zero weight or a value of {@code -Infinity} contribute nothing. When nothing contributes
     * the result is {@code -Infinity}.
     * </p>
     *
     * @param logValues the log values $a_i$
     * @param weights non-negative linear-space weights $w_i$, same length as {@code logValues}
     */
    public static double logSumExp(final double[] logValues, final double[] weights) {
        Utils.nonNull(logValues);
        Utils.nonNull(weights);
        Utils.validateArg(logValues.length == weights.length,
                () -> "values and weights differ in length: " + logValues.length + " vs " + weights.length);

        double maxValue = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < logValues.length; i++) {
            final double w = weights[i];
            Utils.validateArg(w >= 0.0 && Double.isFinite(w), () -> "weights must be finite and non-negative but got " + w);
            if (w > 0.0 && logValues[i] > maxValue) {
                maxValue = logValues[i];
            }
        }
        if (maxValue == Double.NEGATIVE_INFINITY) {
            return maxValue;
        }

        double sum = 0.0;
        for (int i = 0; i < logValues.length; i++) {
            if (weights[i] == 0.0 || logValues[i] == Double.NEGATIVE_INFINITY) {
                continue;
            }
            sum += weights[i] * FastMath.exp(logValues[i] - maxValue);
        }
        if ( Double.isNaN(sum) || sum == Double.POSITIVE_INFINITY ) {
            throw new IllegalArgumentException("logValues must be non-infinite and non-NAN");
        }
        return sum == 0.0 ? Double.NEGATIVE_INFINITY : maxValue + FastMath.log(sum);
    }
}
