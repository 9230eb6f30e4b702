package org.broadinstitute.haplomix.utils;

import java.util.function.DoublePredicate;
import java.util.function.DoubleUnaryOperator;

/**
 * MathUtils is a static class (no instantiation allowed!) with some useful math methods.
 */
public final class MathUtils {

    private MathUtils() { }

    public static double sum(final double[] values) {
        Utils.nonNull(values);
        double s = 0.0;
        for (double v : values)
            s += v;
        return s;
    }

    /**
     * Sum of {@code |a[i] - b[i]|} over all entries.
     */
    public static double sumOfAbsoluteDifferences(final double[] a, final double[] b) {
        Utils.nonNull(a);
        Utils.nonNull(b);
        Utils.validateArg(a.length == b.length, "arrays must have the same length");
        double result = 0.0;
        for (int i = 0; i < a.length; i++) {
            result += Math.abs(a[i] - b[i]);
        }
        return result;
    }

    /**
     * normalizes the real-space probability array.
     *
     * Does not assume anything about the values in the array, beyond that no elements are below 0.  It's ok
     * to have values in the array of > 1, or have the sum go above 0.
     *
     * @param array the array to be normalized
     * @return a newly allocated array corresponding the normalized values in array
     */
    public static double[] normalizeSumToOne(final double[] array) {
        Utils.nonNull(array);
        if ( array.length == 0 )
            return array;

        final double sum = sum(array);
        Utils.validateArg(sum >= 0.0, () -> "Values in probability array sum to a negative number " + sum);
        return applyToArray(array, x -> x/sum);
    }

    public static int maxElementIndex(final double[] array) {
        Utils.nonNull(array);
        Utils.validateArg(array.length > 0, "array may not be empty");

        int maxI = 0;
        for (int i = 1; i < array.length; i++) {
            if (array[i] > array[maxI])
                maxI = i;
        }
        return maxI;
    }

    /**
     * The following method implements Arrays.stream(array).map(func).toArray(), which is concise but performs poorly due
     * to the overhead of creating a stream, especially with small arrays.
     *
     * Returns a new array -- the original array in not modified.
     */
    public static double[] applyToArray(final double[] array, final DoubleUnaryOperator func) {
        Utils.nonNull(func);
        Utils.nonNull(array);
        final double[] result = new double[array.length];
        for (int m = 0; m < result.length; m++) {
            result[m] = func.applyAsDouble(array[m]);
        }
        return result;
    }

    /**
     * As {@link #applyToArray(double[], DoubleUnaryOperator)}, but the original array is modified in place.
     */
    public static double[] applyToArrayInPlace(final double[] array, final DoubleUnaryOperator func) {
        Utils.nonNull(array);
        Utils.nonNull(func);
        for (int m = 0; m < array.length; m++) {
            array[m] = func.applyAsDouble(array[m]);
        }
        return array;
    }

    /**
     * Test whether all elements of a double[] array satisfy a double -> boolean predicate
     */
    public static boolean allMatch(final double[] array, final DoublePredicate pred) {
        Utils.nonNull(array);
        Utils.nonNull(pred);
        for (final double x : array) {
            if (!pred.test(x)) {
                return false;
            }
        }
        return true;
    }
}
