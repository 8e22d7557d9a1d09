package org.broadinstitute.signatures.utils;

import java.util.function.IntToDoubleFunction;

/**
 * Represents 0-based integer index range.
 *
 * <p>
 * It represents an integer index range as the pair values:
 * <dl>
 *     <dt>{@link #from}</dt>
 *     <dd>- index of the first element in range (i.e. inclusive).</dd>
 *     <dt>{@link #to}</dt>
 *     <dd>- index of the element following the last element in range (i.e. exclusive).</dd>
 * </dl>
 * </p>
 */
public final class IndexRange {

    /**
     * First index in the range.
     */
    public final int from;

    /**
     * Index following the last index included in the range.
     */
    public final int to;

    /**
     * Creates a new range given its {@code from} and {@code to} indices.
     *
     * @param fromIndex the {@code from} index value.
     * @param toIndex   the {@code to} index value.
     * @throws IllegalArgumentException if {@code fromIndex} is larger than {@code toIndex} or negative.
     */
    public IndexRange(final int fromIndex, final int toIndex) {
        Utils.validateArg(fromIndex <= toIndex, "the range size cannot be negative");
        Utils.validateArg(fromIndex >= 0, "the range cannot contain negative indices");
        from = fromIndex;
        to = toIndex;
    }

    /**
     * Returns number indexes expanded by this range.
     *
     * @return 0 or greater.
     */
    public int size() {
        return to - from;
    }

    /**
     * Apply the {@link IntToDoubleFunction} lambda to each index in the range and return the results in an array
     * of length {@link #size()}.
     */
    public double[] mapToDouble(final IntToDoubleFunction lambda) {
        Utils.nonNull(lambda, "the lambda function cannot be null");
        final double[] result = new double[size()];
        for (int i = from; i < to; i++) {
            result[i - from] = lambda.applyAsDouble(i);
        }
        return result;
    }

    @Override
    public boolean equals(final Object other) {
        if (other == this) {
            return true;
        } else if (!(other instanceof IndexRange)) {
            return false;
        } else {
            final IndexRange otherCasted = (IndexRange) other;
            return otherCasted.from == this.from && otherCasted.to == this.to;
        }
    }

    @Override
    public int hashCode() {
        return ((from * 31) + to) * 31;
    }

    @Override
    public String toString() {
        return String.format("%d-%d",from,to);
    }
}
