package org.codelibs.taste.similarity;

import org.codelibs.taste.exception.AggregationOverflowException;

import com.google.common.base.Preconditions;

/**
 * <p>
 * Running sums for one item pair: the sum of products of the two ratings, the sum of squares of each side and
 * the number of users who rated both items.
 * </p>
 *
 * <p>
 * Sums are exact 64-bit integers, so {@link #combine(PairAggregate, PairAggregate)} is associative and
 * commutative without rounding and partial aggregates can be merged in any order. Any overflow raises
 * {@link AggregationOverflowException}.
 * </p>
 */
public final class PairAggregate {

    private final int itemA;

    private final int itemB;

    private long sumProduct;

    private long sumSqA;

    private long sumSqB;

    private int supportCount;

    public PairAggregate(final int itemA, final int itemB) {
        this(itemA, itemB, 0L, 0L, 0L, 0);
    }

    public PairAggregate(final int itemA, final int itemB,
            final long sumProduct, final long sumSqA, final long sumSqB,
            final int supportCount) {
        Preconditions.checkArgument(itemA < itemB,
                "itemA must be less than itemB: (%s,%s)", itemA, itemB);
        Preconditions.checkArgument(supportCount >= 0,
                "supportCount must be at least 0");
        this.itemA = itemA;
        this.itemB = itemB;
        this.sumProduct = sumProduct;
        this.sumSqA = sumSqA;
        this.sumSqB = sumSqB;
        this.supportCount = supportCount;
    }

    public int getItemA() {
        return itemA;
    }

    public int getItemB() {
        return itemB;
    }

    public long getSumProduct() {
        return sumProduct;
    }

    public long getSumSqA() {
        return sumSqA;
    }

    public long getSumSqB() {
        return sumSqB;
    }

    public int getSupportCount() {
        return supportCount;
    }

    /**
     * Absorbs the contribution of one user.
     */
    public void add(final int valueA, final int valueB) {
        try {
            final long newSumProduct = Math.addExact(sumProduct, (long) valueA
                    * valueB);
            final long newSumSqA = Math.addExact(sumSqA, (long) valueA * valueA);
            final long newSumSqB = Math.addExact(sumSqB, (long) valueB * valueB);
            final int newSupportCount = Math.addExact(supportCount, 1);
            sumProduct = newSumProduct;
            sumSqA = newSumSqA;
            sumSqB = newSumSqB;
            supportCount = newSupportCount;
        } catch (final ArithmeticException e) {
            throw new AggregationOverflowException("Overflow while adding ("
                    + valueA + "," + valueB + ") to " + this, e);
        }
    }

    public void add(final PairContribution contribution) {
        Preconditions.checkArgument(
                contribution.getItemA() == itemA
                        && contribution.getItemB() == itemB,
                "%s does not belong to (%s,%s)", contribution, itemA, itemB);
        add(contribution.getValueA(), contribution.getValueB());
    }

    /**
     * Merges another partial aggregate of the same pair into this one.
     */
    public void merge(final PairAggregate other) {
        checkSamePair(other);
        try {
            final long newSumProduct = Math.addExact(sumProduct,
                    other.sumProduct);
            final long newSumSqA = Math.addExact(sumSqA, other.sumSqA);
            final long newSumSqB = Math.addExact(sumSqB, other.sumSqB);
            final int newSupportCount = Math.addExact(supportCount,
                    other.supportCount);
            sumProduct = newSumProduct;
            sumSqA = newSumSqA;
            sumSqB = newSumSqB;
            supportCount = newSupportCount;
        } catch (final ArithmeticException e) {
            throw new AggregationOverflowException("Overflow while merging "
                    + other + " into " + this, e);
        }
    }

    /**
     * The combine function of the aggregation: returns a new aggregate holding the sums of both arguments,
     * which are left unchanged.
     */
    public static PairAggregate combine(final PairAggregate first,
            final PairAggregate second) {
        Preconditions.checkArgument(first != null, "first is null");
        Preconditions.checkArgument(second != null, "second is null");
        final PairAggregate result = first.copy();
        result.merge(second);
        return result;
    }

    public PairAggregate copy() {
        return new PairAggregate(itemA, itemB, sumProduct, sumSqA, sumSqB,
                supportCount);
    }

    private void checkSamePair(final PairAggregate other) {
        Preconditions.checkArgument(other != null, "other is null");
        Preconditions.checkArgument(
                other.itemA == itemA && other.itemB == itemB,
                "Cannot combine (%s,%s) with (%s,%s)", itemA, itemB,
                other.itemA, other.itemB);
    }

    @Override
    public int hashCode() {
        int result = 31 * itemA + itemB;
        result = 31 * result + Long.hashCode(sumProduct);
        result = 31 * result + Long.hashCode(sumSqA);
        result = 31 * result + Long.hashCode(sumSqB);
        return 31 * result + supportCount;
    }

    @Override
    public boolean equals(final Object o) {
        if (!(o instanceof PairAggregate)) {
            return false;
        }
        final PairAggregate other = (PairAggregate) o;
        return itemA == other.itemA && itemB == other.itemB
                && sumProduct == other.sumProduct && sumSqA == other.sumSqA
                && sumSqB == other.sumSqB
                && supportCount == other.supportCount;
    }

    @Override
    public String toString() {
        return "PairAggregate[(" + itemA + ',' + itemB + "), sumProduct:"
                + sumProduct + ", sumSqA:" + sumSqA + ", sumSqB:" + sumSqB
                + ", supportCount:" + supportCount + ']';
    }

}
