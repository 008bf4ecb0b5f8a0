package org.codelibs.taste.similarity;

import com.google.common.base.Preconditions;

/**
 * The similarity score and support count of an item pair.
 */
public final class ScoredPair {

    private final int itemA;

    private final int itemB;

    private final double score;

    private final int supportCount;

    public ScoredPair(final int itemA, final int itemB, final double score,
            final int supportCount) {
        Preconditions.checkArgument(itemA < itemB,
                "itemA must be less than itemB: (%s,%s)", itemA, itemB);
        this.itemA = itemA;
        this.itemB = itemB;
        this.score = score;
        this.supportCount = supportCount;
    }

    public static ScoredPair of(final PairAggregate aggregate,
            final SimilarityScorer scorer) {
        return new ScoredPair(aggregate.getItemA(), aggregate.getItemB(),
                scorer.score(aggregate), aggregate.getSupportCount());
    }

    public int getItemA() {
        return itemA;
    }

    public int getItemB() {
        return itemB;
    }

    public double getScore() {
        return score;
    }

    public int getSupportCount() {
        return supportCount;
    }

    public boolean contains(final int itemID) {
        return itemA == itemID || itemB == itemID;
    }

    /**
     * @return the item of this pair that is not {@code itemID}
     */
    public int getOtherItemID(final int itemID) {
        if (itemA == itemID) {
            return itemB;
        }
        Preconditions.checkArgument(itemB == itemID,
                "%s is not a member of %s", itemID, this);
        return itemA;
    }

    @Override
    public int hashCode() {
        return (31 * itemA + itemB) * 31 + Double.hashCode(score) ^ supportCount;
    }

    @Override
    public boolean equals(final Object o) {
        if (!(o instanceof ScoredPair)) {
            return false;
        }
        final ScoredPair other = (ScoredPair) o;
        return itemA == other.itemA && itemB == other.itemB
                && Double.compare(score, other.score) == 0
                && supportCount == other.supportCount;
    }

    @Override
    public String toString() {
        return "ScoredPair[(" + itemA + ',' + itemB + "), score:" + score
                + ", supportCount:" + supportCount + ']';
    }

}
