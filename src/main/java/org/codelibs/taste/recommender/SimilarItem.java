package org.codelibs.taste.recommender;

/**
 * An item similar to a query target, with the score and support count of the pair.
 */
public final class SimilarItem {

    private final int itemID;

    private final double score;

    private final int supportCount;

    public SimilarItem(final int itemID, final double score,
            final int supportCount) {
        this.itemID = itemID;
        this.score = score;
        this.supportCount = supportCount;
    }

    public int getItemID() {
        return itemID;
    }

    public double getScore() {
        return score;
    }

    public int getSupportCount() {
        return supportCount;
    }

    @Override
    public int hashCode() {
        return itemID ^ Double.hashCode(score) ^ supportCount;
    }

    @Override
    public boolean equals(final Object o) {
        if (!(o instanceof SimilarItem)) {
            return false;
        }
        final SimilarItem other = (SimilarItem) o;
        return itemID == other.itemID
                && Double.compare(score, other.score) == 0
                && supportCount == other.supportCount;
    }

    @Override
    public String toString() {
        return "SimilarItem[item:" + itemID + ", score:" + score
                + ", support:" + supportCount + ']';
    }

}
