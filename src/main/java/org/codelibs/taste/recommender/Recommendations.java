package org.codelibs.taste.recommender;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * The two top-N views of a query: by similarity score and by number of shared users.
 */
public final class Recommendations {

    private final int targetItemID;

    private final List<SimilarItem> byScore;

    private final List<SimilarItem> bySupport;

    public Recommendations(final int targetItemID,
            final List<SimilarItem> byScore, final List<SimilarItem> bySupport) {
        this.targetItemID = targetItemID;
        this.byScore = ImmutableList.copyOf(byScore);
        this.bySupport = ImmutableList.copyOf(bySupport);
    }

    public static Recommendations empty(final int targetItemID) {
        return new Recommendations(targetItemID,
                ImmutableList.<SimilarItem> of(),
                ImmutableList.<SimilarItem> of());
    }

    public int getTargetItemID() {
        return targetItemID;
    }

    public List<SimilarItem> getByScore() {
        return byScore;
    }

    public List<SimilarItem> getBySupport() {
        return bySupport;
    }

    public boolean isEmpty() {
        return byScore.isEmpty() && bySupport.isEmpty();
    }

    @Override
    public String toString() {
        return "Recommendations[target:" + targetItemID + ", byScore:"
                + byScore + ", bySupport:" + bySupport + ']';
    }

}
