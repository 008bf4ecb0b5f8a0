package org.codelibs.taste.recommender;

import java.util.List;

import org.codelibs.taste.similarity.ScoredPair;
import org.codelibs.taste.similarity.ScoredPairTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/**
 * <p>
 * Finds the items most similar to a target item in a {@link ScoredPairTable}.
 * </p>
 *
 * <p>
 * A pair qualifies when its score is strictly above the score threshold and its support count strictly above
 * the minimum support. Qualifying items are returned twice, ranked by score and ranked by support count, each
 * cut to the top N. An item that is in no pair, or a target whose pairs all miss the thresholds, gives two
 * empty lists.
 * </p>
 */
public class RecommendationQuery {

    private static final Logger logger = LoggerFactory
            .getLogger(RecommendationQuery.class);

    private final ScoredPairTable table;

    public RecommendationQuery(final ScoredPairTable table) {
        Preconditions.checkArgument(table != null, "table is null");
        this.table = table;
    }

    public Recommendations recommend(final int targetItemID,
            final QueryConfig config) {
        Preconditions.checkArgument(config != null, "config is null");
        final List<ScoredPair> pairs = table.getPairsOf(targetItemID);
        if (pairs.isEmpty()) {
            logger.debug("Item {} is not in any pair.", targetItemID);
            return Recommendations.empty(targetItemID);
        }

        final List<SimilarItem> candidates = Lists.newArrayList();
        for (final ScoredPair pair : pairs) {
            if (pair.getScore() > config.getScoreThreshold()
                    && pair.getSupportCount() > config.getMinSupport()) {
                candidates.add(new SimilarItem(pair
                        .getOtherItemID(targetItemID), pair.getScore(), pair
                        .getSupportCount()));
            }
        }
        if (logger.isDebugEnabled()) {
            logger.debug("Item {} => {} of {} pairs qualify with {}",
                    targetItemID, candidates.size(), pairs.size(), config);
        }

        final List<SimilarItem> byScore = TopItems.getTopItems(
                config.getTopN(), candidates,
                ByScoreSimilarItemComparator.getInstance());
        final List<SimilarItem> bySupport = TopItems.getTopItems(
                config.getTopN(), candidates,
                BySupportSimilarItemComparator.getInstance());
        return new Recommendations(targetItemID, byScore, bySupport);
    }

}
