package org.codelibs.taste;

import java.util.Iterator;

import org.codelibs.taste.model.Rating;
import org.codelibs.taste.model.RatingFilter;
import org.codelibs.taste.model.UserGrouper;
import org.codelibs.taste.model.UserProfile;
import org.codelibs.taste.recommender.QueryConfig;
import org.codelibs.taste.recommender.RecommendationQuery;
import org.codelibs.taste.recommender.Recommendations;
import org.codelibs.taste.similarity.CosineSimilarityScorer;
import org.codelibs.taste.similarity.PairAggregator;
import org.codelibs.taste.similarity.ScoredPairTable;
import org.codelibs.taste.similarity.SimilarityScorer;
import org.codelibs.taste.similarity.precompute.MultithreadedPairAggregation;
import org.codelibs.taste.similarity.precompute.PairAggregation;
import org.codelibs.taste.similarity.precompute.SequentialPairAggregation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * <p>
 * Computes the cosine similarity of every co-rated item pair from a sequence of ratings and answers "similar
 * items" queries against the result.
 * </p>
 *
 * <p>
 * Ratings flow through {@link RatingFilter}, {@link UserGrouper} and a {@link PairAggregation}; the finished
 * aggregates are scored into a {@link ScoredPairTable}. A failed run leaves no table behind and must be
 * started again from the beginning.
 * </p>
 */
public class ItemSimilarityEngine {

    private static final Logger logger = LoggerFactory
            .getLogger(ItemSimilarityEngine.class);

    private final SimilarityConfig config;

    private final SimilarityScorer scorer;

    private volatile ScoredPairTable table;

    public ItemSimilarityEngine(final SimilarityConfig config) {
        this(config, CosineSimilarityScorer.getInstance());
    }

    public ItemSimilarityEngine(final SimilarityConfig config,
            final SimilarityScorer scorer) {
        Preconditions.checkArgument(config != null, "config is null");
        Preconditions.checkArgument(scorer != null, "scorer is null");
        this.config = config;
        this.scorer = scorer;
    }

    public ScoredPairTable compute(final Iterator<Rating> ratings) {
        Preconditions.checkArgument(ratings != null, "ratings is null");
        // a failed run must not leave the previous table in service
        table = null;
        logger.info("Computing item similarities with {}", config);
        final long startTime = System.currentTimeMillis();

        final RatingFilter filter = new RatingFilter(config.getMinRating());
        final UserGrouper grouper = new UserGrouper(config.getGroupingMode());
        final Iterator<UserProfile> profiles = grouper.group(filter
                .filter(ratings));

        final PairAggregator aggregator = createAggregation()
                .aggregate(profiles);
        final ScoredPairTable result = ScoredPairTable.build(aggregator,
                scorer);
        table = result;
        logger.info("Computed {} in {} ms.", result,
                System.currentTimeMillis() - startTime);
        return result;
    }

    protected PairAggregation createAggregation() {
        if (config.getNumOfThreads() == 1) {
            return new SequentialPairAggregation();
        }
        return new MultithreadedPairAggregation(config.getNumOfThreads(),
                config.getBatchSize(), config.getMaxDuration());
    }

    /**
     * @throws IllegalStateException if {@link #compute(Iterator)} has not completed
     */
    public Recommendations recommend(final int targetItemID,
            final QueryConfig queryConfig) {
        final ScoredPairTable current = table;
        Preconditions.checkState(current != null,
                "Item similarities are not computed.");
        return new RecommendationQuery(current).recommend(targetItemID,
                queryConfig);
    }

    public ScoredPairTable getTable() {
        return table;
    }

    public SimilarityConfig getConfig() {
        return config;
    }

}
