package org.codelibs.taste.similarity.precompute;

import java.util.Iterator;

import org.codelibs.taste.model.UserProfile;
import org.codelibs.taste.similarity.PairAggregator;

/**
 * Runs the pair aggregation over all user profiles.
 */
public interface PairAggregation {

    /**
     * Consumes every profile exactly once.
     *
     * @return a finished aggregator
     */
    PairAggregator aggregate(Iterator<UserProfile> profiles);

}
