package org.codelibs.taste.similarity.precompute;

import java.util.Iterator;

import org.codelibs.taste.common.MemoryUtil;
import org.codelibs.taste.model.UserProfile;
import org.codelibs.taste.similarity.PairAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Aggregates all profiles on the calling thread.
 */
public class SequentialPairAggregation implements PairAggregation {

    private static final Logger log = LoggerFactory
            .getLogger(SequentialPairAggregation.class);

    @Override
    public PairAggregator aggregate(final Iterator<UserProfile> profiles) {
        Preconditions.checkArgument(profiles != null, "profiles is null");
        final long startTime = System.currentTimeMillis();
        final PairAggregator aggregator = new PairAggregator();
        while (profiles.hasNext()) {
            aggregator.addUser(profiles.next());
            if (aggregator.getNumUsers() % 10000 == 0) {
                log.info("Processed {} users, {} pairs",
                        aggregator.getNumUsers(), aggregator.getNumPairs());
                MemoryUtil.logMemoryStatistics();
            }
        }
        aggregator.finish();
        log.info("Aggregation finished at {} ms.", System.currentTimeMillis()
                - startTime);
        return aggregator;
    }

}
