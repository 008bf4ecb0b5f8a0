package org.codelibs.taste.similarity;

import java.util.Iterator;

import org.codelibs.taste.model.UserProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.Iterators;

/**
 * <p>
 * Reduces the pair contributions of many users into one {@link PairAggregate} per co-rated item pair.
 * </p>
 *
 * <p>
 * Each user must be added exactly once. Aggregators filled from disjoint sets of users can be merged with
 * {@link #merge(PairAggregator)}; the result does not depend on the order of users or merges. After
 * {@link #finish()} the aggregator is read-only and may be shared between threads.
 * </p>
 */
public class PairAggregator implements PairContributionHandler,
        Iterable<PairAggregate> {

    private static final Logger log = LoggerFactory
            .getLogger(PairAggregator.class);

    private final PairAggregateMap aggregates;

    private long numOfUsers = 0;

    private long numOfContributions = 0;

    private volatile boolean finished = false;

    public PairAggregator() {
        aggregates = new PairAggregateMap();
    }

    public PairAggregator(final int expectedPairs) {
        aggregates = new PairAggregateMap(expectedPairs);
    }

    @Override
    public void handle(final PairContribution contribution) {
        checkNotFinished();
        aggregates.getOrCreate(contribution.getItemA(),
                contribution.getItemB()).add(contribution);
        numOfContributions++;
    }

    /**
     * Expands the profile and absorbs all of its pairs.
     */
    public long addUser(final UserProfile profile) {
        checkNotFinished();
        final long count = PairExpander.expand(profile, this);
        numOfUsers++;
        return count;
    }

    /**
     * Merges the partial result of another aggregator, built from a disjoint set of users.
     */
    public void merge(final PairAggregator other) {
        checkNotFinished();
        Preconditions.checkArgument(other != null, "other is null");
        Preconditions.checkArgument(other != this, "cannot merge into itself");
        aggregates.mergeAll(other.aggregates);
        numOfUsers += other.numOfUsers;
        numOfContributions += other.numOfContributions;
    }

    public void finish() {
        if (!finished) {
            finished = true;
            log.info("Aggregated {} contributions of {} users into {} pairs",
                    numOfContributions, numOfUsers, aggregates.size());
        }
    }

    public boolean isFinished() {
        return finished;
    }

    /**
     * @return the aggregate of the pair, or {@code null} if no user rated both items
     */
    public PairAggregate get(final int itemA, final int itemB) {
        if (itemA == itemB) {
            return null;
        }
        return itemA < itemB ? aggregates.get(itemA, itemB) : aggregates.get(
                itemB, itemA);
    }

    public int getNumPairs() {
        return aggregates.size();
    }

    public long getNumUsers() {
        return numOfUsers;
    }

    public long getNumContributions() {
        return numOfContributions;
    }

    @Override
    public Iterator<PairAggregate> iterator() {
        return Iterators.unmodifiableIterator(aggregates.iterator());
    }

    private void checkNotFinished() {
        if (finished) {
            throw new IllegalStateException("Aggregation is already finished.");
        }
    }

    @Override
    public String toString() {
        return "PairAggregator[users:" + numOfUsers + ", contributions:"
                + numOfContributions + ", pairs:" + aggregates.size()
                + ", finished:" + finished + ']';
    }

}
