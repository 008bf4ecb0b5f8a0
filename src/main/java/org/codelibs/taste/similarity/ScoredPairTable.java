package org.codelibs.taste.similarity;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.Ordering;
import com.google.common.primitives.Ints;

/**
 * <p>
 * The immutable set of scored item pairs produced by one aggregation run, indexed by item so that the pairs
 * of one item can be read without a full scan.
 * </p>
 *
 * <p>
 * Pairs are kept in ascending (itemA, itemB) order, so two tables built from the same ratings are equal
 * regardless of how the aggregation was scheduled.
 * </p>
 */
public final class ScoredPairTable {

    private static final Logger log = LoggerFactory
            .getLogger(ScoredPairTable.class);

    private static final Ordering<ScoredPair> PAIR_ORDER = new Ordering<ScoredPair>() {
        @Override
        public int compare(final ScoredPair left, final ScoredPair right) {
            final int result = Ints.compare(left.getItemA(), right.getItemA());
            return result != 0 ? result : Ints.compare(left.getItemB(),
                    right.getItemB());
        }
    };

    private final ImmutableList<ScoredPair> pairs;

    private final ImmutableListMultimap<Integer, ScoredPair> pairsByItem;

    public ScoredPairTable(final Iterable<ScoredPair> scoredPairs) {
        Preconditions.checkArgument(scoredPairs != null, "scoredPairs is null");
        pairs = ImmutableList.copyOf(PAIR_ORDER.sortedCopy(scoredPairs));
        final ImmutableListMultimap.Builder<Integer, ScoredPair> builder = ImmutableListMultimap
                .builder();
        for (final ScoredPair pair : pairs) {
            builder.put(pair.getItemA(), pair);
            builder.put(pair.getItemB(), pair);
        }
        pairsByItem = builder.build();
    }

    /**
     * Scores every aggregate of a finished aggregation.
     */
    public static ScoredPairTable build(final PairAggregator aggregator,
            final SimilarityScorer scorer) {
        Preconditions.checkArgument(aggregator != null, "aggregator is null");
        Preconditions.checkArgument(scorer != null, "scorer is null");
        Preconditions.checkState(aggregator.isFinished(),
                "aggregation is not finished");
        final List<ScoredPair> scoredPairs = Lists
                .newArrayListWithCapacity(aggregator.getNumPairs());
        for (final PairAggregate aggregate : aggregator) {
            scoredPairs.add(ScoredPair.of(aggregate, scorer));
        }
        final ScoredPairTable table = new ScoredPairTable(scoredPairs);
        log.info("Scored {} pairs of {} items with {}", table.size(),
                table.getNumItems(), scorer);
        return table;
    }

    public int size() {
        return pairs.size();
    }

    public int getNumItems() {
        return pairsByItem.keySet().size();
    }

    public boolean containsItem(final int itemID) {
        return pairsByItem.containsKey(itemID);
    }

    public List<ScoredPair> getPairs() {
        return pairs;
    }

    /**
     * @return every pair containing the item, empty for an unknown item
     */
    public List<ScoredPair> getPairsOf(final int itemID) {
        return pairsByItem.get(itemID);
    }

    /**
     * @return the pair of both items in either order, or {@code null}
     */
    public ScoredPair get(final int itemID1, final int itemID2) {
        for (final ScoredPair pair : pairsByItem.get(itemID1)) {
            if (pair.contains(itemID2) && itemID1 != itemID2) {
                return pair;
            }
        }
        return null;
    }

    @Override
    public int hashCode() {
        return pairs.hashCode();
    }

    @Override
    public boolean equals(final Object o) {
        if (!(o instanceof ScoredPairTable)) {
            return false;
        }
        return pairs.equals(((ScoredPairTable) o).pairs);
    }

    @Override
    public String toString() {
        return "ScoredPairTable[pairs:" + pairs.size() + ", items:"
                + getNumItems() + ']';
    }

}
