package org.codelibs.taste.similarity;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.codelibs.taste.model.Rating;
import org.codelibs.taste.model.RatingFilter;
import org.codelibs.taste.model.UserGrouper;
import org.codelibs.taste.model.UserProfile;
import org.junit.Test;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

public class PairAggregatorTest {

    static List<Rating> randomRatings(final long seed, final int numUsers,
            final int numItems, final int ratingsPerUser) {
        final Random random = new Random(seed);
        final List<Rating> ratings = Lists.newArrayList();
        for (int user = 1; user <= numUsers; user++) {
            final int count = random.nextInt(ratingsPerUser + 1);
            for (int i = 0; i < count; i++) {
                // duplicates of (user, item) happen on purpose
                ratings.add(new Rating(user, random.nextInt(numItems) + 1,
                        random.nextInt(5) + 1));
            }
        }
        return ratings;
    }

    private static PairAggregator aggregate(final Iterator<Rating> ratings,
            final int minRating) {
        final PairAggregator aggregator = new PairAggregator();
        final Iterator<UserProfile> profiles = new UserGrouper()
                .group(new RatingFilter(minRating).filter(ratings));
        while (profiles.hasNext()) {
            aggregator.addUser(profiles.next());
        }
        aggregator.finish();
        return aggregator;
    }

    @Test
    public void test_threeUserScenario() {
        final List<Rating> ratings = Lists.newArrayList(new Rating(1, 1, 5),
                new Rating(1, 2, 5), new Rating(2, 1, 4), new Rating(2, 2, 4),
                new Rating(3, 1, 1), new Rating(3, 2, 1));
        final PairAggregator aggregator = aggregate(ratings.iterator(), 3);

        assertEquals(1, aggregator.getNumPairs());
        assertEquals(2, aggregator.getNumUsers());
        final PairAggregate aggregate = aggregator.get(1, 2);
        assertEquals(41, aggregate.getSumProduct());
        assertEquals(41, aggregate.getSumSqA());
        assertEquals(41, aggregate.getSumSqB());
        assertEquals(2, aggregate.getSupportCount());
        assertEquals(aggregate, aggregator.get(2, 1));
        assertNull(aggregator.get(1, 1));
    }

    @Test
    public void test_singleRatingUserContributesNothing() {
        final PairAggregator aggregator = new PairAggregator();
        assertEquals(0,
                aggregator.addUser(new UserProfile(1, ImmutableMap.of(7, 5))));
        aggregator.finish();
        assertEquals(0, aggregator.getNumPairs());
        assertEquals(0, aggregator.getNumContributions());
        assertEquals(1, aggregator.getNumUsers());
    }

    @Test
    public void test_matchesBruteForce() {
        final int minRating = 3;
        final List<Rating> ratings = randomRatings(17, 200, 40, 12);
        final PairAggregator aggregator = aggregate(ratings.iterator(),
                minRating);

        // keep ratings >= minRating, then last write wins per (user, item)
        final Map<Integer, Map<Integer, Integer>> byUser = new HashMap<Integer, Map<Integer, Integer>>();
        for (final Rating rating : ratings) {
            if (rating.getValue() >= minRating) {
                Map<Integer, Integer> items = byUser.get(rating.getUserID());
                if (items == null) {
                    items = new HashMap<Integer, Integer>();
                    byUser.put(rating.getUserID(), items);
                }
                items.put(rating.getItemID(), rating.getValue());
            }
        }

        int expectedPairs = 0;
        long expectedContributions = 0;
        for (int a = 1; a <= 40; a++) {
            for (int b = a + 1; b <= 40; b++) {
                int support = 0;
                long sumProduct = 0;
                long sumSqA = 0;
                long sumSqB = 0;
                for (final Map<Integer, Integer> items : byUser.values()) {
                    final Integer x = items.get(a);
                    final Integer y = items.get(b);
                    if (x != null && y != null) {
                        support++;
                        sumProduct += x * y;
                        sumSqA += x * x;
                        sumSqB += y * y;
                    }
                }
                final PairAggregate aggregate = aggregator.get(a, b);
                if (support == 0) {
                    assertNull(aggregate);
                } else {
                    expectedPairs++;
                    expectedContributions += support;
                    assertEquals(new PairAggregate(a, b, sumProduct, sumSqA,
                            sumSqB, support), aggregate);
                }
            }
        }
        assertEquals(expectedPairs, aggregator.getNumPairs());
        assertEquals(expectedContributions, aggregator.getNumContributions());

        long fanOut = 0;
        for (final Map<Integer, Integer> items : byUser.values()) {
            fanOut += PairExpander.numberOfPairs(items.size());
        }
        assertEquals(fanOut, aggregator.getNumContributions());
    }

    @Test
    public void test_mergeOfUserPartitions() {
        final List<Rating> ratings = randomRatings(5, 100, 25, 10);
        final List<UserProfile> profiles = Lists.newArrayList(new UserGrouper()
                .group(ratings.iterator()));

        final PairAggregator full = new PairAggregator();
        final PairAggregator even = new PairAggregator();
        final PairAggregator odd = new PairAggregator();
        for (final UserProfile profile : profiles) {
            full.addUser(profile);
            (profile.getUserID() % 2 == 0 ? even : odd).addUser(profile);
        }
        full.finish();
        odd.merge(even);
        odd.finish();

        assertEquals(full.getNumPairs(), odd.getNumPairs());
        assertEquals(full.getNumUsers(), odd.getNumUsers());
        assertEquals(full.getNumContributions(), odd.getNumContributions());
        for (final PairAggregate aggregate : full) {
            assertEquals(aggregate,
                    odd.get(aggregate.getItemA(), aggregate.getItemB()));
        }
    }

    @Test
    public void test_finishedAggregatorIsReadOnly() {
        final PairAggregator aggregator = new PairAggregator();
        aggregator.handle(new PairContribution(1, 2, 3, 3));
        assertFalse(aggregator.isFinished());
        aggregator.finish();
        assertTrue(aggregator.isFinished());
        try {
            aggregator.handle(new PairContribution(1, 2, 3, 3));
            fail();
        } catch (final IllegalStateException e) {
            // expected
        }
        try {
            aggregator.merge(new PairAggregator());
            fail();
        } catch (final IllegalStateException e) {
            // expected
        }
        assertEquals(1, aggregator.get(1, 2).getSupportCount());
    }
}
