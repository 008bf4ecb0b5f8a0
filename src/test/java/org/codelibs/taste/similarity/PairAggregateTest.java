package org.codelibs.taste.similarity;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.List;
import java.util.Random;

import org.codelibs.taste.exception.AggregationOverflowException;
import org.junit.Test;

import com.google.common.collect.Lists;

public class PairAggregateTest {

    @Test
    public void test_add() {
        final PairAggregate aggregate = new PairAggregate(1, 2);
        aggregate.add(5, 5);
        aggregate.add(new PairContribution(1, 2, 4, 4));
        assertEquals(41, aggregate.getSumProduct());
        assertEquals(41, aggregate.getSumSqA());
        assertEquals(41, aggregate.getSumSqB());
        assertEquals(2, aggregate.getSupportCount());
    }

    @Test(expected = IllegalArgumentException.class)
    public void test_addContributionOfOtherPair() {
        new PairAggregate(1, 2).add(new PairContribution(1, 3, 4, 4));
    }

    @Test
    public void test_combineIsAssociativeAndCommutative() {
        final Random random = new Random(3);
        final List<int[]> contributions = Lists.newArrayList();
        for (int i = 0; i < 200; i++) {
            contributions.add(new int[] { random.nextInt(5) + 1,
                    random.nextInt(5) + 1 });
        }

        final PairAggregate full = new PairAggregate(10, 20);
        for (final int[] c : contributions) {
            full.add(c[0], c[1]);
        }

        for (int split = 0; split <= contributions.size(); split += 17) {
            final PairAggregate first = new PairAggregate(10, 20);
            final PairAggregate second = new PairAggregate(10, 20);
            for (int i = 0; i < contributions.size(); i++) {
                final int[] c = contributions.get(i);
                if (i < split) {
                    first.add(c[0], c[1]);
                } else {
                    second.add(c[0], c[1]);
                }
            }
            assertEquals(full, PairAggregate.combine(first, second));
            assertEquals(full, PairAggregate.combine(second, first));
        }

        final PairAggregate a = new PairAggregate(10, 20, 3, 4, 5, 1);
        final PairAggregate b = new PairAggregate(10, 20, 30, 40, 50, 2);
        final PairAggregate c = new PairAggregate(10, 20, 300, 400, 500, 3);
        assertEquals(PairAggregate.combine(PairAggregate.combine(a, b), c),
                PairAggregate.combine(a, PairAggregate.combine(b, c)));
    }

    @Test
    public void test_combineLeavesArgumentsUnchanged() {
        final PairAggregate a = new PairAggregate(1, 2, 3, 4, 5, 1);
        final PairAggregate b = new PairAggregate(1, 2, 6, 7, 8, 2);
        final PairAggregate result = PairAggregate.combine(a, b);
        assertEquals(new PairAggregate(1, 2, 9, 11, 13, 3), result);
        assertEquals(new PairAggregate(1, 2, 3, 4, 5, 1), a);
        assertEquals(new PairAggregate(1, 2, 6, 7, 8, 2), b);
    }

    @Test(expected = IllegalArgumentException.class)
    public void test_combineDifferentPairs() {
        PairAggregate.combine(new PairAggregate(1, 2), new PairAggregate(1, 3));
    }

    @Test
    public void test_addOverflow() {
        final PairAggregate aggregate = new PairAggregate(1, 2);
        aggregate.add(Integer.MAX_VALUE, Integer.MAX_VALUE);
        aggregate.add(Integer.MAX_VALUE, Integer.MAX_VALUE);
        final PairAggregate before = aggregate.copy();
        try {
            aggregate.add(Integer.MAX_VALUE, Integer.MAX_VALUE);
            fail();
        } catch (final AggregationOverflowException e) {
            // the failed contribution is not partially applied
            assertEquals(before, aggregate);
        }
    }

    @Test(expected = AggregationOverflowException.class)
    public void test_supportCountOverflow() {
        new PairAggregate(1, 2, 0, 0, 0, Integer.MAX_VALUE).add(1, 1);
    }

    @Test(expected = AggregationOverflowException.class)
    public void test_combineOverflow() {
        PairAggregate.combine(new PairAggregate(1, 2, Long.MAX_VALUE - 1, 1,
                1, 1), new PairAggregate(1, 2, 2, 1, 1, 1));
    }
}
