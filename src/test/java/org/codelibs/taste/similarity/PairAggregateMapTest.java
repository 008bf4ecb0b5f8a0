package org.codelibs.taste.similarity;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

public class PairAggregateMapTest {

    @Test
    public void test_getOrCreate() {
        final PairAggregateMap map = new PairAggregateMap();
        assertTrue(map.isEmpty());
        assertNull(map.get(1, 2));

        final PairAggregate aggregate = map.getOrCreate(1, 2);
        assertEquals(0, aggregate.getSupportCount());
        aggregate.add(3, 4);
        assertSame(aggregate, map.getOrCreate(1, 2));
        assertSame(aggregate, map.get(1, 2));
        assertEquals(1, map.size());
    }

    @Test
    public void test_manyPairs() {
        final PairAggregateMap map = new PairAggregateMap();
        final int numItems = 300;
        for (int a = 0; a < numItems; a++) {
            for (int b = a + 1; b < numItems; b += 3) {
                map.getOrCreate(a, b).add(a % 5 + 1, b % 5 + 1);
            }
        }
        int expected = 0;
        for (int a = 0; a < numItems; a++) {
            for (int b = a + 1; b < numItems; b += 3) {
                final PairAggregate aggregate = map.get(a, b);
                assertEquals(a, aggregate.getItemA());
                assertEquals(b, aggregate.getItemB());
                assertEquals((a % 5 + 1) * (b % 5 + 1),
                        aggregate.getSumProduct());
                expected++;
            }
            assertNull(map.get(a, a + 2 < numItems ? a + 2 : numItems + 1));
        }
        assertEquals(expected, map.size());

        int iterated = 0;
        for (final PairAggregate aggregate : map) {
            assertEquals(1, aggregate.getSupportCount());
            iterated++;
        }
        assertEquals(expected, iterated);
    }

    @Test
    public void test_mergeAll() {
        final PairAggregateMap first = new PairAggregateMap();
        first.getOrCreate(1, 2).add(2, 3);
        first.getOrCreate(2, 3).add(1, 1);
        final PairAggregateMap second = new PairAggregateMap();
        second.getOrCreate(1, 2).add(4, 5);
        second.getOrCreate(5, 9).add(2, 2);

        first.mergeAll(second);
        assertEquals(3, first.size());
        assertEquals(new PairAggregate(1, 2, 26, 20, 34, 2), first.get(1, 2));
        assertEquals(new PairAggregate(5, 9, 4, 4, 4, 1), first.get(5, 9));
        // merged entries are copies
        second.get(5, 9).add(1, 1);
        assertEquals(1, first.get(5, 9).getSupportCount());

        final Map<String, PairAggregate> all = new HashMap<String, PairAggregate>();
        for (final PairAggregate aggregate : first) {
            all.put(aggregate.getItemA() + ":" + aggregate.getItemB(),
                    aggregate);
        }
        assertEquals(3, all.size());
    }
}
