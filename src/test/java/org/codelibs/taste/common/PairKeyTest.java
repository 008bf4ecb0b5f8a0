package org.codelibs.taste.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class PairKeyTest {

    @Test
    public void test_packAndUnpack() {
        final long key = PairKey.of(12, 345);
        assertEquals(12, PairKey.first(key));
        assertEquals(345, PairKey.second(key));

        final long negative = PairKey.of(-5, -1);
        assertEquals(-5, PairKey.first(negative));
        assertEquals(-1, PairKey.second(negative));
        assertNotEquals(PairKey.of(1, 2), PairKey.of(2, 3));
    }

    @Test(expected = IllegalArgumentException.class)
    public void test_unorderedPair() {
        PairKey.of(2, 1);
    }

    @Test
    public void test_hashIsNonNegative() {
        for (int i = -100; i < 100; i++) {
            assertTrue(PairKey.hash(PairKey.of(i, i + 1000)) >= 0);
            assertTrue(PairKey.hash(PairKey.of(Integer.MIN_VALUE + 1,
                    Integer.MAX_VALUE - i - 100)) >= 0);
        }
    }
}
