package org.codelibs.taste.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import org.junit.Test;

public class FastIDSetTest {

    @Test
    public void test_addAndContains() {
        final FastIDSet set = new FastIDSet();
        assertTrue(set.isEmpty());
        assertTrue(set.add(3));
        assertFalse(set.add(3));
        assertTrue(set.add(-7));
        assertTrue(set.contains(3));
        assertTrue(set.contains(-7));
        assertFalse(set.contains(4));
        assertEquals(2, set.size());
        assertFalse(set.isEmpty());
    }

    @Test
    public void test_growth() {
        final Random random = new Random(11);
        final FastIDSet set = new FastIDSet();
        final Set<Long> expected = new HashSet<Long>();
        for (int i = 0; i < 10000; i++) {
            final long id = random.nextInt(50000);
            assertEquals(expected.add(id), set.add(id));
        }
        assertEquals(expected.size(), set.size());
        for (final long id : expected) {
            assertTrue(set.contains(id));
        }
    }
}
