package org.codelibs.taste.common;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class HashUtilsTest {

    @Test
    public void test_nextTwinPrime() {
        assertEquals(5, HashUtils.nextTwinPrime(-1));
        assertEquals(5, HashUtils.nextTwinPrime(3));
        assertEquals(7, HashUtils.nextTwinPrime(4));
        assertEquals(7, HashUtils.nextTwinPrime(5));
        assertEquals(13, HashUtils.nextTwinPrime(7));
        assertEquals(19, HashUtils.nextTwinPrime(12));
        assertEquals(31, HashUtils.nextTwinPrime(18));
        assertEquals(61, HashUtils.nextTwinPrime(42));
    }
}
