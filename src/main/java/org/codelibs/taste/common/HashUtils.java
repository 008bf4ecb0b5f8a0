/**
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.codelibs.taste.common;

import com.google.common.base.Preconditions;
import com.google.common.math.IntMath;

/**
 * Sizing helpers for the open-addressing tables in this package.
 */
public final class HashUtils {

    /** The largest prime less than 2<sup>31</sup>-1 that is the smaller of a twin prime pair. */
    public static final int MAX_INT_SMALLER_TWIN_PRIME = 2147482949;

    private HashUtils() {
    }

    /**
     * Finds next-largest "twin primes": numbers p and p+2 such that both are prime. Finds the smallest such p
     * such that the smaller twin, p, is greater than or equal to n. Returns p+2, the larger of the two twins.
     */
    public static int nextTwinPrime(final int n) {
        Preconditions.checkArgument(n <= MAX_INT_SMALLER_TWIN_PRIME,
                "n must be at most %s", MAX_INT_SMALLER_TWIN_PRIME);
        if (n <= 3) {
            return 5;
        }
        int next = IntMath.isPrime(n) ? n : nextPrime(n);
        while (!IntMath.isPrime(next + 2)) {
            next = nextPrime(next + 4);
        }
        return next + 2;
    }

    private static int nextPrime(final int n) {
        int candidate = n | 1;
        while (!IntMath.isPrime(candidate)) {
            candidate += 2;
        }
        return candidate;
    }

}
