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
import com.google.common.primitives.Ints;

/**
 * Packs an ordered pair of item IDs into a single {@code long}, the first ID in the high 32 bits.
 */
public final class PairKey {

    private PairKey() {
    }

    public static long of(final int first, final int second) {
        Preconditions.checkArgument(first < second,
                "first must be less than second: (%s,%s)", first, second);
        return (long) first << 32 | second & 0xFFFFFFFFL;
    }

    public static int first(final long key) {
        return (int) (key >> 32);
    }

    public static int second(final long key) {
        return (int) key;
    }

    /**
     * @return a non-negative hash of the key
     */
    public static int hash(final long key) {
        final int firstHash = Ints.hashCode(first(key));
        // Flip top and bottom 16 bits; this makes the hash function probably different
        // for (a,b) versus (b,a)
        return ((firstHash >>> 16 | firstHash << 16) * 0x9E3779B1 ^ Ints
                .hashCode(second(key))) & 0x7FFFFFFF;
    }

}
