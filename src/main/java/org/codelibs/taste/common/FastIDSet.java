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

import java.io.Serializable;
import java.util.Arrays;

import com.google.common.base.Preconditions;

/**
 * An open-addressing set of {@code long} IDs, free of boxing. IDs are never removed.
 */
public final class FastIDSet implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final float DEFAULT_LOAD_FACTOR = 1.5f;

    private static final long NULL = Long.MIN_VALUE;

    private long[] keys;

    private final float loadFactor;

    private int numEntries;

    /** Creates a new {@link FastIDSet} with default capacity. */
    public FastIDSet() {
        this(2);
    }

    public FastIDSet(final int size) {
        this(size, DEFAULT_LOAD_FACTOR);
    }

    public FastIDSet(final int size, final float loadFactor) {
        Preconditions.checkArgument(size >= 0, "size must be at least 0");
        Preconditions.checkArgument(loadFactor >= 1.0f,
                "loadFactor must be at least 1.0");
        this.loadFactor = loadFactor;
        final int max = (int) (HashUtils.MAX_INT_SMALLER_TWIN_PRIME / loadFactor);
        Preconditions.checkArgument(size < max, "size must be less than %s",
                max);
        final int hashSize = HashUtils
                .nextTwinPrime((int) (loadFactor * size));
        keys = new long[hashSize];
        Arrays.fill(keys, NULL);
    }

    private int find(final long key) {
        final int theHashCode = (int) (key ^ key >>> 32) & 0x7FFFFFFF; // make sure it's positive
        final long[] keys = this.keys;
        final int hashSize = keys.length;
        final int jump = 1 + theHashCode % (hashSize - 2);
        int index = theHashCode % hashSize;
        long currentKey = keys[index];
        while (currentKey != NULL && key != currentKey) {
            index -= index < jump ? jump - hashSize : jump;
            currentKey = keys[index];
        }
        return index;
    }

    public int size() {
        return numEntries;
    }

    public boolean isEmpty() {
        return numEntries == 0;
    }

    public boolean contains(final long key) {
        return key != NULL && keys[find(key)] != NULL;
    }

    public boolean add(final long key) {
        Preconditions.checkArgument(key != NULL);

        if (numEntries * loadFactor >= keys.length) {
            growAndRehash();
        }
        final int index = find(key);
        if (keys[index] != key) {
            keys[index] = key;
            numEntries++;
            return true;
        }
        return false;
    }

    private void growAndRehash() {
        if (keys.length * loadFactor >= HashUtils.MAX_INT_SMALLER_TWIN_PRIME) {
            throw new IllegalStateException("Can't grow any more");
        }
        final long[] oldKeys = keys;
        numEntries = 0;
        keys = new long[HashUtils.nextTwinPrime((int) (loadFactor * oldKeys.length))];
        Arrays.fill(keys, NULL);
        for (final long key : oldKeys) {
            if (key != NULL) {
                add(key);
            }
        }
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "[]";
        }
        final StringBuilder result = new StringBuilder();
        result.append('[');
        for (final long key : keys) {
            if (key != NULL) {
                result.append(key).append(',');
            }
        }
        result.setCharAt(result.length() - 1, ']');
        return result.toString();
    }

}
