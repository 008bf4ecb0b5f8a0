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

package org.codelibs.taste.similarity;

import java.util.Iterator;
import java.util.NoSuchElementException;

import org.codelibs.taste.common.HashUtils;
import org.codelibs.taste.common.PairKey;

import com.google.common.base.Preconditions;
import com.google.common.collect.UnmodifiableIterator;

/**
 * <p>
 * An open-addressing hash map from an item pair to its {@link PairAggregate}. Keys are the two item IDs packed
 * into a {@code long} by {@link PairKey}, so only pairs that actually co-occur take memory.
 * </p>
 *
 * <p>
 * Entries are never removed. The map is not thread-safe; concurrent aggregation gives each worker its own
 * map and merges them afterwards.
 * </p>
 */
public final class PairAggregateMap implements Iterable<PairAggregate> {

    private static final float DEFAULT_LOAD_FACTOR = 1.5f;

    private long[] keys;

    private PairAggregate[] values;

    private final float loadFactor;

    private int numEntries;

    public PairAggregateMap() {
        this(2);
    }

    public PairAggregateMap(final int size) {
        this(size, DEFAULT_LOAD_FACTOR);
    }

    public PairAggregateMap(final int size, final float loadFactor) {
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
        values = new PairAggregate[hashSize];
    }

    /**
     * Empty slots are the ones without a value.
     */
    private int find(final long key) {
        final int theHashCode = PairKey.hash(key);
        final long[] keys = this.keys;
        final PairAggregate[] values = this.values;
        final int hashSize = keys.length;
        final int jump = 1 + theHashCode % (hashSize - 2);
        int index = theHashCode % hashSize;
        while (values[index] != null && keys[index] != key) {
            index -= index < jump ? jump - hashSize : jump;
        }
        return index;
    }

    public int size() {
        return numEntries;
    }

    public boolean isEmpty() {
        return numEntries == 0;
    }

    public PairAggregate get(final int itemA, final int itemB) {
        return values[find(PairKey.of(itemA, itemB))];
    }

    /**
     * @return the aggregate of the pair, created empty on first access
     */
    public PairAggregate getOrCreate(final int itemA, final int itemB) {
        final long key = PairKey.of(itemA, itemB);
        int index = find(key);
        PairAggregate aggregate = values[index];
        if (aggregate == null) {
            if (numEntries * loadFactor >= keys.length) {
                growAndRehash();
                index = find(key);
            }
            aggregate = new PairAggregate(itemA, itemB);
            keys[index] = key;
            values[index] = aggregate;
            numEntries++;
        }
        return aggregate;
    }

    /**
     * Combines a partial aggregate into the entry of its pair. The argument is copied, never shared.
     */
    public void merge(final PairAggregate aggregate) {
        getOrCreate(aggregate.getItemA(), aggregate.getItemB()).merge(
                aggregate);
    }

    public void mergeAll(final PairAggregateMap other) {
        Preconditions.checkArgument(other != this, "cannot merge into itself");
        for (final PairAggregate aggregate : other) {
            merge(aggregate);
        }
    }

    private void growAndRehash() {
        if (keys.length * loadFactor >= HashUtils.MAX_INT_SMALLER_TWIN_PRIME) {
            throw new IllegalStateException("Can't grow any more");
        }
        final long[] oldKeys = keys;
        final PairAggregate[] oldValues = values;
        final int newHashSize = HashUtils
                .nextTwinPrime((int) (loadFactor * oldKeys.length));
        keys = new long[newHashSize];
        values = new PairAggregate[newHashSize];
        for (int i = 0; i < oldKeys.length; i++) {
            if (oldValues[i] != null) {
                final int index = find(oldKeys[i]);
                keys[index] = oldKeys[i];
                values[index] = oldValues[i];
            }
        }
    }

    @Override
    public Iterator<PairAggregate> iterator() {
        return new ValueIterator();
    }

    @Override
    public String toString() {
        return "PairAggregateMap[size:" + numEntries + ", slots:"
                + keys.length + ']';
    }

    private final class ValueIterator extends
            UnmodifiableIterator<PairAggregate> {

        private int position;

        @Override
        public boolean hasNext() {
            goToNext();
            return position < values.length;
        }

        @Override
        public PairAggregate next() {
            goToNext();
            if (position >= values.length) {
                throw new NoSuchElementException();
            }
            return values[position++];
        }

        private void goToNext() {
            final int length = values.length;
            while (position < length && values[position] == null) {
                position++;
            }
        }
    }

}
