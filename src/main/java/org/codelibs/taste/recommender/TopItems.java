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

package org.codelibs.taste.recommender;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Queue;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/**
 * <p>
 * A simple class that refactors the "find top N things" logic. Only N + 1 candidates are held at a time.
 * </p>
 */
public final class TopItems {

    private static final int DEFAULT_CAPACITY = 16;

    private TopItems() {
    }

    /**
     * @param howMany maximum size of the result
     * @param candidates items to choose from
     * @param comparator ordering of the result, best first
     * @return at most {@code howMany} items in the order of {@code comparator}
     */
    public static List<SimilarItem> getTopItems(final int howMany,
            final Iterator<SimilarItem> candidates,
            final Comparator<SimilarItem> comparator) {
        return getTopItems(howMany, candidates, comparator,
                DEFAULT_CAPACITY);
    }

    /**
     * @param howMany maximum size of the result
     * @param candidates items to choose from
     * @param comparator ordering of the result, best first
     * @return at most {@code howMany} items of {@code candidates} in the order of {@code comparator}
     */
    public static List<SimilarItem> getTopItems(final int howMany,
            final Collection<SimilarItem> candidates,
            final Comparator<SimilarItem> comparator) {
        Preconditions.checkArgument(candidates != null, "candidates is null");
        return getTopItems(howMany, candidates.iterator(), comparator,
                candidates.size());
    }

    private static List<SimilarItem> getTopItems(final int howMany,
            final Iterator<SimilarItem> candidates,
            final Comparator<SimilarItem> comparator,
            final int expectedCandidates) {
        Preconditions.checkArgument(howMany >= 0, "howMany must be at least 0");
        Preconditions.checkArgument(candidates != null, "candidates is null");
        Preconditions.checkArgument(comparator != null, "comparator is null");
        if (howMany == 0) {
            return Collections.emptyList();
        }

        // the head of the queue is the worst item kept so far; it grows as needed
        final int capacity = Math.min(howMany, expectedCandidates) + 1;
        final Queue<SimilarItem> topItems = new PriorityQueue<SimilarItem>(
                capacity, Collections.reverseOrder(comparator));
        boolean full = false;
        while (candidates.hasNext()) {
            final SimilarItem candidate = candidates.next();
            if (!full || comparator.compare(candidate, topItems.peek()) < 0) {
                topItems.add(candidate);
                if (full) {
                    topItems.poll();
                } else if (topItems.size() > howMany) {
                    full = true;
                    topItems.poll();
                }
            }
        }
        final int size = topItems.size();
        if (size == 0) {
            return Collections.emptyList();
        }
        final List<SimilarItem> result = Lists.newArrayListWithCapacity(size);
        result.addAll(topItems);
        Collections.sort(result, comparator);
        return result;
    }

}
