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

import java.io.Serializable;
import java.util.Comparator;

/**
 * Orders from highest to lowest score; equal scores put the lower item ID first.
 */
public final class ByScoreSimilarItemComparator implements
        Comparator<SimilarItem>, Serializable {

    private static final long serialVersionUID = 1L;

    private static final Comparator<SimilarItem> INSTANCE = new ByScoreSimilarItemComparator();

    public static Comparator<SimilarItem> getInstance() {
        return INSTANCE;
    }

    @Override
    public int compare(final SimilarItem o1, final SimilarItem o2) {
        final double value1 = o1.getScore();
        final double value2 = o2.getScore();
        if (value1 > value2) {
            return -1;
        } else if (value1 < value2) {
            return 1;
        }
        return Integer.compare(o1.getItemID(), o2.getItemID());
    }

}
