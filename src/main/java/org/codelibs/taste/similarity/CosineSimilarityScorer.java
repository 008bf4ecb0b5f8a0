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

/**
 * <p>
 * Cosine of the angle between the rating vectors of two items, taken over the users who rated both.
 * </p>
 *
 * <p>
 * Like an uncentered cosine, ratings are not shifted to a zero mean. When either item has a zero sum of
 * squares the score is 0 rather than {@link Double#NaN}.
 * </p>
 */
public final class CosineSimilarityScorer implements SimilarityScorer {

    private static final CosineSimilarityScorer INSTANCE = new CosineSimilarityScorer();

    public static CosineSimilarityScorer getInstance() {
        return INSTANCE;
    }

    private CosineSimilarityScorer() {
    }

    @Override
    public double score(final PairAggregate aggregate) {
        return computeResult(aggregate.getSumProduct(),
                aggregate.getSumSqA(), aggregate.getSumSqB());
    }

    static double computeResult(final double sumXY, final double sumX2,
            final double sumY2) {
        final double denominator = Math.sqrt(sumX2) * Math.sqrt(sumY2);
        if (denominator == 0.0) {
            return 0.0;
        }
        final double result = sumXY / denominator;
        // Make sure the result is not accidentally a little outside [-1.0, 1.0] due to rounding:
        if (result < -1.0) {
            return -1.0;
        } else if (result > 1.0) {
            return 1.0;
        }
        return result;
    }

    @Override
    public String toString() {
        return "CosineSimilarityScorer";
    }

}
