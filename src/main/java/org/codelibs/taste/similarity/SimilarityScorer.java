package org.codelibs.taste.similarity;

/**
 * Turns the sums of an item pair into a similarity value.
 */
public interface SimilarityScorer {

    double score(PairAggregate aggregate);

}
