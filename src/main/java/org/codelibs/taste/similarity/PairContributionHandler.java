package org.codelibs.taste.similarity;

/**
 * Receives the contributions produced by {@link PairExpander}.
 */
public interface PairContributionHandler {

    void handle(PairContribution contribution);

}
