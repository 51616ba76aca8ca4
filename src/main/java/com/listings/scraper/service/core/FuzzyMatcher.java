package com.listings.scraper.service.core;

/**
 * String-similarity primitive used by the listing filter.
 */
@FunctionalInterface
public interface FuzzyMatcher {

    /**
     * Partial (best substring) similarity of two strings.
     *
     * @param needle   short text, e.g. a keyword
     * @param haystack longer text, e.g. a title
     * @return score between 0 and 100
     */
    int partialScore(String needle, String haystack);
}
