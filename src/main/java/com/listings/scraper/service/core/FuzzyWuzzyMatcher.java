package com.listings.scraper.service.core;

import me.xdrop.fuzzywuzzy.FuzzySearch;
import org.springframework.stereotype.Component;

/**
 * {@link FuzzyMatcher} backed by the FuzzyWuzzy partial ratio.
 */
@Component
public class FuzzyWuzzyMatcher implements FuzzyMatcher {

    @Override
    public int partialScore(final String needle, final String haystack) {
        if (needle == null || haystack == null || needle.isEmpty() || haystack.isEmpty()) {
            return 0;
        }
        return FuzzySearch.partialRatio(needle, haystack);
    }
}
