package com.listings.scraper.parser;

import com.listings.scraper.model.SearchPage;
import com.listings.scraper.service.core.SearchOutcome;

/**
 * Converts a raw search response body into a typed {@link SearchPage}.
 */
@FunctionalInterface
public interface SearchPageParser {

    /**
     * @param body response body as returned by the marketplace
     * @return the page, or a PARSING failure when the body is not a search page
     */
    SearchOutcome<SearchPage> parse(String body);

}
