package com.listings.scraper.service.core;

import com.listings.scraper.model.ResultSet;
import com.listings.scraper.model.SearchCriteria;
import com.listings.scraper.model.SearchSettings;

/**
 * Searches a marketplace for listings matching a buyer's criteria.
 */
public interface ListingSearchService {

    /**
     * Runs a search with the service's default settings.
     *
     * @param criteria search criteria
     * @return the ordered, deduplicated matches, or the categorised failure
     */
    SearchOutcome<ResultSet> search(SearchCriteria criteria);

    /**
     * Runs a search with explicit settings.
     *
     * @param criteria search criteria
     * @param settings endpoint, headers and thresholds for this call only
     * @return the ordered, deduplicated matches, or the categorised failure
     */
    SearchOutcome<ResultSet> search(SearchCriteria criteria, SearchSettings settings);
}
