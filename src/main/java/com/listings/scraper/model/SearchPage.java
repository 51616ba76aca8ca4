package com.listings.scraper.model;

import java.util.List;
import java.util.Optional;

/**
 * One page of search results.
 *
 * @param listings   raw listings in API order
 * @param nextCursor {@code meta.next_page}, empty at the end of results
 */
public record SearchPage(List<RawListing> listings, Optional<String> nextCursor) {

    public SearchPage {
        listings = List.copyOf(listings);
    }

    public boolean isEmpty() {
        return listings.isEmpty();
    }
}
