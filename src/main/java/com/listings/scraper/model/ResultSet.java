package com.listings.scraper.model;

import java.util.List;

/**
 * Ordered, identity-deduplicated search results.
 *
 * @param matches accepted listings in fetch order
 * @param faults  listings dropped because of processing faults (diagnostics only)
 */
public record ResultSet(List<MatchedListing> matches, List<ListingFault> faults) {

    public ResultSet {
        matches = List.copyOf(matches);
        faults = List.copyOf(faults);
    }

    public static ResultSet empty() {
        return new ResultSet(List.of(), List.of());
    }

    public List<NormalizedListing> listings() {
        return matches.stream().map(MatchedListing::listing).toList();
    }

    public int size() {
        return matches.size();
    }

    public boolean isEmpty() {
        return matches.isEmpty();
    }
}
