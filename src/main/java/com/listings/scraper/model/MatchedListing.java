package com.listings.scraper.model;

import java.time.ZonedDateTime;

/**
 * A listing that passed filtering, with its relevance data.
 *
 * @param listing              normalized listing
 * @param score                relevance score (0–100)
 * @param matchedInDescription whether the best match came from the description
 * @param searchTerm           product name the search was run for
 * @param platform             marketplace name, e.g. {@code WALLAPOP}
 * @param createdAtLocal       creation time in the configured zone, {@code null} when unknown
 */
public record MatchedListing(
        NormalizedListing listing,
        int score,
        boolean matchedInDescription,
        String searchTerm,
        String platform,
        ZonedDateTime createdAtLocal
) {
}
