package com.listings.scraper.model;

/**
 * Outcome of evaluating one listing against the search criteria.
 *
 * @param passed               whether the listing is kept
 * @param score                best qualifying keyword score (0–100), 0 when no keywords were given
 * @param matchedInDescription whether a description match qualified
 * @param rejectedBy           first rule that disqualified the listing, {@code null} when passed
 */
public record FilterDecision(boolean passed, int score, boolean matchedInDescription, FilterRule rejectedBy) {

    public static FilterDecision pass(final int score, final boolean matchedInDescription) {
        return new FilterDecision(true, score, matchedInDescription, null);
    }

    public static FilterDecision reject(final FilterRule rule) {
        return new FilterDecision(false, 0, false, rule);
    }

    public static FilterDecision reject(final FilterRule rule, final int score, final boolean matchedInDescription) {
        return new FilterDecision(false, score, matchedInDescription, rule);
    }
}
