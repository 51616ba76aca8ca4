package com.listings.scraper.model;

/**
 * Per-field fuzzy matching thresholds on the 0–100 scale.
 *
 * @param title       a keyword matches the title when its score is strictly above this value
 * @param description a keyword matches the description when its score is strictly above this value
 * @param excluded    an excluded term disqualifies a listing when its score reaches this value
 */
public record FuzzyThresholds(int title, int description, int excluded) {

    /** Compile-time defaults. */
    public static final FuzzyThresholds DEFAULTS = new FuzzyThresholds(75, 65, 85);
}
