package com.listings.scraper.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.ZoneId;
import java.util.Map;

/**
 * Immutable per-call configuration of the search pipeline.
 * Built from {@code MarketplaceProperties} for the default case; callers may
 * pass their own instance to override endpoints, headers or thresholds.
 */
@Value
@Builder(toBuilder = true)
public class SearchSettings {

    /** Search endpoint, without query string. */
    String baseUrl;

    /** Headers sent with every page request. */
    @Singular
    Map<String, String> headers;

    @Builder.Default
    FuzzyThresholds thresholds = FuzzyThresholds.DEFAULTS;

    /** Search origin, {@code null} to let the API decide. */
    GeoPoint geo;

    /** Prefix of public detail links; the listing slug is appended. */
    String itemLinkBase;

    /** Prefix of public seller links; the seller id is appended. */
    String userLinkBase;

    @Builder.Default
    String platform = "WALLAPOP";

    @Builder.Default
    ZoneId zoneId = ZoneId.of("UTC");
}
