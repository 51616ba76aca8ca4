package com.listings.scraper.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Typed projection of one element of {@code data.section.payload.items}.
 * <p>
 * Every field may be {@code null}: the API does not guarantee field presence
 * and wrong-typed values are read as absent. Deciding what is required is
 * left to the normalizer.
 * </p>
 *
 * @param id              listing identity
 * @param title           listing title
 * @param description     free-text description
 * @param webSlug         slug used to build the public detail link
 * @param price           price block
 * @param userId          seller identity
 * @param location        location block
 * @param reserved        {@code flags.reserved}
 * @param createdAt       raw {@code created_at} text (epoch millis)
 * @param images          image entries, empty when none were sent
 * @param imagesMalformed whether the {@code images} block had an unexpected shape
 */
public record RawListing(
        String id,
        String title,
        String description,
        String webSlug,
        RawPrice price,
        String userId,
        RawLocation location,
        Boolean reserved,
        String createdAt,
        List<RawImage> images,
        boolean imagesMalformed
) {

    /**
     * @param amount   numeric amount, {@code null} when absent or not a number
     * @param currency ISO currency code
     */
    public record RawPrice(BigDecimal amount, String currency) {
    }

    /**
     * @param city        city name
     * @param region      region name
     * @param countryCode ISO country code
     */
    public record RawLocation(String city, String region, String countryCode) {
    }

    /**
     * @param urls size variant ({@code big}, {@code medium}, ...) → URL
     */
    public record RawImage(Map<String, String> urls) {
    }
}
