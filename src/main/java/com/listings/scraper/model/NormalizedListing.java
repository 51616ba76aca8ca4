package com.listings.scraper.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Validated listing. Identity, title, description, price, location and seller
 * are always present; a listing lacking any of them is never built.
 */
@Value
@Builder
public class NormalizedListing {

    String id;

    String title;

    String description;

    ListingPrice price;

    /** City, else region, else country code. */
    String location;

    /** Publication time in UTC, {@code null} when missing or unparseable. */
    Instant createdAt;

    String sellerId;

    boolean reserved;

    String mainImage;

    @Singular
    List<String> images;

    /** Public detail page. */
    String link;

    /** Public seller profile page. */
    String sellerLink;
}
