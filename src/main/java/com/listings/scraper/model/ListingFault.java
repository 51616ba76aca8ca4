package com.listings.scraper.model;

/**
 * A listing dropped because processing it failed unexpectedly.
 *
 * @param listingId identity of the raw listing, {@code null} if it had none
 * @param message   failure description
 */
public record ListingFault(String listingId, String message) {
}
