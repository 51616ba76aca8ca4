package com.listings.scraper.model;

/**
 * Search origin sent to the marketplace as {@code latitude}/{@code longitude}.
 *
 * @param latitude  decimal degrees
 * @param longitude decimal degrees
 */
public record GeoPoint(double latitude, double longitude) {
}
