package com.listings.scraper.model;

import java.math.BigDecimal;

/**
 * @param amount   listing price
 * @param currency currency code, {@code null} when the API omitted it
 */
public record ListingPrice(BigDecimal amount, String currency) {
}
