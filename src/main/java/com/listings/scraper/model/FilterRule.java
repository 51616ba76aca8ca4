package com.listings.scraper.model;

/**
 * Filter rules in evaluation order.
 */
public enum FilterRule {
    RESERVED,
    EXCLUDED_TERM,
    KEYWORD,
    PRICE
}
