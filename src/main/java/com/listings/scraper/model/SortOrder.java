package com.listings.scraper.model;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;

/**
 * Sort orders accepted by the marketplace search endpoint
 * ({@code order_by} query parameter).
 */
@Slf4j
@Getter
public enum SortOrder {

    NEWEST("newest"),
    PRICE_LOW_TO_HIGH("price_low_to_high"),
    PRICE_HIGH_TO_LOW("price_high_to_low");

    /** Value sent on the wire. */
    private final String wireValue;

    SortOrder(final String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * Resolves a wire value to a sort order.
     * <p>
     * Unknown or blank values are <strong>not</strong> rejected: they fall back
     * to {@link #NEWEST} with a warning, which is what the public search API
     * has always done.
     * </p>
     *
     * @param value raw {@code order_by} value, may be {@code null}
     * @return the matching order, or {@link #NEWEST}
     */
    public static SortOrder fromWireValue(final String value) {
        return Arrays.stream(values())
                .filter(o -> o.wireValue.equals(value))
                .findFirst()
                .orElseGet(() -> {
                    log.warn("Invalid order_by value '{}'. Using default '{}'.", value, NEWEST.wireValue);
                    return NEWEST;
                });
    }
}
