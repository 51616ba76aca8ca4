package com.listings.scraper.service.core;

import lombok.Getter;

/**
 * Unchecked form of a {@link SearchError}.
 */
@Getter
public class ListingSearchException extends RuntimeException {

    private final SearchErrorKind kind;

    public ListingSearchException(final SearchError error) {
        super(error.message(), error.cause());
        this.kind = error.kind();
    }
}
