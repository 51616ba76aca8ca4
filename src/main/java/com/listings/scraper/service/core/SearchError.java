package com.listings.scraper.service.core;

import java.util.Objects;

/**
 * A search failure carried as a value.
 *
 * @param kind    failure category
 * @param message human-readable description
 * @param cause   underlying exception, may be {@code null}
 */
public record SearchError(SearchErrorKind kind, String message, Throwable cause) {

    public SearchError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    public static SearchError configuration(final String message) {
        return new SearchError(SearchErrorKind.CONFIGURATION, message, null);
    }

    public static SearchError request(final String message, final Throwable cause) {
        return new SearchError(SearchErrorKind.REQUEST, message, cause);
    }

    public static SearchError parsing(final String message, final Throwable cause) {
        return new SearchError(SearchErrorKind.PARSING, message, cause);
    }

    public static SearchError unclassified(final String message, final Throwable cause) {
        return new SearchError(SearchErrorKind.UNCLASSIFIED, message, cause);
    }

    /**
     * @return this error as an exception, for callers that want to throw
     */
    public ListingSearchException toException() {
        return new ListingSearchException(this);
    }
}
