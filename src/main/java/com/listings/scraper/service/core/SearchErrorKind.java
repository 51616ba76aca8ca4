package com.listings.scraper.service.core;

/**
 * Failure categories of a search.
 */
public enum SearchErrorKind {

    /** Invalid caller input, detected before any network call. */
    CONFIGURATION,

    /** A page could not be fetched or came back with a non-success status. */
    REQUEST,

    /** A response body could not be read as a search page. */
    PARSING,

    /** Anything else; the original cause is kept. */
    UNCLASSIFIED
}
