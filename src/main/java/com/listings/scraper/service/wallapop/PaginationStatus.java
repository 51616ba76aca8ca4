package com.listings.scraper.service.wallapop;

/**
 * States of one pagination run.
 */
public enum PaginationStatus {

    FETCHING,

    /** The item budget was filled. */
    BUDGET_REACHED,

    /** The API sent an empty page or no cursor. */
    EXHAUSTED,

    /** A page could not be fetched or parsed. */
    FAILED;

    public boolean isTerminal() {
        return this != FETCHING;
    }
}
