package com.listings.scraper.service.wallapop;

import com.listings.scraper.model.RawListing;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable state of one pagination run. Never shared between searches.
 */
@Getter
class PaginationState {

    private final int budget;

    private final List<RawListing> listings = new ArrayList<>();

    private String currentUrl;

    private String cursor;

    private int pagesFetched;

    private PaginationStatus status = PaginationStatus.FETCHING;

    PaginationState(final String initialUrl, final int budget) {
        this.currentUrl = initialUrl;
        this.budget = budget;
    }

    /**
     * Records a fetched page, keeping at most the remaining budget.
     *
     * @param page listings of the page just fetched
     * @return number of listings kept
     */
    int accept(final List<RawListing> page) {
        pagesFetched++;
        int kept = Math.min(page.size(), remaining());
        listings.addAll(page.subList(0, kept));
        if (remaining() == 0) {
            status = PaginationStatus.BUDGET_REACHED;
        }
        return kept;
    }

    void emptyPage() {
        pagesFetched++;
        status = PaginationStatus.EXHAUSTED;
    }

    void advance(final String nextUrl, final String nextCursor) {
        currentUrl = nextUrl;
        cursor = nextCursor;
    }

    void finish(final PaginationStatus terminal) {
        status = terminal;
    }

    int remaining() {
        return budget - listings.size();
    }

    List<RawListing> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(listings));
    }
}
