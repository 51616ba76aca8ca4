package com.listings.scraper.service.wallapop;

import com.listings.scraper.model.RawListing;

import java.util.List;

/**
 * @param listings     raw listings in fetch order, never more than the budget
 * @param status       terminal status ({@link PaginationStatus#BUDGET_REACHED} or {@link PaginationStatus#EXHAUSTED})
 * @param pagesFetched number of page requests made
 */
public record PaginationResult(List<RawListing> listings, PaginationStatus status, int pagesFetched) {
}
