package com.listings.scraper.service.wallapop;

import com.listings.scraper.model.SearchPage;
import com.listings.scraper.service.core.SearchError;
import com.listings.scraper.service.core.SearchOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Pages through the search API with its opaque cursor until the item budget
 * is filled or the results run out.
 * <p>
 * Pages are fetched strictly one after the other. Every non-empty page adds
 * at least one listing, so the budget also bounds the number of requests;
 * the loop checks that bound explicitly as well.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaginationDriver {

    /** Query parameter carrying the cursor. */
    static final String CURSOR_PARAM = "start_cursor";

    private final WallapopPageFetcher pageFetcher;

    /**
     * @param initialUrl first-page URL
     * @param headers    request headers
     * @param budget     maximum number of listings, positive
     * @return collected listings, or the failure of the first page that failed
     */
    public SearchOutcome<PaginationResult> drive(final String initialUrl,
                                                 final Map<String, String> headers,
                                                 final int budget) {
        PaginationState state = new PaginationState(initialUrl, budget);

        while (!state.getStatus().isTerminal()) {
            if (state.getPagesFetched() >= budget) {
                log.warn("Made {} requests for a budget of {}. Stopping pagination.",
                        state.getPagesFetched(), budget);
                state.finish(PaginationStatus.BUDGET_REACHED);
                break;
            }

            int page = state.getPagesFetched() + 1;
            log.debug("Fetching page {}. Target items: {}. Current count: {}",
                    page, budget, state.getListings().size());

            SearchOutcome<SearchPage> fetched = pageFetcher.fetchPage(state.getCurrentUrl(), headers);
            if (fetched.isFailure()) {
                state.finish(PaginationStatus.FAILED);
                return SearchOutcome.failure(fetched.error());
            }

            SearchPage result = fetched.value();
            if (result.isEmpty()) {
                log.info("No items found on page {}. Stopping pagination.", page);
                state.emptyPage();
                break;
            }

            state.accept(result.listings());
            if (state.getStatus() == PaginationStatus.BUDGET_REACHED) {
                log.info("Reached item limit ({}). Stopping pagination.", budget);
            } else if (result.nextCursor().isEmpty()) {
                log.info("No 'next_page' cursor on page {}. Assuming end of results.", page);
                state.finish(PaginationStatus.EXHAUSTED);
            } else {
                String cursor = result.nextCursor().get();
                try {
                    state.advance(nextPageUrl(state.getCurrentUrl(), cursor), cursor);
                } catch (IllegalArgumentException ex) {
                    state.finish(PaginationStatus.FAILED);
                    log.error("Cannot build next page URL with {}={}", CURSOR_PARAM, cursor, ex);
                    return SearchOutcome.failure(SearchError.parsing(
                            "Error constructing next page URL with " + CURSOR_PARAM + "=" + cursor, ex));
                }
            }
        }

        log.info("Finished fetching. Total items collected: {} in {} page(s), status {}",
                state.getListings().size(), state.getPagesFetched(), state.getStatus());
        return SearchOutcome.success(
                new PaginationResult(state.snapshot(), state.getStatus(), state.getPagesFetched()));
    }

    /**
     * Rewrites a page URL to point at the page starting at {@code cursor}.
     * Stale paging parameters ({@code since}, {@code next_page}) are dropped.
     *
     * @param currentUrl encoded URL of the page just fetched
     * @param cursor     raw cursor from {@code meta.next_page}
     * @return encoded URL of the next page
     * @throws IllegalArgumentException if the URL cannot be rebuilt
     */
    static String nextPageUrl(final String currentUrl, final String cursor) {
        return UriComponentsBuilder.fromUriString(currentUrl)
                .replaceQueryParam(CURSOR_PARAM, UriUtils.encode(cursor, StandardCharsets.UTF_8))
                .replaceQueryParam("since")
                .replaceQueryParam("next_page")
                .build(true)
                .toUriString();
    }
}
