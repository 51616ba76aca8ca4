package com.listings.scraper.service.wallapop;

import com.listings.scraper.model.SearchPage;
import com.listings.scraper.parser.SearchPageParser;
import com.listings.scraper.service.core.HttpTransport;
import com.listings.scraper.service.core.SearchError;
import com.listings.scraper.service.core.SearchOutcome;
import com.listings.scraper.service.core.TransportException;
import com.listings.scraper.service.core.TransportResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Fetches and parses exactly one page of search results.
 * <p>
 * No retries happen here: the transport applies its own policy and whatever
 * it hands back is final. A non-success status fails the whole search.
 * </p>
 */
@Slf4j
@Component
public class WallapopPageFetcher {

    private static final int LOG_URL_LENGTH = 120;

    private static final int BODY_EXCERPT_LENGTH = 500;

    private final HttpTransport transport;

    private final SearchPageParser parser;

    public WallapopPageFetcher(final HttpTransport transport,
                               @Qualifier("wallapopPageParser") final SearchPageParser parser) {
        this.transport = transport;
        this.parser = parser;
    }

    /**
     * @param url     encoded page URL
     * @param headers request headers
     * @return the page, a REQUEST failure, or a PARSING failure
     */
    public SearchOutcome<SearchPage> fetchPage(final String url, final Map<String, String> headers) {
        String logUrl = StringUtils.abbreviate(url, LOG_URL_LENGTH);

        TransportResponse rsp;
        try {
            rsp = transport.get(url, headers);
        } catch (TransportException ex) {
            log.error("Failed to fetch {} after retries: {}", logUrl, ex.getMessage());
            return SearchOutcome.failure(SearchError.request(
                    "Failed to fetch " + logUrl + " after retries", ex));
        }

        if (!rsp.isSuccess()) {
            log.error("Failed API request. Status Code: {}. URL: {}. Response body: {}",
                    rsp.statusCode(), logUrl, rsp.bodyExcerpt(BODY_EXCERPT_LENGTH));
            return SearchOutcome.failure(SearchError.request(
                    "Failed API request. Status Code: " + rsp.statusCode() + ". URL: " + logUrl, null));
        }

        SearchOutcome<SearchPage> page = parser.parse(rsp.body());
        if (page.isFailure()) {
            log.error("Failed to parse response from {}: {}", logUrl, page.error().message());
        }
        return page;
    }
}
