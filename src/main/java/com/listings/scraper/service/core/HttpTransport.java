package com.listings.scraper.service.core;

import java.util.Map;

/**
 * Performs HTTP GETs on behalf of the search pipeline.
 * <p>
 * Implementations own connection handling, timeouts and retries; callers
 * never retry on top of them.
 * </p>
 */
public interface HttpTransport {

    /**
     * @param url     absolute, already encoded URL
     * @param headers request headers
     * @return the final response, whatever its status
     * @throws TransportException if no response could be obtained
     */
    TransportResponse get(String url, Map<String, String> headers) throws TransportException;
}
