package com.listings.scraper.service.core;

/**
 * @param statusCode HTTP status
 * @param body       response body as text, empty when none was sent
 */
public record TransportResponse(int statusCode, String body) {

    public boolean isSuccess() {
        return statusCode / 100 == 2;
    }

    /**
     * @param max maximum number of characters
     * @return start of the body, for log lines and error messages
     */
    public String bodyExcerpt(final int max) {
        if (body == null) {
            return "";
        }
        return body.length() > max ? body.substring(0, max) + "..." : body;
    }
}
