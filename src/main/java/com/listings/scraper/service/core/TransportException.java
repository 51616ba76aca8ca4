package com.listings.scraper.service.core;

/**
 * Raised by an {@link HttpTransport} when a request could not be completed
 * once its own retry policy is exhausted.
 */
public class TransportException extends Exception {

    public TransportException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
