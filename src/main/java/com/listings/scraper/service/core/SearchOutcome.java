package com.listings.scraper.service.core;

import java.util.Objects;
import java.util.function.Function;

/**
 * Either a value or a {@link SearchError}. Pipeline stages return outcomes
 * instead of throwing so that every failure keeps its category on the way up.
 *
 * @param <T> type of the success value
 */
public final class SearchOutcome<T> {

    private final T value;

    private final SearchError error;

    private SearchOutcome(final T value, final SearchError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> SearchOutcome<T> success(final T value) {
        return new SearchOutcome<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> SearchOutcome<T> failure(final SearchError error) {
        return new SearchOutcome<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * @return the success value
     * @throws IllegalStateException if this outcome is a failure
     */
    public T value() {
        if (error != null) {
            throw new IllegalStateException("No value on failed outcome: " + error.message());
        }
        return value;
    }

    /**
     * @return the failure
     * @throws IllegalStateException if this outcome is a success
     */
    public SearchError error() {
        if (error == null) {
            throw new IllegalStateException("No error on successful outcome");
        }
        return error;
    }

    public <R> SearchOutcome<R> map(final Function<? super T, ? extends R> mapper) {
        return isSuccess() ? success(mapper.apply(value)) : failure(error);
    }

    public <R> SearchOutcome<R> flatMap(final Function<? super T, SearchOutcome<R>> mapper) {
        return isSuccess() ? mapper.apply(value) : failure(error);
    }

    /**
     * @return the success value
     * @throws ListingSearchException carrying the error kind if this outcome failed
     */
    public T orElseThrow() {
        if (error != null) {
            throw error.toException();
        }
        return value;
    }

    @Override
    public String toString() {
        return isSuccess() ? "SearchOutcome[success=" + value + "]" : "SearchOutcome[failure=" + error + "]";
    }
}
