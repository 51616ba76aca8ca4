package com.listings.scraper.service.core;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchOutcomeTest {

    @Test
    void shouldMapSuccess() {
        SearchOutcome<Integer> outcome = SearchOutcome.success("abc").map(String::length);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.value()).isEqualTo(3);
    }

    @Test
    void shouldCarryFailureThroughMapAndFlatMap() {
        SearchError error = SearchError.request("HTTP 503", null);

        SearchOutcome<Integer> outcome = SearchOutcome.<String>failure(error)
                .map(String::length)
                .flatMap(n -> SearchOutcome.success(n * 2));

        assertThat(outcome.isFailure()).isTrue();
        assertThat(outcome.error()).isSameAs(error);
        assertThatThrownBy(outcome::value).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldThrowTypedExceptionWithCause() {
        IOException cause = new IOException("boom");
        SearchOutcome<String> outcome = SearchOutcome.failure(SearchError.parsing("bad body", cause));

        assertThatThrownBy(outcome::orElseThrow)
                .isInstanceOf(ListingSearchException.class)
                .hasMessage("bad body")
                .hasCause(cause)
                .extracting(ex -> ((ListingSearchException) ex).getKind())
                .isEqualTo(SearchErrorKind.PARSING);
    }

    @Test
    void shouldRefuseErrorOnSuccess() {
        assertThatThrownBy(() -> SearchOutcome.success("x").error())
                .isInstanceOf(IllegalStateException.class);
    }
}
