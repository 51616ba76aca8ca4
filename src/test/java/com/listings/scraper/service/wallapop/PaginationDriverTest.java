package com.listings.scraper.service.wallapop;

import com.listings.scraper.model.RawListing;
import com.listings.scraper.model.SearchPage;
import com.listings.scraper.service.core.SearchError;
import com.listings.scraper.service.core.SearchErrorKind;
import com.listings.scraper.service.core.SearchOutcome;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PaginationDriverTest {

    private static final String FIRST_URL = "https://api.example.test/search?source=search_box&keywords=ps5";

    private static final Map<String, String> HEADERS = Map.of("X-DeviceOS", "0");

    @Mock
    private WallapopPageFetcher fetcher;

    private static List<RawListing> listings(final String prefix, final int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> new RawListing(prefix + i, "t", "d", null, null, "u", null,
                        false, null, List.of(), false))
                .toList();
    }

    private static SearchOutcome<SearchPage> page(final List<RawListing> items, final String cursor) {
        return SearchOutcome.success(new SearchPage(items, Optional.ofNullable(cursor)));
    }

    @Test
    void shouldStopWhenBudgetIsFilledAndTruncateLastPage() {
        when(fetcher.fetchPage(anyString(), anyMap()))
                .thenReturn(page(listings("a", 40), "c1"))
                .thenReturn(page(listings("b", 40), "c2"))
                .thenReturn(page(listings("c", 40), "c3"));

        PaginationResult result = new PaginationDriver(fetcher).drive(FIRST_URL, HEADERS, 100).value();

        assertThat(result.listings()).hasSize(100);
        assertThat(result.listings().get(99).id()).isEqualTo("c19");
        assertThat(result.status()).isEqualTo(PaginationStatus.BUDGET_REACHED);
        assertThat(result.pagesFetched()).isEqualTo(3);
        verify(fetcher, times(3)).fetchPage(anyString(), eq(HEADERS));
    }

    @Test
    void shouldFollowCursorAndStopWhenNoneIsReturned() {
        when(fetcher.fetchPage(anyString(), anyMap()))
                .thenReturn(page(listings("a", 2), "next/page+1"))
                .thenReturn(page(listings("b", 1), null));

        PaginationResult result = new PaginationDriver(fetcher).drive(FIRST_URL, HEADERS, 10).value();

        assertThat(result.listings()).extracting(RawListing::id).containsExactly("a0", "a1", "b0");
        assertThat(result.status()).isEqualTo(PaginationStatus.EXHAUSTED);

        ArgumentCaptor<String> urls = ArgumentCaptor.forClass(String.class);
        verify(fetcher, times(2)).fetchPage(urls.capture(), anyMap());
        assertThat(urls.getAllValues().get(0)).isEqualTo(FIRST_URL);
        assertThat(urls.getAllValues().get(1)).isEqualTo(FIRST_URL + "&start_cursor=next%2Fpage%2B1");
    }

    @Test
    void shouldStopOnEmptyPage() {
        when(fetcher.fetchPage(anyString(), anyMap()))
                .thenReturn(page(listings("a", 3), "c1"))
                .thenReturn(page(List.of(), "c2"));

        PaginationResult result = new PaginationDriver(fetcher).drive(FIRST_URL, HEADERS, 50).value();

        assertThat(result.listings()).hasSize(3);
        assertThat(result.status()).isEqualTo(PaginationStatus.EXHAUSTED);
        assertThat(result.pagesFetched()).isEqualTo(2);
    }

    @Test
    void shouldReturnEmptyResultWhenFirstPageIsEmpty() {
        when(fetcher.fetchPage(anyString(), anyMap())).thenReturn(page(List.of(), "c1"));

        PaginationResult result = new PaginationDriver(fetcher).drive(FIRST_URL, HEADERS, 5).value();

        assertThat(result.listings()).isEmpty();
        verify(fetcher, times(1)).fetchPage(anyString(), anyMap());
    }

    @Test
    void shouldPropagateFirstFailure() {
        when(fetcher.fetchPage(anyString(), anyMap()))
                .thenReturn(page(listings("a", 2), "c1"))
                .thenReturn(SearchOutcome.failure(SearchError.request("Failed API request. Status Code: 500", null)));

        SearchOutcome<PaginationResult> outcome = new PaginationDriver(fetcher).drive(FIRST_URL, HEADERS, 10);

        assertThat(outcome.isFailure()).isTrue();
        assertThat(outcome.error().kind()).isEqualTo(SearchErrorKind.REQUEST);
        verify(fetcher, times(2)).fetchPage(anyString(), anyMap());
    }

    @Test
    void shouldNeverMakeMoreRequestsThanBudget() {
        when(fetcher.fetchPage(anyString(), anyMap()))
                .thenReturn(page(listings("a", 1), "c1"))
                .thenReturn(page(listings("b", 1), "c2"))
                .thenReturn(page(listings("c", 1), "c3"));

        PaginationResult result = new PaginationDriver(fetcher).drive(FIRST_URL, HEADERS, 2).value();

        assertThat(result.pagesFetched()).isEqualTo(2);
        assertThat(result.listings()).hasSize(2);
        verify(fetcher, times(2)).fetchPage(anyString(), anyMap());
    }

    @Test
    void shouldFailWithParsingErrorWhenCursorCannotBeApplied() {
        when(fetcher.fetchPage(anyString(), anyMap())).thenReturn(page(listings("a", 1), "c1"));

        SearchOutcome<PaginationResult> outcome =
                new PaginationDriver(fetcher).drive("https://api.example.test/search?x=%zz", HEADERS, 10);

        assertThat(outcome.isFailure()).isTrue();
        assertThat(outcome.error().kind()).isEqualTo(SearchErrorKind.PARSING);
        assertThat(outcome.error().message()).contains("start_cursor=c1");
        verify(fetcher, times(1)).fetchPage(anyString(), anyMap());
    }

    @Test
    void shouldReplaceCursorAndDropStalePagingParams() {
        String next = PaginationDriver.nextPageUrl(
                "https://api.example.test/search?keywords=ps5&since=123&start_cursor=old&next_page=x&order_by=newest",
                "abc=");

        assertThat(next)
                .startsWith("https://api.example.test/search?keywords=ps5")
                .contains("start_cursor=abc%3D")
                .contains("order_by=newest")
                .doesNotContain("since")
                .doesNotContain("next_page")
                .doesNotContain("old");
    }
}
