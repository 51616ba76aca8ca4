package com.listings.scraper.controller;

import com.listings.scraper.config.MarketplaceProperties;
import com.listings.scraper.model.ListingPrice;
import com.listings.scraper.model.MatchedListing;
import com.listings.scraper.model.NormalizedListing;
import com.listings.scraper.model.ResultSet;
import com.listings.scraper.model.SearchCriteria;
import com.listings.scraper.model.SortOrder;
import com.listings.scraper.service.core.ListingSearchService;
import com.listings.scraper.service.core.SearchError;
import com.listings.scraper.service.core.SearchOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ListingSearchControllerTest {

    private static final String URL = "/api/search/listings";

    @Mock
    private ListingSearchService searchService;

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        MarketplaceProperties props = new MarketplaceProperties();
        props.setDefaultItemBudget(40);
        mvc = MockMvcBuilders.standaloneSetup(new ListingSearchController(searchService, props)).build();
    }

    private static MatchedListing match() {
        NormalizedListing listing = NormalizedListing.builder()
                .id("A1")
                .title("PS5 Slim")
                .description("Console")
                .price(new ListingPrice(new BigDecimal("180"), "EUR"))
                .location("Siena")
                .sellerId("u1")
                .image("https://img.test/1.jpg")
                .mainImage("https://img.test/1.jpg")
                .link("https://it.example.test/item/ps5-slim")
                .sellerLink("https://it.example.test/user/u1")
                .build();
        return new MatchedListing(listing, 100, false, "ps5", "WALLAPOP", null);
    }

    @Test
    void shouldReturnMatches() throws Exception {
        when(searchService.search(any(SearchCriteria.class)))
                .thenReturn(SearchOutcome.success(new ResultSet(List.of(match()), List.of())));

        mvc.perform(post(URL).contentType(MediaType.APPLICATION_JSON).content("""
                        {"productName": "ps5", "keywords": ["console"], "minPrice": 100,
                         "maxPrice": 200, "maxTotalItems": 10, "orderBy": "price_low_to_high"}
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].listing.id").value("A1"))
                .andExpect(jsonPath("$[0].listing.price.amount").value(180))
                .andExpect(jsonPath("$[0].score").value(100))
                .andExpect(jsonPath("$[0].platform").value("WALLAPOP"));

        ArgumentCaptor<SearchCriteria> criteria = ArgumentCaptor.forClass(SearchCriteria.class);
        verify(searchService).search(criteria.capture());
        assertThat(criteria.getValue().getItemBudget()).isEqualTo(10);
        assertThat(criteria.getValue().getSortOrder()).isEqualTo(SortOrder.PRICE_LOW_TO_HIGH);
        assertThat(criteria.getValue().getKeywords()).containsExactly("console");
    }

    @Test
    void shouldApplyDefaultBudgetAndSortOrder() throws Exception {
        when(searchService.search(any(SearchCriteria.class)))
                .thenReturn(SearchOutcome.success(ResultSet.empty()));

        mvc.perform(post(URL).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"productName\": \"ps5\", \"orderBy\": \"cheapest\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());

        ArgumentCaptor<SearchCriteria> criteria = ArgumentCaptor.forClass(SearchCriteria.class);
        verify(searchService).search(criteria.capture());
        assertThat(criteria.getValue().getItemBudget()).isEqualTo(40);
        assertThat(criteria.getValue().getSortOrder()).isEqualTo(SortOrder.NEWEST);
    }

    @Test
    void shouldRejectInvalidPayloadBeforeSearching() throws Exception {
        mvc.perform(post(URL).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"productName\": \" \", \"maxTotalItems\": 0}"))
                .andExpect(status().isBadRequest());

        mvc.perform(post(URL).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"productName\": \"ps5\", \"minPrice\": -5}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(searchService);
    }

    @Test
    void shouldMapConfigurationErrorToBadRequest() throws Exception {
        when(searchService.search(any(SearchCriteria.class))).thenReturn(SearchOutcome.failure(
                SearchError.configuration("Minimum price (200) cannot be greater than maximum price (100)")));

        mvc.perform(post(URL).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"productName\": \"ps5\", \"minPrice\": 200, \"maxPrice\": 100}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("CONFIGURATION"));
    }

    @Test
    void shouldMapUpstreamErrorsToBadGateway() throws Exception {
        when(searchService.search(any(SearchCriteria.class)))
                .thenReturn(SearchOutcome.failure(SearchError.request("Failed API request. Status Code: 503", null)))
                .thenReturn(SearchOutcome.failure(SearchError.parsing("Error decoding JSON response", null)));

        mvc.perform(post(URL).contentType(MediaType.APPLICATION_JSON).content("{\"productName\": \"ps5\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.kind").value("REQUEST"))
                .andExpect(jsonPath("$.error").value("Failed API request. Status Code: 503"));

        mvc.perform(post(URL).contentType(MediaType.APPLICATION_JSON).content("{\"productName\": \"ps5\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.kind").value("PARSING"));
    }

    @Test
    void shouldMapUnclassifiedErrorToInternalServerError() throws Exception {
        when(searchService.search(any(SearchCriteria.class))).thenReturn(SearchOutcome.failure(
                SearchError.unclassified("Unexpected error searching for 'ps5'", new IllegalStateException())));

        mvc.perform(post(URL).contentType(MediaType.APPLICATION_JSON).content("{\"productName\": \"ps5\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.kind").value("UNCLASSIFIED"));
    }
}
