package com.listings.scraper.controller;

import com.listings.scraper.config.MarketplaceProperties;
import com.listings.scraper.dto.ListingSearchRequest;
import com.listings.scraper.model.MatchedListing;
import com.listings.scraper.model.ResultSet;
import com.listings.scraper.service.core.ListingSearchService;
import com.listings.scraper.service.core.SearchError;
import com.listings.scraper.service.core.SearchOutcome;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller exposing the listing search.
 * <p>
 * Endpoint: <code>POST /api/search/listings</code><br>
 * Consumes: <code>application/json</code><br>
 * Produces: <code>application/json</code>
 * </p>
 *
 * <h3>Example Request</h3>
 * <pre>{@code
 * POST /api/search/listings
 * Content-Type: application/json
 *
 * {
 *   "productName": "ps5",
 *   "keywords": ["console", "playstation 5"],
 *   "excludedKeywords": ["broken"],
 *   "minPrice": 100,
 *   "maxPrice": 200,
 *   "maxTotalItems": 10,
 *   "timeFilter": "lastWeek"
 * }
 * }</pre>
 *
 * <h3>Error Handling</h3>
 * <ul>
 *   <li>400 BAD REQUEST: invalid criteria</li>
 *   <li>502 BAD GATEWAY: the marketplace could not be reached or answered garbage</li>
 *   <li>500 INTERNAL SERVER ERROR: anything else</li>
 * </ul>
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/api/search/listings")
@RequiredArgsConstructor
public class ListingSearchController {

    private final ListingSearchService searchService;

    private final MarketplaceProperties props;

    /**
     * Runs a search and returns the accepted listings in fetch order.
     *
     * @param request validated search request
     * @return HTTP 200 with the matches, or an error status with {"kind", "error"}
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> search(@Valid @RequestBody final ListingSearchRequest request) {
        SearchOutcome<ResultSet> outcome = searchService.search(request.toCriteria(props.getDefaultItemBudget()));
        if (outcome.isFailure()) {
            return errorResponse(outcome.error());
        }
        List<MatchedListing> matches = outcome.value().matches();
        return ResponseEntity.ok(matches);
    }

    private static ResponseEntity<Map<String, String>> errorResponse(final SearchError error) {
        HttpStatus status = switch (error.kind()) {
            case CONFIGURATION -> HttpStatus.BAD_REQUEST;
            case REQUEST, PARSING -> HttpStatus.BAD_GATEWAY;
            case UNCLASSIFIED -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        log.warn("Search failed with {}: {}", error.kind(), error.message());
        return ResponseEntity.status(status)
                .body(Map.of("kind", error.kind().name(), "error", error.message()));
    }
}
