package com.listings.scraper.service.wallapop;

import com.listings.scraper.config.MarketplaceProperties;
import com.listings.scraper.model.FilterDecision;
import com.listings.scraper.model.ListingFault;
import com.listings.scraper.model.MatchedListing;
import com.listings.scraper.model.NormalizedListing;
import com.listings.scraper.model.RawListing;
import com.listings.scraper.model.ResultSet;
import com.listings.scraper.model.SearchCriteria;
import com.listings.scraper.model.SearchSettings;
import com.listings.scraper.service.core.ListingSearchService;
import com.listings.scraper.service.core.SearchError;
import com.listings.scraper.service.core.SearchOutcome;
import com.listings.scraper.service.core.TextCleaner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * <h2>Wallapop – Listing Search Service</h2>
 *
 * <p>Runs the whole search pipeline for one set of criteria:</p>
 * <ol>
 *   <li>rejects invalid criteria before touching the network,</li>
 *   <li>builds the first-page URL and pages through the API,</li>
 *   <li>normalizes and filters every listing in fetch order,</li>
 *   <li>drops later duplicates of an already accepted listing id.</li>
 * </ol>
 *
 * <p>Request and parsing failures abort the search. A fault while processing
 * one listing only drops that listing; it is logged and reported on the
 * {@link ResultSet}.</p>
 */
@Slf4j
@Service("wallapopSearchSvc")
public class WallapopSearchService implements ListingSearchService {

    private final WallapopQueryBuilder queryBuilder;

    private final PaginationDriver paginationDriver;

    private final WallapopListingNormalizer normalizer;

    private final ListingFilterEngine filterEngine;

    private final SearchSettings defaultSettings;

    public WallapopSearchService(final WallapopQueryBuilder queryBuilder,
                                 final PaginationDriver paginationDriver,
                                 final WallapopListingNormalizer normalizer,
                                 final ListingFilterEngine filterEngine,
                                 final MarketplaceProperties props) {
        this.queryBuilder = queryBuilder;
        this.paginationDriver = paginationDriver;
        this.normalizer = normalizer;
        this.filterEngine = filterEngine;
        this.defaultSettings = props.toSettings();
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public SearchOutcome<ResultSet> search(final SearchCriteria criteria) {
        return search(criteria, defaultSettings);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public SearchOutcome<ResultSet> search(final SearchCriteria criteria, final SearchSettings settings) {
        Optional<SearchError> invalid = validate(criteria);
        if (invalid.isPresent()) {
            log.error("Invalid configuration: {}", invalid.get().message());
            return SearchOutcome.failure(invalid.get());
        }

        log.info("Starting search for '{}'", criteria.getProductName());
        log.debug("Parameters: keywords={}, price=({}-{}), excluded={}, max_items={}, order={}, time={}",
                criteria.getKeywords(), criteria.getMinPrice(), criteria.getMaxPrice(),
                criteria.getExcludedKeywords(), criteria.getItemBudget(), criteria.getSortOrder(),
                criteria.getTimeFilter());

        SearchCriteria cleaned = criteria.normalized();
        try {
            String url = queryBuilder.buildInitialUrl(cleaned, settings.getGeo(), settings.getBaseUrl());

            SearchOutcome<PaginationResult> fetched =
                    paginationDriver.drive(url, settings.getHeaders(), cleaned.getItemBudget());
            if (fetched.isFailure()) {
                log.error("Search for '{}' failed ({}): {}", criteria.getProductName(),
                        fetched.error().kind(), fetched.error().message());
                return SearchOutcome.failure(fetched.error());
            }

            List<RawListing> raw = fetched.value().listings();
            if (raw.isEmpty()) {
                log.info("No raw items found for '{}' matching the initial API query.", criteria.getProductName());
                return SearchOutcome.success(ResultSet.empty());
            }

            ResultSet results = process(raw, cleaned, settings);
            log.info("Processing complete. Found {} valid products matching all criteria.", results.size());
            return SearchOutcome.success(results);
        } catch (RuntimeException ex) {
            log.error("Unexpected error searching for '{}'", criteria.getProductName(), ex);
            return SearchOutcome.failure(SearchError.unclassified(
                    "Unexpected error searching for '" + criteria.getProductName() + "': " + ex.getMessage(), ex));
        }
    }

    private ResultSet process(final List<RawListing> raw,
                              final SearchCriteria criteria,
                              final SearchSettings settings) {
        List<MatchedListing> matches = new ArrayList<>();
        List<ListingFault> faults = new ArrayList<>();
        Set<String> acceptedIds = new HashSet<>();

        for (RawListing item : raw) {
            if (item.id() != null && acceptedIds.contains(item.id())) {
                log.debug("Skipping item with duplicate ID: {}", item.id());
                continue;
            }
            try {
                Optional<MatchedListing> match = evaluate(item, criteria, settings);
                match.ifPresent(m -> {
                    matches.add(m);
                    acceptedIds.add(m.listing().getId());
                });
            } catch (RuntimeException ex) {
                log.error("Error processing item {}", item.id(), ex);
                faults.add(new ListingFault(item.id(), ex.toString()));
            }
        }
        return new ResultSet(matches, faults);
    }

    private Optional<MatchedListing> evaluate(final RawListing item,
                                              final SearchCriteria criteria,
                                              final SearchSettings settings) {
        Optional<NormalizedListing> normalized = normalizer.normalize(item, settings);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        NormalizedListing listing = normalized.get();

        FilterDecision decision = filterEngine.evaluate(listing, criteria, settings.getThresholds());
        if (!decision.passed()) {
            return Optional.empty();
        }
        log.debug("Item {} processed successfully.", listing.getId());
        return Optional.of(new MatchedListing(
                listing,
                decision.score(),
                decision.matchedInDescription(),
                criteria.getProductName(),
                settings.getPlatform(),
                listing.getCreatedAt() == null ? null : listing.getCreatedAt().atZone(settings.getZoneId())));
    }

    private static Optional<SearchError> validate(final SearchCriteria criteria) {
        if (criteria == null) {
            return Optional.of(SearchError.configuration("Search criteria are required"));
        }
        if (TextCleaner.clean(criteria.getProductName()).isEmpty()) {
            return Optional.of(SearchError.configuration("Product name cannot be empty"));
        }
        BigDecimal min = criteria.getMinPrice();
        BigDecimal max = criteria.getMaxPrice();
        if ((min != null && min.signum() < 0) || (max != null && max.signum() < 0)) {
            return Optional.of(SearchError.configuration("Prices cannot be negative"));
        }
        if (min != null && max != null && min.compareTo(max) > 0) {
            return Optional.of(SearchError.configuration(
                    "Minimum price (" + min + ") cannot be greater than maximum price (" + max + ")"));
        }
        if (criteria.getItemBudget() < 1) {
            return Optional.of(SearchError.configuration(
                    "Item budget must be positive, got " + criteria.getItemBudget()));
        }
        return Optional.empty();
    }
}
