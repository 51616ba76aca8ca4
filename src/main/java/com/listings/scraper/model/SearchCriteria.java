package com.listings.scraper.model;

import com.listings.scraper.service.core.TextCleaner;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Immutable description of one buyer search.
 * <p>
 * Instances are not validated on construction; the search service rejects
 * invalid combinations (blank product name, inverted price bounds, non-positive
 * budget) before any network call is made.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class SearchCriteria {

    /** Default maximum number of listings fetched from the API. */
    public static final int DEFAULT_ITEM_BUDGET = 100;

    /** Main product name, sent as the {@code keywords} query parameter. */
    String productName;

    /** Relevance keywords matched against title and description. */
    @Singular
    List<String> keywords;

    /** Terms that disqualify a listing. */
    @Singular
    List<String> excludedKeywords;

    /** Inclusive lower price bound, {@code null} when unbounded. */
    BigDecimal minPrice;

    /** Inclusive upper price bound, {@code null} when unbounded. */
    BigDecimal maxPrice;

    /** Maximum number of raw listings collected across all pages. */
    @Builder.Default
    int itemBudget = DEFAULT_ITEM_BUDGET;

    @Builder.Default
    SortOrder sortOrder = SortOrder.NEWEST;

    /** Publication window passed through verbatim, e.g. {@code lastWeek}. */
    String timeFilter;

    /**
     * Returns a copy whose keyword lists are cleaned with {@link TextCleaner}
     * and stripped of entries that clean down to nothing.
     *
     * @return cleaned criteria
     */
    public SearchCriteria normalized() {
        return toBuilder()
                .clearKeywords()
                .keywords(clean(keywords))
                .clearExcludedKeywords()
                .excludedKeywords(clean(excludedKeywords))
                .build();
    }

    private static List<String> clean(final List<String> terms) {
        return terms.stream()
                .filter(Objects::nonNull)
                .map(TextCleaner::clean)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
