package com.listings.scraper.dto;

import com.listings.scraper.model.SearchCriteria;
import com.listings.scraper.model.SortOrder;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Request payload for a listing search.
 * <p>
 * {@code orderBy} takes the marketplace's wire values
 * ({@code newest}, {@code price_low_to_high}, {@code price_high_to_low});
 * anything else silently becomes {@code newest}.
 * </p>
 */
@Data
public class ListingSearchRequest {

    /**
     * The product to search for (e.g., "ps5"). Must be a non-blank string.
     */
    @NotBlank
    private String productName;

    /** Relevance keywords; empty keeps every otherwise valid listing. */
    private List<String> keywords = new ArrayList<>();

    /** Terms that disqualify a listing. */
    private List<String> excludedKeywords = new ArrayList<>();

    @DecimalMin("0")
    private BigDecimal minPrice;

    @DecimalMin("0")
    private BigDecimal maxPrice;

    /**
     * Maximum number of listings fetched from the API; the configured default
     * applies when omitted.
     */
    @Min(1)
    private Integer maxTotalItems;

    private String orderBy;

    /** Publication window, e.g. {@code today}, {@code lastWeek}, {@code lastMonth}. */
    private String timeFilter;

    /**
     * @param defaultBudget budget used when {@code maxTotalItems} is absent
     * @return immutable criteria for the search service
     */
    public SearchCriteria toCriteria(final int defaultBudget) {
        return SearchCriteria.builder()
                .productName(productName)
                .keywords(keywords == null ? List.of() : keywords)
                .excludedKeywords(excludedKeywords == null ? List.of() : excludedKeywords)
                .minPrice(minPrice)
                .maxPrice(maxPrice)
                .itemBudget(maxTotalItems != null ? maxTotalItems : defaultBudget)
                .sortOrder(orderBy == null ? SortOrder.NEWEST : SortOrder.fromWireValue(orderBy))
                .timeFilter(timeFilter)
                .build();
    }
}
