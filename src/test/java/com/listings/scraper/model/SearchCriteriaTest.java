package com.listings.scraper.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SearchCriteriaTest {

    @Test
    void shouldApplyDefaults() {
        SearchCriteria criteria = SearchCriteria.builder().productName("ps5").build();

        assertThat(criteria.getItemBudget()).isEqualTo(SearchCriteria.DEFAULT_ITEM_BUDGET);
        assertThat(criteria.getSortOrder()).isEqualTo(SortOrder.NEWEST);
        assertThat(criteria.getKeywords()).isEmpty();
        assertThat(criteria.getExcludedKeywords()).isEmpty();
    }

    @Test
    void shouldCleanKeywordsAndDropBlanks() {
        SearchCriteria criteria = SearchCriteria.builder()
                .productName("ps5")
                .keywords(List.of(" PlayStation  5 ", "!!", "Console"))
                .excludedKeyword("  ")
                .excludedKeyword("BROKEN")
                .itemBudget(10)
                .build();

        SearchCriteria cleaned = criteria.normalized();

        assertThat(cleaned.getKeywords()).containsExactly("playstation 5", "console");
        assertThat(cleaned.getExcludedKeywords()).containsExactly("broken");
        assertThat(cleaned.getItemBudget()).isEqualTo(10);
        assertThat(criteria.getKeywords()).hasSize(3);
    }
}
