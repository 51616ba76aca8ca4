package com.listings.scraper.service.wallapop;

import com.listings.scraper.model.FilterDecision;
import com.listings.scraper.model.FilterRule;
import com.listings.scraper.model.FuzzyThresholds;
import com.listings.scraper.model.NormalizedListing;
import com.listings.scraper.model.SearchCriteria;
import com.listings.scraper.service.core.FuzzyMatcher;
import com.listings.scraper.service.core.TextCleaner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Decides whether a normalized listing is kept and how relevant it is.
 * <p>
 * Rules run in a fixed order and stop at the first one that rejects:
 * reserved, excluded term, keyword, price. The price rule runs last so that
 * a rejected listing still reports its keyword score.
 * </p>
 * <p>
 * Keyword lists are expected to be cleaned already
 * (see {@link SearchCriteria#normalized()}).
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ListingFilterEngine {

    private final FuzzyMatcher matcher;

    /**
     * @param listing    listing to evaluate
     * @param criteria   cleaned search criteria
     * @param thresholds per-field thresholds for this search
     * @return pass/fail with relevance score
     */
    public FilterDecision evaluate(final NormalizedListing listing,
                                   final SearchCriteria criteria,
                                   final FuzzyThresholds thresholds) {
        String id = listing.getId();

        if (listing.isReserved()) {
            log.debug("Item {}: Skipping because it is reserved.", id);
            return FilterDecision.reject(FilterRule.RESERVED);
        }

        String fullText = TextCleaner.clean(listing.getTitle() + " " + listing.getDescription());
        for (String term : criteria.getExcludedKeywords()) {
            if (matcher.partialScore(term, fullText) >= thresholds.excluded()) {
                log.debug("Item {}: Skipping due to excluded keyword match '{}'.", id, term);
                return FilterDecision.reject(FilterRule.EXCLUDED_TERM);
            }
        }

        int best = 0;
        boolean inDescription = false;
        if (!criteria.getKeywords().isEmpty()) {
            String title = TextCleaner.clean(listing.getTitle());
            String description = TextCleaner.clean(listing.getDescription());
            boolean matched = false;
            int maxSeen = 0;

            for (String keyword : criteria.getKeywords()) {
                int titleScore = matcher.partialScore(keyword, title);
                int descScore = matcher.partialScore(keyword, description);
                maxSeen = Math.max(maxSeen, Math.max(titleScore, descScore));

                if (titleScore > thresholds.title()) {
                    matched = true;
                    best = Math.max(best, titleScore);
                }
                if (descScore > thresholds.description()) {
                    matched = true;
                    inDescription = true;
                    best = Math.max(best, descScore);
                }
            }
            if (!matched) {
                log.debug("Item {}: Skipping, no keyword match above threshold. Max score: {}", id, maxSeen);
                return FilterDecision.reject(FilterRule.KEYWORD, maxSeen, false);
            }
        }

        if (!inRange(listing.getPrice().amount(), criteria.getMinPrice(), criteria.getMaxPrice())) {
            log.debug("Item {}: Skipping, price {} out of range ({}-{}).",
                    id, listing.getPrice().amount(), criteria.getMinPrice(), criteria.getMaxPrice());
            return FilterDecision.reject(FilterRule.PRICE, best, inDescription);
        }

        return FilterDecision.pass(best, inDescription);
    }

    private static boolean inRange(final BigDecimal price, final BigDecimal min, final BigDecimal max) {
        return (min == null || price.compareTo(min) >= 0) && (max == null || price.compareTo(max) <= 0);
    }
}
