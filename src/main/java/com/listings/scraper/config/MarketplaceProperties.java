package com.listings.scraper.config;

import com.listings.scraper.model.FuzzyThresholds;
import com.listings.scraper.model.GeoPoint;
import com.listings.scraper.model.SearchCriteria;
import com.listings.scraper.model.SearchSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Binds the marketplace endpoint configuration from <code>application.yml</code>
 * under the <code>marketplace</code> prefix.
 * <p>
 * Example YAML:
 * <pre>{@code
 * marketplace:
 *   base-url: https://api.wallapop.com/api/v3/search
 *   item-link-base: https://it.wallapop.com/item/
 *   headers:
 *     X-DeviceOS: "0"
 *   thresholds:
 *     title: 75
 * }</pre>
 * The bound values are turned into an immutable {@link SearchSettings} by
 * {@link #toSettings()}; search code never reads this bean directly.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "marketplace")
public class MarketplaceProperties {

    /**
     * Search endpoint without query string.
     * <p>For example, "https://api.wallapop.com/api/v3/search".</p>
     */
    @NotBlank
    private String baseUrl;

    /**
     * Prefix of public listing pages; the listing slug is appended.
     * <p>For example, "https://it.wallapop.com/item/".</p>
     */
    @NotBlank
    private String itemLinkBase;

    /**
     * Prefix of public seller pages; the seller id is appended.
     */
    @NotBlank
    private String userLinkBase;

    /** Marketplace name reported with every result. */
    private String platform = "WALLAPOP";

    /** Zone used to report local creation times. */
    private String zoneId = "UTC";

    /** User agent sent with every request. */
    private String userAgent;

    /** Blocking timeout for one page request. */
    @NotNull
    private Duration timeout = Duration.ofSeconds(15);

    /** Item budget used when a request does not specify one. */
    @Min(1)
    private int defaultItemBudget = SearchCriteria.DEFAULT_ITEM_BUDGET;

    /** Extra headers sent with every request, insertion ordered. */
    private Map<String, String> headers = new LinkedHashMap<>();

    /** Search origin; leave unset to omit latitude/longitude. */
    private Geo geo;

    @Valid
    private Thresholds thresholds = new Thresholds();

    @Valid
    private RetryPolicy retry = new RetryPolicy();

    /**
     * @return immutable settings for the search pipeline
     */
    public SearchSettings toSettings() {
        return SearchSettings.builder()
                .baseUrl(baseUrl)
                .headers(headers)
                .thresholds(thresholds.toThresholds())
                .geo(geo == null || geo.getLatitude() == null || geo.getLongitude() == null
                        ? null
                        : new GeoPoint(geo.getLatitude(), geo.getLongitude()))
                .itemLinkBase(itemLinkBase)
                .userLinkBase(userLinkBase)
                .platform(platform)
                .zoneId(ZoneId.of(zoneId))
                .build();
    }

    @Data
    public static class Geo {

        private Double latitude;

        private Double longitude;
    }

    @Data
    public static class Thresholds {

        /** Minimum title score (exclusive) for a keyword match. */
        @Min(0)
        @Max(100)
        private int title = FuzzyThresholds.DEFAULTS.title();

        /** Minimum description score (exclusive) for a keyword match. */
        @Min(0)
        @Max(100)
        private int description = FuzzyThresholds.DEFAULTS.description();

        /** Score (inclusive) at which an excluded term disqualifies a listing. */
        @Min(0)
        @Max(100)
        private int excluded = FuzzyThresholds.DEFAULTS.excluded();

        FuzzyThresholds toThresholds() {
            return new FuzzyThresholds(title, description, excluded);
        }
    }

    @Data
    public static class RetryPolicy {

        /** Attempts per page request, first one included. */
        @Min(1)
        private int maxAttempts = 3;

        /** Pause between attempts. */
        @NotNull
        private Duration waitDuration = Duration.ofMillis(500);
    }
}
