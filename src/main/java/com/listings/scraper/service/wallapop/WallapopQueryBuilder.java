package com.listings.scraper.service.wallapop;

import com.listings.scraper.model.GeoPoint;
import com.listings.scraper.model.SearchCriteria;
import com.listings.scraper.model.SortOrder;
import com.listings.scraper.service.core.TextCleaner;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;

/**
 * Builds the first-page search URL from the buyer's criteria.
 * <p>
 * The marketplace only accepts whole-unit prices, so price bounds are
 * truncated (never rounded). The time filter is passed through without
 * checking it against a known set.
 * </p>
 */
@Slf4j
@Component
public class WallapopQueryBuilder {

    /**
     * @param criteria search criteria
     * @param geo      search origin, {@code null} to omit it
     * @param baseUrl  search endpoint without query string
     * @return encoded absolute URL of the first page
     */
    public String buildInitialUrl(final SearchCriteria criteria, final GeoPoint geo, final String baseUrl) {
        String keywords = encode(TextCleaner.clean(criteria.getProductName()));

        UriComponentsBuilder b = UriComponentsBuilder.fromUriString(StringUtils.removeEnd(baseUrl, "/"))
                .queryParam("source", "search_box")
                .queryParam("keywords", keywords);

        if (criteria.getMinPrice() != null) {
            b.queryParam("min_sale_price", wholeUnits(criteria.getMinPrice()));
        }
        if (criteria.getMaxPrice() != null) {
            b.queryParam("max_sale_price", wholeUnits(criteria.getMaxPrice()));
        }

        SortOrder order = criteria.getSortOrder() == null ? SortOrder.NEWEST : criteria.getSortOrder();
        b.queryParam("order_by", order.getWireValue());

        if (StringUtils.isNotBlank(criteria.getTimeFilter())) {
            b.queryParam("time_filter", encode(criteria.getTimeFilter().trim()));
        }
        if (geo != null) {
            b.queryParam("latitude", geo.latitude());
            b.queryParam("longitude", geo.longitude());
        }

        String url = b.build(true).toUriString();
        log.debug("Constructed URL: {}", url);
        return url;
    }

    private static String wholeUnits(final BigDecimal price) {
        return price.setScale(0, RoundingMode.DOWN).toBigInteger().toString();
    }

    private static String encode(final String value) {
        return UriUtils.encodeQueryParam(value, StandardCharsets.UTF_8);
    }
}
