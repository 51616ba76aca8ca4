package com.listings.scraper.config;

import com.listings.scraper.model.FuzzyThresholds;
import com.listings.scraper.model.GeoPoint;
import com.listings.scraper.model.SearchSettings;
import com.listings.scraper.service.core.ListingSearchService;
import io.github.resilience4j.retry.Retry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class MarketplacePropertiesTest {

    @Autowired
    private MarketplaceProperties props;

    @Autowired
    @Qualifier("marketplaceRetry")
    private Retry retry;

    @Autowired
    private ListingSearchService searchService;

    @Test
    void shouldBindApplicationYaml() {
        assertThat(props.getBaseUrl()).isEqualTo("https://api.wallapop.com/api/v3/search");
        assertThat(props.getTimeout()).isEqualTo(Duration.ofSeconds(15));
        assertThat(props.getDefaultItemBudget()).isEqualTo(100);
        assertThat(props.getHeaders()).containsEntry("X-DeviceOS", "0");
    }

    @Test
    void shouldBuildImmutableSettings() {
        SearchSettings settings = props.toSettings();

        assertThat(settings.getThresholds()).isEqualTo(new FuzzyThresholds(75, 65, 85));
        assertThat(settings.getGeo()).isEqualTo(new GeoPoint(43.318611, 11.330556));
        assertThat(settings.getZoneId()).isEqualTo(ZoneId.of("Europe/Rome"));
        assertThat(settings.getItemLinkBase()).isEqualTo("https://it.wallapop.com/item/");
    }

    @Test
    void shouldOmitGeoWhenIncomplete() {
        MarketplaceProperties partial = new MarketplaceProperties();
        MarketplaceProperties.Geo geo = new MarketplaceProperties.Geo();
        geo.setLatitude(1.0);
        partial.setGeo(geo);

        assertThat(partial.toSettings().getGeo()).isNull();
    }

    @Test
    void shouldWireRetryAndSearchService() {
        assertThat(retry.getName()).isEqualTo(Resilience4jConfig.MARKETPLACE_FETCH);
        assertThat(retry.getRetryConfig().getMaxAttempts()).isEqualTo(3);
        assertThat(searchService).isNotNull();
    }
}
