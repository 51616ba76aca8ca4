package com.listings.scraper.service.wallapop;

import com.listings.scraper.model.ListingPrice;
import com.listings.scraper.model.NormalizedListing;
import com.listings.scraper.model.RawListing;
import com.listings.scraper.model.RawListing.RawImage;
import com.listings.scraper.model.RawListing.RawLocation;
import com.listings.scraper.model.SearchSettings;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Turns a {@link RawListing} into a {@link NormalizedListing}, or drops it.
 * <p>
 * Listings without identity, title, description, price, seller or location
 * are expected API noise and are skipped silently. A missing or unreadable
 * timestamp and malformed image data only degrade the listing.
 * </p>
 */
@Slf4j
@Component
public class WallapopListingNormalizer {

    /** Image size variants in order of preference. */
    static final List<String> IMAGE_PRIORITY = List.of("big", "medium", "original", "small");

    /**
     * @param raw      listing as read from the API
     * @param settings link prefixes of the current search
     * @return the normalized listing, empty when a required field is missing
     */
    public Optional<NormalizedListing> normalize(final RawListing raw, final SearchSettings settings) {
        String id = raw.id();
        if (StringUtils.isBlank(id)) {
            log.debug("Skipping item due to missing ID.");
            return Optional.empty();
        }

        BigDecimal amount = raw.price() == null ? null : raw.price().amount();
        String location = location(raw.location());
        if (StringUtils.isAnyBlank(raw.title(), raw.description(), raw.userId(), location) || amount == null) {
            log.debug("Item {}: Missing essential data (Title, Desc, Price, UserID, Location). Skipping.", id);
            return Optional.empty();
        }

        List<String> images = images(raw);
        return Optional.of(NormalizedListing.builder()
                .id(id)
                .title(raw.title())
                .description(raw.description())
                .price(new ListingPrice(amount, StringUtils.trimToNull(raw.price().currency())))
                .location(location)
                .createdAt(createdAt(id, raw.createdAt()))
                .sellerId(raw.userId())
                .reserved(Boolean.TRUE.equals(raw.reserved()))
                .mainImage(raw.images().isEmpty() || images.isEmpty() ? null : pick(raw.images().get(0)))
                .images(images)
                .link(settings.getItemLinkBase() + StringUtils.defaultIfBlank(raw.webSlug(), id))
                .sellerLink(settings.getUserLinkBase() + raw.userId())
                .build());
    }

    private static String location(final RawLocation location) {
        if (location == null) {
            return null;
        }
        return Stream.of(location.city(), location.region(), location.countryCode())
                .filter(StringUtils::isNotBlank)
                .findFirst()
                .orElse(null);
    }

    private static Instant createdAt(final String id, final String millis) {
        if (StringUtils.isBlank(millis)) {
            log.warn("Item {}: Missing creation/modification date.", id);
            return null;
        }
        if (!NumberUtils.isParsable(millis.trim())) {
            log.warn("Item {}: Invalid timestamp format ({}). Cannot parse date.", id, millis);
            return null;
        }
        try {
            long epochMillis = new BigDecimal(millis.trim()).toBigInteger().longValueExact();
            if (epochMillis == 0) {
                log.warn("Item {}: Missing creation/modification date.", id);
                return null;
            }
            return Instant.ofEpochMilli(epochMillis);
        } catch (ArithmeticException ex) {
            log.warn("Item {}: Invalid timestamp format ({}). Cannot parse date.", id, millis);
            return null;
        }
    }

    private static List<String> images(final RawListing raw) {
        if (raw.imagesMalformed()) {
            log.warn("Item {}: Error extracting images, unexpected structure.", raw.id());
            return List.of();
        }
        List<String> urls = new ArrayList<>(raw.images().size());
        for (RawImage image : raw.images()) {
            String url = pick(image);
            if (url != null) {
                urls.add(url);
            }
        }
        return urls;
    }

    private static String pick(final RawImage image) {
        return IMAGE_PRIORITY.stream()
                .map(image.urls()::get)
                .filter(StringUtils::isNotBlank)
                .findFirst()
                .orElse(null);
    }
}
