package com.listings.scraper.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.listings.scraper.model.RawListing;
import com.listings.scraper.model.RawListing.RawImage;
import com.listings.scraper.model.RawListing.RawLocation;
import com.listings.scraper.model.RawListing.RawPrice;
import com.listings.scraper.model.SearchPage;
import com.listings.scraper.service.core.SearchError;
import com.listings.scraper.service.core.SearchOutcome;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * <h2>Wallapop Search Page Parser</h2>
 * <p>Validates the v3 search response against the shape below and maps it to
 * typed records:</p>
 * <pre>{@code
 * {
 *   "data": { "section": { "payload": { "items": [ { … }, … ] } } },
 *   "meta": { "next_page": "<cursor>" }
 * }
 * }</pre>
 * <p>Rules:</p>
 * <ol>
 *     <li>A body that is not JSON, a root that is not an object, or a
 *         {@code data}/{@code section}/{@code payload}/{@code meta} block of
 *         the wrong type is a parsing failure.</li>
 *     <li>A missing or non-array {@code items} is an empty page.</li>
 *     <li>Array elements that are not objects are skipped.</li>
 *     <li>Scalar fields of the wrong type are read as absent.</li>
 *     <li>An {@code images} block of the wrong shape is flagged, not fatal.</li>
 * </ol>
 */
@Slf4j
@Component("wallapopPageParser")
public class WallapopSearchPageParser implements SearchPageParser {

    private static final int EXCERPT_LENGTH = 500;

    private final ObjectMapper mapper;

    public WallapopSearchPageParser(@Qualifier("scraperObjectMapper") final ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public SearchOutcome<SearchPage> parse(final String body) {
        JsonNode root;
        try {
            root = mapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException ex) {
            return SearchOutcome.failure(SearchError.parsing(
                    "Error decoding JSON response: " + ex.getOriginalMessage()
                            + ". Response text: " + StringUtils.abbreviate(body, EXCERPT_LENGTH), ex));
        }
        if (root == null || !root.isObject()) {
            return SearchOutcome.failure(SearchError.parsing(
                    "Expected a JSON object at the response root, got "
                            + (root == null ? "nothing" : root.getNodeType()), null));
        }

        JsonNode payload = root;
        for (String name : List.of("data", "section", "payload")) {
            payload = payload.path(name);
            if (!payload.isMissingNode() && !payload.isNull() && !payload.isObject()) {
                return SearchOutcome.failure(SearchError.parsing(
                        "Expected an object for '" + name + "', got " + payload.getNodeType(), null));
            }
        }
        JsonNode meta = root.path("meta");
        if (!meta.isMissingNode() && !meta.isNull() && !meta.isObject()) {
            return SearchOutcome.failure(SearchError.parsing(
                    "Expected an object for 'meta', got " + meta.getNodeType(), null));
        }

        Optional<String> cursor = Optional.ofNullable(text(meta, "next_page"))
                .filter(StringUtils::isNotBlank);
        return SearchOutcome.success(new SearchPage(readItems(payload.path("items")), cursor));
    }

    private List<RawListing> readItems(final JsonNode items) {
        if (items.isMissingNode() || items.isNull()) {
            return List.of();
        }
        if (!items.isArray()) {
            log.warn("Expected list for 'items' in data.section.payload, got {}. Treating as empty.",
                    items.getNodeType());
            return List.of();
        }
        List<RawListing> out = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            if (item.isObject()) {
                out.add(readListing(item));
            } else {
                log.warn("Skipping non-object entry in items: {}", item.getNodeType());
            }
        }
        return out;
    }

    private RawListing readListing(final JsonNode item) {
        JsonNode price = item.path("price");
        JsonNode location = item.path("location");
        JsonNode images = item.path("images");

        List<RawImage> imageList = readImages(images);
        return new RawListing(
                text(item, "id"),
                text(item, "title"),
                text(item, "description"),
                text(item, "web_slug"),
                price.isObject() ? new RawPrice(decimal(price.path("amount")), text(price, "currency")) : null,
                text(item, "user_id"),
                location.isObject()
                        ? new RawLocation(text(location, "city"), text(location, "region"),
                                text(location, "country_code"))
                        : null,
                bool(item.path("flags").path("reserved")),
                text(item, "created_at"),
                imageList == null ? List.of() : imageList,
                imageList == null);
    }

    /**
     * @return the image entries, or {@code null} when the block is malformed
     */
    private static List<RawImage> readImages(final JsonNode images) {
        if (images.isMissingNode() || images.isNull()) {
            return List.of();
        }
        if (!images.isArray()) {
            return null;
        }
        List<RawImage> out = new ArrayList<>(images.size());
        for (JsonNode image : images) {
            JsonNode urls = image.path("urls");
            if (!image.isObject() || !urls.isObject()) {
                return null;
            }
            Map<String, String> variants = new LinkedHashMap<>();
            urls.fields().forEachRemaining(e -> {
                if (e.getValue().isTextual() && StringUtils.isNotBlank(e.getValue().asText())) {
                    variants.put(e.getKey(), e.getValue().asText());
                }
            });
            out.add(new RawImage(Map.copyOf(variants)));
        }
        return out;
    }

    private static String text(final JsonNode node, final String field) {
        JsonNode value = node.path(field);
        return value.isTextual() || value.isNumber() ? value.asText() : null;
    }

    private static BigDecimal decimal(final JsonNode value) {
        if (value.isNumber()) {
            return value.decimalValue();
        }
        if (value.isTextual() && NumberUtils.isParsable(value.asText().trim())) {
            return new BigDecimal(value.asText().trim());
        }
        return null;
    }

    private static Boolean bool(final JsonNode value) {
        return value.isBoolean() ? value.booleanValue() : null;
    }
}
