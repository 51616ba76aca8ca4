package com.listings.scraper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * The main entry point for the Listing Scraper application.
 *
 * <p>This Spring Boot application searches a consumer marketplace for
 * listings matching a buyer's criteria and exposes the pipeline through
 * <code>POST /api/search/listings</code>:
 * <ul>
 *   <li>builds the search query and pages through the API with its cursor,</li>
 *   <li>normalises and validates every listing,</li>
 *   <li>filters by reservation, excluded terms, fuzzy keywords and price,</li>
 *   <li>deduplicates by listing identity.</li>
 * </ul>
 *
 * <p>Usage:
 * <pre>{@code
 *   mvn spring-boot:run
 * }</pre>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ListingScraperApplication {

    /**
     * Bootstrap method to launch the Spring Boot application.
     *
     * @param args command-line arguments (ignored)
     */
    public static void main(final String[] args) {
        SpringApplication.run(ListingScraperApplication.class, args);
    }
}
