package com.listings.scraper.config;

import com.listings.scraper.service.core.TransportException;
import com.listings.scraper.service.core.TransportResponse;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * <h2>Resilience4j Configuration</h2>
 *
 * <p>
 * Exposes the retry policy applied by the HTTP transport to every page
 * request. The search pipeline itself never retries: a page either comes back
 * from the transport or the whole search fails.
 * </p>
 */
@Configuration
public class Resilience4jConfig {

    /** Name of the retry instance wrapping page requests. */
    public static final String MARKETPLACE_FETCH = "marketplaceFetch";

    private static final int TOO_MANY_REQUESTS = 429;

    private static final int SERVER_ERROR = 500;

    /**
     * Creates the global {@link RetryRegistry}.
     *
     * @return a registry with default retry configuration
     */
    @Bean
    public RetryRegistry retryRegistry() {
        return RetryRegistry.ofDefaults();
    }

    /**
     * Retry policy for marketplace page requests.
     * <p>
     * Retries transport failures and throttled or server-side responses
     * (429, 5xx). When attempts run out the last response is handed back so
     * the caller can report its status.
     * </p>
     *
     * @param registry the global {@link RetryRegistry}
     * @param props    marketplace properties supplying attempts and wait
     * @return a {@link Retry} registered as "marketplaceFetch"
     */
    @Bean
    public Retry marketplaceRetry(final RetryRegistry registry, final MarketplaceProperties props) {
        return registry.retry(MARKETPLACE_FETCH, fetchRetryConfig(props.getRetry()));
    }

    /**
     * @param policy bound retry properties
     * @return the retry configuration used for page requests
     */
    public static RetryConfig fetchRetryConfig(final MarketplaceProperties.RetryPolicy policy) {
        return RetryConfig.<TransportResponse>custom()
                .maxAttempts(policy.getMaxAttempts())
                .waitDuration(policy.getWaitDuration())
                .retryExceptions(TransportException.class)
                .retryOnResult(rsp -> rsp.statusCode() == TOO_MANY_REQUESTS || rsp.statusCode() >= SERVER_ERROR)
                .build();
    }

}
