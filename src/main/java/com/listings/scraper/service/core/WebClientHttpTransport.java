package com.listings.scraper.service.core;

import com.listings.scraper.config.MarketplaceProperties;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * <h2>WebClientHttpTransport</h2>
 *
 * <p>{@link HttpTransport} on top of the shared {@link WebClient} builder.</p>
 *
 * <ul>
 *   <li>One blocking GET per call, bounded by the configured timeout.</li>
 *   <li>Every status code is returned as a {@link TransportResponse}; only
 *       connection-level failures raise {@link TransportException}.</li>
 *   <li>Attempts are wrapped in the "marketplaceFetch" Resilience4j retry.</li>
 * </ul>
 */
@Slf4j
@Component
public class WebClientHttpTransport implements HttpTransport {

    private final WebClient webClient;

    private final Retry retry;

    private final Duration timeout;

    public WebClientHttpTransport(final WebClient.Builder builder,
                                  @Qualifier("marketplaceRetry") final Retry retry,
                                  final MarketplaceProperties props) {
        this.webClient = builder.clone().build();
        this.retry = retry;
        this.timeout = props.getTimeout();
    }

    @Override
    public TransportResponse get(final String url, final Map<String, String> headers) throws TransportException {
        Callable<TransportResponse> attempt = () -> exchange(url, headers);
        try {
            return Retry.decorateCallable(retry, attempt).call();
        } catch (TransportException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new TransportException("GET " + url + " failed", ex);
        }
    }

    private TransportResponse exchange(final String url, final Map<String, String> headers)
            throws TransportException {
        TransportResponse rsp;
        try {
            rsp = webClient.get()
                    .uri(URI.create(url))
                    .headers(h -> headers.forEach(h::set))
                    .exchangeToMono(r -> r.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> new TransportResponse(r.statusCode().value(), body)))
                    .block(timeout);
        } catch (RuntimeException ex) {
            log.warn("GET {} failed: {}", url, ex.toString());
            throw new TransportException("GET " + url + " failed", ex);
        }
        if (rsp == null) {
            throw new TransportException("GET " + url + " produced no response", null);
        }
        if (!rsp.isSuccess()) {
            log.debug("GET {} answered {}", url, rsp.statusCode());
        }
        return rsp;
    }
}
