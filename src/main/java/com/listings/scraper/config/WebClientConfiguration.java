package com.listings.scraper.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelOption;
import io.netty.handler.logging.LogLevel;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.transport.logging.AdvancedByteBufFormat;

import java.time.Duration;

/**
 * WebClient used for marketplace search requests.
 * <p>
 * Pages are fetched one at a time per search, so the pool stays small. The
 * response timeout comes from {@code marketplace.timeout}; the transport
 * additionally bounds its blocking wait with the same value.
 * </p>
 */
@Configuration
@Slf4j
public class WebClientConfiguration {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private static final Duration ACQUIRE_TIMEOUT = Duration.ofSeconds(2);

    private static final int MAX_CONNECTIONS = 20;

    /** Search pages carry full descriptions; the 256 KB codec default is too small. */
    private static final int MAX_IN_MEMORY_SIZE = 4 * 1024 * 1024;

    private static final String START_NANOS = "marketplace.start";

    @Bean
    public WebClient.Builder webClientBuilder(@Qualifier("scraperObjectMapper") final ObjectMapper mapper,
                                              final MarketplaceProperties props) {
        WebClient.Builder builder = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(marketplaceHttpClient(props)))
                .exchangeStrategies(jsonStrategies(mapper))
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .filter(stampRequest())
                .filter(logExchange());
        if (StringUtils.isNotBlank(props.getUserAgent())) {
            builder.defaultHeader(HttpHeaders.USER_AGENT, props.getUserAgent());
        }
        return builder;
    }

    private static HttpClient marketplaceHttpClient(final MarketplaceProperties props) {
        ConnectionProvider pool = ConnectionProvider.builder("marketplace-pool")
                .maxConnections(MAX_CONNECTIONS)
                .pendingAcquireTimeout(ACQUIRE_TIMEOUT)
                .build();

        return HttpClient.create(pool)
                .compress(true)
                .followRedirect(true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) CONNECT_TIMEOUT.toMillis())
                .responseTimeout(props.getTimeout())
                .wiretap("reactor.netty.http.client.HttpClient",
                        LogLevel.DEBUG, AdvancedByteBufFormat.TEXTUAL);
    }

    private static ExchangeStrategies jsonStrategies(final ObjectMapper mapper) {
        return ExchangeStrategies.builder()
                .codecs(cfg -> {
                    cfg.defaultCodecs()
                            .jackson2JsonDecoder(new Jackson2JsonDecoder(mapper, MediaType.APPLICATION_JSON));
                    cfg.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE);
                })
                .build();
    }

    private static ExchangeFilterFunction stampRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(req -> Mono.just(
                ClientRequest.from(req).attribute(START_NANOS, System.nanoTime()).build()));
    }

    private static ExchangeFilterFunction logExchange() {
        return (req, next) -> {
            log.debug("--> {} {}", req.method(), req.url());
            return next.exchange(req).doOnNext(res -> {
                long started = (Long) req.attribute(START_NANOS).orElse(System.nanoTime());
                log.debug("<-- {} {} ({} ms)", res.statusCode().value(), req.url(),
                        Duration.ofNanos(System.nanoTime() - started).toMillis());
            });
        };
    }
}
