package com.listings.scraper.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

@Configuration
public class JacksonScraperConfig {

    /**
     * The application's {@link ObjectMapper}, qualified <b>scraperObjectMapper</b>.
     * <p>
     * It reads marketplace pages and, being the only mapper in the context, also
     * writes REST responses. Starts from Boot's builder so {@code java.time}
     * values in results serialize as ISO strings; floats are read as
     * {@code BigDecimal} so prices keep their exact value.
     *
     * @param builder Boot-configured builder
     * @return ObjectMapper for scraper
     */
    @Bean
    @Qualifier("scraperObjectMapper")
    public ObjectMapper scraperObjectMapper(final Jackson2ObjectMapperBuilder builder) {
        return builder.featuresToEnable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS).build();
    }
}
