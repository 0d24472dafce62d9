package com.starscape.astrocat.common.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class HttpClientConfig {

    /**
     * Shared client for the solver JSON API.
     */
    @Bean
    public RestTemplate solverRestTemplate(RestTemplateBuilder builder, AstrometryProperties properties) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(15))
                .setReadTimeout(Duration.ofSeconds(properties.getHttpTimeoutSeconds()))
                .build();
    }
}
