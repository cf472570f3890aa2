package com.owldoor.geocoder.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * Shared RestTemplate for all provider clients. Bounded timeouts keep a stuck provider from
 * stalling the single worker indefinitely.
 */
@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

    private final BulkGeocoderProperties properties;

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(properties.getHttp().getConnectTimeout())
                .setReadTimeout(properties.getHttp().getReadTimeout())
                .build();
    }
}
