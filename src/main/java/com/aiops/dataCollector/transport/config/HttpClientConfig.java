package com.aiops.dataCollector.transport.config;

import com.aiops.dataCollector.config.CollectorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Builds the single RestClient shared by every outbound call.
 * TLS verification and timeouts are applied here so that all calls behave the same.
 */
@Slf4j
@Configuration
public class HttpClientConfig {

    @Bean
    public RestClient collectorRestClient(RestClient.Builder builder, CollectorProperties properties) {
        CollectorProperties.Http http = properties.getHttp();
        if (http.getMaxRetries() < 2) {
            throw new IllegalStateException("collector.http.max-retries must be greater than 1, got " + http.getMaxRetries());
        }

        return builder
                .requestFactory(requestFactory(http))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    static SimpleClientHttpRequestFactory requestFactory(CollectorProperties.Http http) {
        SimpleClientHttpRequestFactory factory;
        if (http.isSslVerify()) {
            factory = new SimpleClientHttpRequestFactory();
        } else {
            log.warn("TLS certificate validation is disabled for outbound calls");
            factory = new InsecureClientHttpRequestFactory();
        }
        factory.setConnectTimeout(http.getConnectTimeout());
        factory.setReadTimeout(http.getReadTimeout());
        return factory;
    }
}
