package com.payment.engine.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Wires the Moyasar client: one RestTemplate per timeout class and the "moyasar"
 * circuit breaker. No retry is configured for gateway calls.
 */
@Slf4j
@Configuration
public class MoyasarClientConfig {

    public static final String CIRCUIT_BREAKER_NAME = "moyasar";

    private final MoyasarProperties properties;

    public MoyasarClientConfig(MoyasarProperties properties) {
        this.properties = properties;
    }

    @Bean(name = "moyasarReadRestTemplate")
    public RestTemplate moyasarReadRestTemplate() {
        return restTemplate(properties.getReadTimeout());
    }

    @Bean(name = "moyasarWriteRestTemplate")
    public RestTemplate moyasarWriteRestTemplate() {
        return restTemplate(properties.getWriteTimeout());
    }

    @Bean
    public CircuitBreaker moyasarCircuitBreaker(CircuitBreakerRegistry circuitBreakerRegistry) {
        return circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER_NAME);
    }

    @Bean
    public PaymentGatewayClient moyasarGatewayClient(
            @Qualifier("moyasarReadRestTemplate") RestTemplate readRestTemplate,
            @Qualifier("moyasarWriteRestTemplate") RestTemplate writeRestTemplate,
            CircuitBreaker moyasarCircuitBreaker,
            ObjectMapper objectMapper) {
        return new MoyasarGatewayClient(readRestTemplate, writeRestTemplate, properties,
                moyasarCircuitBreaker, objectMapper);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void logKeyConfiguration() {
        if (properties.getSecretKey() == null || properties.getSecretKey().isBlank()) {
            log.warn("MOYASAR_SECRET_KEY is not configured; gateway calls will fail with AUTHENTICATION_ERROR");
        }
        MoyasarKeyValidator.KeyCheck check = MoyasarKeyValidator.validatePublishableKey(properties.getPublishableKey());
        if (check.valid()) {
            log.info("Moyasar configured: baseUrl={}, environment={}, publishableKey={}",
                    properties.getBaseUrl(), check.environment(), check.maskedKey());
        } else {
            log.warn("Moyasar publishable key check failed: {}, key={}", check.error(), check.maskedKey());
        }
    }

    private RestTemplate restTemplate(Duration readTimeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(properties.getConnectTimeout());
        factory.setReadTimeout(readTimeout);
        return new RestTemplate(factory);
    }
}
