package com.payment.engine.gateway;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payment.engine.exception.GatewayAuthenticationException;
import com.payment.engine.exception.GatewayException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Moyasar REST client. Basic auth with the secret key as user and an empty password,
 * integral minor-unit amounts, idempotency through {@code given_id}. Read calls use the
 * short-timeout template, charge and refund calls the long one. No call is retried here.
 */
@Slf4j
public class MoyasarGatewayClient implements PaymentGatewayClient {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final RestTemplate readRestTemplate;
    private final RestTemplate writeRestTemplate;
    private final MoyasarProperties properties;
    private final CircuitBreaker circuitBreaker;
    private final GatewayErrorTranslator errorTranslator;
    private final ObjectMapper objectMapper;

    public MoyasarGatewayClient(RestTemplate readRestTemplate,
                                RestTemplate writeRestTemplate,
                                MoyasarProperties properties,
                                CircuitBreaker circuitBreaker,
                                ObjectMapper objectMapper) {
        this.readRestTemplate = readRestTemplate;
        this.writeRestTemplate = writeRestTemplate;
        this.properties = properties;
        this.circuitBreaker = circuitBreaker;
        this.objectMapper = objectMapper;
        this.errorTranslator = new GatewayErrorTranslator(objectMapper);
    }

    @Override
    public GatewayCharge createCharge(GatewayChargeRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("given_id", request.getGivenId());
        body.put("amount", request.getAmount());
        body.put("currency", request.getCurrency());
        body.put("description", request.getDescription());
        body.put("callback_url", request.getCallbackUrl());
        body.put("source", request.getSource().toGatewayPayload());
        if (request.getMetadata() != null && !request.getMetadata().isEmpty()) {
            body.put("metadata", request.getMetadata());
        }

        log.debug("Creating Moyasar charge: givenId={}, amount={}, currency={}, sourceType={}",
                request.getGivenId(), request.getAmount(), request.getCurrency(), request.getSource().getType());

        String responseBody = call("createCharge", () ->
                writeRestTemplate.exchange(url("/payments"), HttpMethod.POST,
                        new HttpEntity<>(body, authHeaders()), String.class));
        GatewayCharge charge = toCharge(responseBody);

        log.info("Moyasar charge created: id={}, status={}, amount={}", charge.getId(), charge.getStatus(), charge.getAmount());
        return charge;
    }

    @Override
    public GatewayCharge fetchCharge(String chargeId) {
        log.debug("Fetching Moyasar charge: id={}", chargeId);
        String responseBody = call("fetchCharge", () ->
                readRestTemplate.exchange(url("/payments/{id}"), HttpMethod.GET,
                        new HttpEntity<>(authHeaders()), String.class, chargeId));
        GatewayCharge charge = toCharge(responseBody);
        log.debug("Moyasar charge fetched: id={}, status={}, amount={}, hasMetadata={}",
                charge.getId(), charge.getStatus(), charge.getAmount(), charge.getMetadata() != null);
        return charge;
    }

    @Override
    public GatewayRefund createRefund(String chargeId, Long amountMinor, String description) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("description", description != null ? description : "Refund processed");
        if (amountMinor != null) {
            body.put("amount", amountMinor);
        }

        log.debug("Creating Moyasar refund: id={}, amount={}", chargeId, amountMinor != null ? amountMinor : "full");

        String responseBody = call("createRefund", () ->
                writeRestTemplate.exchange(url("/payments/{id}/refund"), HttpMethod.POST,
                        new HttpEntity<>(body, authHeaders()), String.class, chargeId));
        Map<String, Object> raw = parse(responseBody);
        GatewayRefund refund = bind(raw, GatewayRefund.class).toBuilder().raw(raw).build();

        log.info("Moyasar refund processed: id={}, refunded={}, refundedAt={}",
                refund.getId(), refund.getRefunded(), refund.getRefundedAt());
        return refund;
    }

    private String call(String operation, Supplier<ResponseEntity<String>> request) {
        try {
            ResponseEntity<String> response = circuitBreaker.executeSupplier(() -> {
                try {
                    return request.get();
                } catch (RestClientException e) {
                    throw errorTranslator.translate(operation, e);
                }
            });
            return response.getBody();
        } catch (CallNotPermittedException e) {
            log.error("Moyasar circuit breaker open, rejecting call: operation={}", operation);
            throw new GatewayException("Moyasar API temporarily unavailable", "circuit_open", 0, e);
        }
    }

    private GatewayCharge toCharge(String responseBody) {
        Map<String, Object> raw = parse(responseBody);
        return bind(raw, GatewayCharge.class).toBuilder().raw(raw).build();
    }

    private <T> T bind(Map<String, Object> raw, Class<T> type) {
        try {
            return objectMapper.convertValue(raw, type);
        } catch (IllegalArgumentException e) {
            log.error("Unexpected Moyasar response shape for {}: {}", type.getSimpleName(), e.getMessage());
            throw new GatewayException("Unexpected response shape from Moyasar", "invalid_response", 0, e);
        }
    }

    private Map<String, Object> parse(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            throw new GatewayException("Empty response from Moyasar", "invalid_response", 0, null);
        }
        try {
            return objectMapper.readValue(responseBody, MAP_TYPE);
        } catch (IOException e) {
            log.error("Unparseable Moyasar response: {}", e.getMessage());
            throw new GatewayException("Unparseable response from Moyasar", "invalid_response", 0, e);
        }
    }

    private HttpHeaders authHeaders() {
        String secretKey = properties.getSecretKey();
        if (secretKey == null || secretKey.isBlank()) {
            log.error("Moyasar configuration error: secret key is not configured");
            throw new GatewayAuthenticationException("MOYASAR_SECRET_KEY is not configured", 0, null);
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setBasicAuth(secretKey, "", StandardCharsets.UTF_8);
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return headers;
    }

    private String url(String path) {
        String base = properties.getBaseUrl();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) + path : base + path;
    }
}
