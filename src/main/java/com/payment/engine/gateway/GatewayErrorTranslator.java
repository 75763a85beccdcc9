package com.payment.engine.gateway;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payment.engine.exception.GatewayAuthenticationException;
import com.payment.engine.exception.GatewayException;
import com.payment.engine.exception.GatewayTimeoutException;
import com.payment.engine.exception.NotFoundException;
import com.payment.engine.exception.PaymentEngineException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.Map;

/**
 * Maps RestTemplate failures onto the engine's error taxonomy. The only place in the
 * codebase that looks at HTTP status codes or transport exceptions.
 */
@Slf4j
public class GatewayErrorTranslator {

    static final String DEFAULT_MESSAGE = "Unknown Moyasar error";
    static final String DEFAULT_TYPE = "moyasar_error";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public GatewayErrorTranslator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public PaymentEngineException translate(String operation, RestClientException e) {
        if (e instanceof RestClientResponseException) {
            return translateResponse(operation, (RestClientResponseException) e);
        }
        if (e instanceof ResourceAccessException && isTimeout(e)) {
            log.error("Moyasar API timeout: operation={}, error={}", operation, e.getMessage());
            return new GatewayTimeoutException("Moyasar API request timeout", e);
        }
        log.error("Moyasar service error: operation={}, error={}", operation, e.getMessage());
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return new GatewayException(message, "network_error", 0, e);
    }

    private PaymentEngineException translateResponse(String operation, RestClientResponseException e) {
        int status = e.getStatusCode().value();
        Map<String, Object> body = parseBody(e.getResponseBodyAsString());
        String message = stringOrDefault(body.get("message"), DEFAULT_MESSAGE);
        String type = stringOrDefault(body.get("type"), DEFAULT_TYPE);

        log.error("Moyasar API error: operation={}, code={}, type={}, message={}", operation, status, type, message);

        if (status == 404) {
            return new NotFoundException("Moyasar payment not found", e);
        }
        String lower = message.toLowerCase(Locale.ROOT);
        if (status == 401 || lower.contains("authentication") || lower.contains("api key")) {
            return new GatewayAuthenticationException(
                    "Invalid Moyasar API credentials. Check MOYASAR_SECRET_KEY.", status, e);
        }
        return new GatewayException(message, type, status, e);
    }

    private Map<String, Object> parseBody(String body) {
        if (body == null || body.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(body, MAP_TYPE);
            return parsed != null ? parsed : Map.of();
        } catch (IOException ex) {
            log.debug("Moyasar error body is not JSON: {}", ex.getMessage());
            return Map.of("message", body);
        }
    }

    private static boolean isTimeout(Throwable e) {
        Throwable t = e;
        while (t != null) {
            if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException) {
                return true;
            }
            t = t.getCause();
        }
        return false;
    }

    private static String stringOrDefault(Object value, String fallback) {
        return value != null && !value.toString().isBlank() ? value.toString() : fallback;
    }
}
