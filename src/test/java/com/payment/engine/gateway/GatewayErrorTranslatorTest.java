package com.payment.engine.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.payment.engine.exception.ErrorCode;
import com.payment.engine.exception.GatewayException;
import com.payment.engine.exception.PaymentEngineException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.net.ConnectException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class GatewayErrorTranslatorTest {

    private final GatewayErrorTranslator translator = new GatewayErrorTranslator(new ObjectMapper());

    private static HttpClientErrorException clientError(HttpStatus status, String body) {
        return HttpClientErrorException.create(status, status.getReasonPhrase(), new HttpHeaders(),
                body.getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8);
    }

    @Test
    void apiKeyMessageIsAuthenticationErrorWhateverTheStatus() {
        PaymentEngineException e = translator.translate("createCharge",
                clientError(HttpStatus.FORBIDDEN, "{\"message\":\"Invalid API key provided\"}"));

        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.AUTHENTICATION_ERROR);
    }

    @Test
    void notFoundWinsOverAuthenticationKeywords() {
        PaymentEngineException e = translator.translate("fetchCharge",
                clientError(HttpStatus.NOT_FOUND, "{\"message\":\"authentication record not found\"}"));

        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.NOT_FOUND);
    }

    @Test
    void missingBodyFieldsFallBackToDefaults() {
        PaymentEngineException e = translator.translate("createCharge",
                HttpServerErrorException.create(HttpStatus.BAD_GATEWAY, "Bad Gateway", new HttpHeaders(),
                        new byte[0], StandardCharsets.UTF_8));

        assertThat(e).isInstanceOfSatisfying(GatewayException.class, g -> {
            assertThat(g.getGatewayMessage()).isEqualTo("Unknown Moyasar error");
            assertThat(g.getErrorType()).isEqualTo("moyasar_error");
            assertThat(g.getHttpStatus()).isEqualTo(502);
        });
    }

    @Test
    void nonJsonBodyBecomesMessage() {
        PaymentEngineException e = translator.translate("createCharge",
                clientError(HttpStatus.UNPROCESSABLE_ENTITY, "upstream rejected"));

        assertThat(e).isInstanceOfSatisfying(GatewayException.class,
                g -> assertThat(g.getGatewayMessage()).isEqualTo("upstream rejected"));
    }

    @Test
    void connectionFailureIsNetworkGatewayError() {
        PaymentEngineException e = translator.translate("createRefund",
                new ResourceAccessException("I/O error", new ConnectException("Connection refused")));

        assertThat(e).isInstanceOfSatisfying(GatewayException.class, g -> {
            assertThat(g.getErrorType()).isEqualTo("network_error");
            assertThat(g.getHttpStatus()).isZero();
        });
    }
}
