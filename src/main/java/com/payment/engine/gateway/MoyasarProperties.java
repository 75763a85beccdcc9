package com.payment.engine.gateway;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Moyasar connection settings, bound from {@code moyasar.*}.
 */
@Data
@ConfigurationProperties(prefix = "moyasar")
public class MoyasarProperties {

    private String baseUrl = "https://api.moyasar.com/v1";

    /** Secret key; sent as basic-auth user with an empty password. */
    private String secretKey;

    /** Publishable key, only validated and logged at start-up. */
    private String publishableKey;

    /** Used when a charge request carries no callback URL. */
    private String defaultCallbackUrl;

    private Duration connectTimeout = Duration.ofSeconds(5);

    /** Fetch / verify calls. */
    private Duration readTimeout = Duration.ofSeconds(10);

    /** Charge and refund calls. */
    private Duration writeTimeout = Duration.ofSeconds(30);
}
