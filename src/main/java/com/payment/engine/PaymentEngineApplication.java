package com.payment.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the payment gateway engine. Provides:
 * <ul>
 *   <li>One-time and tokenized card charges against Moyasar</li>
 *   <li>Reconciliation of gateway state against stored payments</li>
 *   <li>Full and partial refunds with running-balance checks</li>
 *   <li>REST API and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class PaymentEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaymentEngineApplication.class, args);
    }
}
