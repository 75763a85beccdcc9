package com.payment.engine;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.kafka.test.context.EmbeddedKafka;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Integration test: verifies that the application context loads against a PostgreSQL
 * container and an embedded Kafka broker.
 * Requires Docker. Excluded from the default build; run with:
 *   mvn test -Pintegration
 */
@Tag("integration")
@SpringBootTest(classes = PaymentEngineApplication.class, properties = {
		"spring.jpa.hibernate.ddl-auto=create-drop",
		"moyasar.secret-key=sk_test_placeholder",
		"moyasar.publishable-key=pk_test_placeholder"
})
@EmbeddedKafka(partitions = 1, topics = { "payment-alerts" },
		bootstrapServersProperty = "spring.kafka.bootstrap-servers")
@Testcontainers
class PaymentEngineApplicationTests {

	@Container
	static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine");

	@DynamicPropertySource
	static void datasourceProperties(DynamicPropertyRegistry registry) {
		registry.add("spring.datasource.url", postgres::getJdbcUrl);
		registry.add("spring.datasource.username", postgres::getUsername);
		registry.add("spring.datasource.password", postgres::getPassword);
	}

	@Test
	void contextLoads() {
	}
}
