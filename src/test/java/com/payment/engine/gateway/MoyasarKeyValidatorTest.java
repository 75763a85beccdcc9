package com.payment.engine.gateway;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MoyasarKeyValidatorTest {

    @Test
    void acceptsTestAndLiveKeys() {
        MoyasarKeyValidator.KeyCheck test = MoyasarKeyValidator.validatePublishableKey("pk_test_abcDEF123456789xyz");
        MoyasarKeyValidator.KeyCheck live = MoyasarKeyValidator.validatePublishableKey("pk_live_abcDEF123456789xyz");

        assertThat(test.valid()).isTrue();
        assertThat(test.environment()).isEqualTo("test");
        assertThat(test.maskedKey()).isEqualTo("pk_test_abcDEF1...");
        assertThat(live.environment()).isEqualTo("production");
        assertThat(MoyasarKeyValidator.isProductionKey("pk_live_abcDEF123456789xyz")).isTrue();
        assertThat(MoyasarKeyValidator.isProductionKey("pk_test_abcDEF123456789xyz")).isFalse();
    }

    @Test
    void rejectsSecretKeysAndMissingValues() {
        assertThat(MoyasarKeyValidator.validatePublishableKey("sk_test_abc123").valid()).isFalse();
        assertThat(MoyasarKeyValidator.validatePublishableKey("pk_dev_abc123").valid()).isFalse();
        assertThat(MoyasarKeyValidator.validatePublishableKey(null).error()).isEqualTo("Publishable key is missing");
    }
}
