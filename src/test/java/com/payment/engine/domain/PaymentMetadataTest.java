package com.payment.engine.domain;

import com.payment.engine.persistence.entity.PaymentMetadataConverter;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PaymentMetadataTest {

    private final PaymentMetadataConverter converter = new PaymentMetadataConverter();

    @Test
    void mergeKeepsKeysAbsentFromPatch() {
        PaymentMetadata base = PaymentMetadata.builder()
                .gateway(PaymentMetadata.GATEWAY_MOYASAR)
                .givenId("key-1")
                .callbackUrl("https://shop.example/return")
                .build();
        base.putExtra("legacy_flag", true);

        PaymentMetadata merged = base.mergedWith(PaymentMetadata.builder()
                .transactionId("pay_gw_1")
                .build());

        assertThat(merged.getGivenId()).isEqualTo("key-1");
        assertThat(merged.getCallbackUrl()).isEqualTo("https://shop.example/return");
        assertThat(merged.getTransactionId()).isEqualTo("pay_gw_1");
        assertThat(merged.getExtra()).containsEntry("legacy_flag", true);
        assertThat(merged).isNotSameAs(base);
        assertThat(base.getTransactionId()).isNull();
    }

    @Test
    void storesSnakeCaseJsonAndKeepsUnknownKeys() {
        String json = "{\"gateway\":\"moyasar\",\"given_id\":\"key-1\",\"session_id\":\"sess-9\","
                + "\"moyasar_response\":{\"id\":\"old\"}}";

        PaymentMetadata metadata = converter.convertToEntityAttribute(json);

        assertThat(metadata.getGivenId()).isEqualTo("key-1");
        assertThat(metadata.getSessionId()).isEqualTo("sess-9");
        assertThat(metadata.getExtra()).containsKey("moyasar_response");

        String written = converter.convertToDatabaseColumn(metadata);
        assertThat(written).contains("\"given_id\":\"key-1\"").contains("\"moyasar_response\"");
    }

    @Test
    void verificationDetailsSurviveStorage() {
        PaymentMetadata metadata = PaymentMetadata.builder()
                .verification(VerificationDetails.builder()
                        .statusMatch(true)
                        .amountMatch(true)
                        .currencyMatch(true)
                        .amountDifference(new BigDecimal("0.00"))
                        .expectedAmount(new BigDecimal("99.99"))
                        .actualAmount(new BigDecimal("99.99"))
                        .expectedCurrency("SAR")
                        .actualCurrency("SAR")
                        .expectedStatus("paid")
                        .actualStatus("paid")
                        .build())
                .gatewayResponse(Map.of("id", "pay_gw_1"))
                .build();

        PaymentMetadata read = converter.convertToEntityAttribute(converter.convertToDatabaseColumn(metadata));

        assertThat(read.getVerification().isAmountMatch()).isTrue();
        assertThat(read.getVerification().getExpectedAmount()).isEqualByComparingTo("99.99");
        assertThat(read.getGatewayResponse()).containsEntry("id", "pay_gw_1");
    }

    @Test
    void emptyColumnReadsAsEmptyMetadata() {
        assertThat(converter.convertToEntityAttribute(null)).isNotNull();
        assertThat(converter.convertToDatabaseColumn(null)).isNull();
    }
}
