package com.payment.engine.core;

import com.payment.engine.exception.InvalidAmountException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MoneyConverterTest {

    @Test
    void convertsMajorToMinorUnit() {
        assertThat(MoneyConverter.toMinorUnit(new BigDecimal("99.99"))).isEqualTo(9999L);
        assertThat(MoneyConverter.toMinorUnit(new BigDecimal("100"))).isEqualTo(10000L);
        assertThat(MoneyConverter.toMinorUnit(BigDecimal.ZERO)).isZero();
    }

    @Test
    void roundsHalfUpToNearestMinorUnit() {
        assertThat(MoneyConverter.toMinorUnit(new BigDecimal("10.005"))).isEqualTo(1001L);
        assertThat(MoneyConverter.toMinorUnit(new BigDecimal("10.004"))).isEqualTo(1000L);
        assertThat(MoneyConverter.toMinorUnit(new BigDecimal("0.125"))).isEqualTo(13L);
    }

    @Test
    void convertsMinorToMajorUnitWithTwoDecimals() {
        assertThat(MoneyConverter.toMajorUnit(9999L)).isEqualTo(new BigDecimal("99.99"));
        assertThat(MoneyConverter.toMajorUnit(5L)).isEqualTo(new BigDecimal("0.05"));
        assertThat(MoneyConverter.toMajorUnit(0L)).isEqualTo(new BigDecimal("0.00"));
    }

    @Test
    void roundTripIsLosslessForTwoDecimalAmounts() {
        for (String value : new String[] {"0.01", "0.10", "1.00", "99.99", "149.50", "12345678.91"}) {
            BigDecimal amount = new BigDecimal(value);
            assertThat(MoneyConverter.toMajorUnit(MoneyConverter.toMinorUnit(amount)))
                    .as(value)
                    .isEqualByComparingTo(amount);
        }
    }

    @Test
    void rejectsNegativeAndNullAmounts() {
        assertThatThrownBy(() -> MoneyConverter.toMinorUnit(new BigDecimal("-0.01")))
                .isInstanceOf(InvalidAmountException.class)
                .hasMessageContaining("-0.01");
        assertThatThrownBy(() -> MoneyConverter.toMinorUnit(null))
                .isInstanceOf(InvalidAmountException.class);
        assertThatThrownBy(() -> MoneyConverter.toMajorUnit(-1L))
                .isInstanceOf(InvalidAmountException.class);
    }

    @Test
    void rejectsAmountsBeyondMinorUnitRange() {
        assertThatThrownBy(() -> MoneyConverter.toMinorUnit(new BigDecimal("1e18")))
                .isInstanceOf(InvalidAmountException.class)
                .hasMessageContaining("Out of range");
    }
}
