package com.payment.engine.core;

import com.payment.engine.exception.InvalidAmountException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Converts between display currency (SAR) and the gateway's minor unit (halala, 1 SAR = 100).
 * BigDecimal only; half-up rounding to the nearest minor unit.
 */
public final class MoneyConverter {

    private static final BigDecimal MINOR_UNITS_PER_MAJOR = BigDecimal.valueOf(100);
    private static final int MAJOR_SCALE = 2;

    private MoneyConverter() {}

    public static long toMinorUnit(BigDecimal amountMajor) {
        if (amountMajor == null) {
            throw new InvalidAmountException("Invalid amount: null. Must be a non-negative number.");
        }
        if (amountMajor.signum() < 0) {
            throw new InvalidAmountException("Invalid amount: " + amountMajor.toPlainString()
                    + ". Must be a non-negative number.");
        }
        try {
            return amountMajor.multiply(MINOR_UNITS_PER_MAJOR)
                    .setScale(0, RoundingMode.HALF_UP)
                    .longValueExact();
        } catch (ArithmeticException e) {
            throw new InvalidAmountException("Invalid amount: " + amountMajor.toPlainString()
                    + ". Out of range for the minor unit.", e);
        }
    }

    public static BigDecimal toMajorUnit(long amountMinor) {
        if (amountMinor < 0) {
            throw new InvalidAmountException("Invalid amount: " + amountMinor + ". Must be a non-negative number.");
        }
        return BigDecimal.valueOf(amountMinor).divide(MINOR_UNITS_PER_MAJOR, MAJOR_SCALE, RoundingMode.UNNECESSARY);
    }

    /** Normalizes a major-unit amount to two decimals, half-up. */
    public static BigDecimal normalize(BigDecimal amountMajor) {
        return amountMajor.setScale(MAJOR_SCALE, RoundingMode.HALF_UP);
    }
}
