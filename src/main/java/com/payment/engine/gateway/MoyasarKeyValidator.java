package com.payment.engine.gateway;

import com.payment.engine.compliance.SensitiveDataMasker;

import java.util.regex.Pattern;

/**
 * Checks Moyasar publishable keys ({@code pk_test_...} / {@code pk_live_...}).
 */
public final class MoyasarKeyValidator {

    private static final Pattern PUBLISHABLE_KEY = Pattern.compile("^pk_(test|live)_[A-Za-z0-9]+$");

    private MoyasarKeyValidator() {}

    public static KeyCheck validatePublishableKey(String key) {
        if (key == null || key.isBlank()) {
            return new KeyCheck(false, null, "Publishable key is missing", null);
        }
        if (!PUBLISHABLE_KEY.matcher(key).matches()) {
            return new KeyCheck(false, null, "Invalid publishable key format. Expected pk_test_... or pk_live_...",
                    SensitiveDataMasker.maskApiKey(key));
        }
        String environment = isProductionKey(key) ? "production" : "test";
        return new KeyCheck(true, environment, null, SensitiveDataMasker.maskApiKey(key));
    }

    public static boolean isProductionKey(String key) {
        return key != null && key.startsWith("pk_live_");
    }

    public record KeyCheck(boolean valid, String environment, String error, String maskedKey) {}
}
