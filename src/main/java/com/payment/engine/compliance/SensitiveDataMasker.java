package com.payment.engine.compliance;

/**
 * Redacts secrets and payment credentials so they are safe to include in logs and metadata.
 */
public final class SensitiveDataMasker {

    private static final int TOKEN_PREFIX_LENGTH = 10;
    private static final int KEY_PREFIX_LENGTH = 15;

    private SensitiveDataMasker() {}

    /** Keeps the first 10 characters of a gateway token, e.g. "token_abcd..." */
    public static String maskToken(String token) {
        if (token == null || token.isBlank()) return null;
        if (token.length() <= TOKEN_PREFIX_LENGTH) return "***";
        return token.substring(0, TOKEN_PREFIX_LENGTH) + "...";
    }

    /** Keeps the key prefix (environment marker) only. */
    public static String maskApiKey(String key) {
        if (key == null || key.isBlank()) return null;
        if (key.length() <= KEY_PREFIX_LENGTH) return "***";
        return key.substring(0, KEY_PREFIX_LENGTH) + "...";
    }
}
