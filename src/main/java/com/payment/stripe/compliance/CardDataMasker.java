package com.payment.stripe.compliance;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Redacts secrets and card fields so they are safe to include in logs.
 * Never log an API key, a card number or a CVC in plain text; route them through these masks.
 */
public final class CardDataMasker {

    private static final String MASKED = "****";
    private static final int KEY_PREFIX_LENGTH = 8;

    private CardDataMasker() {}

    /** Keeps the mode prefix only (e.g. "sk_test_abc123" -> "sk_test_****"). */
    public static String maskApiKey(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) return null;
        int cut = apiKey.lastIndexOf('_');
        if (cut > 0 && cut < KEY_PREFIX_LENGTH) {
            return apiKey.substring(0, cut + 1) + MASKED;
        }
        return MASKED;
    }

    /** Returns a safe-to-log card number, keeping only the last four digits. */
    public static String maskCardNumber(String number) {
        if (number == null || number.isBlank()) return null;
        String digits = number.replaceAll("\\s", "");
        if (digits.length() <= 4) return MASKED;
        return MASKED + digits.substring(digits.length() - 4);
    }

    /** Returns a safe-to-log value for a CVC. */
    public static String maskCvc(String cvc) {
        if (cvc == null || cvc.isBlank()) return null;
        return "***";
    }

    /** Copy of {@code params} with card number and CVC fields (top level or bracketed) masked. */
    public static Map<String, String> maskFormParams(Map<String, String> params) {
        Map<String, String> masked = new LinkedHashMap<>();
        params.forEach((key, value) -> {
            if (value == null || value.isBlank()) {
                masked.put(key, value);
            } else if (isField(key, "number")) {
                masked.put(key, maskCardNumber(value));
            } else if (isField(key, "cvc")) {
                masked.put(key, maskCvc(value));
            } else {
                masked.put(key, value);
            }
        });
        return masked;
    }

    private static boolean isField(String key, String name) {
        return key.equals(name) || key.endsWith("[" + name + "]");
    }
}
