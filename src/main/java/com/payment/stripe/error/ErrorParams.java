package com.payment.stripe.error;

/**
 * Maps the wire name in an error's {@code param} to the field name used by the input types,
 * e.g. {@code exp_month -> expMonth}, {@code legal_entity[first_name] -> legalEntity[firstName]}.
 */
public final class ErrorParams {

    private ErrorParams() {}

    public static String toFieldName(String param) {
        if (param == null) return null;
        StringBuilder out = new StringBuilder(param.length());
        boolean upper = false;
        for (int i = 0; i < param.length(); i++) {
            char c = param.charAt(i);
            if (c == '_' && out.length() > 0 && out.charAt(out.length() - 1) != '[') {
                upper = true;
                continue;
            }
            out.append(upper ? Character.toUpperCase(c) : c);
            upper = false;
        }
        return out.toString();
    }
}
