package com.example.threadcache.core;

/** Reads cached values as counters. */
final class IntegerValues {

    private IntegerValues() {
    }

    /**
     * {@code null} is zero, numbers are truncated, and text contributes its leading signed digits
     * (zero when there are none).
     */
    static long toLong(String key, Object value) {
        if (value == null) {
            return 0L;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof CharSequence) {
            return parseLeading((CharSequence) value);
        }
        throw new IllegalArgumentException(
            "Value of key '" + key + "' is not numeric: " + value.getClass().getName());
    }

    static long parseLeading(CharSequence text) {
        int i = 0;
        int n = text.length();
        while (i < n && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        boolean negative = false;
        if (i < n && (text.charAt(i) == '+' || text.charAt(i) == '-')) {
            negative = text.charAt(i) == '-';
            i++;
        }
        // accumulated negatively so Long.MIN_VALUE parses
        long result = 0L;
        while (i < n) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                break;
            }
            result = Math.subtractExact(Math.multiplyExact(result, 10L), c - '0');
            i++;
        }
        return negative ? result : Math.negateExact(result);
    }
}
