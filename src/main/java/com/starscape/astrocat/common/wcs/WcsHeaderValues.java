package com.starscape.astrocat.common.wcs;

import java.util.Map;

final class WcsHeaderValues {

    private WcsHeaderValues() {
    }

    static boolean has(Map<String, Object> header, String key) {
        return header.get(key) != null;
    }

    static double requireNumber(Map<String, Object> header, String key) {
        Object value = header.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Missing WCS card " + key);
        }
        double number = toDouble(key, value);
        if (!Double.isFinite(number)) {
            throw new IllegalArgumentException("Non-finite WCS card " + key);
        }
        return number;
    }

    static double optionalNumber(Map<String, Object> header, String key, double fallback) {
        Object value = header.get(key);
        return value == null ? fallback : toDouble(key, value);
    }

    private static double toDouble(String key, Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            // FITS allows a D exponent
            return Double.parseDouble(value.toString().trim().replace('D', 'E'));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("WCS card " + key + " is not numeric: " + value, e);
        }
    }
}
