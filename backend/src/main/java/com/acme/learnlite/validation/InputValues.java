package com.acme.learnlite.validation;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Coercions for values bound from an untyped JSON body or query string.
 */
public final class InputValues {
    private static final Pattern INTEGER = Pattern.compile("^[+-]?\\d+$");
    private static final Pattern LEADING_INTEGER = Pattern.compile("^\\s*([+-]?\\d+)");

    private InputValues() {}

    public static boolean isString(Object value) {
        return value instanceof String;
    }

    public static boolean isBlank(Object value) {
        return !(value instanceof String s) || s.trim().isEmpty();
    }

    /**
     * Integral value of a number or integer string; {@code null} for fractions and anything else.
     */
    public static Long toLong(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger bi) {
            return bi.bitLength() < 64 ? bi.longValue() : null;
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            BigDecimal decimal = toDecimal(value);
            if (decimal == null) return null;
            try {
                return decimal.longValueExact();
            } catch (ArithmeticException e) {
                return null;
            }
        }
        if (value instanceof String s && INTEGER.matcher(s.trim()).matches()) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public static Long toPositiveLong(Object value) {
        Long parsed = toLong(value);
        return parsed != null && parsed > 0 ? parsed : null;
    }

    /**
     * Lenient integer read used for query parameters: numbers are truncated and
     * strings contribute their leading digits ({@code "3abc"} reads as 3).
     */
    public static Integer toInt(Object value) {
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) return null;
            return clamp((long) d);
        }
        if (value instanceof String s) {
            Matcher m = LEADING_INTEGER.matcher(s);
            if (!m.find()) return null;
            String digits = m.group(1);
            try {
                return clamp(Long.parseLong(digits));
            } catch (NumberFormatException e) {
                return digits.startsWith("-") ? Integer.MIN_VALUE : Integer.MAX_VALUE;
            }
        }
        return null;
    }

    public static String trimmed(Object value) {
        return value instanceof String s ? s.trim() : null;
    }

    /**
     * Trimmed string, or {@code null} for null and whitespace-only input.
     */
    public static String trimmedOrNull(Object value) {
        String s = trimmed(value);
        return s == null || s.isEmpty() ? null : s;
    }

    static BigDecimal toDecimal(Object value) {
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) return null;
            return new BigDecimal(value.toString());
        }
        if (value instanceof BigDecimal bd) return bd;
        if (value instanceof BigInteger bi) return new BigDecimal(bi);
        if (value instanceof Number n) return BigDecimal.valueOf(n.longValue());
        if (value instanceof String s) {
            String text = s.trim();
            if (text.isEmpty()) return null;
            try {
                return new BigDecimal(text);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static int clamp(long value) {
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, value));
    }
}
