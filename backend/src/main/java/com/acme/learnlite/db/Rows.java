package com.acme.learnlite.db;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;

/**
 * Column readers for rows returned by {@link SqlClient}. Drivers hand back
 * counts as Long, averages as BigDecimal and timestamps as java.sql.Timestamp;
 * these helpers flatten those differences.
 */
public final class Rows {
    private Rows() {}

    public static Long getLong(Map<String, Object> row, String column) {
        return toLong(row.get(column));
    }

    public static long getLongOrZero(Map<String, Object> row, String column) {
        Long value = getLong(row, column);
        return value == null ? 0L : value;
    }

    public static Integer getInt(Map<String, Object> row, String column) {
        Long value = getLong(row, column);
        return value == null ? null : value.intValue();
    }

    public static String getString(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value == null ? null : value.toString();
    }

    public static boolean getBoolean(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value instanceof Boolean b) return b;
        if (value instanceof String s) return Boolean.parseBoolean(s) || "t".equalsIgnoreCase(s);
        return false;
    }

    public static Instant getInstant(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value == null) return null;
        if (value instanceof Instant i) return i;
        if (value instanceof Timestamp ts) return ts.toInstant();
        if (value instanceof OffsetDateTime odt) return odt.toInstant();
        if (value instanceof LocalDateTime ldt) return ldt.toInstant(ZoneOffset.UTC);
        if (value instanceof java.util.Date d) return d.toInstant();
        return Instant.parse(value.toString());
    }

    public static long roundedOrZero(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value == null) return 0L;
        try {
            return new BigDecimal(value.toString()).setScale(0, RoundingMode.HALF_UP).longValue();
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    private static Long toLong(Object value) {
        if (value == null) return null;
        if (value instanceof Number n) return n.longValue();
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
