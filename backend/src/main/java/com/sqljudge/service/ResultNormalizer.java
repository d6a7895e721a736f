package com.sqljudge.service;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonicalizes values so that equal results compare equal whatever their encoding.
 * <ul>
 *   <li>dates, times and timestamps become ISO-8601 strings</li>
 *   <li>decimals and floating values become a {@code Long} when integral, otherwise a
 *       {@code Double} rounded to {@value #SCALE} places</li>
 *   <li>integers of any width become a {@code Long} ({@code BigInteger} beyond that range)</li>
 *   <li>text, booleans and nulls are left as they are</li>
 * </ul>
 * Normalizing an already normalized row returns an equal row.
 */
@Component
public class ResultNormalizer {

    static final int SCALE = 6;

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    public List<Map<String, Object>> normalize(List<Map<String, Object>> rows) {
        if (rows == null || rows.isEmpty()) return new ArrayList<>();

        List<Map<String, Object>> normalized = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            normalized.add(normalizeRow(row));
        }
        return normalized;
    }

    public Map<String, Object> normalizeRow(Map<String, Object> row) {
        Map<String, Object> normalizedRow = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : row.entrySet()) {
            normalizedRow.put(entry.getKey(), normalizeValue(entry.getValue()));
        }
        return normalizedRow;
    }

    public Object normalizeValue(Object value) {
        if (value == null) return null;

        // java.sql types first: they extend java.util.Date and would lose precision otherwise
        if (value instanceof java.sql.Timestamp ts) return formatDateTime(ts.toLocalDateTime());
        if (value instanceof java.sql.Date d) return d.toLocalDate().toString();
        if (value instanceof java.sql.Time t) return formatTime(t.toLocalTime());
        if (value instanceof LocalDate d) return d.toString();
        if (value instanceof LocalDateTime dt) return formatDateTime(dt);
        if (value instanceof LocalTime t) return formatTime(t);
        if (value instanceof OffsetDateTime odt) return formatDateTime(odt.toLocalDateTime()) + formatOffset(odt.getOffset());
        if (value instanceof ZonedDateTime zdt) return normalizeValue(zdt.toOffsetDateTime());
        if (value instanceof Instant i) return normalizeValue(i.atOffset(ZoneOffset.UTC));
        if (value instanceof OffsetTime ot) return formatTime(ot.toLocalTime()) + formatOffset(ot.getOffset());

        if (value instanceof BigDecimal bd) return normalizeFloating(bd.doubleValue());
        if (value instanceof Double || value instanceof Float) return normalizeFloating(((Number) value).doubleValue());

        if (value instanceof Long) return value;
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger bi) return narrow(bi);

        return value;
    }

    private Object normalizeFloating(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) return value;

        double rounded = BigDecimal.valueOf(value).setScale(SCALE, RoundingMode.HALF_EVEN).doubleValue();
        if (rounded == Math.rint(rounded)) {
            return narrow(new BigDecimal(rounded).toBigInteger());
        }
        return rounded;
    }

    private Object narrow(BigInteger value) {
        if (value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0) {
            return value.longValue();
        }
        return value;
    }

    private String formatDateTime(LocalDateTime dt) {
        return dt.toLocalDate() + "T" + formatTime(dt.toLocalTime());
    }

    private String formatTime(LocalTime t) {
        String base = String.format("%02d:%02d:%02d", t.getHour(), t.getMinute(), t.getSecond());
        int micros = t.getNano() / 1_000;
        return micros == 0 ? base : base + String.format(".%06d", micros);
    }

    private String formatOffset(ZoneOffset offset) {
        return offset.getTotalSeconds() == 0 ? "+00:00" : offset.getId();
    }
}
