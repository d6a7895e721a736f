package com.sqljudge.model.enums;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Optional;

public enum ColumnType {
    INTEGER(BigInteger.valueOf(Integer.MIN_VALUE), BigInteger.valueOf(Integer.MAX_VALUE)),
    BIGINT(BigInteger.valueOf(Long.MIN_VALUE), BigInteger.valueOf(Long.MAX_VALUE)),
    UBIGINT(BigInteger.ZERO, BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE)),
    TEXT(null, null),
    REAL(null, null),
    DATE(null, null);

    private final BigInteger min;
    private final BigInteger max;

    ColumnType(BigInteger min, BigInteger max) {
        this.min = min;
        this.max = max;
    }

    public boolean isInteger() {
        return min != null;
    }

    /** True when {@code value} fits this integer type. Non-integer types accept everything. */
    public boolean accepts(BigInteger value) {
        if (!isInteger()) return true;
        return value.compareTo(min) >= 0 && value.compareTo(max) <= 0;
    }

    /** Resolves a declared type name, ignoring case and any precision suffix. */
    public static Optional<ColumnType> fromDeclared(String declared) {
        if (declared == null || declared.isBlank()) return Optional.empty();
        String base = declared.trim().toUpperCase(Locale.ROOT);
        int paren = base.indexOf('(');
        if (paren > 0) base = base.substring(0, paren).trim();
        try {
            return Optional.of(ColumnType.valueOf(base));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
