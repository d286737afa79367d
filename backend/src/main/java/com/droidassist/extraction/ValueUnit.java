package com.droidassist.extraction;

import lombok.Getter;

import java.util.Locale;
import java.util.Optional;

/**
 * Unit attached to a candidate. Data units normalize to megabytes (binary multiples).
 */
@Getter
public enum ValueUnit {
    CURRENCY(ValueKind.CURRENCY, "元", 1),
    DATA_MB(ValueKind.DATA, "MB", 1),
    DATA_GB(ValueKind.DATA, "GB", 1024),
    DATA_TB(ValueKind.DATA, "TB", 1024 * 1024);

    private final ValueKind kind;
    private final String symbol;
    private final double baseFactor;

    ValueUnit(ValueKind kind, String symbol, double baseFactor) {
        this.kind = kind;
        this.symbol = symbol;
        this.baseFactor = baseFactor;
    }

    /**
     * Value in the kind's base unit: yuan for currency, megabytes for data.
     */
    public double toBase(double value) {
        return value * baseFactor;
    }

    public double toGigabytes(double value) {
        if (kind != ValueKind.DATA) {
            throw new IllegalStateException(this + " is not a data unit");
        }
        return toBase(value) / DATA_GB.baseFactor;
    }

    /**
     * Maps a unit token as it appears on screen ("¥", "元", "GB", "g", "M"...) to a unit.
     */
    public static Optional<ValueUnit> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        return switch (token.strip().toUpperCase(Locale.ROOT)) {
            case "¥", "元" -> Optional.of(CURRENCY);
            case "MB", "M" -> Optional.of(DATA_MB);
            case "GB", "G" -> Optional.of(DATA_GB);
            case "TB", "T" -> Optional.of(DATA_TB);
            default -> Optional.empty();
        };
    }
}
