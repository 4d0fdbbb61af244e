package com.mm.chartdata.model;

import java.util.Locale;

/** Time bucket applied to a date-valued x axis. */
public enum Resolution {
    DAY, MONTH, YEAR;

    /** Returns null for absent or unknown values (no bucketing). */
    public static Resolution parse(String raw) {
        if (raw == null || raw.isBlank()) return null;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "day" -> DAY;
            case "month" -> MONTH;
            case "year" -> YEAR;
            default -> null;
        };
    }
}
