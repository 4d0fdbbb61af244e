package com.mm.chartdata.model;

import java.util.Locale;

public enum Aggregation {
    SUM, AVG, COUNT, MIN, MAX;

    /** Case-insensitive; anything unrecognised falls back to SUM. */
    public static Aggregation parse(String raw) {
        if (raw == null || raw.isBlank()) return SUM;
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return SUM;
        }
    }
}
