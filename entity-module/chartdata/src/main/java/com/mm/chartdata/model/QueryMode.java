package com.mm.chartdata.model;

import com.mm.chartdata.query.ChartValidationException;

import java.util.Locale;

public enum QueryMode {
    SIMPLE, CUSTOM, IMPORT;

    /**
     * Explicit {@code queryMode} wins; without one a non-blank custom query selects CUSTOM.
     */
    public static QueryMode resolve(ChartDataSource spec) {
        String raw = spec.getQueryMode();
        if (raw == null || raw.isBlank()) {
            return spec.getCustomQuery() != null && !spec.getCustomQuery().isBlank() ? CUSTOM : SIMPLE;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "simple" -> SIMPLE;
            case "custom" -> CUSTOM;
            case "import" -> IMPORT;
            default -> throw new ChartValidationException("Unsupported queryMode: " + raw);
        };
    }
}
