package com.mm.chartdata.model;

import java.util.Locale;

public enum FilterOperator {
    EQ("="),
    NE("!="),
    GT(">"),
    LT("<"),
    GE(">="),
    LE("<="),
    LIKE("LIKE"),
    IN("IN");

    private final String symbol;

    FilterOperator(String symbol) {
        this.symbol = symbol;
    }

    /** SQL text of the operator; always one of the fixed symbols above. */
    public String symbol() {
        return symbol;
    }

    /** Case-insensitive lookup by symbol; null when the operator is not supported. */
    public static FilterOperator fromSymbol(String raw) {
        if (raw == null) return null;
        String s = raw.trim().toUpperCase(Locale.ROOT);
        for (FilterOperator op : values()) {
            if (op.symbol.equals(s)) return op;
        }
        return null;
    }
}
