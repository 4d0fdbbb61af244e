package com.mm.chartdata.model;

public enum SortDirection {
    ASC, DESC;

    public static SortDirection parse(String raw) {
        return "desc".equalsIgnoreCase(raw == null ? null : raw.trim()) ? DESC : ASC;
    }
}
