package com.mm.chartdata.model;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one widget in a batch: either rows or an error message, never both.
 */
public final class BatchResult {
    private final String widgetId;
    private final List<Map<String, Object>> rows;
    private final String error;
    private final List<String> warnings;

    private BatchResult(String widgetId, List<Map<String, Object>> rows, String error, List<String> warnings) {
        this.widgetId = widgetId;
        this.rows = rows;
        this.error = error;
        this.warnings = warnings;
    }

    public static BatchResult success(String widgetId, ChartResult result) {
        return new BatchResult(widgetId, result.getRows(), null, result.getWarnings());
    }

    public static BatchResult failure(String widgetId, String error) {
        return new BatchResult(widgetId, List.of(), error, List.of());
    }

    public String getWidgetId() { return widgetId; }
    public List<Map<String, Object>> getRows() { return rows; }
    public String getError() { return error; }
    public List<String> getWarnings() { return warnings; }

    public boolean isFailed() { return error != null; }
}
