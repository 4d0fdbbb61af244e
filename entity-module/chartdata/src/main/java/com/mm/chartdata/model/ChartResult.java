package com.mm.chartdata.model;

import java.util.List;
import java.util.Map;

/** Result rows of one chart plus the names of chart config fields that were dropped on the way. */
public final class ChartResult {
    private final List<Map<String, Object>> rows;
    private final List<String> warnings;

    public ChartResult(List<Map<String, Object>> rows, List<String> warnings) {
        this.rows = rows == null ? List.of() : rows;
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public List<Map<String, Object>> getRows() { return rows; }
    public List<String> getWarnings() { return warnings; }
}
