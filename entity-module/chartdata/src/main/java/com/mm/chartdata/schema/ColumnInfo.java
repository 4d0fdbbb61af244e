package com.mm.chartdata.schema;

public record ColumnInfo(String name, String type, boolean nullable) {}
