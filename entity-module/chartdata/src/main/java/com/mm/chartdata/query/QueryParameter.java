package com.mm.chartdata.query;

public record QueryParameter(String name, Object value) {}
