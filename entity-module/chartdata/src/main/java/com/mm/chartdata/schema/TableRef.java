package com.mm.chartdata.schema;

/** A table as the catalog knows it. {@code schema} may be null for engines without schemas. */
public record TableRef(String schema, String name) {}
