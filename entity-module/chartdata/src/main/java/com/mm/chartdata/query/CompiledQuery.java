package com.mm.chartdata.query;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SQL text with named placeholders ({@code :name}) and the values bound to them, in the
 * order they appear in the text.
 */
public record CompiledQuery(String sql, List<QueryParameter> parameters) {

  public CompiledQuery {
    parameters = List.copyOf(parameters);
  }

  public Map<String, Object> parameterMap() {
    Map<String, Object> m = new LinkedHashMap<>();
    for (QueryParameter p : parameters) m.put(p.name(), p.value());
    return m;
  }

  public List<String> parameterNames() {
    return parameters.stream().map(QueryParameter::name).toList();
  }
}
