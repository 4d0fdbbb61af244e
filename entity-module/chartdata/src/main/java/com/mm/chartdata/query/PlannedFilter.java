package com.mm.chartdata.query;

import com.mm.chartdata.model.FilterOperator;
import com.mm.chartdata.security.SqlIdentifier;

import java.util.List;

/**
 * A filter that survived planning. {@code values} holds one element for scalar operators
 * and one element per list entry for {@code IN}.
 */
public record PlannedFilter(SqlIdentifier field, FilterOperator operator, List<Object> values) {

  public Object value() {
    return values.isEmpty() ? null : values.get(0);
  }
}
