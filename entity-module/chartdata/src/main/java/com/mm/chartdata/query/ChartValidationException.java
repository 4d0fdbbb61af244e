package com.mm.chartdata.query;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * A chart config that cannot be compiled or run. Always a client error.
 */
public class ChartValidationException extends ResponseStatusException {

  public ChartValidationException(String reason) {
    super(HttpStatus.BAD_REQUEST, reason);
  }

  public static ChartValidationException noValidYAxis(List<String> rejected) {
    if (rejected == null || rejected.isEmpty()) {
      return new ChartValidationException("No valid Y-axis columns found");
    }
    return new ChartValidationException("No valid Y-axis columns found (rejected: " + String.join(", ", rejected) + ")");
  }

  public static ChartValidationException invalidXAxis(String xAxis) {
    return new ChartValidationException("X-axis column '" + xAxis + "' not found");
  }
}
