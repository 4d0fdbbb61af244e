package com.mm.chartdata.schema;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/** Catalog metadata could not be read for the requested table. */
public class SchemaLookupException extends ResponseStatusException {

  public SchemaLookupException(String reason) {
    super(HttpStatus.NOT_FOUND, reason);
  }

  public SchemaLookupException(String reason, Throwable cause) {
    super(HttpStatus.NOT_FOUND, reason, cause);
  }
}
