package com.mm.chartdata.jdbc;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/** Driver-side failure (timeout, connectivity, bad SQL) while running a compiled query. */
public class QueryExecutionException extends ResponseStatusException {

    public QueryExecutionException(String reason, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, reason, cause);
    }
}
