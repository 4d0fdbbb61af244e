package com.mm.chartdata.jdbc;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class ConnectionNotFoundException extends ResponseStatusException {

    private final String connectionId;

    public ConnectionNotFoundException(String connectionId) {
        super(HttpStatus.NOT_FOUND, "Database connection '" + connectionId + "' not found");
        this.connectionId = connectionId;
    }

    public String getConnectionId() {
        return connectionId;
    }
}
