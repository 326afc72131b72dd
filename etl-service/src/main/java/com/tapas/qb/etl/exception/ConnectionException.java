package com.tapas.qb.etl.exception;

/**
 * The source or target database could not be reached.
 */
public class ConnectionException extends EtlException {

    private final String endpoint;

    public ConnectionException(String endpoint, Throwable cause) {
        super("Could not connect to " + endpoint + " database: " + cause.getMessage(), cause);
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
