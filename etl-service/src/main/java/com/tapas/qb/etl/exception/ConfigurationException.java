package com.tapas.qb.etl.exception;

/**
 * Missing or malformed settings. Raised before any connection is attempted.
 */
public class ConfigurationException extends EtlException {

    public ConfigurationException(String message) {
        super(message);
    }
}
