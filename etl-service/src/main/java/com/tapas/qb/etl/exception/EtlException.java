package com.tapas.qb.etl.exception;

/**
 * Base type for failures raised by the warehouse load.
 */
public class EtlException extends RuntimeException {

    public EtlException(String message) {
        super(message);
    }

    public EtlException(String message, Throwable cause) {
        super(message, cause);
    }
}
