package com.tapas.qb.reporting.api;

public record ErrorResponse(
        int status,
        String error,
        String message
) {
}
