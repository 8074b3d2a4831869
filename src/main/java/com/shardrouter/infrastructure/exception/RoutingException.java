package com.shardrouter.infrastructure.exception;

/**
 * Base type for routing failures. Carries a stable error code for logs, metrics and API responses.
 */
public abstract class RoutingException extends RuntimeException {

    private final String errorCode;

    protected RoutingException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
