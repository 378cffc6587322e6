package com.factory.palletizer.exception;

/**
 * Base class for every rejected packing operation. Thrown before any write is
 * made visible, so the enclosing transaction always rolls back cleanly.
 */
public abstract class PackingException extends RuntimeException {

    private final String errorCode;

    protected PackingException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
