package com.cloudcrud.exception;

/**
 * Base class for every failure surfaced by a cloud function.
 * Callers only get the message text; the kind drives logging and the HTTP status.
 */
public abstract class CloudFunctionException extends RuntimeException {

    protected CloudFunctionException(String message) {
        super(message);
    }

    protected CloudFunctionException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind getKind();

    /**
     * Re-create this failure with an operation prefix in front of the original message,
     * keeping its kind and chaining it as the cause
     */
    public abstract CloudFunctionException withPrefix(String prefix);
}
