package com.cloudcrud.exception;

/**
 * Failure originating from the document store: connectivity, schema conflicts, constraint violations
 */
public class StoreException extends CloudFunctionException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.STORE;
    }

    @Override
    public StoreException withPrefix(String prefix) {
        return new StoreException(prefix + getMessage(), this);
    }
}
