package com.cloudcrud.exception;

/**
 * A required parameter is missing or has the wrong shape; raised before any store access
 */
public class ValidationException extends CloudFunctionException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.VALIDATION;
    }

    @Override
    public ValidationException withPrefix(String prefix) {
        return new ValidationException(prefix + getMessage(), this);
    }
}
