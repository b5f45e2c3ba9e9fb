package com.cloudcrud.exception;

/**
 * The referenced class or record does not exist
 */
public class NotFoundException extends CloudFunctionException {

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.NOT_FOUND;
    }

    @Override
    public NotFoundException withPrefix(String prefix) {
        return new NotFoundException(prefix + getMessage(), this);
    }
}
