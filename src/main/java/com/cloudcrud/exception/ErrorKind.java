package com.cloudcrud.exception;

/**
 * Failure categories reported by cloud functions
 */
public enum ErrorKind {
    VALIDATION(142, 400),
    NOT_FOUND(101, 404),
    STORE(1, 500);

    private final int code;
    private final int httpStatus;

    ErrorKind(int code, int httpStatus) {
        this.code = code;
        this.httpStatus = httpStatus;
    }

    public int getCode() {
        return code;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
