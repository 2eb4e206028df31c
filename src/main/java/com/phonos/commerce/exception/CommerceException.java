package com.phonos.commerce.exception;

/**
 * Base type for failures that map onto an {@link ErrorCode} and an HTTP status.
 */
public class CommerceException extends RuntimeException {

    private final ErrorCode errorCode;

    public CommerceException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public CommerceException(ErrorCode errorCode, String detail) {
        super(detail);
        this.errorCode = errorCode;
    }

    public CommerceException(ErrorCode errorCode, String detail, Throwable cause) {
        super(detail, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
