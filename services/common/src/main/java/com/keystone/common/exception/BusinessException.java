package com.keystone.common.exception;

import org.springframework.http.HttpStatus;

import java.util.UUID;

/**
 * Base exception for all business-related failures.
 *
 * FEATURES:
 * - Typed error codes via the ErrorCode enum, so callers can switch on the failure kind
 * - HTTP status taken from the error code
 * - Unique error IDs for correlating a response with the server log
 *
 * USAGE PATTERNS:
 * 1. Simple construction: new BusinessException(ErrorCode.XXX, "message")
 * 2. With cause: new BusinessException(ErrorCode.XXX, "message", cause)
 */
public class BusinessException extends RuntimeException {

    private final String errorId;
    private final ErrorCode errorCode;

    /**
     * Create business exception with the error code's default message
     */
    public BusinessException(ErrorCode errorCode) {
        this(errorCode, null, null);
    }

    /**
     * PRIMARY CONSTRUCTOR: Create business exception with ErrorCode enum
     */
    public BusinessException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    /**
     * Create business exception with ErrorCode enum and cause
     * Use when wrapping lower-level exceptions with business context
     */
    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        super(resolveMessage(errorCode, message), cause);
        this.errorId = UUID.randomUUID().toString();
        this.errorCode = errorCode != null ? errorCode : ErrorCode.SYS_INTERNAL_ERROR;
    }

    public String getErrorId() {
        return errorId;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public HttpStatus getStatus() {
        return errorCode.getStatus();
    }

    private static String resolveMessage(ErrorCode errorCode, String message) {
        if (message != null) {
            return message;
        }
        return errorCode != null ? errorCode.getDefaultMessage() : "Business error occurred";
    }

    @Override
    public String toString() {
        return String.format("BusinessException[errorId=%s, errorCode=%s, message=%s]",
            errorId, errorCode.getCode(), getMessage());
    }
}
