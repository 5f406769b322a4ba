package com.keystone.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Error codes for the Keystone platform
 * Format: MODULE_SPECIFIC_ERROR
 */
public enum ErrorCode {

    // ===== AUTHENTICATION & AUTHORIZATION ERRORS (AUTH_XXX) =====
    AUTH_INVALID_CREDENTIALS("AUTH_001", "Incorrect email or password", HttpStatus.UNAUTHORIZED),
    AUTH_ACCOUNT_LOCKED("AUTH_002", "Account is locked", HttpStatus.FORBIDDEN),
    AUTH_TOO_MANY_SESSIONS("AUTH_003", "Too many active sessions", HttpStatus.FORBIDDEN),
    AUTH_TOKEN_NOT_FOUND("AUTH_004", "Not found", HttpStatus.NOT_FOUND),
    AUTH_TOKEN_INVALID("AUTH_005", "Token is expired or invalid", HttpStatus.UNAUTHORIZED),
    AUTH_UNAUTHORIZED("AUTH_006", "Please authenticate", HttpStatus.UNAUTHORIZED),
    AUTH_FORBIDDEN("AUTH_007",
            "Forbidden. You do not have the required rights to access this resource.", HttpStatus.FORBIDDEN),

    // ===== USER MANAGEMENT ERRORS (USER_XXX) =====
    USER_NOT_FOUND("USER_001", "User not found", HttpStatus.NOT_FOUND),
    USER_EMAIL_TAKEN("USER_002", "Email already taken. Please use a different email.", HttpStatus.BAD_REQUEST),

    // ===== ROLE & PERMISSION ERRORS (ROLE_XXX, PERM_XXX) =====
    ROLE_NOT_FOUND("ROLE_001", "Role not found", HttpStatus.NOT_FOUND),
    ROLE_ALREADY_EXISTS("ROLE_002", "Role already exists", HttpStatus.CONFLICT),
    ROLE_IN_USE("ROLE_003", "Role is still assigned to users", HttpStatus.CONFLICT),
    PERMISSION_NOT_FOUND("PERM_001", "Permission not found", HttpStatus.NOT_FOUND),
    PERMISSION_ALREADY_EXISTS("PERM_002", "Permission already exists", HttpStatus.CONFLICT),
    PERMISSION_INVALID_NAME("PERM_003",
            "Permission name must look like <resource>-<create|modify|get|update|delete>", HttpStatus.BAD_REQUEST),

    // ===== VALIDATION & SYSTEM ERRORS =====
    VAL_INVALID_INPUT("VAL_001", "Invalid input", HttpStatus.BAD_REQUEST),
    SYS_INTERNAL_ERROR("SYS_001", "An unexpected error occurred. Please try again later.",
            HttpStatus.INTERNAL_SERVER_ERROR);

    private final String code;
    private final String defaultMessage;
    private final HttpStatus status;

    ErrorCode(String code, String defaultMessage, HttpStatus status) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.status = status;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
