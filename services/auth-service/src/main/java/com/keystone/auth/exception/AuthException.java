package com.keystone.auth.exception;

import com.keystone.common.exception.BusinessException;
import com.keystone.common.exception.ErrorCode;

/**
 * Failure raised by the authentication core.
 *
 * The factories name each failure kind; {@link #getErrorCode()} carries the
 * kind for callers that need to tell them apart.
 */
public class AuthException extends BusinessException {

    public AuthException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public AuthException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public static AuthException invalidCredentials(String message) {
        return new AuthException(ErrorCode.AUTH_INVALID_CREDENTIALS, message);
    }

    public static AuthException accountLocked(String message) {
        return new AuthException(ErrorCode.AUTH_ACCOUNT_LOCKED, message);
    }

    public static AuthException tooManySessions(String message) {
        return new AuthException(ErrorCode.AUTH_TOO_MANY_SESSIONS, message);
    }

    public static AuthException tokenNotFound() {
        return new AuthException(ErrorCode.AUTH_TOKEN_NOT_FOUND, null);
    }

    public static AuthException tokenInvalid(String message, Throwable cause) {
        return new AuthException(ErrorCode.AUTH_TOKEN_INVALID, message, cause);
    }

    public static AuthException userNotFound(String message) {
        return new AuthException(ErrorCode.USER_NOT_FOUND, message);
    }

    public static AuthException emailAlreadyTaken() {
        return new AuthException(ErrorCode.USER_EMAIL_TAKEN, null);
    }

    public static AuthException emailAlreadyTaken(Throwable cause) {
        return new AuthException(ErrorCode.USER_EMAIL_TAKEN, null, cause);
    }

    public static AuthException unauthorized() {
        return new AuthException(ErrorCode.AUTH_UNAUTHORIZED, null);
    }

    public static AuthException forbidden() {
        return new AuthException(ErrorCode.AUTH_FORBIDDEN, null);
    }
}
