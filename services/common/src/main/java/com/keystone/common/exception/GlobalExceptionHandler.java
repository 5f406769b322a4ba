package com.keystone.common.exception;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Global exception handler shared by all services.
 *
 * Every failure leaves as an {@link ErrorResponse} carrying the status code and a
 * human readable message. Stack traces stay in the server log.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusinessException(BusinessException ex, WebRequest request) {
        if (ex.getStatus().is5xxServerError()) {
            log.error("Business exception [{}] {}", ex.getErrorId(), ex.getErrorCode().getCode(), ex);
        } else {
            log.warn("Business exception [{}] {}: {}", ex.getErrorId(), ex.getErrorCode().getCode(), ex.getMessage());
        }
        return buildErrorResponse(ex.getErrorCode(), ex.getMessage(), request, ex.getErrorId());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(
            MethodArgumentNotValidException ex, WebRequest request) {
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(error -> errors.merge(
                error.getField(),
                error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing + ", " + replacement));
        log.warn("Validation failed: {}", errors);

        ErrorResponse response = ErrorResponse.of(ErrorCode.VAL_INVALID_INPUT,
                "Invalid input. Please check the submitted fields.", path(request), UUID.randomUUID().toString());
        response.setValidationErrors(errors);
        return new ResponseEntity<>(response, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex, WebRequest request) {
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getConstraintViolations().forEach(violation ->
                errors.put(violation.getPropertyPath().toString(), violation.getMessage()));
        log.warn("Constraint violation: {}", errors);

        ErrorResponse response = ErrorResponse.of(ErrorCode.VAL_INVALID_INPUT,
                "Invalid input. Please check the submitted fields.", path(request), UUID.randomUUID().toString());
        response.setValidationErrors(errors);
        return new ResponseEntity<>(response, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleBadParameter(Exception ex, WebRequest request) {
        log.warn("Bad request parameter: {}", ex.getMessage());
        return buildErrorResponse(ErrorCode.VAL_INVALID_INPUT, ex.getMessage(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableMessage(HttpMessageNotReadableException ex,
                                                                 WebRequest request) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return buildErrorResponse(ErrorCode.VAL_INVALID_INPUT, "Malformed request body", request);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(AccessDeniedException ex, WebRequest request) {
        log.warn("Access denied: {}", path(request));
        return buildErrorResponse(ErrorCode.AUTH_FORBIDDEN, null, request);
    }

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<ErrorResponse> handleAuthenticationException(AuthenticationException ex,
                                                                       WebRequest request) {
        log.warn("Authentication failed: {}", ex.getMessage());
        return buildErrorResponse(ErrorCode.AUTH_UNAUTHORIZED, null, request);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex,
                                                                  WebRequest request) {
        ErrorResponse response = ErrorResponse.of(ErrorCode.VAL_INVALID_INPUT,
                "HTTP method " + ex.getMethod() + " is not supported for this endpoint",
                path(request), UUID.randomUUID().toString());
        response.setStatus(HttpStatus.METHOD_NOT_ALLOWED.value());
        response.setError(HttpStatus.METHOD_NOT_ALLOWED.getReasonPhrase());
        return new ResponseEntity<>(response, HttpStatus.METHOD_NOT_ALLOWED);
    }

    @ExceptionHandler({DataIntegrityViolationException.class, OptimisticLockingFailureException.class})
    public ResponseEntity<ErrorResponse> handleConflict(Exception ex, WebRequest request) {
        log.warn("Data conflict: {}", ex.getMessage());
        ErrorResponse response = ErrorResponse.of(ErrorCode.VAL_INVALID_INPUT,
                "The request conflicts with the current state of the resource",
                path(request), UUID.randomUUID().toString());
        response.setStatus(HttpStatus.CONFLICT.value());
        response.setError(HttpStatus.CONFLICT.getReasonPhrase());
        return new ResponseEntity<>(response, HttpStatus.CONFLICT);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, WebRequest request) {
        String errorId = UUID.randomUUID().toString();
        log.error("Unexpected error [{}]", errorId, ex);
        return buildErrorResponse(ErrorCode.SYS_INTERNAL_ERROR, null, request, errorId);
    }

    protected ResponseEntity<ErrorResponse> buildErrorResponse(ErrorCode errorCode, String message,
                                                               WebRequest request, String errorId) {
        ErrorResponse response = ErrorResponse.of(errorCode, message, path(request), errorId);
        return new ResponseEntity<>(response, errorCode.getStatus());
    }

    protected ResponseEntity<ErrorResponse> buildErrorResponse(ErrorCode errorCode, String message,
                                                               WebRequest request) {
        return buildErrorResponse(errorCode, message, request, UUID.randomUUID().toString());
    }

    private static String path(WebRequest request) {
        String description = request.getDescription(false);
        return description.startsWith("uri=") ? description.substring(4) : description;
    }
}
