/**
 * =============================================================================
 * GLOBAL EXCEPTION HANDLER
 * =============================================================================
 * Turns every failure into the {status, message, data} envelope:
 *
 * - BusinessException        -> status of its ErrorCode, "error"
 * - validation failures      -> 422, "fail", data = list of field violations
 * - DataAccessException      -> 500, "error", details only in the log
 * - anything else            -> 500, "error"
 * =============================================================================
 */
package com.example.usersapi.exception;

import com.example.usersapi.response.ApiResponse;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.ArrayList;
import java.util.List;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ApiResponse<Void>> handleBusinessException(BusinessException e) {
        ErrorCode errorCode = e.getErrorCode();
        logger.warn("Business exception: code={}, message={}", errorCode.getCode(), e.getMessage());
        return ResponseEntity.status(errorCode.getStatus())
            .body(ApiResponse.error(e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<List<FieldViolation>>> handleInvalidBody(MethodArgumentNotValidException e) {
        List<FieldViolation> violations = new ArrayList<>();
        for (FieldError error : e.getBindingResult().getFieldErrors()) {
            violations.add(new FieldViolation(error.getField(), error.getDefaultMessage()));
        }
        return validationFailure(violations);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ApiResponse<List<FieldViolation>>> handleInvalidParameters(HandlerMethodValidationException e) {
        List<FieldViolation> violations = new ArrayList<>();
        e.getAllValidationResults().forEach(result -> {
            String field = result.getMethodParameter().getParameterName();
            result.getResolvableErrors().forEach(error ->
                violations.add(new FieldViolation(field, error.getDefaultMessage())));
        });
        return validationFailure(violations);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<List<FieldViolation>>> handleConstraintViolation(ConstraintViolationException e) {
        List<FieldViolation> violations = new ArrayList<>();
        for (ConstraintViolation<?> violation : e.getConstraintViolations()) {
            violations.add(new FieldViolation(lastNode(violation.getPropertyPath().toString()), violation.getMessage()));
        }
        return validationFailure(violations);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<List<FieldViolation>>> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return validationFailure(List.of(new FieldViolation(e.getName(), "invalid value: " + e.getValue())));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiResponse<List<FieldViolation>>> handleMissingParameter(MissingServletRequestParameterException e) {
        return validationFailure(List.of(new FieldViolation(e.getParameterName(), "parameter is required")));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<List<FieldViolation>>> handleUnreadableBody(HttpMessageNotReadableException e) {
        logger.debug("Unreadable request body: {}", e.getMessage());
        return validationFailure(List.of(new FieldViolation("body", "request body is missing or malformed")));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNoResource(NoResourceFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(ApiResponse.error("Not found"));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponse<Void>> handleMethodNotSupported(HttpRequestMethodNotSupportedException e) {
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
            .body(ApiResponse.error("Method " + e.getMethod() + " is not allowed"));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiResponse<Void>> handleStoreFailure(DataAccessException e) {
        logger.error("Store failure: ", e);
        return internalError();
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleException(Exception e) {
        logger.error("Unexpected failure: ", e);
        return internalError();
    }

    private ResponseEntity<ApiResponse<List<FieldViolation>>> validationFailure(List<FieldViolation> violations) {
        logger.info("Request rejected by validation: {} violation(s)", violations.size());
        return ResponseEntity.status(UserErrorCode.INVALID_INPUT.getStatus())
            .body(ApiResponse.fail(UserErrorCode.INVALID_INPUT.getMessage(), violations));
    }

    private ResponseEntity<ApiResponse<Void>> internalError() {
        return ResponseEntity.status(UserErrorCode.INTERNAL_SERVER_ERROR.getStatus())
            .body(ApiResponse.error(UserErrorCode.INTERNAL_SERVER_ERROR.getMessage()));
    }

    // "listUsers.limit" -> "limit"
    private static String lastNode(String path) {
        int dot = path.lastIndexOf('.');
        return dot < 0 ? path : path.substring(dot + 1);
    }
}
