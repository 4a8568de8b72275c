package com.example.usersapi.exception;

import org.springframework.http.HttpStatus;

public enum UserErrorCode implements ErrorCode {
    // === Client Errors (4xx) ===
    USER_NOT_FOUND("U001", "User is not found", HttpStatus.NOT_FOUND),
    EMAIL_ALREADY_EXISTS("U002", "Email already exists", HttpStatus.CONFLICT),
    INVALID_INPUT("U003", "Validation failed", HttpStatus.UNPROCESSABLE_ENTITY),

    // === Server Errors (5xx) ===
    INTERNAL_SERVER_ERROR("S001", "Internal server error", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String code;
    private final String message;
    private final HttpStatus status;

    UserErrorCode(String code, String message, HttpStatus status) {
        this.code = code;
        this.message = message;
        this.status = status;
    }

    @Override
    public String getCode() { return code; }

    @Override
    public String getMessage() { return message; }

    @Override
    public HttpStatus getStatus() { return status; }
}
