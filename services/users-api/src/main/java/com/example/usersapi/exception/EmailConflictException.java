package com.example.usersapi.exception;

/**
 * Raised when an email is already held by another user, either found by the
 * pre-check or rejected by the unique index on write.
 */
public class EmailConflictException extends BusinessException {

    private final String email;

    public EmailConflictException(String email) {
        super(UserErrorCode.EMAIL_ALREADY_EXISTS);
        this.email = email;
    }

    public EmailConflictException(String email, Throwable cause) {
        super(UserErrorCode.EMAIL_ALREADY_EXISTS, cause);
        this.email = email;
    }

    public String getEmail() {
        return email;
    }
}
