package com.example.usersapi.exception;

public class UserNotFoundException extends BusinessException {

    private final long userId;

    public UserNotFoundException(long userId) {
        super(UserErrorCode.USER_NOT_FOUND);
        this.userId = userId;
    }

    public long getUserId() {
        return userId;
    }
}
