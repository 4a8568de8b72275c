package com.example.usersapi.model;

import java.util.List;

/**
 * One page of active users. total counts every active user, not just this page.
 */
public class UserListResponse {

    private final List<UserResponse> users;
    private final long total;
    private final int limit;
    private final int offset;

    public UserListResponse(List<UserResponse> users, long total, int limit, int offset) {
        this.users = List.copyOf(users);
        this.total = total;
        this.limit = limit;
        this.offset = offset;
    }

    public List<UserResponse> getUsers() { return users; }
    public long getTotal() { return total; }
    public int getLimit() { return limit; }
    public int getOffset() { return offset; }
}
