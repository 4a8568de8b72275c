/**
 * =============================================================================
 * API RESPONSE ENVELOPE
 * =============================================================================
 * Every endpoint answers with {status, message, data}. The HTTP status code is
 * set separately by the controller or the exception handler.
 *
 *   success - request handled (2xx)
 *   fail    - request rejected by validation (422)
 *   error   - domain error (404, 409) or unexpected server fault (500)
 * =============================================================================
 */
package com.example.usersapi.response;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.ALWAYS)
public class ApiResponse<T> {

    public static final String SUCCESS = "success";
    public static final String FAIL = "fail";
    public static final String ERROR = "error";

    private final String status;
    private final String message;
    private final T data;

    private ApiResponse(String status, String message, T data) {
        this.status = status;
        this.message = message;
        this.data = data;
    }

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(SUCCESS, "Success", data);
    }

    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(SUCCESS, message, data);
    }

    public static <T> ApiResponse<T> created(T data) {
        return new ApiResponse<>(SUCCESS, "Created", data);
    }

    public static <T> ApiResponse<T> fail(String message, T data) {
        return new ApiResponse<>(FAIL, message, data);
    }

    public static <T> ApiResponse<T> error(String message) {
        return new ApiResponse<>(ERROR, message, null);
    }

    public String getStatus() { return status; }
    public String getMessage() { return message; }
    public T getData() { return data; }
}
