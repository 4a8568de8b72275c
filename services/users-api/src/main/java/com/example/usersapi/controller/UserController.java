/**
 * =============================================================================
 * USER CONTROLLER
 * =============================================================================
 * Handles HTTP requests for user operations.
 *
 * REST ENDPOINTS:
 * - POST   /users              - Create user
 * - GET    /users?limit&offset - List active users, newest first
 * - GET    /users/:id          - Get user by ID
 * - PUT    /users/:id          - Update name and email
 * - DELETE /users/:id          - Soft-delete user
 * =============================================================================
 */
package com.example.usersapi.controller;

import com.example.usersapi.model.User;
import com.example.usersapi.model.UserListResponse;
import com.example.usersapi.model.UserRequest;
import com.example.usersapi.model.UserResponse;
import com.example.usersapi.response.ApiResponse;
import com.example.usersapi.service.UserService;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;

@RestController
@RequestMapping("/users")
public class UserController {

    private final UserService userService;
    private final Counter usersCreatedCounter;
    private final Counter usersDeletedCounter;

    public UserController(UserService userService, MeterRegistry registry) {
        this.userService = userService;

        this.usersCreatedCounter = Counter.builder("users_created_total")
            .description("Total number of users created")
            .register(registry);

        this.usersDeletedCounter = Counter.builder("users_deleted_total")
            .description("Total number of users soft-deleted")
            .register(registry);
    }

    /**
     * POST /users
     *
     * @param request name and email of the new user
     * @return 201 with the created user
     */
    @PostMapping
    public ResponseEntity<ApiResponse<UserResponse>> createUser(@Valid @RequestBody UserRequest request) {
        User user = userService.createUser(request);
        usersCreatedCounter.increment();
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(ApiResponse.created(UserResponse.from(user)));
    }

    /**
     * GET /users?limit=10&offset=0
     *
     * @param limit page size, 1 to 100
     * @param offset number of active users to skip
     * @return one page of active users plus the total count
     */
    @GetMapping
    public ResponseEntity<ApiResponse<UserListResponse>> listUsers(
            @RequestParam(name = "limit", defaultValue = "10")
            @Min(value = 1, message = "limit must be at least 1")
            @Max(value = 100, message = "limit must be at most 100") int limit,
            @RequestParam(name = "offset", defaultValue = "0")
            @Min(value = 0, message = "offset must not be negative") int offset) {
        Page<User> page = userService.listUsers(limit, offset);
        List<UserResponse> users = page.getContent().stream()
            .map(UserResponse::from)
            .toList();
        return ResponseEntity.ok(ApiResponse.success(
            new UserListResponse(users, page.getTotalElements(), limit, offset)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<UserResponse>> getUser(@PathVariable("id") long id) {
        return ResponseEntity.ok(ApiResponse.success(UserResponse.from(userService.getUser(id))));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<UserResponse>> updateUser(
            @PathVariable("id") long id,
            @Valid @RequestBody UserRequest request) {
        User user = userService.updateUser(id, request);
        return ResponseEntity.ok(ApiResponse.success(UserResponse.from(user)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> deleteUser(@PathVariable("id") long id) {
        userService.deleteUser(id);
        usersDeletedCounter.increment();
        return ResponseEntity.ok(ApiResponse.success("Deleted user successfully", null));
    }
}
