/**
 * =============================================================================
 * USERS API - Main Application (Java + Spring Boot)
 * =============================================================================
 * Entry point for the Users API.
 *
 * WHAT THIS SERVICE DOES:
 * - Create, fetch, list, update and soft-delete users
 * - Enforces email uniqueness among active users
 * - Wraps every response in a {status, message, data} envelope
 * - Exposes Prometheus metrics through Spring Boot Actuator
 * =============================================================================
 */
package com.example.usersapi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Users API.
 */
@SpringBootApplication
public class UsersApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(UsersApiApplication.class, args);
    }
}
