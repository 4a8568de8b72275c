/**
 * =============================================================================
 * USER SERVICE
 * =============================================================================
 * Business rules for user operations:
 * - only active users can be read, updated or deleted
 * - an email belongs to at most one user
 * =============================================================================
 */
package com.example.usersapi.service;

import com.example.usersapi.exception.EmailConflictException;
import com.example.usersapi.exception.UserNotFoundException;
import com.example.usersapi.model.User;
import com.example.usersapi.model.UserRequest;
import com.example.usersapi.repository.UserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

@Service
public class UserService {

    private static final Logger logger = LoggerFactory.getLogger(UserService.class);

    private final UserRepository userRepository;

    public UserService(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    @Transactional
    public User createUser(UserRequest request) {
        logger.info("Creating user: email={}", request.getEmail());

        if (userRepository.emailExists(request.getEmail(), null)) {
            logger.warn("Create failed - email already exists: {}", request.getEmail());
            throw new EmailConflictException(request.getEmail());
        }

        User saved;
        try {
            saved = userRepository.saveAndFlush(new User(request.getName(), request.getEmail(), now()));
        } catch (DataIntegrityViolationException e) {
            // Lost a race, or the email belongs to a soft-deleted user
            logger.warn("Create failed - unique index rejected email: {}", request.getEmail());
            throw new EmailConflictException(request.getEmail(), e);
        }

        logger.info("User created successfully: id={}, email={}", saved.getId(), saved.getEmail());
        return saved;
    }

    @Transactional(readOnly = true)
    public User getUser(long id) {
        logger.info("Fetching user by id: {}", id);
        return findActive(id);
    }

    @Transactional(readOnly = true)
    public Page<User> listUsers(int limit, int offset) {
        logger.info("Listing users: limit={}, offset={}", limit, offset);
        return userRepository.findActivePage(limit, offset);
    }

    @Transactional
    public User updateUser(long id, UserRequest request) {
        logger.info("Updating user: id={}, email={}", id, request.getEmail());

        User current = findActive(id);

        if (!current.getEmail().equals(request.getEmail())
                && userRepository.emailExists(request.getEmail(), id)) {
            logger.warn("Update failed - email already exists: id={}, email={}", id, request.getEmail());
            throw new EmailConflictException(request.getEmail());
        }

        int updated;
        try {
            updated = userRepository.updateFields(id, request.getName(), request.getEmail(), now());
        } catch (DataIntegrityViolationException e) {
            logger.warn("Update failed - unique index rejected email: id={}, email={}", id, request.getEmail());
            throw new EmailConflictException(request.getEmail(), e);
        }
        if (updated == 0) {
            logger.warn("Update failed - user deleted concurrently: {}", id);
            throw new UserNotFoundException(id);
        }

        User saved = findActive(id);
        logger.info("User updated successfully: id={}", id);
        return saved;
    }

    @Transactional
    public void deleteUser(long id) {
        logger.info("Deleting user: id={}", id);

        if (userRepository.markDeleted(id, now()) == 0) {
            logger.warn("Delete failed - user not found: {}", id);
            throw new UserNotFoundException(id);
        }

        logger.info("User deleted successfully: id={}", id);
    }

    // Stores keep microseconds; truncating keeps returned and re-read values equal
    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }

    private User findActive(long id) {
        return userRepository.findActiveById(id)
            .orElseThrow(() -> {
                logger.warn("User not found: {}", id);
                return new UserNotFoundException(id);
            });
    }
}
