package com.example.usersapi.repository;

import com.example.usersapi.model.User;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
class UserRepositoryTest {

    private static final Instant BASE = Instant.parse("2024-01-01T12:00:00Z");

    @Autowired
    private UserRepository userRepository;

    private User save(String name, String email, Instant createdAt) {
        return userRepository.saveAndFlush(new User(name, email, createdAt));
    }

    // user0 is the oldest
    private List<User> saveUsers(int count) {
        List<User> users = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            users.add(save("user" + i, "user" + i + "@example.com", BASE.plusSeconds(i)));
        }
        return users;
    }

    @Test
    @DisplayName("insert assigns an id and leaves the row active with no updated_at")
    void save_assignsIdAndDefaults() {
        User user = save("John Doe", "john.doe@example.com", BASE);

        assertThat(user.getId()).isNotNull();
        assertThat(user.getIsDeleted()).isNull();
        assertThat(user.isActive()).isTrue();
        assertThat(user.getUpdatedAt()).isNull();
    }

    @Test
    @DisplayName("unique index rejects a second row with the same email")
    void save_duplicateEmail_rejectedByStore() {
        save("John Doe", "john.doe@example.com", BASE);

        assertThatThrownBy(() -> save("Other", "john.doe@example.com", BASE.plusSeconds(1)))
            .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("soft-deleted rows are hidden from the active lookup but kept in the table")
    void markDeleted_hidesRowFromActiveLookup() {
        User user = save("John Doe", "john.doe@example.com", BASE);

        assertThat(userRepository.markDeleted(user.getId(), BASE.plusSeconds(5))).isEqualTo(1);

        assertThat(userRepository.findActiveById(user.getId())).isEmpty();
        User raw = userRepository.findById(user.getId()).orElseThrow();
        assertThat(raw.getIsDeleted()).isTrue();
        assertThat(raw.getUpdatedAt()).isEqualTo(BASE.plusSeconds(5));
    }

    @Test
    @DisplayName("deleting an already deleted row touches nothing")
    void markDeleted_twice_secondIsNoMatch() {
        User user = save("John Doe", "john.doe@example.com", BASE);
        userRepository.markDeleted(user.getId(), BASE.plusSeconds(1));

        assertThat(userRepository.markDeleted(user.getId(), BASE.plusSeconds(2))).isZero();
        assertThat(userRepository.markDeleted(12345L, BASE.plusSeconds(2))).isZero();
    }

    @Test
    @DisplayName("updateFields changes name, email and updated_at of an active row")
    void updateFields_activeRow_applied() {
        User user = save("John Doe", "john.doe@example.com", BASE);

        int touched = userRepository.updateFields(user.getId(), "Johnny", "johnny@example.com", BASE.plusSeconds(30));

        assertThat(touched).isEqualTo(1);
        User updated = userRepository.findActiveById(user.getId()).orElseThrow();
        assertThat(updated.getName()).isEqualTo("Johnny");
        assertThat(updated.getEmail()).isEqualTo("johnny@example.com");
        assertThat(updated.getCreatedAt()).isEqualTo(BASE);
        assertThat(updated.getUpdatedAt()).isEqualTo(BASE.plusSeconds(30));
    }

    @Test
    @DisplayName("updateFields cannot reach or resurrect a soft-deleted row")
    void updateFields_deletedRow_untouched() {
        User user = save("John Doe", "john.doe@example.com", BASE);
        userRepository.markDeleted(user.getId(), BASE.plusSeconds(1));

        int touched = userRepository.updateFields(user.getId(), "Johnny", "john.doe@example.com", BASE.plusSeconds(2));

        assertThat(touched).isZero();
        User raw = userRepository.findById(user.getId()).orElseThrow();
        assertThat(raw.getIsDeleted()).isTrue();
        assertThat(raw.getName()).isEqualTo("John Doe");
    }

    @Test
    @DisplayName("emailExists only sees active users and can exclude one id")
    void emailExists_activeOnly_withExclusion() {
        User john = save("John Doe", "john.doe@example.com", BASE);
        User jane = save("Jane Doe", "jane.doe@example.com", BASE.plusSeconds(1));
        userRepository.markDeleted(jane.getId(), BASE.plusSeconds(2));

        assertThat(userRepository.emailExists("john.doe@example.com", null)).isTrue();
        assertThat(userRepository.emailExists("john.doe@example.com", john.getId())).isFalse();
        assertThat(userRepository.emailExists("john.doe@example.com", jane.getId())).isTrue();
        assertThat(userRepository.emailExists("jane.doe@example.com", null)).isFalse();
        assertThat(userRepository.emailExists("nobody@example.com", null)).isFalse();
    }

    @Test
    @DisplayName("email lookup is exact and case-sensitive")
    void findByEmail_caseSensitive() {
        save("John Doe", "John.Doe@Example.com", BASE);

        assertThat(userRepository.findByEmail("John.Doe@Example.com")).isPresent();
        assertThat(userRepository.findByEmail("john.doe@example.com")).isEmpty();
        assertThat(userRepository.emailExists("john.doe@example.com", null)).isFalse();
    }

    @Test
    @DisplayName("15 users, limit 5 offset 10 -> the 5 oldest, total 15")
    void findActivePage_lastPage_holdsOldest() {
        saveUsers(15);

        Page<User> page = userRepository.findActivePage(5, 10);

        assertThat(page.getContent()).extracting(User::getName)
            .containsExactly("user4", "user3", "user2", "user1", "user0");
        assertThat(page.getTotalElements()).isEqualTo(15);
    }

    @Test
    @DisplayName("offset need not be a multiple of limit")
    void findActivePage_unalignedOffset() {
        saveUsers(10);

        Page<User> page = userRepository.findActivePage(4, 3);

        assertThat(page.getContent()).extracting(User::getName)
            .containsExactly("user6", "user5", "user4", "user3");
        assertThat(page.getTotalElements()).isEqualTo(10);
    }

    @Test
    @DisplayName("total counts active rows only and does not depend on the window")
    void findActivePage_excludesDeleted() {
        List<User> users = saveUsers(6);
        userRepository.markDeleted(users.get(5).getId(), BASE.plusSeconds(100));
        userRepository.markDeleted(users.get(2).getId(), BASE.plusSeconds(100));

        Page<User> first = userRepository.findActivePage(2, 0);
        Page<User> beyond = userRepository.findActivePage(10, 50);

        assertThat(first.getContent()).extracting(User::getName).containsExactly("user4", "user3");
        assertThat(first.getTotalElements()).isEqualTo(4);
        assertThat(beyond.getContent()).isEmpty();
        assertThat(beyond.getTotalElements()).isEqualTo(4);
    }

    @Test
    @DisplayName("equal created_at -> higher id first")
    void findActivePage_tiesBrokenById() {
        User first = save("first", "first@example.com", BASE);
        User second = save("second", "second@example.com", BASE);

        Page<User> page = userRepository.findActivePage(10, 0);

        assertThat(page.getContent()).extracting(User::getId).containsExactly(second.getId(), first.getId());
    }
}
