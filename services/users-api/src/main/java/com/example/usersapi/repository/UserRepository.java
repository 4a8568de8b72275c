/**
 * =============================================================================
 * USER REPOSITORY
 * =============================================================================
 * Spring Data JPA repository for the users table.
 *
 * findById (inherited) is the raw lookup and also sees soft-deleted rows.
 * Everything the service exposes goes through the *Active* queries below.
 * Field updates and soft delete are separate statements: updateFields never
 * touches is_deleted, markDeleted touches nothing but is_deleted/updated_at.
 * =============================================================================
 */
package com.example.usersapi.repository;

import com.example.usersapi.model.User;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    /** Newest first, id breaks ties. */
    Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));

    @Query("SELECT u FROM User u WHERE u.id = :id AND (u.isDeleted IS NULL OR u.isDeleted = false)")
    Optional<User> findActiveById(@Param("id") Long id);

    // Exact, case-sensitive match. Includes soft-deleted rows.
    Optional<User> findByEmail(String email);

    @Query(value = "SELECT u FROM User u WHERE u.isDeleted IS NULL OR u.isDeleted = false",
           countQuery = "SELECT COUNT(u) FROM User u WHERE u.isDeleted IS NULL OR u.isDeleted = false")
    Page<User> findActive(Pageable pageable);

    @Query("SELECT CASE WHEN COUNT(u) > 0 THEN true ELSE false END FROM User u "
         + "WHERE u.email = :email AND (u.isDeleted IS NULL OR u.isDeleted = false)")
    boolean existsActiveByEmail(@Param("email") String email);

    @Query("SELECT CASE WHEN COUNT(u) > 0 THEN true ELSE false END FROM User u "
         + "WHERE u.email = :email AND u.id <> :excludeId AND (u.isDeleted IS NULL OR u.isDeleted = false)")
    boolean existsActiveByEmailExcludingId(@Param("email") String email, @Param("excludeId") Long excludeId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE User u SET u.name = :name, u.email = :email, u.updatedAt = :updatedAt "
         + "WHERE u.id = :id AND (u.isDeleted IS NULL OR u.isDeleted = false)")
    int updateFields(@Param("id") Long id,
                     @Param("name") String name,
                     @Param("email") String email,
                     @Param("updatedAt") Instant updatedAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE User u SET u.isDeleted = true, u.updatedAt = :updatedAt "
         + "WHERE u.id = :id AND (u.isDeleted IS NULL OR u.isDeleted = false)")
    int markDeleted(@Param("id") Long id, @Param("updatedAt") Instant updatedAt);

    default Page<User> findActivePage(int limit, long offset) {
        return findActive(OffsetLimitRequest.of(offset, limit, NEWEST_FIRST));
    }

    default boolean emailExists(String email, Long excludeId) {
        return excludeId == null
            ? existsActiveByEmail(email)
            : existsActiveByEmailExcludingId(email, excludeId);
    }
}
