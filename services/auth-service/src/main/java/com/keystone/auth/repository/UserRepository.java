package com.keystone.auth.repository;

import com.keystone.auth.domain.User;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * User repository with the atomic counter and lock updates used by the login
 * state machine.
 *
 * Features:
 * - Conditional decrement that never goes below zero
 * - Lock that only applies once attempts are exhausted and no lock is in force
 * - Counter reset on successful login
 *
 * @author Keystone Security Team
 * @version 1.0.0
 */
@Repository
public interface UserRepository extends JpaRepository<User, UUID> {

    // Basic finders
    Optional<User> findByEmail(String email);

    boolean existsByEmail(String email);

    boolean existsByRoleId(UUID roleId);

    Page<User> findAllByOrderByCreatedAtAsc(Pageable pageable);

    @Query("SELECT u.maximumLoginAttempts FROM User u WHERE u.id = :userId")
    Optional<Integer> findRemainingLoginAttempts(@Param("userId") UUID userId);

    // Failed login tracking
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE User u SET u.maximumLoginAttempts = u.maximumLoginAttempts - 1 " +
           "WHERE u.id = :userId AND u.maximumLoginAttempts > 0")
    int decrementLoginAttempts(@Param("userId") UUID userId);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE User u SET u.locked = true, u.lockDuration = :lockedUntil " +
           "WHERE u.id = :userId AND u.maximumLoginAttempts = 0 " +
           "AND (u.locked = false OR u.lockDuration IS NULL OR u.lockDuration < :now)")
    int lockIfAttemptsExhausted(@Param("userId") UUID userId,
                                @Param("lockedUntil") Instant lockedUntil,
                                @Param("now") Instant now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE User u SET u.maximumLoginAttempts = :attempts, u.locked = false, u.lockDuration = null " +
           "WHERE u.id = :userId")
    int resetLoginAttempts(@Param("userId") UUID userId, @Param("attempts") int attempts);

    // Single column writes, the lock and counter columns are never touched
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE User u SET u.passwordHash = :passwordHash, u.updatedBy = :updatedBy, " +
           "u.updatedAt = :now WHERE u.id = :userId")
    int updatePassword(@Param("userId") UUID userId,
                       @Param("passwordHash") String passwordHash,
                       @Param("updatedBy") UUID updatedBy,
                       @Param("now") Instant now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE User u SET u.emailVerified = true, u.updatedAt = :now " +
           "WHERE u.id = :userId")
    int markEmailVerified(@Param("userId") UUID userId, @Param("now") Instant now);
}
