package com.keystone.auth.domain;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.DynamicUpdate;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * User account with lockout state.
 *
 * Security Features:
 * - Remaining login attempts, decremented per failure and reset on success
 * - Time boxed account lock with lazy expiry
 * - Email verification flag
 * - Audit trail (created/updated by and timestamps)
 * - Optimistic locking for concurrent updates
 *
 * Updates only write changed columns so that a stale entity never overwrites
 * the counters maintained by the conditional updates in UserRepository.
 *
 * @author Keystone Security Team
 * @version 1.0.0
 */
@Entity
@Table(name = "users", indexes = {
    @Index(name = "idx_users_email", columnList = "email", unique = true),
    @Index(name = "idx_users_role", columnList = "role_id")
})
@DynamicUpdate
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "email", unique = true, nullable = false, length = 255)
    private String email;

    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "role_id")
    private Role role;

    @Column(name = "is_email_verified", nullable = false)
    @Builder.Default
    private boolean emailVerified = false;

    // Account Security
    @Column(name = "is_locked", nullable = false)
    @Builder.Default
    private boolean locked = false;

    @Column(name = "lock_duration")
    private Instant lockDuration;

    @Column(name = "maximum_login_attempts", nullable = false)
    private int maximumLoginAttempts;

    // Audit fields
    @Column(name = "created_by")
    private UUID createdBy;

    @Column(name = "updated_by")
    private UUID updatedBy;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    /**
     * A lock is in force until {@code lockDuration} has passed, even when the
     * flag has not been cleared yet.
     */
    public boolean isLockActive(Instant now) {
        return locked && lockDuration != null && !now.isAfter(lockDuration);
    }
}
