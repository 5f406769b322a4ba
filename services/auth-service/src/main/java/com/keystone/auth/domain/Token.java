package com.keystone.auth.domain;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * Persisted token record for refresh, reset-password and verify-email tokens.
 *
 * Access tokens are never stored. The verifier hands out transient instances
 * of this class for them.
 *
 * @author Keystone Security Team
 * @version 1.0.0
 */
@Entity
@Table(name = "tokens", indexes = {
    @Index(name = "idx_tokens_token", columnList = "token"),
    @Index(name = "idx_tokens_user_type", columnList = "user_id, type"),
    @Index(name = "idx_tokens_expires", columnList = "expires")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Token {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "token", nullable = false, length = 500)
    private String token;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 20)
    private TokenType type;

    @Column(name = "expires", nullable = false)
    private Instant expires;

    @Column(name = "blacklisted", nullable = false)
    @Builder.Default
    private boolean blacklisted = false;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * Expired strictly after the expiry instant.
     */
    public boolean isExpired(Instant now) {
        return expires.isBefore(now);
    }
}
