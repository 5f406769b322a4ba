package com.keystone.auth.repository;

import com.keystone.auth.domain.Token;
import com.keystone.auth.domain.TokenType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Token repository.
 *
 * Features:
 * - Lookup by signed value, type and owner for verification
 * - Deletes that report affected rows, so single-use consumption is race free
 * - Cleanup of expired tokens
 *
 * @author Keystone Security Team
 * @version 1.0.0
 */
@Repository
public interface TokenRepository extends JpaRepository<Token, UUID> {

    Optional<Token> findFirstByTokenAndTypeAndUserIdAndBlacklistedFalse(String token, TokenType type, UUID userId);

    Optional<Token> findFirstByTokenAndTypeAndBlacklistedFalse(String token, TokenType type);

    List<Token> findByUserIdAndType(UUID userId, TokenType type);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM Token t WHERE t.id = :id")
    int deleteTokenById(@Param("id") UUID id);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM Token t WHERE t.id IN :ids")
    int deleteTokensByIdIn(@Param("ids") Collection<UUID> ids);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM Token t WHERE t.userId = :userId AND t.type = :type")
    int deleteByUserIdAndType(@Param("userId") UUID userId, @Param("type") TokenType type);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM Token t WHERE t.userId = :userId")
    int deleteAllByUserId(@Param("userId") UUID userId);

    // Cleanup operations
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM Token t WHERE t.expires < :now")
    int deleteExpired(@Param("now") Instant now);
}
