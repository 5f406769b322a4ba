package com.keystone.auth.service;

import com.keystone.auth.domain.Token;
import com.keystone.auth.domain.TokenType;
import com.keystone.auth.domain.User;
import com.keystone.auth.dto.AuthTokensResponse;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Issues, persists and verifies signed tokens.
 *
 * Access tokens are stateless: they are checked by signature and expiry only
 * and can not be revoked before they expire. Every other type must also have
 * a stored, non-blacklisted record to verify.
 */
public interface TokenService {

    /**
     * Signs a token for {@code userId} that expires {@code ttl} from now.
     * Nothing is stored.
     */
    String issue(UUID userId, TokenType type, Duration ttl);

    /**
     * Stores a token so it can be looked up and revoked. Access tokens are rejected.
     */
    Token persist(String token, UUID userId, TokenType type, Instant expires);

    /**
     * Signs and stores a token in one step.
     */
    String issueAndPersist(UUID userId, TokenType type, Duration ttl);

    /**
     * Checks the signature, expiry and type of {@code token}.
     *
     * @return the stored record, or a transient record for access tokens
     * @throws com.keystone.auth.exception.AuthException TokenExpiredOrInvalid when the
     *         token is malformed, expired or of another type, TokenNotFound when no
     *         matching stored record exists
     */
    Token verify(String token, TokenType expectedType);

    /**
     * Issues an access token and a stored refresh token for the user.
     */
    AuthTokensResponse issuePair(User user);

    /**
     * Deletes the expired refresh tokens of a user.
     *
     * @return every refresh token found and the expired subset that was deleted
     */
    PurgeResult purgeExpired(UUID userId);

    /**
     * Deletes one stored token.
     *
     * @throws com.keystone.auth.exception.AuthException TokenNotFound when another
     *         request already removed it
     */
    void consume(Token token);

    int deleteAll(UUID userId, TokenType type);

    int deleteAllForUser(UUID userId);

    /**
     * Deletes every stored token that has expired.
     */
    int sweepExpired();

    record PurgeResult(List<Token> allTokens, List<Token> expiredTokens) {

        /**
         * Unexpired, non-blacklisted tokens, i.e. active sessions.
         */
        public long activeCount() {
            return allTokens.stream()
                    .filter(token -> !expiredTokens.contains(token))
                    .filter(token -> !token.isBlacklisted())
                    .count();
        }
    }
}
