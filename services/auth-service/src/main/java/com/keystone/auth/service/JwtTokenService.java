package com.keystone.auth.service;

import com.keystone.auth.config.AuthProperties;
import com.keystone.auth.domain.Token;
import com.keystone.auth.domain.TokenType;
import com.keystone.auth.domain.User;
import com.keystone.auth.dto.AuthTokensResponse;
import com.keystone.auth.dto.TokenResponse;
import com.keystone.auth.exception.AuthException;
import com.keystone.auth.repository.TokenRepository;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * HS256 JWT implementation of {@link TokenService}.
 *
 * Token claims:
 * - sub: user id
 * - iat / exp: issue and expiry instants
 * - type: the {@link TokenType}
 * - jti: random id, keeps tokens minted in the same second distinct
 *
 * @author Keystone Security Team
 * @version 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JwtTokenService implements TokenService {

    static final String TYPE_CLAIM = "type";
    private static final int MIN_SECRET_BYTES = 32;

    private final TokenRepository tokenRepository;
    private final AuthProperties properties;
    private final Clock clock;

    private Key key;
    private JwtParser parser;

    @PostConstruct
    void init() {
        String secret = properties.getJwt().getSecret();
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                    "keystone.auth.jwt.secret must be set to at least " + MIN_SECRET_BYTES + " bytes");
        }
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.parser = Jwts.parserBuilder()
                .setSigningKey(key)
                .setClock(() -> Date.from(clock.instant()))
                .build();
        log.info("JWT token service initialized");
    }

    @Override
    public String issue(UUID userId, TokenType type, Duration ttl) {
        Instant issuedAt = clock.instant();
        return sign(userId, type, issuedAt, issuedAt.plus(ttl));
    }

    @Override
    public Token persist(String token, UUID userId, TokenType type, Instant expires) {
        if (type == TokenType.ACCESS) {
            throw new IllegalArgumentException("Access tokens are not persisted");
        }
        return tokenRepository.save(Token.builder()
                .token(token)
                .userId(userId)
                .type(type)
                .expires(expires)
                .blacklisted(false)
                .build());
    }

    @Override
    public String issueAndPersist(UUID userId, TokenType type, Duration ttl) {
        Instant issuedAt = clock.instant();
        Instant expires = issuedAt.plus(ttl);
        String token = sign(userId, type, issuedAt, expires);
        persist(token, userId, type, expires);
        log.debug("Issued {} token for user {}", type, userId);
        return token;
    }

    @Override
    public Token verify(String token, TokenType expectedType) {
        Claims claims = parse(token);

        String type = claims.get(TYPE_CLAIM, String.class);
        if (!expectedType.name().equals(type)) {
            log.debug("Token type mismatch: expected {} but was {}", expectedType, type);
            throw AuthException.tokenInvalid("Token is expired or invalid", null);
        }

        UUID userId = subjectOf(claims);
        if (expectedType == TokenType.ACCESS) {
            return Token.builder()
                    .token(token)
                    .userId(userId)
                    .type(TokenType.ACCESS)
                    .expires(claims.getExpiration().toInstant())
                    .build();
        }

        Token stored = tokenRepository.findFirstByTokenAndTypeAndUserIdAndBlacklistedFalse(token, expectedType, userId)
                .orElseThrow(AuthException::tokenNotFound);
        if (stored.isExpired(clock.instant())) {
            throw AuthException.tokenInvalid("Token is expired or invalid", null);
        }
        return stored;
    }

    @Override
    public AuthTokensResponse issuePair(User user) {
        Instant issuedAt = clock.instant();
        AuthProperties.Jwt jwt = properties.getJwt();

        Instant accessExpires = issuedAt.plus(jwt.accessTtl());
        String accessToken = sign(user.getId(), TokenType.ACCESS, issuedAt, accessExpires);

        Instant refreshExpires = issuedAt.plus(jwt.refreshTtl());
        String refreshToken = sign(user.getId(), TokenType.REFRESH, issuedAt, refreshExpires);
        persist(refreshToken, user.getId(), TokenType.REFRESH, refreshExpires);

        return AuthTokensResponse.builder()
                .access(new TokenResponse(accessToken, accessExpires))
                .refresh(new TokenResponse(refreshToken, refreshExpires))
                .build();
    }

    @Override
    public PurgeResult purgeExpired(UUID userId) {
        Instant now = clock.instant();
        List<Token> allTokens = tokenRepository.findByUserIdAndType(userId, TokenType.REFRESH);
        List<Token> expiredTokens = allTokens.stream()
                .filter(token -> token.isExpired(now))
                .collect(Collectors.toList());

        if (!expiredTokens.isEmpty()) {
            tokenRepository.deleteTokensByIdIn(expiredTokens.stream().map(Token::getId).collect(Collectors.toList()));
            log.debug("Purged {} expired refresh tokens for user {}", expiredTokens.size(), userId);
        }
        return new PurgeResult(allTokens, expiredTokens);
    }

    @Override
    public void consume(Token token) {
        if (tokenRepository.deleteTokenById(token.getId()) == 0) {
            throw AuthException.tokenNotFound();
        }
    }

    @Override
    public int deleteAll(UUID userId, TokenType type) {
        return tokenRepository.deleteByUserIdAndType(userId, type);
    }

    @Override
    public int deleteAllForUser(UUID userId) {
        return tokenRepository.deleteAllByUserId(userId);
    }

    @Override
    public int sweepExpired() {
        return tokenRepository.deleteExpired(clock.instant());
    }

    private String sign(UUID userId, TokenType type, Instant issuedAt, Instant expires) {
        return Jwts.builder()
                .setSubject(userId.toString())
                .setId(UUID.randomUUID().toString())
                .setIssuedAt(Date.from(issuedAt))
                .setExpiration(Date.from(expires))
                .claim(TYPE_CLAIM, type.name())
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    private Claims parse(String token) {
        if (token == null || token.isBlank()) {
            throw AuthException.tokenInvalid("Token is expired or invalid", null);
        }
        try {
            return parser.parseClaimsJws(token).getBody();
        } catch (ExpiredJwtException e) {
            log.debug("Token expired at {}", e.getClaims().getExpiration());
            throw AuthException.tokenInvalid("Token is expired or invalid", e);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Token rejected: {}", e.getMessage());
            throw AuthException.tokenInvalid("Token is expired or invalid", e);
        }
    }

    private static UUID subjectOf(Claims claims) {
        try {
            return UUID.fromString(claims.getSubject());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw AuthException.tokenInvalid("Token is expired or invalid", e);
        }
    }
}
