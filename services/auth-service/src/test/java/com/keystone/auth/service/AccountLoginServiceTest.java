package com.keystone.auth.service;

import com.keystone.auth.config.AuthProperties;
import com.keystone.auth.domain.Role;
import com.keystone.auth.domain.Token;
import com.keystone.auth.domain.TokenType;
import com.keystone.auth.domain.User;
import com.keystone.auth.dto.AuthResponse;
import com.keystone.auth.dto.AuthTokensResponse;
import com.keystone.auth.dto.RoleResponse;
import com.keystone.auth.dto.TokenResponse;
import com.keystone.auth.exception.AuthException;
import com.keystone.auth.notification.AuthNotificationService;
import com.keystone.auth.repository.UserRepository;
import com.keystone.common.exception.ErrorCode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AccountLoginService.
 *
 * Tests cover:
 * - Successful login
 * - Attempt counting and account locking
 * - Lock window and lazy unlock
 * - Active session cap
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("AccountLoginService Unit Tests")
class AccountLoginServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final String EMAIL = "jane@example.com";
    private static final String PASSWORD = "password1";
    private static final String HASH = "$2a$12$hashed_password";

    @Mock
    private UserRepository userRepository;

    @Mock
    private TokenService tokenService;

    @Mock
    private RoleResolver roleResolver;

    @Mock
    private AuthNotificationService notificationService;

    @Mock
    private PasswordEncoder passwordEncoder;

    private SimpleMeterRegistry meterRegistry;
    private AccountLoginService loginService;
    private User user;
    private Role role;

    @BeforeEach
    void setUp() {
        AuthProperties properties = new AuthProperties();
        meterRegistry = new SimpleMeterRegistry();
        loginService = new AccountLoginService(
            userRepository,
            tokenService,
            roleResolver,
            new LockoutPolicy(properties),
            notificationService,
            passwordEncoder,
            properties,
            Clock.fixed(NOW, ZoneOffset.UTC),
            meterRegistry);

        role = Role.builder().id(UUID.randomUUID()).name(Role.DEFAULT).build();
        user = User.builder()
            .id(UUID.randomUUID())
            .name("Jane")
            .email(EMAIL)
            .passwordHash(HASH)
            .role(role)
            .maximumLoginAttempts(3)
            .build();
    }

    private double loginCount(String outcome) {
        return meterRegistry.get("keystone.auth.login").tag("outcome", outcome).counter().count();
    }

    private static AuthTokensResponse tokenPair() {
        return AuthTokensResponse.builder()
            .access(new TokenResponse("access_token", NOW.plus(Duration.ofMinutes(30))))
            .refresh(new TokenResponse("refresh_token", NOW.plus(Duration.ofDays(30))))
            .build();
    }

    private static TokenService.PurgeResult sessions(int active) {
        List<Token> tokens = new ArrayList<>();
        for (int i = 0; i < active; i++) {
            tokens.add(Token.builder()
                .id(UUID.randomUUID())
                .type(TokenType.REFRESH)
                .expires(NOW.plus(Duration.ofDays(1)))
                .build());
        }
        return new TokenService.PurgeResult(tokens, List.of());
    }

    private static ErrorCode errorCodeOf(Throwable thrown) {
        return ((AuthException) thrown).getErrorCode();
    }

    @Test
    @DisplayName("Should log in and return user, role and tokens")
    void shouldLoginSuccessfully() {
        // Given
        RoleResponse resolvedRole = RoleResponse.builder().id(role.getId()).name(Role.DEFAULT).active(true).build();
        when(userRepository.findByEmail(EMAIL)).thenReturn(Optional.of(user));
        when(passwordEncoder.matches(PASSWORD, HASH)).thenReturn(true);
        when(tokenService.purgeExpired(user.getId())).thenReturn(sessions(0));
        when(tokenService.issuePair(user)).thenReturn(tokenPair());
        when(roleResolver.resolve(role.getId())).thenReturn(resolvedRole);

        // When
        AuthResponse response = loginService.login(EMAIL, PASSWORD);

        // Then
        assertThat(response.getUser().getId()).isEqualTo(user.getId());
        assertThat(response.getRole()).isSameAs(resolvedRole);
        assertThat(response.getToken().getAccess().getToken()).isEqualTo("access_token");
        assertThat(response.getToken().getRefresh().getToken()).isEqualTo("refresh_token");
        verify(userRepository).resetLoginAttempts(user.getId(), 3);
        verify(notificationService).loginSucceeded(user);
        assertThat(loginCount("success")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should reject an unknown email without touching counters")
    void shouldRejectUnknownEmail() {
        // Given
        when(userRepository.findByEmail(EMAIL)).thenReturn(Optional.empty());

        // When
        Throwable thrown = catchThrowable(() -> loginService.login(EMAIL, PASSWORD));

        // Then
        assertThat(errorCodeOf(thrown)).isEqualTo(ErrorCode.AUTH_INVALID_CREDENTIALS);
        assertThat(thrown).hasMessage("Incorrect email or password");
        verify(userRepository, never()).decrementLoginAttempts(any());
        verifyNoInteractions(tokenService, notificationService);
    }

    @Nested
    @DisplayName("Failed attempts")
    class FailedAttempts {

        @Test
        @DisplayName("Should count down and lock on the last attempt")
        void shouldCountDownAndLock() {
            // Given
            when(userRepository.findByEmail(EMAIL)).thenReturn(Optional.of(user));
            when(passwordEncoder.matches("wrong", HASH)).thenReturn(false);
            when(userRepository.decrementLoginAttempts(user.getId())).thenReturn(1);
            when(userRepository.findRemainingLoginAttempts(user.getId()))
                .thenReturn(Optional.of(2), Optional.of(1), Optional.of(0));
            Instant lockedUntil = NOW.plus(Duration.ofHours(1));
            when(userRepository.lockIfAttemptsExhausted(user.getId(), lockedUntil, NOW)).thenReturn(1);

            // When
            Throwable first = catchThrowable(() -> loginService.login(EMAIL, "wrong"));
            Throwable second = catchThrowable(() -> loginService.login(EMAIL, "wrong"));
            Throwable third = catchThrowable(() -> loginService.login(EMAIL, "wrong"));

            // Then
            assertThat(first).hasMessage("Incorrect email or password. 2 attempts left.");
            assertThat(second).hasMessage("Incorrect email or password. 1 attempt left.");
            assertThat(third)
                .hasMessage("Account locked due to too many failed login attempts. Please try again in 1 hour.");
            assertThat(List.of(first, second, third))
                .allSatisfy(thrown -> assertThat(errorCodeOf(thrown)).isEqualTo(ErrorCode.AUTH_INVALID_CREDENTIALS));

            verify(userRepository, times(3)).decrementLoginAttempts(user.getId());
            verify(userRepository).lockIfAttemptsExhausted(user.getId(), lockedUntil, NOW);
            verify(notificationService).accountLocked(user, lockedUntil);
            verifyNoInteractions(tokenService);
            assertThat(loginCount("invalid_credentials")).isEqualTo(3.0);
        }

        @Test
        @DisplayName("Should not notify again when a concurrent request already locked the account")
        void shouldNotifyOnlyForTheLockingRequest() {
            // Given
            when(userRepository.findByEmail(EMAIL)).thenReturn(Optional.of(user));
            when(passwordEncoder.matches("wrong", HASH)).thenReturn(false);
            when(userRepository.findRemainingLoginAttempts(user.getId())).thenReturn(Optional.of(0));
            when(userRepository.lockIfAttemptsExhausted(eq(user.getId()), any(), eq(NOW))).thenReturn(0);

            // When
            Throwable thrown = catchThrowable(() -> loginService.login(EMAIL, "wrong"));

            // Then
            assertThat(thrown).hasMessageStartingWith("Account locked due to too many failed login attempts");
            verify(notificationService, never()).accountLocked(any(), any());
        }
    }

    @Nested
    @DisplayName("Account lock")
    class AccountLock {

        @Test
        @DisplayName("Should refuse login while the lock is in force, even with the right password")
        void shouldRefuseWhileLocked() {
            // Given
            user.setLocked(true);
            user.setLockDuration(NOW.plus(Duration.ofMinutes(30)));
            user.setMaximumLoginAttempts(0);
            when(userRepository.findByEmail(EMAIL)).thenReturn(Optional.of(user));

            // When
            Throwable thrown = catchThrowable(() -> loginService.login(EMAIL, PASSWORD));

            // Then
            assertThat(errorCodeOf(thrown)).isEqualTo(ErrorCode.AUTH_ACCOUNT_LOCKED);
            assertThat(thrown).hasMessage("Account is locked. Please try again after 30 minutes.");
            verifyNoInteractions(passwordEncoder, tokenService);
            assertThat(loginCount("locked")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should refuse login at the exact expiry instant")
        void shouldRefuseAtExpiryInstant() {
            // Given
            user.setLocked(true);
            user.setLockDuration(NOW);
            when(userRepository.findByEmail(EMAIL)).thenReturn(Optional.of(user));

            // When
            Throwable thrown = catchThrowable(() -> loginService.login(EMAIL, PASSWORD));

            // Then
            assertThat(errorCodeOf(thrown)).isEqualTo(ErrorCode.AUTH_ACCOUNT_LOCKED);
        }

        @Test
        @DisplayName("Should unlock lazily once the lock has expired and reset the counters")
        void shouldUnlockLazily() {
            // Given
            user.setLocked(true);
            user.setLockDuration(NOW.minusSeconds(1));
            user.setMaximumLoginAttempts(0);
            when(userRepository.findByEmail(EMAIL)).thenReturn(Optional.of(user));
            when(passwordEncoder.matches(PASSWORD, HASH)).thenReturn(true);
            when(tokenService.purgeExpired(user.getId())).thenReturn(sessions(0));
            when(tokenService.issuePair(user)).thenReturn(tokenPair());

            // When
            AuthResponse response = loginService.login(EMAIL, PASSWORD);

            // Then
            verify(userRepository).resetLoginAttempts(user.getId(), 3);
            assertThat(response.getUser().isLocked()).isFalse();
            assertThat(response.getUser().getLockDuration()).isNull();
            assertThat(user.getMaximumLoginAttempts()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("Session cap")
    class SessionCap {

        @Test
        @DisplayName("Should allow login just below the cap")
        void shouldAllowBelowCap() {
            // Given
            when(userRepository.findByEmail(EMAIL)).thenReturn(Optional.of(user));
            when(passwordEncoder.matches(PASSWORD, HASH)).thenReturn(true);
            when(tokenService.purgeExpired(user.getId())).thenReturn(sessions(2));
            when(tokenService.issuePair(user)).thenReturn(tokenPair());

            // When
            AuthResponse response = loginService.login(EMAIL, PASSWORD);

            // Then
            assertThat(response.getToken()).isNotNull();
            verify(notificationService, never()).maxSessionsReached(any(), anyInt());
        }

        @Test
        @DisplayName("Should refuse login at the cap and notify the user")
        void shouldRefuseAtCap() {
            // Given
            when(userRepository.findByEmail(EMAIL)).thenReturn(Optional.of(user));
            when(passwordEncoder.matches(PASSWORD, HASH)).thenReturn(true);
            when(tokenService.purgeExpired(user.getId())).thenReturn(sessions(3));

            // When
            Throwable thrown = catchThrowable(() -> loginService.login(EMAIL, PASSWORD));

            // Then
            assertThat(errorCodeOf(thrown)).isEqualTo(ErrorCode.AUTH_TOO_MANY_SESSIONS);
            assertThat(thrown).hasMessage("Too many active sessions. Maximum 3 sessions allowed at a time. "
                + "Please logout from one of the active sessions.");
            verify(notificationService).maxSessionsReached(user, 3);
            verify(tokenService, never()).issuePair(any());
            assertThat(loginCount("too_many_sessions")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should not count expired sessions towards the cap")
        void shouldIgnoreExpiredSessions() {
            // Given
            TokenService.PurgeResult full = sessions(3);
            Token expired = full.allTokens().get(0);
            when(userRepository.findByEmail(EMAIL)).thenReturn(Optional.of(user));
            when(passwordEncoder.matches(PASSWORD, HASH)).thenReturn(true);
            when(tokenService.purgeExpired(user.getId()))
                .thenReturn(new TokenService.PurgeResult(full.allTokens(), List.of(expired)));
            when(tokenService.issuePair(user)).thenReturn(tokenPair());

            // When & Then
            assertThatCode(() -> loginService.login(EMAIL, PASSWORD)).doesNotThrowAnyException();
        }
    }
}
