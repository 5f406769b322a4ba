package com.keystone.auth.service;

import com.keystone.auth.config.AuthProperties;
import com.keystone.auth.domain.Token;
import com.keystone.auth.domain.TokenType;
import com.keystone.auth.domain.User;
import com.keystone.auth.dto.AuthTokensResponse;
import com.keystone.auth.exception.AuthException;
import com.keystone.auth.notification.AuthNotificationService;
import com.keystone.auth.repository.TokenRepository;
import com.keystone.auth.repository.UserRepository;
import com.keystone.common.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AuthService.
 *
 * Tests cover:
 * - Password reset request and completion
 * - Email verification
 * - Logout
 * - Refresh token rotation
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("AuthService Unit Tests")
class AuthServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private UserRepository userRepository;

    @Mock
    private TokenRepository tokenRepository;

    @Mock
    private TokenService tokenService;

    @Mock
    private AuthNotificationService notificationService;

    @Mock
    private PasswordEncoder passwordEncoder;

    private AuthService authService;
    private User user;

    @BeforeEach
    void setUp() {
        AuthProperties properties = new AuthProperties();
        authService = new AuthService(
            userRepository,
            tokenRepository,
            tokenService,
            new LockoutPolicy(properties),
            notificationService,
            passwordEncoder,
            properties,
            Clock.fixed(NOW, ZoneOffset.UTC));

        user = User.builder()
            .id(UUID.randomUUID())
            .name("Jane")
            .email("jane@example.com")
            .passwordHash("$2a$12$old_hash")
            .maximumLoginAttempts(3)
            .build();
    }

    private Token storedToken(String value, TokenType type) {
        return Token.builder()
            .id(UUID.randomUUID())
            .token(value)
            .userId(user.getId())
            .type(type)
            .expires(NOW.plus(Duration.ofMinutes(10)))
            .build();
    }

    private static ErrorCode errorCodeOf(Throwable thrown) {
        return ((AuthException) thrown).getErrorCode();
    }

    @Nested
    @DisplayName("Password reset")
    class PasswordReset {

        @Test
        @DisplayName("Should issue a reset token and mail it")
        void shouldIssueResetToken() {
            // Given
            when(userRepository.findByEmail(user.getEmail())).thenReturn(Optional.of(user));
            when(tokenService.issueAndPersist(user.getId(), TokenType.RESET_PASSWORD, Duration.ofMinutes(10)))
                .thenReturn("reset_token");

            // When
            String token = authService.requestPasswordReset(user.getEmail());

            // Then
            assertThat(token).isEqualTo("reset_token");
            verify(notificationService).passwordResetRequested(user, "reset_token");
        }

        @Test
        @DisplayName("Should report an unknown email")
        void shouldReportUnknownEmail() {
            // Given
            when(userRepository.findByEmail("nobody@example.com")).thenReturn(Optional.empty());

            // When
            Throwable thrown = catchThrowable(() -> authService.requestPasswordReset("nobody@example.com"));

            // Then
            assertThat(errorCodeOf(thrown)).isEqualTo(ErrorCode.USER_NOT_FOUND);
            assertThat(thrown).hasMessage("No users found with this email");
            verifyNoInteractions(tokenService);
        }

        @Test
        @DisplayName("Should set the new password and delete every reset token")
        void shouldResetPassword() {
            // Given
            when(tokenService.verify("reset_token", TokenType.RESET_PASSWORD))
                .thenReturn(storedToken("reset_token", TokenType.RESET_PASSWORD));
            when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));
            when(passwordEncoder.encode("newPassword1")).thenReturn("$2a$12$new_hash");

            // When
            authService.resetPassword("reset_token", "newPassword1");

            // Then
            verify(userRepository).updatePassword(user.getId(), "$2a$12$new_hash", user.getId(), NOW);
            verify(userRepository, never()).save(any());
            verify(tokenService).deleteAll(user.getId(), TokenType.RESET_PASSWORD);
            verify(notificationService).passwordResetSucceeded(user);
        }

        @Test
        @DisplayName("Should refuse a reset token that was already used")
        void shouldRefuseReusedToken() {
            // Given
            when(tokenService.verify("reset_token", TokenType.RESET_PASSWORD))
                .thenThrow(AuthException.tokenNotFound());

            // When
            Throwable thrown = catchThrowable(() -> authService.resetPassword("reset_token", "newPassword1"));

            // Then
            assertThat(errorCodeOf(thrown)).isEqualTo(ErrorCode.AUTH_TOKEN_NOT_FOUND);
            verify(userRepository, never()).updatePassword(any(), any(), any(), any());
        }

        @Test
        @DisplayName("Should refuse a reset while the account is locked")
        void shouldRefuseResetWhileLocked() {
            // Given
            user.setLocked(true);
            user.setLockDuration(NOW.plus(Duration.ofMinutes(65)));
            when(tokenService.verify("reset_token", TokenType.RESET_PASSWORD))
                .thenReturn(storedToken("reset_token", TokenType.RESET_PASSWORD));
            when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));

            // When
            Throwable thrown = catchThrowable(() -> authService.resetPassword("reset_token", "newPassword1"));

            // Then
            assertThat(errorCodeOf(thrown)).isEqualTo(ErrorCode.AUTH_ACCOUNT_LOCKED);
            assertThat(thrown).hasMessage("Account is locked. Please try again after 1 hour 5 minutes.");
            verify(userRepository, never()).updatePassword(any(), any(), any(), any());
            verify(tokenService, never()).deleteAll(any(), any());
        }
    }

    @Nested
    @DisplayName("Email verification")
    class EmailVerification {

        @Test
        @DisplayName("Should issue a verification token for the user")
        void shouldIssueVerificationToken() {
            // Given
            when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));
            when(tokenService.issueAndPersist(user.getId(), TokenType.VERIFY_EMAIL, Duration.ofMinutes(10)))
                .thenReturn("verify_token");

            // When
            String token = authService.requestEmailVerification(user.getId());

            // Then
            assertThat(token).isEqualTo("verify_token");
            verify(notificationService).verificationRequested(user, "verify_token");
        }

        @Test
        @DisplayName("Should mark the email verified and delete verification tokens")
        void shouldVerifyEmail() {
            // Given
            when(tokenService.verify("verify_token", TokenType.VERIFY_EMAIL))
                .thenReturn(storedToken("verify_token", TokenType.VERIFY_EMAIL));
            when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));

            // When
            authService.verifyEmail("verify_token");

            // Then
            assertThat(user.isEmailVerified()).isTrue();
            verify(tokenService).deleteAll(user.getId(), TokenType.VERIFY_EMAIL);
            verify(userRepository).markEmailVerified(user.getId(), NOW);
            verify(userRepository, never()).save(any());
            verify(notificationService).emailVerified(user);
        }

        @Test
        @DisplayName("Should report a verification token of a deleted user")
        void shouldReportDeletedUser() {
            // Given
            when(tokenService.verify("verify_token", TokenType.VERIFY_EMAIL))
                .thenReturn(storedToken("verify_token", TokenType.VERIFY_EMAIL));
            when(userRepository.findById(user.getId())).thenReturn(Optional.empty());

            // When
            Throwable thrown = catchThrowable(() -> authService.verifyEmail("verify_token"));

            // Then
            assertThat(errorCodeOf(thrown)).isEqualTo(ErrorCode.USER_NOT_FOUND);
        }
    }

    @Nested
    @DisplayName("Logout and refresh")
    class LogoutAndRefresh {

        @Test
        @DisplayName("Should delete the refresh token on logout")
        void shouldLogout() {
            // Given
            Token refresh = storedToken("refresh_token", TokenType.REFRESH);
            when(tokenRepository.findFirstByTokenAndTypeAndBlacklistedFalse("refresh_token", TokenType.REFRESH))
                .thenReturn(Optional.of(refresh));

            // When
            authService.logout("refresh_token");

            // Then
            verify(tokenService).consume(refresh);
        }

        @Test
        @DisplayName("Should report an unknown refresh token on logout")
        void shouldReportUnknownTokenOnLogout() {
            // Given
            when(tokenRepository.findFirstByTokenAndTypeAndBlacklistedFalse("refresh_token", TokenType.REFRESH))
                .thenReturn(Optional.empty());

            // When
            Throwable thrown = catchThrowable(() -> authService.logout("refresh_token"));

            // Then
            assertThat(errorCodeOf(thrown)).isEqualTo(ErrorCode.AUTH_TOKEN_NOT_FOUND);
            verifyNoInteractions(tokenService);
        }

        @Test
        @DisplayName("Should consume the refresh token before issuing a new pair")
        void shouldRotateRefreshToken() {
            // Given
            Token refresh = storedToken("refresh_token", TokenType.REFRESH);
            AuthTokensResponse pair = AuthTokensResponse.builder().build();
            when(tokenService.verify("refresh_token", TokenType.REFRESH)).thenReturn(refresh);
            when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));
            when(tokenService.issuePair(user)).thenReturn(pair);

            // When
            AuthTokensResponse result = authService.refresh("refresh_token");

            // Then
            assertThat(result).isSameAs(pair);
            InOrder inOrder = inOrder(tokenService);
            inOrder.verify(tokenService).consume(refresh);
            inOrder.verify(tokenService).issuePair(user);
        }

        @Test
        @DisplayName("Should not issue tokens when a concurrent refresh consumed the token first")
        void shouldFailWhenAlreadyConsumed() {
            // Given
            Token refresh = storedToken("refresh_token", TokenType.REFRESH);
            when(tokenService.verify("refresh_token", TokenType.REFRESH)).thenReturn(refresh);
            when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));
            doThrow(AuthException.tokenNotFound()).when(tokenService).consume(refresh);

            // When
            Throwable thrown = catchThrowable(() -> authService.refresh("refresh_token"));

            // Then
            assertThat(errorCodeOf(thrown)).isEqualTo(ErrorCode.AUTH_TOKEN_NOT_FOUND);
            verify(tokenService, never()).issuePair(any());
        }

        @Test
        @DisplayName("Should refuse to refresh for a locked account")
        void shouldRefuseRefreshWhileLocked() {
            // Given
            user.setLocked(true);
            user.setLockDuration(NOW.plus(Duration.ofMinutes(1)));
            when(tokenService.verify("refresh_token", TokenType.REFRESH))
                .thenReturn(storedToken("refresh_token", TokenType.REFRESH));
            when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));

            // When
            Throwable thrown = catchThrowable(() -> authService.refresh("refresh_token"));

            // Then
            assertThat(errorCodeOf(thrown)).isEqualTo(ErrorCode.AUTH_ACCOUNT_LOCKED);
            verify(tokenService, never()).consume(any());
        }
    }
}
