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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

/**
 * Token driven account flows: password reset, email verification, logout and
 * refresh-token rotation.
 *
 * @author Keystone Security Team
 * @version 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final UserRepository userRepository;
    private final TokenRepository tokenRepository;
    private final TokenService tokenService;
    private final LockoutPolicy lockoutPolicy;
    private final AuthNotificationService notificationService;
    private final PasswordEncoder passwordEncoder;
    private final AuthProperties properties;
    private final Clock clock;

    /**
     * Issues a reset token and mails the reset link.
     *
     * @return the reset token
     */
    public String requestPasswordReset(String email) {
        User user = userRepository.findByEmail(email)
                .orElseThrow(() -> AuthException.userNotFound("No users found with this email"));

        String token = tokenService.issueAndPersist(
                user.getId(), TokenType.RESET_PASSWORD, properties.getJwt().resetPasswordTtl());
        log.info("Password reset requested for user {}", user.getId());
        notificationService.passwordResetRequested(user, token);
        return token;
    }

    public void resetPassword(String resetToken, String newPassword) {
        Token token = tokenService.verify(resetToken, TokenType.RESET_PASSWORD);
        User user = loadUser(token.getUserId());
        lockoutPolicy.assertNotLocked(user, clock.instant());

        userRepository.updatePassword(user.getId(), passwordEncoder.encode(newPassword), user.getId(), clock.instant());
        tokenService.deleteAll(user.getId(), TokenType.RESET_PASSWORD);

        log.info("Password reset for user {}", user.getId());
        notificationService.passwordResetSucceeded(user);
    }

    /**
     * Issues a verify-email token and mails the verification link.
     *
     * @return the verification token
     */
    public String requestEmailVerification(UUID userId) {
        User user = loadUser(userId);
        String token = tokenService.issueAndPersist(
                user.getId(), TokenType.VERIFY_EMAIL, properties.getJwt().verifyEmailTtl());
        log.info("Email verification requested for user {}", user.getId());
        notificationService.verificationRequested(user, token);
        return token;
    }

    public void verifyEmail(String verifyEmailToken) {
        Token token = tokenService.verify(verifyEmailToken, TokenType.VERIFY_EMAIL);
        User user = loadUser(token.getUserId());

        tokenService.deleteAll(user.getId(), TokenType.VERIFY_EMAIL);
        userRepository.markEmailVerified(user.getId(), clock.instant());
        user.setEmailVerified(true);

        log.info("Email verified for user {}", user.getId());
        notificationService.emailVerified(user);
    }

    /**
     * Removes the refresh token; reports TokenNotFound when it was already used
     * or never existed.
     */
    public void logout(String refreshToken) {
        Token token = tokenRepository.findFirstByTokenAndTypeAndBlacklistedFalse(refreshToken, TokenType.REFRESH)
                .orElseThrow(AuthException::tokenNotFound);
        tokenService.consume(token);
        log.info("User {} logged out", token.getUserId());
    }

    /**
     * Rotates a refresh token. The presented token is consumed, so a second
     * call with it fails.
     */
    public AuthTokensResponse refresh(String refreshToken) {
        Token token = tokenService.verify(refreshToken, TokenType.REFRESH);
        User user = loadUser(token.getUserId());
        lockoutPolicy.assertNotLocked(user, clock.instant());

        tokenService.consume(token);
        log.debug("Rotated refresh token for user {}", user.getId());
        return tokenService.issuePair(user);
    }

    private User loadUser(UUID userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> AuthException.userNotFound("User not found"));
    }
}
