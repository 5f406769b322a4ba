package com.keystone.auth.notification;

import com.keystone.auth.domain.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.function.Supplier;

/**
 * Account notifications.
 *
 * Every method runs on the async executor and logs delivery failures instead
 * of propagating them, so the operation that triggered a notification never
 * fails because of it.
 *
 * @author Keystone Security Team
 * @version 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthNotificationService {

    private final EmailTemplates templates;
    private final EmailDeliveryService deliveryService;

    @Async
    public void registered(User user, String verifyEmailToken) {
        deliver("registration", () -> templates.registration(user, verifyEmailToken));
    }

    @Async
    public void loginSucceeded(User user) {
        deliver("login", () -> templates.loginSucceeded(user));
    }

    @Async
    public void accountLocked(User user, Instant lockedUntil) {
        deliver("account-locked", () -> templates.accountLocked(user, lockedUntil));
    }

    @Async
    public void maxSessionsReached(User user, int maxSessions) {
        deliver("max-sessions", () -> templates.maxSessionsReached(user, maxSessions));
    }

    @Async
    public void passwordResetRequested(User user, String resetToken) {
        deliver("password-reset-request", () -> templates.passwordResetRequested(user, resetToken));
    }

    @Async
    public void passwordResetSucceeded(User user) {
        deliver("password-reset-success", () -> templates.passwordResetSucceeded(user));
    }

    @Async
    public void verificationRequested(User user, String verifyEmailToken) {
        deliver("verify-email-request", () -> templates.verificationRequested(user, verifyEmailToken));
    }

    @Async
    public void emailVerified(User user) {
        deliver("verify-email-success", () -> templates.emailVerified(user));
    }

    private void deliver(String event, Supplier<EmailMessage> message) {
        try {
            deliveryService.send(message.get());
        } catch (RuntimeException e) {
            log.warn("Failed to deliver {} notification: {}", event, e.getMessage(), e);
        }
    }
}
