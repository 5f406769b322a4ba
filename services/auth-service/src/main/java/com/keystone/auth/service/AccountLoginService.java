package com.keystone.auth.service;

import com.keystone.auth.config.AuthProperties;
import com.keystone.auth.domain.User;
import com.keystone.auth.dto.AuthResponse;
import com.keystone.auth.dto.AuthTokensResponse;
import com.keystone.auth.dto.UserResponse;
import com.keystone.auth.exception.AuthException;
import com.keystone.auth.notification.AuthNotificationService;
import com.keystone.auth.repository.UserRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Login state machine.
 *
 * Flow:
 * 1. Look up the user by email
 * 2. Reject while a lock is in force
 * 3. On a wrong password, decrement the remaining attempts and lock once they
 *    run out; the request that exhausts them reports the lock
 * 4. On a correct password, reset the counters, purge expired sessions and
 *    refuse when the session cap is already reached
 * 5. Issue the token pair
 *
 * Counter and lock changes are conditional updates in the database, so
 * concurrent attempts on one account can not lose a decrement or lock twice.
 * The steps are not one transaction: each write commits on its own.
 *
 * @author Keystone Security Team
 * @version 1.0.0
 */
@Slf4j
@Service
public class AccountLoginService implements LoginService {

    static final String INVALID_CREDENTIALS = "Incorrect email or password";

    private final UserRepository userRepository;
    private final TokenService tokenService;
    private final RoleResolver roleResolver;
    private final LockoutPolicy lockoutPolicy;
    private final AuthNotificationService notificationService;
    private final PasswordEncoder passwordEncoder;
    private final AuthProperties properties;
    private final Clock clock;

    private final Counter successCounter;
    private final Counter invalidCredentialsCounter;
    private final Counter lockedCounter;
    private final Counter tooManySessionsCounter;

    public AccountLoginService(UserRepository userRepository,
                               TokenService tokenService,
                               RoleResolver roleResolver,
                               LockoutPolicy lockoutPolicy,
                               AuthNotificationService notificationService,
                               PasswordEncoder passwordEncoder,
                               AuthProperties properties,
                               Clock clock,
                               MeterRegistry meterRegistry) {
        this.userRepository = userRepository;
        this.tokenService = tokenService;
        this.roleResolver = roleResolver;
        this.lockoutPolicy = lockoutPolicy;
        this.notificationService = notificationService;
        this.passwordEncoder = passwordEncoder;
        this.properties = properties;
        this.clock = clock;
        this.successCounter = loginCounter(meterRegistry, "success");
        this.invalidCredentialsCounter = loginCounter(meterRegistry, "invalid_credentials");
        this.lockedCounter = loginCounter(meterRegistry, "locked");
        this.tooManySessionsCounter = loginCounter(meterRegistry, "too_many_sessions");
    }

    @Override
    public AuthResponse login(String email, String password) {
        Instant now = clock.instant();

        User user = userRepository.findByEmail(email).orElse(null);
        if (user == null) {
            log.warn("Login rejected: unknown email");
            invalidCredentialsCounter.increment();
            throw AuthException.invalidCredentials(INVALID_CREDENTIALS);
        }

        try {
            lockoutPolicy.assertNotLocked(user, now);
        } catch (AuthException e) {
            log.warn("Login rejected for locked user {}", user.getId());
            lockedCounter.increment();
            throw e;
        }

        if (!passwordEncoder.matches(password, user.getPasswordHash())) {
            throw recordFailedAttempt(user, now);
        }
        return completeLogin(user);
    }

    private AuthException recordFailedAttempt(User user, Instant now) {
        userRepository.decrementLoginAttempts(user.getId());
        int remaining = userRepository.findRemainingLoginAttempts(user.getId()).orElse(0);
        invalidCredentialsCounter.increment();

        if (remaining > 0) {
            log.warn("Wrong password for user {}, {} attempts left", user.getId(), remaining);
            return AuthException.invalidCredentials(
                    INVALID_CREDENTIALS + ". " + LockoutPolicy.plural(remaining, "attempt") + " left.");
        }

        Instant lockedUntil = now.plus(lockoutPolicy.lockDuration());
        if (userRepository.lockIfAttemptsExhausted(user.getId(), lockedUntil, now) == 1) {
            log.info("User {} locked until {}", user.getId(), lockedUntil);
            notificationService.accountLocked(user, lockedUntil);
        }
        return AuthException.invalidCredentials(lockoutPolicy.lockNotice());
    }

    private AuthResponse completeLogin(User user) {
        int maxAttempts = properties.getLockout().getMaxLoginAttempts();
        userRepository.resetLoginAttempts(user.getId(), maxAttempts);
        user.setMaximumLoginAttempts(maxAttempts);
        user.setLocked(false);
        user.setLockDuration(null);

        int maxSessions = properties.getSessions().getMaxActive();
        long activeSessions = tokenService.purgeExpired(user.getId()).activeCount();
        if (activeSessions >= maxSessions) {
            log.warn("Login refused for user {}: {} active sessions", user.getId(), activeSessions);
            tooManySessionsCounter.increment();
            notificationService.maxSessionsReached(user, maxSessions);
            throw AuthException.tooManySessions(String.format(
                    "Too many active sessions. Maximum %s allowed at a time. "
                            + "Please logout from one of the active sessions.",
                    LockoutPolicy.plural(maxSessions, "session")));
        }

        AuthTokensResponse tokens = tokenService.issuePair(user);
        successCounter.increment();
        log.info("User {} logged in", user.getId());
        notificationService.loginSucceeded(user);

        return AuthResponse.builder()
                .user(UserResponse.from(user))
                .role(roleResolver.resolve(user.getRole() != null ? user.getRole().getId() : null))
                .token(tokens)
                .build();
    }

    private static Counter loginCounter(MeterRegistry registry, String outcome) {
        return Counter.builder("keystone.auth.login")
                .description("Login attempts by outcome")
                .tag("outcome", outcome)
                .register(registry);
    }
}
