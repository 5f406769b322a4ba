package com.keystone.auth.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Settings of the auth service, bound once from {@code keystone.auth.*} and
 * injected wherever they are needed.
 */
@Data
@Component
@ConfigurationProperties(prefix = "keystone.auth")
public class AuthProperties {

    private Jwt jwt = new Jwt();
    private Lockout lockout = new Lockout();
    private Sessions sessions = new Sessions();
    private Frontend frontend = new Frontend();
    private Mail mail = new Mail();
    private Bootstrap bootstrap = new Bootstrap();
    private Tokens tokens = new Tokens();

    @Data
    public static class Jwt {
        private String secret;
        private long accessExpirationMinutes = 30;
        private long refreshExpirationDays = 30;
        private long resetPasswordExpirationMinutes = 10;
        private long verifyEmailExpirationMinutes = 10;

        public Duration accessTtl() {
            return Duration.ofMinutes(accessExpirationMinutes);
        }

        public Duration refreshTtl() {
            return Duration.ofDays(refreshExpirationDays);
        }

        public Duration resetPasswordTtl() {
            return Duration.ofMinutes(resetPasswordExpirationMinutes);
        }

        public Duration verifyEmailTtl() {
            return Duration.ofMinutes(verifyEmailExpirationMinutes);
        }
    }

    @Data
    public static class Lockout {
        private int maxLoginAttempts = 3;
        private long lockDurationHours = 1;
    }

    @Data
    public static class Sessions {
        private int maxActive = 3;
    }

    @Data
    public static class Frontend {
        private String resetPasswordUrl = "http://localhost:3000/reset-password";
        private String verifyEmailUrl = "http://localhost:3000/verify-email";
    }

    @Data
    public static class Mail {
        private String from = "no-reply@keystone.local";
        private String appName = "Keystone";
    }

    @Data
    public static class Bootstrap {
        private boolean enabled = true;
        private String adminEmail;
        private String adminPassword;
        private String adminName = "Super Admin";
    }

    @Data
    public static class Tokens {
        private String cleanupCron = "0 0 * * * *";
    }
}
