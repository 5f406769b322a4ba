package com.keystone.auth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;

/**
 * Keystone Auth Service
 *
 * Handles:
 * - Registration and email verification
 * - Password login with attempt counting and time boxed lockout
 * - JWT access/refresh tokens with refresh rotation and an active-session cap
 * - Password reset
 * - Role and permission administration
 *
 * @version 1.0.0
 */
@SpringBootApplication(
    scanBasePackages = {"com.keystone.auth", "com.keystone.common"},
    exclude = UserDetailsServiceAutoConfiguration.class
)
public class AuthServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuthServiceApplication.class, args);
    }
}
