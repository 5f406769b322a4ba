package com.keystone.auth.service;

import com.keystone.auth.dto.AuthResponse;

/**
 * Password login with attempt counting, lockout and an active-session cap.
 */
public interface LoginService {

    /**
     * @throws com.keystone.auth.exception.AuthException InvalidCredentials,
     *         AccountLocked or TooManySessions
     */
    AuthResponse login(String email, String password);
}
