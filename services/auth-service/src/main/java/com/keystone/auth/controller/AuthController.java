package com.keystone.auth.controller;

import com.keystone.auth.config.OpenApiConfig;
import com.keystone.auth.dto.AuthResponse;
import com.keystone.auth.dto.AuthTokensResponse;
import com.keystone.auth.dto.ForgotPasswordRequest;
import com.keystone.auth.dto.LoginRequest;
import com.keystone.auth.dto.RefreshTokenRequest;
import com.keystone.auth.dto.RegisterRequest;
import com.keystone.auth.dto.ResetPasswordRequest;
import com.keystone.auth.security.AuthenticatedUser;
import com.keystone.auth.service.AuthService;
import com.keystone.auth.service.LoginService;
import com.keystone.auth.service.RegistrationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * Authentication endpoints.
 *
 * API Endpoints:
 * - POST /auth/register - Create an account and sign in
 * - POST /auth/login - Sign in with email and password
 * - POST /auth/logout - Revoke a refresh token
 * - POST /auth/refresh-tokens - Rotate a refresh token
 * - POST /auth/forgot-password - Mail a password reset link
 * - POST /auth/reset-password - Set a new password with a reset token
 * - POST /auth/send-verification-email - Mail an email verification link
 * - GET /auth/verify-email - Confirm the email address
 *
 * @author Keystone Security Team
 * @version 1.0.0
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
@Tag(name = "Authentication", description = "Registration, login and token lifecycle APIs")
public class AuthController {

    private final LoginService loginService;
    private final AuthService authService;
    private final RegistrationService registrationService;

    @PostMapping("/register")
    @Operation(summary = "Register", description = "Creates an account with the Default role and returns a token pair")
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(registrationService.register(request));
    }

    @PostMapping("/login")
    @Operation(summary = "Login with credentials",
        description = "Returns the user, the resolved role and a token pair. "
            + "Repeated failures lock the account for a while.")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(loginService.login(request.getEmail(), request.getPassword()));
    }

    @PostMapping("/logout")
    @Operation(summary = "Logout", description = "Revokes the given refresh token")
    public ResponseEntity<Void> logout(@Valid @RequestBody RefreshTokenRequest request) {
        authService.logout(request.getRefreshToken());
        return ResponseEntity.ok().build();
    }

    @PostMapping("/refresh-tokens")
    @Operation(summary = "Refresh tokens", description = "Consumes the refresh token and issues a new pair")
    public ResponseEntity<AuthTokensResponse> refreshTokens(@Valid @RequestBody RefreshTokenRequest request) {
        return ResponseEntity.ok(authService.refresh(request.getRefreshToken()));
    }

    @PostMapping("/forgot-password")
    @Operation(summary = "Forgot password", description = "Mails a password reset link")
    public ResponseEntity<Void> forgotPassword(@Valid @RequestBody ForgotPasswordRequest request) {
        authService.requestPasswordReset(request.getEmail());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/reset-password")
    @Operation(summary = "Reset password", description = "Sets a new password using a reset token")
    public ResponseEntity<Void> resetPassword(@RequestParam @NotBlank String token,
                                              @Valid @RequestBody ResetPasswordRequest request) {
        authService.resetPassword(token, request.getPassword());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/send-verification-email")
    @Operation(summary = "Send verification email", description = "Mails an email verification link")
    @SecurityRequirement(name = OpenApiConfig.BEARER_AUTH)
    public ResponseEntity<Void> sendVerificationEmail(@AuthenticationPrincipal AuthenticatedUser user) {
        authService.requestEmailVerification(user.getId());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/verify-email")
    @Operation(summary = "Verify email", description = "Marks the email address as verified")
    public ResponseEntity<Void> verifyEmail(@RequestParam @NotBlank String token) {
        authService.verifyEmail(token);
        return ResponseEntity.noContent().build();
    }
}
