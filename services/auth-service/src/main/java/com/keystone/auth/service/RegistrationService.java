package com.keystone.auth.service;

import com.keystone.auth.config.AuthProperties;
import com.keystone.auth.domain.Role;
import com.keystone.auth.domain.TokenType;
import com.keystone.auth.domain.User;
import com.keystone.auth.dto.AuthResponse;
import com.keystone.auth.dto.AuthTokensResponse;
import com.keystone.auth.dto.RegisterRequest;
import com.keystone.auth.dto.UserResponse;
import com.keystone.auth.exception.AuthException;
import com.keystone.auth.notification.AuthNotificationService;
import com.keystone.auth.repository.RoleRepository;
import com.keystone.auth.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

/**
 * Creates accounts with the Default role and signs the new user in.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RegistrationService {

    private final UserRepository userRepository;
    private final RoleRepository roleRepository;
    private final TokenService tokenService;
    private final RoleResolver roleResolver;
    private final AuthNotificationService notificationService;
    private final PasswordEncoder passwordEncoder;
    private final AuthProperties properties;

    public AuthResponse register(RegisterRequest request) {
        if (userRepository.existsByEmail(request.getEmail())) {
            throw AuthException.emailAlreadyTaken();
        }

        Role role = defaultRole();
        User user;
        try {
            user = userRepository.saveAndFlush(User.builder()
                    .name(request.getName())
                    .email(request.getEmail())
                    .passwordHash(passwordEncoder.encode(request.getPassword()))
                    .role(role)
                    .maximumLoginAttempts(properties.getLockout().getMaxLoginAttempts())
                    .build());
        } catch (DataIntegrityViolationException e) {
            // unique email index, a concurrent registration won
            log.warn("Registration for an already taken email rejected by the database");
            throw AuthException.emailAlreadyTaken(e);
        }

        AuthTokensResponse tokens = tokenService.issuePair(user);
        String verifyEmailToken = tokenService.issueAndPersist(
                user.getId(), TokenType.VERIFY_EMAIL, properties.getJwt().verifyEmailTtl());

        log.info("Registered user {}", user.getId());
        notificationService.registered(user, verifyEmailToken);

        return AuthResponse.builder()
                .user(UserResponse.from(user))
                .role(roleResolver.resolve(role.getId()))
                .token(tokens)
                .build();
    }

    private Role defaultRole() {
        return roleRepository.findByName(Role.DEFAULT).orElseGet(() -> {
            log.info("Creating missing '{}' role", Role.DEFAULT);
            return roleRepository.save(Role.builder().name(Role.DEFAULT).active(true).build());
        });
    }
}
