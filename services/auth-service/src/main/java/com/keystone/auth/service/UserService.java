package com.keystone.auth.service;

import com.keystone.auth.domain.Role;
import com.keystone.auth.domain.User;
import com.keystone.auth.dto.UserResponse;
import com.keystone.auth.exception.AuthException;
import com.keystone.auth.exception.ResourceException;
import com.keystone.auth.repository.RoleRepository;
import com.keystone.auth.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;
    private final RoleRepository roleRepository;
    private final TokenService tokenService;

    @Transactional(readOnly = true)
    public UserResponse getUser(UUID userId) {
        return UserResponse.from(load(userId));
    }

    @Transactional(readOnly = true)
    public Page<UserResponse> listUsers(Pageable pageable) {
        return userRepository.findAllByOrderByCreatedAtAsc(pageable).map(UserResponse::from);
    }

    @Transactional
    public UserResponse assignRole(UUID userId, UUID roleId, UUID actingUserId) {
        User user = load(userId);
        Role role = roleRepository.findById(roleId)
                .orElseThrow(() -> ResourceException.roleNotFound(roleId));

        user.setRole(role);
        user.setUpdatedBy(actingUserId);
        log.info("User {} assigned role '{}' by {}", userId, role.getName(), actingUserId);
        return UserResponse.from(userRepository.save(user));
    }

    /**
     * Deletes the account together with all of its tokens.
     */
    @Transactional
    public void deleteUser(UUID userId) {
        User user = load(userId);
        int tokens = tokenService.deleteAllForUser(userId);
        userRepository.delete(user);
        log.info("Deleted user {} and {} tokens", userId, tokens);
    }

    private User load(UUID userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> AuthException.userNotFound("User not found"));
    }
}
