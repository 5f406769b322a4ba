package com.keystone.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.keystone.auth.domain.User;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * User view without credentials.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserResponse {

    private UUID id;
    private String name;
    private String email;
    private UUID roleId;

    @JsonProperty("isEmailVerified")
    private boolean emailVerified;

    @JsonProperty("isLocked")
    private boolean locked;

    private Instant lockDuration;
    private Instant createdAt;
    private Instant updatedAt;

    public static UserResponse from(User user) {
        return UserResponse.builder()
                .id(user.getId())
                .name(user.getName())
                .email(user.getEmail())
                .roleId(user.getRole() != null ? user.getRole().getId() : null)
                .emailVerified(user.isEmailVerified())
                .locked(user.isLocked())
                .lockDuration(user.getLockDuration())
                .createdAt(user.getCreatedAt())
                .updatedAt(user.getUpdatedAt())
                .build();
    }
}
