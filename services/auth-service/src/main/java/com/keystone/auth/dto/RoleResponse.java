package com.keystone.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Role with its permissions materialized.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoleResponse {

    private UUID id;
    private String name;

    @JsonProperty("isActive")
    private boolean active;

    @Builder.Default
    private List<PermissionResponse> permissions = new ArrayList<>();

    /**
     * Whether any required right names an active permission of this role,
     * provided the role itself is active.
     */
    public boolean grantsAny(List<String> requiredRights) {
        if (!active) {
            return false;
        }
        return permissions.stream()
                .filter(PermissionResponse::isActive)
                .anyMatch(permission -> requiredRights.contains(permission.getName()));
    }
}
