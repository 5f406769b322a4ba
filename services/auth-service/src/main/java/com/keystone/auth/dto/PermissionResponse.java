package com.keystone.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.keystone.auth.domain.Permission;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PermissionResponse {

    private UUID id;
    private String name;

    @JsonProperty("isActive")
    private boolean active;

    public static PermissionResponse from(Permission permission) {
        return PermissionResponse.builder()
                .id(permission.getId())
                .name(permission.getName())
                .active(permission.isActive())
                .build();
    }
}
