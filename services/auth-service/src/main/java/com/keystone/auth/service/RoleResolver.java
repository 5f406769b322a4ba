package com.keystone.auth.service;

import com.keystone.auth.domain.Role;
import com.keystone.auth.dto.RoleResponse;

import java.util.UUID;

/**
 * Expands a role reference into the role with its permission objects.
 */
public interface RoleResolver {

    /**
     * Every referenced permission is returned, active or not.
     *
     * @return the resolved role, or {@code null} when {@code roleId} is null
     * @throws com.keystone.auth.exception.ResourceException RoleNotFound for an unknown id
     */
    RoleResponse resolve(UUID roleId);

    /**
     * Joins an already loaded role with its permissions.
     */
    RoleResponse resolve(Role role);
}
