package com.keystone.auth.service;

import com.keystone.auth.domain.Permission;
import com.keystone.auth.domain.Role;
import com.keystone.auth.dto.PermissionResponse;
import com.keystone.auth.dto.RoleResponse;
import com.keystone.auth.exception.ResourceException;
import com.keystone.auth.repository.PermissionRepository;
import com.keystone.auth.repository.RoleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Resolves roles with one lookup for the role and one for its permissions,
 * joined in memory.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RepositoryRoleResolver implements RoleResolver {

    private final RoleRepository roleRepository;
    private final PermissionRepository permissionRepository;

    @Override
    @Transactional(readOnly = true)
    public RoleResponse resolve(UUID roleId) {
        if (roleId == null) {
            return null;
        }
        Role role = roleRepository.findById(roleId)
                .orElseThrow(() -> ResourceException.roleNotFound(roleId));
        return resolve(role);
    }

    @Override
    @Transactional(readOnly = true)
    public RoleResponse resolve(Role role) {
        List<Permission> permissions = role.getPermissionIds().isEmpty()
                ? List.of()
                : permissionRepository.findByIdIn(role.getPermissionIds());

        if (permissions.size() < role.getPermissionIds().size()) {
            log.warn("Role {} references {} permissions but only {} exist",
                    role.getName(), role.getPermissionIds().size(), permissions.size());
        }

        return RoleResponse.builder()
                .id(role.getId())
                .name(role.getName())
                .active(role.isActive())
                .permissions(permissions.stream()
                        .sorted(Comparator.comparing(Permission::getName))
                        .map(PermissionResponse::from)
                        .collect(Collectors.toList()))
                .build();
    }
}
