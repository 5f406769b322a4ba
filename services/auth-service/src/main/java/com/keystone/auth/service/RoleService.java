package com.keystone.auth.service;

import com.keystone.auth.domain.Permission;
import com.keystone.auth.domain.Role;
import com.keystone.auth.dto.RoleRequest;
import com.keystone.auth.dto.RoleResponse;
import com.keystone.auth.exception.ResourceException;
import com.keystone.auth.repository.PermissionRepository;
import com.keystone.auth.repository.RoleRepository;
import com.keystone.auth.repository.UserRepository;
import com.keystone.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class RoleService {

    private final RoleRepository roleRepository;
    private final PermissionRepository permissionRepository;
    private final UserRepository userRepository;
    private final RoleResolver roleResolver;

    @Transactional
    public RoleResponse create(RoleRequest request, UUID actingUserId) {
        String name = request.getName().trim();
        if (roleRepository.existsByName(name)) {
            throw new ResourceException(ErrorCode.ROLE_ALREADY_EXISTS, "Role already exists: " + name);
        }
        Role role = roleRepository.save(Role.builder()
                .name(name)
                .permissionIds(existingPermissions(request.getPermissionIds()))
                .active(request.getActive() == null || request.getActive())
                .createdBy(actingUserId)
                .updatedBy(actingUserId)
                .build());
        log.info("Created role '{}' with {} permissions", name, role.getPermissionIds().size());
        return roleResolver.resolve(role);
    }

    @Transactional(readOnly = true)
    public RoleResponse get(UUID roleId) {
        return roleResolver.resolve(roleId);
    }

    @Transactional(readOnly = true)
    public List<RoleResponse> list() {
        return roleRepository.findAllByOrderByNameAsc().stream()
                .map(role -> roleResolver.resolve(role))
                .collect(Collectors.toList());
    }

    @Transactional
    public RoleResponse update(UUID roleId, RoleRequest request, UUID actingUserId) {
        Role role = load(roleId);
        String name = request.getName().trim();
        if (!name.equals(role.getName()) && roleRepository.existsByName(name)) {
            throw new ResourceException(ErrorCode.ROLE_ALREADY_EXISTS, "Role already exists: " + name);
        }
        role.setName(name);
        if (request.getPermissionIds() != null) {
            role.setPermissionIds(existingPermissions(request.getPermissionIds()));
        }
        if (request.getActive() != null) {
            role.setActive(request.getActive());
        }
        role.setUpdatedBy(actingUserId);
        return roleResolver.resolve(roleRepository.save(role));
    }

    @Transactional
    public void delete(UUID roleId) {
        Role role = load(roleId);
        if (userRepository.existsByRoleId(roleId)) {
            throw new ResourceException(ErrorCode.ROLE_IN_USE, "Role '" + role.getName() + "' is still assigned to users");
        }
        roleRepository.delete(role);
        log.info("Deleted role '{}'", role.getName());
    }

    private Role load(UUID roleId) {
        return roleRepository.findById(roleId)
                .orElseThrow(() -> ResourceException.roleNotFound(roleId));
    }

    /**
     * Collapses duplicates and rejects ids that name no permission.
     */
    private Set<UUID> existingPermissions(Set<UUID> permissionIds) {
        if (permissionIds == null || permissionIds.isEmpty()) {
            return new HashSet<>();
        }
        Set<UUID> found = permissionRepository.findByIdIn(permissionIds).stream()
                .map(Permission::getId)
                .collect(Collectors.toSet());
        for (UUID permissionId : permissionIds) {
            if (!found.contains(permissionId)) {
                throw ResourceException.permissionNotFound(permissionId);
            }
        }
        return found;
    }
}
