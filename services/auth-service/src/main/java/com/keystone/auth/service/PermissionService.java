package com.keystone.auth.service;

import com.keystone.auth.domain.Permission;
import com.keystone.auth.domain.Role;
import com.keystone.auth.dto.PermissionRequest;
import com.keystone.auth.dto.PermissionResponse;
import com.keystone.auth.exception.ResourceException;
import com.keystone.auth.repository.PermissionRepository;
import com.keystone.auth.repository.RoleRepository;
import com.keystone.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Permission administration. Names are unique and follow
 * {@code <resource>-<create|modify|get|update|delete>}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PermissionService {

    private final PermissionRepository permissionRepository;
    private final RoleRepository roleRepository;

    @Transactional
    public PermissionResponse create(PermissionRequest request) {
        String name = validName(request.getName());
        if (permissionRepository.existsByName(name)) {
            throw new ResourceException(ErrorCode.PERMISSION_ALREADY_EXISTS, "Permission already exists: " + name);
        }
        Permission permission = permissionRepository.save(Permission.builder()
                .name(name)
                .active(request.getActive() == null || request.getActive())
                .build());
        log.info("Created permission '{}'", name);
        return PermissionResponse.from(permission);
    }

    @Transactional(readOnly = true)
    public PermissionResponse get(UUID permissionId) {
        return PermissionResponse.from(load(permissionId));
    }

    @Transactional(readOnly = true)
    public List<PermissionResponse> list() {
        return permissionRepository.findAllByOrderByNameAsc().stream()
                .map(PermissionResponse::from)
                .collect(Collectors.toList());
    }

    @Transactional
    public PermissionResponse update(UUID permissionId, PermissionRequest request) {
        Permission permission = load(permissionId);
        String name = validName(request.getName());
        if (!name.equals(permission.getName()) && permissionRepository.existsByName(name)) {
            throw new ResourceException(ErrorCode.PERMISSION_ALREADY_EXISTS, "Permission already exists: " + name);
        }
        permission.setName(name);
        if (request.getActive() != null) {
            permission.setActive(request.getActive());
        }
        return PermissionResponse.from(permissionRepository.save(permission));
    }

    /**
     * Deletes the permission and drops it from every role that references it.
     */
    @Transactional
    public void delete(UUID permissionId) {
        Permission permission = load(permissionId);
        List<Role> roles = roleRepository.findByPermissionId(permissionId);
        roles.forEach(role -> role.getPermissionIds().remove(permissionId));
        roleRepository.saveAll(roles);
        permissionRepository.delete(permission);
        log.info("Deleted permission '{}' from {} roles", permission.getName(), roles.size());
    }

    private Permission load(UUID permissionId) {
        return permissionRepository.findById(permissionId)
                .orElseThrow(() -> ResourceException.permissionNotFound(permissionId));
    }

    private static String validName(String name) {
        String trimmed = name == null ? null : name.trim();
        if (!Permission.isValidName(trimmed)) {
            throw new ResourceException(ErrorCode.PERMISSION_INVALID_NAME,
                    "Invalid permission name '" + name + "'. Expected <resource>-<create|modify|get|update|delete>");
        }
        return trimmed;
    }
}
