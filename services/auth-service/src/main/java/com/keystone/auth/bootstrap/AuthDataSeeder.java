package com.keystone.auth.bootstrap;

import com.keystone.auth.config.AuthProperties;
import com.keystone.auth.domain.Permission;
import com.keystone.auth.domain.Role;
import com.keystone.auth.domain.User;
import com.keystone.auth.repository.PermissionRepository;
import com.keystone.auth.repository.RoleRepository;
import com.keystone.auth.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Seeds the permission catalogue, the Default, Admin and Super Admin roles and
 * optionally a super admin account on startup.
 *
 * Every step looks up what exists first, so restarts leave the data as is
 * apart from granting newly added catalogue permissions to the admin roles.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuthDataSeeder implements ApplicationRunner {

    static final List<String> RESOURCES = List.of("role", "permission", "user");
    static final List<String> ACTIONS = List.of("create", "modify", "get", "update", "delete");

    private final PermissionRepository permissionRepository;
    private final RoleRepository roleRepository;
    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final AuthProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getBootstrap().isEnabled()) {
            log.info("Auth data seeding is disabled");
            return;
        }
        log.info("Seeding auth reference data");

        Set<UUID> catalogue = seedPermissions();
        seedRole(Role.DEFAULT, Set.of());
        seedRole(Role.ADMIN, catalogue);
        Role superAdmin = seedRole(Role.SUPER_ADMIN, catalogue);
        seedSuperAdmin(superAdmin);
    }

    Set<UUID> seedPermissions() {
        Set<UUID> ids = new HashSet<>();
        List<Permission> created = new ArrayList<>();
        for (String resource : RESOURCES) {
            for (String action : ACTIONS) {
                String name = resource + "-" + action;
                permissionRepository.findByName(name).ifPresentOrElse(
                        existing -> ids.add(existing.getId()),
                        () -> created.add(Permission.builder().name(name).active(true).build()));
            }
        }
        permissionRepository.saveAll(created).forEach(permission -> ids.add(permission.getId()));
        if (!created.isEmpty()) {
            log.info("Created {} permissions", created.size());
        }
        return ids;
    }

    Role seedRole(String name, Set<UUID> permissionIds) {
        Role role = roleRepository.findByName(name).orElse(null);
        if (role == null) {
            log.info("Creating role '{}' with {} permissions", name, permissionIds.size());
            return roleRepository.save(Role.builder()
                    .name(name)
                    .active(true)
                    .permissionIds(new HashSet<>(permissionIds))
                    .build());
        }
        if (!role.getPermissionIds().containsAll(permissionIds)) {
            role.getPermissionIds().addAll(permissionIds);
            log.info("Granted missing catalogue permissions to role '{}'", name);
            return roleRepository.save(role);
        }
        return role;
    }

    void seedSuperAdmin(Role superAdmin) {
        AuthProperties.Bootstrap bootstrap = properties.getBootstrap();
        if (!StringUtils.hasText(bootstrap.getAdminEmail()) || !StringUtils.hasText(bootstrap.getAdminPassword())) {
            log.info("No super admin credentials configured, skipping account creation");
            return;
        }
        if (userRepository.existsByEmail(bootstrap.getAdminEmail())) {
            return;
        }

        User admin = userRepository.save(User.builder()
                .name(bootstrap.getAdminName())
                .email(bootstrap.getAdminEmail())
                .passwordHash(passwordEncoder.encode(bootstrap.getAdminPassword()))
                .role(superAdmin)
                .emailVerified(true)
                .maximumLoginAttempts(properties.getLockout().getMaxLoginAttempts())
                .build());
        log.info("Created super admin account {}", admin.getId());
    }
}
