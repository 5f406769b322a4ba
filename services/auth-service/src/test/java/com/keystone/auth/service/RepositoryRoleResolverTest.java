package com.keystone.auth.service;

import com.keystone.auth.domain.Permission;
import com.keystone.auth.domain.Role;
import com.keystone.auth.dto.PermissionResponse;
import com.keystone.auth.dto.RoleResponse;
import com.keystone.auth.exception.ResourceException;
import com.keystone.auth.repository.PermissionRepository;
import com.keystone.auth.repository.RoleRepository;
import com.keystone.common.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("RepositoryRoleResolver Unit Tests")
class RepositoryRoleResolverTest {

    @Mock
    private RoleRepository roleRepository;

    @Mock
    private PermissionRepository permissionRepository;

    @InjectMocks
    private RepositoryRoleResolver roleResolver;

    @Test
    @DisplayName("Should materialize the full permission objects of a role")
    void shouldResolveAdminPermissions() {
        // Given
        Permission userGet = Permission.builder().id(UUID.randomUUID()).name("user-get").active(true).build();
        Permission userCreate = Permission.builder().id(UUID.randomUUID()).name("user-create").active(false).build();
        Role admin = Role.builder()
            .id(UUID.randomUUID())
            .name(Role.ADMIN)
            .active(true)
            .permissionIds(new HashSet<>(Set.of(userGet.getId(), userCreate.getId())))
            .build();
        when(roleRepository.findById(admin.getId())).thenReturn(Optional.of(admin));
        when(permissionRepository.findByIdIn(admin.getPermissionIds())).thenReturn(List.of(userGet, userCreate));

        // When
        RoleResponse resolved = roleResolver.resolve(admin.getId());

        // Then
        assertThat(resolved.getName()).isEqualTo("Admin");
        assertThat(resolved.isActive()).isTrue();
        assertThat(resolved.getPermissions())
            .extracting(PermissionResponse::getName, PermissionResponse::isActive)
            .containsExactly(tuple("user-create", false), tuple("user-get", true));
    }

    @Test
    @DisplayName("Should skip the permission lookup for a role without permissions")
    void shouldResolveEmptyRole() {
        // Given
        Role role = Role.builder().id(UUID.randomUUID()).name(Role.DEFAULT).build();

        // When
        RoleResponse resolved = roleResolver.resolve(role);

        // Then
        assertThat(resolved.getPermissions()).isEmpty();
        verifyNoInteractions(permissionRepository);
    }

    @Test
    @DisplayName("Should drop references to deleted permissions")
    void shouldDropDanglingReferences() {
        // Given
        Permission userGet = Permission.builder().id(UUID.randomUUID()).name("user-get").build();
        Role role = Role.builder()
            .id(UUID.randomUUID())
            .name("Support")
            .permissionIds(new HashSet<>(Set.of(userGet.getId(), UUID.randomUUID())))
            .build();
        when(permissionRepository.findByIdIn(anyCollection())).thenReturn(List.of(userGet));

        // When
        RoleResponse resolved = roleResolver.resolve(role);

        // Then
        assertThat(resolved.getPermissions()).extracting(PermissionResponse::getName).containsExactly("user-get");
    }

    @Test
    @DisplayName("Should return null for a missing role reference and fail for an unknown id")
    void shouldHandleMissingRole() {
        // Given
        UUID unknown = UUID.randomUUID();
        when(roleRepository.findById(unknown)).thenReturn(Optional.empty());

        // Then
        assertThat(roleResolver.resolve((UUID) null)).isNull();
        assertThatThrownBy(() -> roleResolver.resolve(unknown))
            .isInstanceOfSatisfying(ResourceException.class,
                e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.ROLE_NOT_FOUND));
    }
}
