package com.keystone.auth.controller;

import com.keystone.auth.config.OpenApiConfig;
import com.keystone.auth.dto.RoleRequest;
import com.keystone.auth.dto.RoleResponse;
import com.keystone.auth.security.AuthenticatedUser;
import com.keystone.auth.service.RoleService;
import com.keystone.common.api.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/roles")
@RequiredArgsConstructor
@SecurityRequirement(name = OpenApiConfig.BEARER_AUTH)
@Tag(name = "Roles", description = "Role administration APIs")
public class RoleController {

    private final RoleService roleService;

    @PostMapping
    @Operation(summary = "Create a role")
    @PreAuthorize("@accessGate.hasRights(authentication, 'role-create')")
    public ResponseEntity<ApiResponse<RoleResponse>> create(@Valid @RequestBody RoleRequest request,
                                                            @AuthenticationPrincipal AuthenticatedUser actingUser) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(roleService.create(request, actingUser.getId()), "Role created"));
    }

    @GetMapping
    @Operation(summary = "List roles with their permissions")
    @PreAuthorize("@accessGate.hasRights(authentication, 'role-get')")
    public ResponseEntity<ApiResponse<List<RoleResponse>>> list() {
        return ResponseEntity.ok(ApiResponse.success(roleService.list()));
    }

    @GetMapping("/{roleId}")
    @Operation(summary = "Get a role with its permissions")
    @PreAuthorize("@accessGate.hasRights(authentication, 'role-get')")
    public ResponseEntity<ApiResponse<RoleResponse>> get(@PathVariable UUID roleId) {
        return ResponseEntity.ok(ApiResponse.success(roleService.get(roleId)));
    }

    @PutMapping("/{roleId}")
    @Operation(summary = "Update a role")
    @PreAuthorize("@accessGate.hasRights(authentication, 'role-update', 'role-modify')")
    public ResponseEntity<ApiResponse<RoleResponse>> update(@PathVariable UUID roleId,
                                                            @Valid @RequestBody RoleRequest request,
                                                            @AuthenticationPrincipal AuthenticatedUser actingUser) {
        return ResponseEntity.ok(ApiResponse.success(roleService.update(roleId, request, actingUser.getId()),
                "Role updated"));
    }

    @DeleteMapping("/{roleId}")
    @Operation(summary = "Delete a role")
    @PreAuthorize("@accessGate.hasRights(authentication, 'role-delete')")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable UUID roleId) {
        roleService.delete(roleId);
        return ResponseEntity.ok(ApiResponse.success(null, "Role deleted"));
    }
}
