package com.keystone.auth.controller;

import com.keystone.auth.config.OpenApiConfig;
import com.keystone.auth.dto.PermissionRequest;
import com.keystone.auth.dto.PermissionResponse;
import com.keystone.auth.service.PermissionService;
import com.keystone.common.api.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/permissions")
@RequiredArgsConstructor
@SecurityRequirement(name = OpenApiConfig.BEARER_AUTH)
@Tag(name = "Permissions", description = "Permission administration APIs")
public class PermissionController {

    private final PermissionService permissionService;

    @PostMapping
    @Operation(summary = "Create a permission")
    @PreAuthorize("@accessGate.hasRights(authentication, 'permission-create')")
    public ResponseEntity<ApiResponse<PermissionResponse>> create(@Valid @RequestBody PermissionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(permissionService.create(request), "Permission created"));
    }

    @GetMapping
    @Operation(summary = "List permissions")
    @PreAuthorize("@accessGate.hasRights(authentication, 'permission-get')")
    public ResponseEntity<ApiResponse<List<PermissionResponse>>> list() {
        return ResponseEntity.ok(ApiResponse.success(permissionService.list()));
    }

    @GetMapping("/{permissionId}")
    @Operation(summary = "Get a permission")
    @PreAuthorize("@accessGate.hasRights(authentication, 'permission-get')")
    public ResponseEntity<ApiResponse<PermissionResponse>> get(@PathVariable UUID permissionId) {
        return ResponseEntity.ok(ApiResponse.success(permissionService.get(permissionId)));
    }

    @PutMapping("/{permissionId}")
    @Operation(summary = "Update a permission")
    @PreAuthorize("@accessGate.hasRights(authentication, 'permission-update', 'permission-modify')")
    public ResponseEntity<ApiResponse<PermissionResponse>> update(@PathVariable UUID permissionId,
                                                                  @Valid @RequestBody PermissionRequest request) {
        return ResponseEntity.ok(ApiResponse.success(permissionService.update(permissionId, request),
                "Permission updated"));
    }

    @DeleteMapping("/{permissionId}")
    @Operation(summary = "Delete a permission")
    @PreAuthorize("@accessGate.hasRights(authentication, 'permission-delete')")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable UUID permissionId) {
        permissionService.delete(permissionId);
        return ResponseEntity.ok(ApiResponse.success(null, "Permission deleted"));
    }
}
