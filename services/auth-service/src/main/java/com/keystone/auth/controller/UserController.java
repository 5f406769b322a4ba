package com.keystone.auth.controller;

import com.keystone.auth.config.OpenApiConfig;
import com.keystone.auth.dto.AssignRoleRequest;
import com.keystone.auth.dto.UserResponse;
import com.keystone.auth.security.AuthenticatedUser;
import com.keystone.auth.service.UserService;
import com.keystone.common.api.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/users")
@RequiredArgsConstructor
@SecurityRequirement(name = OpenApiConfig.BEARER_AUTH)
@Tag(name = "Users", description = "User administration APIs")
public class UserController {

    private final UserService userService;

    @GetMapping
    @Operation(summary = "List users")
    @PreAuthorize("@accessGate.hasRights(authentication, 'user-get')")
    public ResponseEntity<ApiResponse<Page<UserResponse>>> listUsers(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(ApiResponse.success(
                userService.listUsers(PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), 100)))));
    }

    @GetMapping("/{userId}")
    @Operation(summary = "Get a user", description = "Allowed for the user themself or with user-get")
    @PreAuthorize("@accessGate.isSelfOrHasRights(authentication, #userId, 'user-get')")
    public ResponseEntity<ApiResponse<UserResponse>> getUser(@PathVariable UUID userId) {
        return ResponseEntity.ok(ApiResponse.success(userService.getUser(userId)));
    }

    @PatchMapping("/{userId}/role")
    @Operation(summary = "Change the role of a user")
    @PreAuthorize("@accessGate.hasRights(authentication, 'user-update')")
    public ResponseEntity<ApiResponse<UserResponse>> assignRole(@PathVariable UUID userId,
                                                                @Valid @RequestBody AssignRoleRequest request,
                                                                @AuthenticationPrincipal AuthenticatedUser actingUser) {
        return ResponseEntity.ok(ApiResponse.success(
                userService.assignRole(userId, request.getRoleId(), actingUser.getId()), "Role updated"));
    }

    @DeleteMapping("/{userId}")
    @Operation(summary = "Delete a user", description = "Allowed for the user themself or with user-delete")
    @PreAuthorize("@accessGate.isSelfOrHasRights(authentication, #userId, 'user-delete')")
    public ResponseEntity<ApiResponse<Void>> deleteUser(@PathVariable UUID userId) {
        userService.deleteUser(userId);
        return ResponseEntity.ok(ApiResponse.success(null, "User deleted"));
    }
}
