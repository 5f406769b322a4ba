package com.keystone.auth.security;

import com.keystone.auth.dto.RoleResponse;
import com.keystone.auth.service.RoleResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * Permission checks used from {@code @PreAuthorize} expressions, e.g.
 * {@code @accessGate.isSelfOrHasRights(authentication, #userId, 'user-get')}.
 *
 * A right is granted when it names an active permission of the caller's
 * active role. On routes that carry a user id, a caller acting on their own
 * account is let through without any permission.
 */
@Slf4j
@Component("accessGate")
@RequiredArgsConstructor
public class AccessGate {

    private final RoleResolver roleResolver;

    public boolean hasRights(Authentication authentication, String... requiredRights) {
        AuthenticatedUser user = principal(authentication);
        if (user == null) {
            return false;
        }
        if (requiredRights.length == 0) {
            return true;
        }
        if (user.getRoleId() == null) {
            log.debug("User {} has no role", user.getId());
            return false;
        }

        RoleResponse role = roleResolver.resolve(user.getRoleId());
        List<String> rights = Arrays.asList(requiredRights);
        boolean granted = role.grantsAny(rights);
        if (!granted) {
            log.debug("User {} lacks any of {}", user.getId(), rights);
        }
        return granted;
    }

    public boolean isSelfOrHasRights(Authentication authentication, UUID userId, String... requiredRights) {
        AuthenticatedUser user = principal(authentication);
        if (user == null) {
            return false;
        }
        if (user.getId().equals(userId)) {
            return true;
        }
        return hasRights(authentication, requiredRights);
    }

    private static AuthenticatedUser principal(Authentication authentication) {
        if (authentication == null || !(authentication.getPrincipal() instanceof AuthenticatedUser)) {
            return null;
        }
        return (AuthenticatedUser) authentication.getPrincipal();
    }
}
