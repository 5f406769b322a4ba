package com.keystone.auth.security;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.UUID;

/**
 * Principal placed in the security context by {@link JwtAuthenticationFilter}.
 */
@Getter
@ToString
@AllArgsConstructor
public class AuthenticatedUser {
    private final UUID id;
    private final String email;
    private final UUID roleId;
}
