package com.keystone.auth.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Access and refresh token pair.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthTokensResponse {
    private TokenResponse access;
    private TokenResponse refresh;
}
