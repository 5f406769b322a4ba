package com.keystone.auth.security;

import com.keystone.auth.domain.Token;
import com.keystone.auth.domain.TokenType;
import com.keystone.auth.domain.User;
import com.keystone.auth.exception.AuthException;
import com.keystone.auth.repository.UserRepository;
import com.keystone.auth.service.TokenService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Bearer token authentication.
 *
 * Process Flow:
 * 1. Read the access token from the {@code Authorization: Bearer} header
 * 2. Verify signature, expiry and type (no token store lookup)
 * 3. Load the user the token was issued to
 * 4. Set the security context
 *
 * Requests without a usable token continue unauthenticated; protected
 * routes are then rejected by the authentication entry point.
 *
 * @author Keystone Security Team
 * @version 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final TokenService tokenService;
    private final UserRepository userRepository;

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {

        Optional<String> bearerToken = extractBearerToken(request);
        if (bearerToken.isPresent() && SecurityContextHolder.getContext().getAuthentication() == null) {
            try {
                Token accessToken = tokenService.verify(bearerToken.get(), TokenType.ACCESS);
                Optional<User> user = userRepository.findById(accessToken.getUserId());

                if (user.isPresent()) {
                    AuthenticatedUser principal = new AuthenticatedUser(
                            user.get().getId(),
                            user.get().getEmail(),
                            user.get().getRole() != null ? user.get().getRole().getId() : null);

                    UsernamePasswordAuthenticationToken authentication =
                            new UsernamePasswordAuthenticationToken(principal, null, List.of());
                    authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                    SecurityContextHolder.getContext().setAuthentication(authentication);

                    log.debug("Authenticated user {} from bearer token", principal.getId());
                } else {
                    log.debug("Bearer token refers to a deleted user");
                }
            } catch (AuthException e) {
                log.debug("Bearer token rejected: {}", e.getMessage());
                SecurityContextHolder.clearContext();
            }
        }

        filterChain.doFilter(request, response);
    }

    private static Optional<String> extractBearerToken(HttpServletRequest request) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            return Optional.empty();
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
