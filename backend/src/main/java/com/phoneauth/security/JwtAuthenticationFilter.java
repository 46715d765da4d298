package com.phoneauth.security;

import com.phoneauth.exception.AuthException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * JWT Authentication Filter for request validation.
 *
 * Filter Execution Flow:
 * 1. Extract JWT token from Authorization header (Bearer {token})
 * 2. Verify it as an access token (signature, type, expiry)
 * 3. If valid, create Authentication object and set in SecurityContext
 * 4. Pass request to next filter in chain
 *
 * Requests without a token, or with a refresh or invalid token, continue
 * unauthenticated; SecurityConfig decides whether the endpoint allows that.
 * Access tokens are checked without any store lookup.
 *
 * @see JwtTokenProvider
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private final JwtTokenProvider jwtTokenProvider;

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        String token = jwtTokenProvider.extractTokenFromHeader(request.getHeader("Authorization"));

        if (token != null) {
            try {
                TokenClaims claims = jwtTokenProvider.verify(token, TokenType.ACCESS);
                Authentication authentication = jwtTokenProvider.getAuthentication(claims);
                SecurityContextHolder.getContext().setAuthentication(authentication);

                log.debug("Set authentication for user: {} on path: {}",
                        authentication.getPrincipal(),
                        request.getRequestURI());
            } catch (AuthException ex) {
                log.warn("Rejected access token on path {}: {}",
                        request.getRequestURI(), ex.getErrorCode().getCode());
                SecurityContextHolder.clearContext();
            }
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        // Spring Boot's internal error dispatch
        return request.getRequestURI().startsWith("/error");
    }
}
