package com.egg.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Bearer token filter for the /v1 API.
 *
 * A valid token puts a ROLE_USER authentication (principal = user id) into the
 * SecurityContext and the user id into the logging MDC under {@code userId} for the
 * rest of the request. Anything else leaves the request anonymous; SecurityConfig answers
 * 401 on protected paths.
 *
 * Anonymous sign-in and the health check never carry a token and are skipped.
 *
 * @see JwtTokenProvider
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    static final String MDC_USER_ID = "userId";

    private static final List<String> SKIPPED_PREFIXES = List.of("/v1/auth/", "/actuator/health", "/error");

    private final JwtTokenProvider jwtTokenProvider;

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        String token = jwtTokenProvider.extractTokenFromHeader(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (token == null) {
            filterChain.doFilter(request, response);
            return;
        }

        boolean authenticated = authenticate(token, request);
        try {
            filterChain.doFilter(request, response);
        } finally {
            if (authenticated) {
                MDC.remove(MDC_USER_ID);
            }
        }
    }

    private boolean authenticate(String token, HttpServletRequest request) {
        if (!jwtTokenProvider.validateToken(token)) {
            log.warn("Rejected bearer token: method={}, path={}", request.getMethod(), request.getRequestURI());
            return false;
        }
        try {
            Authentication authentication = jwtTokenProvider.getAuthentication(token);
            SecurityContextHolder.getContext().setAuthentication(authentication);
            MDC.put(MDC_USER_ID, authentication.getName());
            log.debug("Authenticated request: userId={}, path={}", authentication.getName(), request.getRequestURI());
            return true;
        } catch (RuntimeException ex) {
            // a signed token whose subject is not a user id
            log.warn("Cannot build authentication from token: {}", ex.getMessage());
            SecurityContextHolder.clearContext();
            return false;
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return SKIPPED_PREFIXES.stream().anyMatch(path::startsWith);
    }
}
