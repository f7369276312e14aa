package com.egg.security;

import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.core.Authentication;

import java.util.UUID;

/**
 * Resolves the caller's user id from the Authentication set by {@link JwtAuthenticationFilter}.
 */
public final class AuthenticatedUser {

    private AuthenticatedUser() {
    }

    /**
     * @param authentication the current authentication
     * @return the user id carried as principal name
     * @throws BadCredentialsException if there is no authenticated user
     */
    public static UUID id(Authentication authentication) {
        if (authentication == null || authentication.getName() == null) {
            throw new BadCredentialsException("Invalid token");
        }
        try {
            return UUID.fromString(authentication.getName());
        } catch (IllegalArgumentException e) {
            throw new BadCredentialsException("Invalid token", e);
        }
    }
}
