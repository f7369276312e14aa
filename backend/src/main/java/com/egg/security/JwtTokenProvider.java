package com.egg.security;

import io.jsonwebtoken.*;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Date;
import java.util.UUID;

/**
 * JWT Token Provider for generating and validating anonymous-user tokens.
 *
 * A token is issued once per app install by the anonymous login endpoint. Its only
 * identity claim is the subject (the user id); there are no credentials behind it.
 *
 * Security Features:
 * - Tokens signed with secret key (HS256)
 * - Configurable expiration time (30 days by default)
 * - Validation of token signature, expiration, and malformation
 *
 * @see io.jsonwebtoken.Jwts
 * @see JwtAuthenticationFilter
 */
@Component
@Slf4j
public class JwtTokenProvider {

    @Value("${jwt.secret}")
    private String jwtSecret;

    @Value("${jwt.expiration}")
    private long jwtExpirationMs;

    private SecretKey secretKey;

    /**
     * Initialize the secret key after properties are injected.
     * HS256 requires the secret to be at least 32 bytes.
     */
    @PostConstruct
    public void init() {
        this.secretKey = Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8));
        log.info("JWT Token Provider initialized with expiration: {} ms", jwtExpirationMs);
    }

    /**
     * Generate JWT token for a user.
     *
     * Claims:
     * - sub: User ID (UUID)
     * - iat: Issued at timestamp
     * - exp: Expiration timestamp
     *
     * @param userId the user's unique identifier
     * @return JWT token string
     */
    public String generateToken(UUID userId) {
        Date now = new Date();
        Date expiryDate = new Date(now.getTime() + jwtExpirationMs);

        String token = Jwts.builder()
                .subject(userId.toString())
                .issuedAt(now)
                .expiration(expiryDate)
                .signWith(secretKey, Jwts.SIG.HS256)
                .compact();

        log.debug("Generated JWT token for user: {}", userId);
        return token;
    }

    /**
     * Validate JWT token signature, expiration, and structure.
     *
     * @param token the JWT token to validate
     * @return true if token is valid, false otherwise
     */
    public boolean validateToken(String token) {
        try {
            Claims claims = parseClaims(token);
            if (claims.getSubject() == null) {
                log.error("JWT token has no subject");
                return false;
            }
            UUID.fromString(claims.getSubject());
            return true;
        } catch (ExpiredJwtException ex) {
            log.warn("Expired JWT token: {}", ex.getMessage());
        } catch (MalformedJwtException ex) {
            log.error("Invalid JWT token: {}", ex.getMessage());
        } catch (UnsupportedJwtException ex) {
            log.error("Unsupported JWT token: {}", ex.getMessage());
        } catch (JwtException ex) {
            log.error("Invalid JWT signature: {}", ex.getMessage());
        } catch (IllegalArgumentException ex) {
            log.error("JWT subject or claims string is invalid: {}", ex.getMessage());
        }
        return false;
    }

    /**
     * Extract user ID from JWT token.
     *
     * @param token the JWT token
     * @return the user ID (UUID)
     */
    public UUID getUserIdFromToken(String token) {
        return UUID.fromString(parseClaims(token).getSubject());
    }

    /**
     * Get Authentication object from JWT token. The principal is the user id string.
     *
     * @param token the JWT token
     * @return Authentication object with user details
     */
    public Authentication getAuthentication(String token) {
        UUID userId = getUserIdFromToken(token);

        return new UsernamePasswordAuthenticationToken(
                userId.toString(),
                null,
                Collections.singletonList(new SimpleGrantedAuthority("ROLE_USER"))
        );
    }

    /**
     * Extract JWT token from Authorization header.
     *
     * Expected header format: "Bearer {token}"
     *
     * @param bearerToken the Authorization header value
     * @return the JWT token string, or null if header is invalid
     */
    public String extractTokenFromHeader(String bearerToken) {
        if (bearerToken != null && bearerToken.startsWith("Bearer ")) {
            return bearerToken.substring(7);
        }
        return null;
    }

    public long getExpirationMs() {
        return jwtExpirationMs;
    }

    private Claims parseClaims(String token) {
        return Jwts.parser()
                .verifyWith(secretKey)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }
}
