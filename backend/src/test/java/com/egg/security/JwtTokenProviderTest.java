package com.egg.security;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.core.Authentication;
import org.springframework.test.util.ReflectionTestUtils;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for JwtTokenProvider.
 *
 * Tests JWT token operations including:
 * - Token generation with the user id as subject
 * - Token validation (signature, expiration, subject)
 * - Authentication object creation
 */
@DisplayName("JwtTokenProvider Unit Tests")
class JwtTokenProviderTest {

    private JwtTokenProvider jwtTokenProvider;
    private UUID testUserId;
    private String testSecret;

    @BeforeEach
    void setUp() {
        jwtTokenProvider = new JwtTokenProvider();
        testUserId = UUID.randomUUID();
        testSecret = "aVerySecureSecretKeyForJWTTokenGenerationThatIsAtLeast256BitsLongForHS256Algorithm";

        // Use reflection to set private fields
        ReflectionTestUtils.setField(jwtTokenProvider, "jwtSecret", testSecret);
        ReflectionTestUtils.setField(jwtTokenProvider, "jwtExpirationMs", 3600000L); // 1 hour

        jwtTokenProvider.init();
    }

    @Test
    @DisplayName("generateToken should create a token whose subject is the user id")
    void testGenerateToken_Subject() {
        // Act
        String token = jwtTokenProvider.generateToken(testUserId);

        // Assert
        assertTrue(jwtTokenProvider.validateToken(token));
        assertEquals(testUserId, jwtTokenProvider.getUserIdFromToken(token));
    }

    @Test
    @DisplayName("validateToken should return false for malformed token")
    void testValidateToken_Malformed() {
        // Act & Assert
        assertFalse(jwtTokenProvider.validateToken("not.a.valid.jwt"));
    }

    @Test
    @DisplayName("validateToken should return false for a token signed with another key")
    void testValidateToken_WrongSignature() {
        // Arrange
        SecretKey otherKey = Keys.hmacShaKeyFor(
                "anotherSecretKeyThatIsAlsoLongEnoughForTheHS256Algorithm!!".getBytes(StandardCharsets.UTF_8));
        String token = Jwts.builder()
                .subject(testUserId.toString())
                .issuedAt(new Date())
                .expiration(new Date(System.currentTimeMillis() + 60000))
                .signWith(otherKey, Jwts.SIG.HS256)
                .compact();

        // Act & Assert
        assertFalse(jwtTokenProvider.validateToken(token));
    }

    @Test
    @DisplayName("validateToken should return false for expired token")
    void testValidateToken_Expired() {
        // Arrange
        SecretKey key = Keys.hmacShaKeyFor(testSecret.getBytes(StandardCharsets.UTF_8));
        String token = Jwts.builder()
                .subject(testUserId.toString())
                .issuedAt(new Date(System.currentTimeMillis() - 7200000))
                .expiration(new Date(System.currentTimeMillis() - 3600000))
                .signWith(key, Jwts.SIG.HS256)
                .compact();

        // Act & Assert
        assertFalse(jwtTokenProvider.validateToken(token));
    }

    @Test
    @DisplayName("validateToken should return false when the subject is not a user id")
    void testValidateToken_NonUuidSubject() {
        // Arrange
        SecretKey key = Keys.hmacShaKeyFor(testSecret.getBytes(StandardCharsets.UTF_8));
        String token = Jwts.builder()
                .subject("test@example.com")
                .expiration(new Date(System.currentTimeMillis() + 60000))
                .signWith(key, Jwts.SIG.HS256)
                .compact();

        // Act & Assert
        assertFalse(jwtTokenProvider.validateToken(token));
    }

    @Test
    @DisplayName("getAuthentication should use the user id as principal")
    void testGetAuthentication() {
        // Arrange
        String token = jwtTokenProvider.generateToken(testUserId);

        // Act
        Authentication authentication = jwtTokenProvider.getAuthentication(token);

        // Assert
        assertEquals(testUserId.toString(), authentication.getName());
        assertEquals(testUserId, AuthenticatedUser.id(authentication));
        assertTrue(authentication.getAuthorities().stream()
                .anyMatch(authority -> authority.getAuthority().equals("ROLE_USER")));
    }

    @Test
    @DisplayName("extractTokenFromHeader should only accept bearer headers")
    void testExtractTokenFromHeader() {
        // Act & Assert
        assertEquals("abc.def.ghi", jwtTokenProvider.extractTokenFromHeader("Bearer abc.def.ghi"));
        assertNull(jwtTokenProvider.extractTokenFromHeader("Basic dXNlcjpwYXNz"));
        assertNull(jwtTokenProvider.extractTokenFromHeader(null));
    }
}
