package ca.nestsync.security;

import io.jsonwebtoken.Claims;
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
 * Tests verification of Supabase access tokens:
 * - Claims of generated tokens (sub, email, aud)
 * - Rejection of bad signatures, expired tokens and foreign audiences
 * - Authentication object creation and header parsing
 */
@DisplayName("JwtTokenProvider Unit Tests")
class JwtTokenProviderTest {

    private static final String SECRET =
            "super-secret-jwt-token-with-at-least-32-characters-long-for-tests";

    private JwtTokenProvider jwtTokenProvider;
    private UUID supabaseUserId;
    private String email;
    private SecretKey key;

    @BeforeEach
    void setUp() {
        jwtTokenProvider = new JwtTokenProvider();
        supabaseUserId = UUID.randomUUID();
        email = "parent@example.ca";
        key = Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8));

        ReflectionTestUtils.setField(jwtTokenProvider, "jwtSecret", SECRET);
        ReflectionTestUtils.setField(jwtTokenProvider, "audience", "authenticated");
        ReflectionTestUtils.setField(jwtTokenProvider, "jwtExpirationMs", 3600000L);
        jwtTokenProvider.init();
    }

    private String supabaseToken(String audience, long issuedOffsetMs, long expiresOffsetMs) {
        long now = System.currentTimeMillis();
        return Jwts.builder()
                .subject(supabaseUserId.toString())
                .claim("email", email)
                .claim("role", "authenticated")
                .audience().add(audience).and()
                .issuedAt(new Date(now + issuedOffsetMs))
                .expiration(new Date(now + expiresOffsetMs))
                .signWith(key, Jwts.SIG.HS256)
                .compact();
    }

    @Test
    @DisplayName("Generated tokens carry Supabase-shaped claims")
    void testGenerateTokenClaims() {
        // Act
        String token = jwtTokenProvider.generateToken(supabaseUserId, email);

        // Assert
        Claims claims = Jwts.parser().verifyWith(key).build().parseSignedClaims(token).getPayload();
        assertEquals(supabaseUserId.toString(), claims.getSubject());
        assertEquals(email, claims.get("email", String.class));
        assertEquals("authenticated", claims.get("role", String.class));
        assertTrue(claims.getAudience().contains("authenticated"));
        long lifetime = claims.getExpiration().getTime() - claims.getIssuedAt().getTime();
        assertEquals(3600000L, lifetime, 1000L);
    }

    @Test
    @DisplayName("A token signed like Supabase validates and yields the user")
    void testValidateSupabaseToken() {
        // Arrange
        String token = supabaseToken("authenticated", 0, 3600000L);

        // Act & Assert
        assertTrue(jwtTokenProvider.validateToken(token));
        assertEquals(supabaseUserId, jwtTokenProvider.getUserIdFromToken(token));
        assertEquals(email, jwtTokenProvider.getEmailFromToken(token));
    }

    @Test
    @DisplayName("Tokens for another audience are rejected")
    void testValidateTokenWrongAudience() {
        assertFalse(jwtTokenProvider.validateToken(supabaseToken("anon", 0, 3600000L)));
    }

    @Test
    @DisplayName("Expired tokens are rejected")
    void testValidateTokenExpired() {
        assertFalse(jwtTokenProvider.validateToken(supabaseToken("authenticated", -7200000L, -3600000L)));
    }

    @Test
    @DisplayName("Tokens signed with another secret are rejected")
    void testValidateTokenInvalidSignature() {
        // Arrange
        SecretKey otherKey = Keys.hmacShaKeyFor(
                "a-different-secret-that-is-also-long-enough-for-hs256".getBytes(StandardCharsets.UTF_8));
        String token = Jwts.builder()
                .subject(supabaseUserId.toString())
                .audience().add("authenticated").and()
                .expiration(new Date(System.currentTimeMillis() + 3600000L))
                .signWith(otherKey, Jwts.SIG.HS256)
                .compact();

        // Act & Assert
        assertFalse(jwtTokenProvider.validateToken(token));
    }

    @Test
    @DisplayName("Malformed, empty and null tokens are rejected")
    void testValidateTokenMalformed() {
        assertFalse(jwtTokenProvider.validateToken("not.a.valid.jwt"));
        assertFalse(jwtTokenProvider.validateToken(""));
        assertFalse(jwtTokenProvider.validateToken(null));
    }

    @Test
    @DisplayName("Authentication holds the Supabase id as principal and email as details")
    void testGetAuthentication() {
        // Arrange
        String token = jwtTokenProvider.generateToken(supabaseUserId, email);

        // Act
        Authentication authentication = jwtTokenProvider.getAuthentication(token);

        // Assert
        assertEquals(supabaseUserId.toString(), authentication.getPrincipal());
        assertEquals(email, authentication.getDetails());
        assertEquals("ROLE_USER", authentication.getAuthorities().iterator().next().getAuthority());
    }

    @Test
    @DisplayName("Only Bearer headers yield a token")
    void testExtractTokenFromHeader() {
        assertEquals("abc.def.ghi", jwtTokenProvider.extractTokenFromHeader("Bearer abc.def.ghi"));
        assertNull(jwtTokenProvider.extractTokenFromHeader("Basic dXNlcjpwYXNz"));
        assertNull(jwtTokenProvider.extractTokenFromHeader(""));
        assertNull(jwtTokenProvider.extractTokenFromHeader(null));
    }
}
