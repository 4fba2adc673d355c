package ca.nestsync.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.IncorrectClaimException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.MissingClaimException;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
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
 * Verifies access tokens issued by Supabase Auth.
 *
 * Supabase signs its JWTs with HS256 using the project's JWT secret. The
 * claims used here are:
 * - sub: Supabase user id (UUID)
 * - email: user email address
 * - aud: must be {@code authenticated}
 * - exp: expiry, enforced by the parser
 *
 * {@link #generateToken(UUID, String)} mints tokens with the same shape. It is
 * used by tests and local tooling; production tokens always come from Supabase.
 *
 * @see io.jsonwebtoken.Jwts
 */
@Component
@Slf4j
public class JwtTokenProvider {

    @Value("${supabase.jwt-secret}")
    private String jwtSecret;

    @Value("${supabase.jwt-audience:authenticated}")
    private String audience;

    @Value("${supabase.jwt-expiration-ms:3600000}")
    private long jwtExpirationMs;

    private SecretKey secretKey;

    @PostConstruct
    public void init() {
        this.secretKey = Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8));
        log.info("Supabase JWT verification initialized (audience={})", audience);
    }

    /**
     * Generate a Supabase-shaped access token.
     *
     * @param supabaseUserId the Supabase user id, stored as {@code sub}
     * @param email the user's email address
     * @return signed JWT
     */
    public String generateToken(UUID supabaseUserId, String email) {
        Date now = new Date();
        Date expiryDate = new Date(now.getTime() + jwtExpirationMs);

        return Jwts.builder()
                .subject(supabaseUserId.toString())
                .claim("email", email)
                .claim("role", "authenticated")
                .audience().add(audience).and()
                .issuedAt(now)
                .expiration(expiryDate)
                .signWith(secretKey, Jwts.SIG.HS256)
                .compact();
    }

    /**
     * Validate signature, expiry, audience and structure.
     *
     * @param token the JWT to validate
     * @return true if the token is valid
     */
    public boolean validateToken(String token) {
        try {
            parseClaims(token);
            return true;
        } catch (SignatureException ex) {
            log.error("Invalid JWT signature: {}", ex.getMessage());
        } catch (MalformedJwtException ex) {
            log.error("Invalid JWT token: {}", ex.getMessage());
        } catch (ExpiredJwtException ex) {
            log.warn("Expired JWT token: {}", ex.getMessage());
        } catch (MissingClaimException | IncorrectClaimException ex) {
            log.warn("JWT audience rejected: {}", ex.getMessage());
        } catch (UnsupportedJwtException ex) {
            log.error("Unsupported JWT token: {}", ex.getMessage());
        } catch (IllegalArgumentException ex) {
            log.error("JWT claims string is empty: {}", ex.getMessage());
        }
        return false;
    }

    public UUID getUserIdFromToken(String token) {
        return UUID.fromString(parseClaims(token).getSubject());
    }

    public String getEmailFromToken(String token) {
        return parseClaims(token).get("email", String.class);
    }

    /**
     * Build the Spring Security authentication for a valid token.
     * The principal is the Supabase user id string and the details hold the email.
     *
     * @param token a token that passed {@link #validateToken(String)}
     * @return authentication for the SecurityContext
     */
    public Authentication getAuthentication(String token) {
        Claims claims = parseClaims(token);

        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(
                        claims.getSubject(),
                        null,
                        Collections.singletonList(new SimpleGrantedAuthority("ROLE_USER"))
                );

        authentication.setDetails(claims.get("email", String.class));
        return authentication;
    }

    /**
     * Extract the token from an {@code Authorization: Bearer ...} header.
     *
     * @param bearerToken header value
     * @return the token, or null if the header is missing or not a bearer header
     */
    public String extractTokenFromHeader(String bearerToken) {
        if (bearerToken != null && bearerToken.startsWith("Bearer ")) {
            return bearerToken.substring(7);
        }
        return null;
    }

    private Claims parseClaims(String token) {
        return Jwts.parser()
                .verifyWith(secretKey)
                .requireAudience(audience)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }
}
