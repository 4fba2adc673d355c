package ca.nestsync.service;

import ca.nestsync.exception.SupabaseAuthException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Thin client for the Supabase Auth (GoTrue) REST API.
 *
 * Every call sends the project's anon key in the {@code apikey} header.
 * Sign-out additionally sends the user's access token as a bearer token.
 *
 * Endpoints used:
 * - POST /auth/v1/signup
 * - POST /auth/v1/token?grant_type=password
 * - POST /auth/v1/token?grant_type=refresh_token
 * - POST /auth/v1/logout
 * - POST /auth/v1/recover
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SupabaseAuthClient {

    private final ObjectMapper objectMapper;

    @Value("${supabase.url}")
    private String supabaseUrl;

    @Value("${supabase.anon-key}")
    private String anonKey;

    private RestClient restClient;

    @PostConstruct
    public void init() {
        this.restClient = RestClient.builder()
                .baseUrl(supabaseUrl.replaceAll("/+$", "") + "/auth/v1")
                .defaultHeader("apikey", anonKey)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
        log.info("Supabase Auth client initialized for {}", supabaseUrl);
    }

    /**
     * Register a new account. Supabase sends the verification email itself.
     *
     * @param email account email
     * @param password account password
     * @param metadata user metadata stored by Supabase (names, locale)
     * @return the created Supabase user, and a session when email confirmation is disabled
     */
    public AuthResult signUp(String email, String password, Map<String, Object> metadata) {
        Map<String, Object> body = new HashMap<>();
        body.put("email", email);
        body.put("password", password);
        body.put("data", metadata);
        JsonNode json = post("sign-up", "/signup", body, null);

        // With email confirmation on, the user object is returned at the top level.
        JsonNode userNode = json.has("user") ? json.get("user") : json;
        Session session = json.hasNonNull("access_token") ? session(json) : null;
        return new AuthResult(user(userNode), session);
    }

    public AuthResult signInWithPassword(String email, String password) {
        JsonNode json = post("sign-in", "/token?grant_type=password",
                Map.of("email", email, "password", password), null);
        return new AuthResult(user(json.get("user")), session(json));
    }

    public AuthResult refresh(String refreshToken) {
        JsonNode json = post("token refresh", "/token?grant_type=refresh_token",
                Map.of("refresh_token", refreshToken), null);
        return new AuthResult(user(json.get("user")), session(json));
    }

    public void signOut(String accessToken) {
        post("sign-out", "/logout", Map.of(), accessToken);
    }

    public void sendPasswordReset(String email) {
        post("password reset", "/recover", Map.of("email", email), null);
    }

    private JsonNode post(String operation, String path, Object body, String bearerToken) {
        try {
            RestClient.RequestBodySpec request = restClient.post().uri(path);
            if (bearerToken != null) {
                request = request.header(HttpHeaders.AUTHORIZATION, "Bearer " + bearerToken);
            }
            String response = request.body(body).retrieve().body(String.class);
            return response == null || response.isBlank()
                    ? objectMapper.createObjectNode()
                    : objectMapper.readTree(response);
        } catch (RestClientResponseException ex) {
            String message = errorMessage(ex.getResponseBodyAsString());
            log.warn("Supabase {} rejected with status {}: {}", operation, ex.getStatusCode().value(), message);
            throw new SupabaseAuthException(ex.getStatusCode().value(), message, ex);
        } catch (RestClientException | IOException ex) {
            log.error("Supabase {} failed: {}", operation, ex.getMessage(), ex);
            throw SupabaseAuthException.unreachable(operation, ex);
        }
    }

    private String errorMessage(String body) {
        try {
            JsonNode json = objectMapper.readTree(body);
            for (String field : new String[]{"error_description", "msg", "message", "error"}) {
                if (json.hasNonNull(field)) {
                    return json.get(field).asText();
                }
            }
        } catch (IOException ex) {
            log.debug("Supabase error body is not JSON: {}", body);
        }
        return "Authentication request was rejected";
    }

    private SupabaseUser user(JsonNode node) {
        if (node == null || !node.hasNonNull("id")) {
            throw new SupabaseAuthException(502, "Authentication service returned no user", null);
        }
        return new SupabaseUser(
                UUID.fromString(node.get("id").asText()),
                node.path("email").asText(null),
                node.hasNonNull("email_confirmed_at"));
    }

    private Session session(JsonNode json) {
        return new Session(
                json.path("access_token").asText(),
                json.path("refresh_token").asText(null),
                json.path("expires_in").asInt(3600),
                json.path("token_type").asText("bearer"));
    }

    public record SupabaseUser(UUID id, String email, boolean emailConfirmed) {
    }

    public record Session(String accessToken, String refreshToken, int expiresIn, String tokenType) {
    }

    /**
     * @param user the authenticated or created user
     * @param session session tokens, null when email confirmation is pending
     */
    public record AuthResult(SupabaseUser user, Session session) {
    }
}
