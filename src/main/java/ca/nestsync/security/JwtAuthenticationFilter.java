package ca.nestsync.security;

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
 * Populates the SecurityContext from a Supabase bearer token.
 *
 * Requests without a token, or with an invalid one, continue anonymously.
 * Authorization is decided later, either by SecurityConfig for REST paths or
 * by {@link CurrentUser} inside GraphQL resolvers.
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
        try {
            String token = jwtTokenProvider.extractTokenFromHeader(request.getHeader("Authorization"));

            if (token != null && jwtTokenProvider.validateToken(token)) {
                Authentication authentication = jwtTokenProvider.getAuthentication(token);
                SecurityContextHolder.getContext().setAuthentication(authentication);

                log.debug("Set authentication for user: {} on path: {}",
                        authentication.getPrincipal(), request.getRequestURI());
            } else if (token != null) {
                log.warn("Invalid JWT token on path: {}", request.getRequestURI());
            }
        } catch (Exception ex) {
            // Anonymous from here on; protected operations reject the request themselves
            log.error("Cannot set user authentication: {}", ex.getMessage());
            SecurityContextHolder.clearContext();
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path.startsWith("/error") || path.startsWith("/webhooks/");
    }
}
