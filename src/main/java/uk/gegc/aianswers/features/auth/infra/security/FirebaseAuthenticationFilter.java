package uk.gegc.aianswers.features.auth.infra.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Authenticates requests carrying {@code Authorization: Bearer <Firebase ID token>}.
 *
 * <p>A rejected token leaves the request unauthenticated and records the reason under
 * {@link #AUTH_FAILURE_ATTRIBUTE} for the entry point to report.
 */
@Slf4j
public class FirebaseAuthenticationFilter extends OncePerRequestFilter {

    public static final String AUTH_FAILURE_ATTRIBUTE = FirebaseAuthenticationFilter.class.getName() + ".FAILURE";

    private static final String BEARER_PREFIX = "Bearer ";

    private final IdTokenVerifier idTokenVerifier;

    public FirebaseAuthenticationFilter(IdTokenVerifier idTokenVerifier) {
        this.idTokenVerifier = idTokenVerifier;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request, @NonNull HttpServletResponse response, @NonNull FilterChain filterChain) throws ServletException, IOException {
        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);

        if (authHeader != null && authHeader.startsWith(BEARER_PREFIX)) {
            String token = authHeader.substring(BEARER_PREFIX.length()).trim();
            try {
                String userId = idTokenVerifier.verify(token);
                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(userId, null, List.of());
                SecurityContextHolder.getContext().setAuthentication(authentication);
                log.debug("Successfully authenticated user: {}", userId);
            } catch (InvalidIdTokenException ex) {
                request.setAttribute(AUTH_FAILURE_ATTRIBUTE, ex.getReason());
                log.warn("Rejected ID token ({}) from IP: {}, URI: {}",
                        ex.getReason(),
                        request.getRemoteAddr(),
                        request.getRequestURI());
            }
        }

        filterChain.doFilter(request, response);
    }
}
