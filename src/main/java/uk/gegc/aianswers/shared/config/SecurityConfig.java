package uk.gegc.aianswers.shared.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import uk.gegc.aianswers.features.auth.infra.security.FirebaseAuthenticationFilter;
import uk.gegc.aianswers.features.auth.infra.security.IdTokenVerifier;
import uk.gegc.aianswers.features.auth.infra.security.InvalidIdTokenException;
import uk.gegc.aianswers.shared.api.problem.ErrorTypes;
import uk.gegc.aianswers.shared.api.problem.ProblemDetailBuilder;

import java.io.IOException;

@Configuration
@RequiredArgsConstructor
public class SecurityConfig {

    private static final String AUTHENTICATION_REQUIRED = "Authentication is required to access this resource";

    private final IdTokenVerifier idTokenVerifier;
    private final ObjectMapper objectMapper;

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity httpSecurity) throws Exception {
        httpSecurity
                .csrf(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)
                .httpBasic(AbstractHttpConfigurer::disable)
                .logout(AbstractHttpConfigurer::disable)
                .sessionManagement(sessionManagement -> sessionManagement.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .exceptionHandling(handler -> handler
                        .authenticationEntryPoint((request, response, ex) -> writeProblem(request, response, false))
                        .accessDeniedHandler((request, response, ex) -> writeProblem(request, response, true)))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                        .requestMatchers(HttpMethod.GET, "/health").permitAll()
                        .requestMatchers(HttpMethod.GET, "/actuator/health", "/actuator/health/**").permitAll()
                        .requestMatchers(HttpMethod.GET, "/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html").permitAll()
                        .requestMatchers("/api/ai-answers", "/api/ai-answers/**").authenticated()
                        .anyRequest().authenticated())
                .addFilterBefore(
                        new FirebaseAuthenticationFilter(idTokenVerifier),
                        UsernamePasswordAuthenticationFilter.class
                );

        return httpSecurity.build();
    }

    private void writeProblem(HttpServletRequest request, HttpServletResponse response, boolean forbidden) throws IOException {
        HttpStatus status = forbidden ? HttpStatus.FORBIDDEN : HttpStatus.UNAUTHORIZED;
        ProblemDetail problemDetail = forbidden
                ? ProblemDetailBuilder.create(
                        HttpStatus.FORBIDDEN,
                        ErrorTypes.ACCESS_DENIED,
                        "Access Denied",
                        "You do not have permission to access this resource",
                        request)
                : ProblemDetailBuilder.create(
                        HttpStatus.UNAUTHORIZED,
                        ErrorTypes.UNAUTHORIZED,
                        "Unauthorized",
                        unauthenticatedDetail(request),
                        request);

        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(problemDetail));
    }

    private static String unauthenticatedDetail(HttpServletRequest request) {
        Object failure = request.getAttribute(FirebaseAuthenticationFilter.AUTH_FAILURE_ATTRIBUTE);
        return failure instanceof InvalidIdTokenException.Reason reason
                ? reason.clientMessage()
                : AUTHENTICATION_REQUIRED;
    }
}
