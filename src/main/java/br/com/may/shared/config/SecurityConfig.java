package br.com.may.shared.config;

import br.com.may.features.auth.infra.security.JwtAuthenticationFilter;
import br.com.may.features.auth.infra.security.JwtTokenService;
import br.com.may.shared.api.problem.ErrorTypes;
import br.com.may.shared.api.problem.ProblemDetailBuilder;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

import java.io.IOException;

@Configuration
@RequiredArgsConstructor
@EnableMethodSecurity
public class SecurityConfig {

    private final JwtTokenService jwtTokenService;
    private final ObjectMapper objectMapper;

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity httpSecurity) throws Exception {
        httpSecurity
                .csrf(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)
                .httpBasic(AbstractHttpConfigurer::disable)
                .sessionManagement(sessionManagement -> sessionManagement.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .exceptionHandling(handler -> handler
                        .authenticationEntryPoint((request, response, ex) -> writeAuthResponse(request, response, false))
                        .accessDeniedHandler((request, response, ex) -> writeAuthResponse(request, response, true)))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                        // Gateways call webhooks without a user session; the controller authenticates them
                        .requestMatchers(HttpMethod.POST, "/api/subscriptions/webhook").permitAll()
                        .requestMatchers(HttpMethod.POST, "/api/subscriptions/webhook/stripe").permitAll()
                        .requestMatchers(HttpMethod.GET, "/api/subscriptions/webhook/config").permitAll()
                        // Card tokenization happens before login on the checkout page
                        .requestMatchers(HttpMethod.POST, "/api/subscriptions/tokenize-card").permitAll()
                        .requestMatchers("/api/subscriptions/**").authenticated()
                        .requestMatchers(HttpMethod.GET, "/v3/api-docs/**").permitAll()
                        .requestMatchers(HttpMethod.GET, "/swagger-ui/**").permitAll()
                        .requestMatchers(HttpMethod.GET, "/actuator/health").permitAll()
                        .requestMatchers(HttpMethod.GET, "/actuator/health/**").permitAll()
                        .anyRequest().authenticated())
                .addFilterBefore(new JwtAuthenticationFilter(jwtTokenService), UsernamePasswordAuthenticationFilter.class);

        return httpSecurity.build();
    }

    private void writeAuthResponse(HttpServletRequest request, HttpServletResponse response, boolean forbidden) throws IOException {
        HttpStatus status = forbidden ? HttpStatus.FORBIDDEN : HttpStatus.UNAUTHORIZED;
        ProblemDetail problemDetail = forbidden
                ? ProblemDetailBuilder.create(
                        HttpStatus.FORBIDDEN,
                        ErrorTypes.ACCESS_DENIED,
                        "Access Denied",
                        "You do not have permission to access this resource",
                        "ACCESS_DENIED",
                        request)
                : ProblemDetailBuilder.create(
                        HttpStatus.UNAUTHORIZED,
                        ErrorTypes.UNAUTHORIZED,
                        "Unauthorized",
                        "Authentication is required to access this resource",
                        "UNAUTHORIZED",
                        request);

        response.setStatus(status.value());
        response.setContentType("application/problem+json");
        response.getWriter().write(objectMapper.writeValueAsString(problemDetail));
    }
}
