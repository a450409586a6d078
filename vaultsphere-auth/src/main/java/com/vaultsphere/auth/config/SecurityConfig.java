package com.vaultsphere.auth.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vaultsphere.auth.domain.service.JwtService;
import com.vaultsphere.auth.security.AuthRateLimitFilter;
import com.vaultsphere.auth.security.ClientIpResolver;
import com.vaultsphere.auth.security.JwtAuthenticationFilter;
import com.vaultsphere.auth.security.RedisRateLimiter;
import com.vaultsphere.auth.security.RestAuthenticationEntryPoint;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.security.web.header.HeaderWriterFilter;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter;
import org.springframework.security.web.header.writers.StaticHeadersWriter;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;

/**
 * Request pipeline, composed once at startup:
 * security headers, then the auth-surface rate limit, then the bearer token, then authorization rules.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }

    @Bean
    public RedisRateLimiter authRateLimiter(
            StringRedisTemplate redisTemplate,
            @Value("${vaultsphere.auth.rate-limit.max-requests:5}") int maxRequests,
            @Value("${vaultsphere.auth.rate-limit.window:PT15M}") Duration window) {
        return new RedisRateLimiter(redisTemplate, maxRequests, window);
    }

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http,
                                           JwtService jwtService,
                                           RedisRateLimiter authRateLimiter,
                                           ClientIpResolver clientIpResolver,
                                           ObjectMapper objectMapper,
                                           Clock clock) throws Exception {
        // Built here rather than as @Components so the servlet container does not register them twice
        AuthRateLimitFilter rateLimitFilter =
                new AuthRateLimitFilter(authRateLimiter, clientIpResolver, objectMapper, clock);
        JwtAuthenticationFilter jwtAuthenticationFilter = new JwtAuthenticationFilter(jwtService);

        http
            // Disable CSRF for stateless APIs
            .csrf(AbstractHttpConfigurer::disable)
            .httpBasic(AbstractHttpConfigurer::disable)
            .formLogin(AbstractHttpConfigurer::disable)

            // Stateless session management
            .sessionManagement(session -> session
                    .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
            )

            // 1. Security headers
            .headers(headers -> headers
                    .httpStrictTransportSecurity(hsts -> hsts
                            .includeSubDomains(true)
                            .preload(true)
                            .maxAgeInSeconds(31536000))
                    .frameOptions(frame -> frame.deny())
                    .contentTypeOptions(Customizer.withDefaults())
                    .referrerPolicy(referrer -> referrer
                            .policy(ReferrerPolicyHeaderWriter.ReferrerPolicy.STRICT_ORIGIN_WHEN_CROSS_ORIGIN))
                    .contentSecurityPolicy(csp -> csp
                            .policyDirectives("default-src 'self'; object-src 'none'; frame-src 'none'"))
                    .addHeaderWriter(new StaticHeadersWriter("Permissions-Policy",
                            "camera=(), microphone=(), geolocation=()"))
                    .addHeaderWriter(new StaticHeadersWriter("X-Permitted-Cross-Domain-Policies", "none"))
            )

            // 2. Rate limit, 3. Bearer token
            .addFilterAfter(rateLimitFilter, HeaderWriterFilter.class)
            .addFilterBefore(jwtAuthenticationFilter, UsernamePasswordAuthenticationFilter.class)

            .exceptionHandling(exceptions -> exceptions
                    .authenticationEntryPoint(new RestAuthenticationEntryPoint(objectMapper, clock))
            )

            // 4. Authorization Rules
            .authorizeHttpRequests(auth -> auth
                // Public endpoints - Authentication
                .requestMatchers("/auth/login").permitAll()
                .requestMatchers("/auth/login/mfa").permitAll()
                .requestMatchers("/auth/signup").permitAll()

                // API docs and health check endpoints
                .requestMatchers("/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html").permitAll()
                .requestMatchers("/actuator/health", "/actuator/info").permitAll()
                .requestMatchers("/error").permitAll()

                // All other requests require authentication
                .anyRequest().authenticated()
            );

        return http.build();
    }
}
