package com.vaultsphere.auth.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vaultsphere.auth.api.dto.ApiErrorResponse;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;

import static com.vaultsphere.auth.domain.constants.AuthConstants.TRACE_ID_HEADER;

/**
 * Coarse per-IP limit on the authentication surface.
 * Sits in front of the AuthGate; the per-account lockout is enforced separately.
 * Fails open when Redis is unreachable.
 */
@Slf4j
public class AuthRateLimitFilter extends OncePerRequestFilter {

    static final List<String> LIMITED_PATHS = List.of(
            "/auth/login",
            "/auth/login/mfa",
            "/auth/signup",
            "/auth/mfa/**"
    );

    private final RedisRateLimiter rateLimiter;
    private final ClientIpResolver clientIpResolver;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    public AuthRateLimitFilter(RedisRateLimiter rateLimiter,
                               ClientIpResolver clientIpResolver,
                               ObjectMapper objectMapper,
                               Clock clock) {
        this.rateLimiter = rateLimiter;
        this.clientIpResolver = clientIpResolver;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return LIMITED_PATHS.stream().noneMatch(pattern -> pathMatcher.match(pattern, path));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String clientIp = clientIpResolver.resolve(request);

        RedisRateLimiter.RateLimitResult result;
        try {
            result = rateLimiter.tryAcquire(clientIp);
        } catch (RuntimeException e) {
            log.warn("[RATE_LIMIT_UNAVAILABLE] Redis unreachable, allowing request | ip={} | error={}",
                    clientIp, e.getMessage());
            filterChain.doFilter(request, response);
            return;
        }

        response.setHeader("X-RateLimit-Limit", String.valueOf(rateLimiter.getMaxRequests()));
        response.setHeader("X-RateLimit-Remaining", String.valueOf(result.getRemaining()));

        if (!result.isAllowed()) {
            log.warn("[RATE_LIMIT_EXCEEDED] Auth rate limit exceeded | ip={} | path={} | retryAfter={}s",
                    clientIp, request.getRequestURI(), result.getRetryAfterSeconds());
            writeRateLimited(request, response, result.getRetryAfterSeconds());
            return;
        }

        filterChain.doFilter(request, response);
    }

    private void writeRateLimited(HttpServletRequest request, HttpServletResponse response,
                                  long retryAfterSeconds) throws IOException {
        ApiErrorResponse error = new ApiErrorResponse(
                "RATE_LIMIT_EXCEEDED",
                "Too many authentication attempts, please try again later",
                request.getHeader(TRACE_ID_HEADER),
                clock.instant()
        );

        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setHeader("Retry-After", String.valueOf(retryAfterSeconds));
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(), error);
    }
}
