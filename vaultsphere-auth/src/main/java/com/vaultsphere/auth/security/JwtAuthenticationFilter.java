package com.vaultsphere.auth.security;

import com.vaultsphere.auth.domain.exception.InvalidTokenException;
import com.vaultsphere.auth.domain.model.SessionClaims;
import com.vaultsphere.auth.domain.service.JwtService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

import static com.vaultsphere.auth.domain.constants.AuthConstants.BEARER_PREFIX;

/**
 * Bearer-token authentication for protected routes.
 * Only ACCESS tokens authenticate; an MFA_PENDING token is treated like no token.
 * The principal is the verified {@link SessionClaims}.
 */
@Slf4j
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    static final String AUTH_ERROR_ATTRIBUTE = "vaultsphere.auth.tokenError";

    private final JwtService jwtService;

    public JwtAuthenticationFilter(JwtService jwtService) {
        this.jwtService = jwtService;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);

        if (header != null && header.startsWith(BEARER_PREFIX)) {
            String token = header.substring(BEARER_PREFIX.length()).trim();
            try {
                SessionClaims claims = jwtService.verifyAccessToken(token);

                String authority = "ROLE_" + claims.getRole().toString().toUpperCase(Locale.ROOT);
                UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                        claims, null, List.of(new SimpleGrantedAuthority(authority)));
                SecurityContextHolder.getContext().setAuthentication(authentication);

                log.debug("[AUTH_TOKEN_ACCEPTED] Request authenticated | accountId={} | role={}",
                        claims.getAccountId(), claims.getRole());
            } catch (InvalidTokenException e) {
                SecurityContextHolder.clearContext();
                request.setAttribute(AUTH_ERROR_ATTRIBUTE, e.getMessage());
                log.debug("[AUTH_TOKEN_REJECTED] Bearer token rejected | path={} | reason={}",
                        request.getRequestURI(), e.getMessage());
            }
        }

        filterChain.doFilter(request, response);
    }
}
