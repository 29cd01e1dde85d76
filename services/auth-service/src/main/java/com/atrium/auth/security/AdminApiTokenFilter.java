package com.atrium.auth.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Guards {@code /admin/**} with a static shared-secret bearer value.
 *
 * The admin token is unrelated to user access tokens: a valid user JWT never
 * opens the admin surface and the admin token never passes as a user.
 * With no token configured the admin surface answers 503.
 */
@Slf4j
public class AdminApiTokenFilter extends OncePerRequestFilter {

    static final String ADMIN_ROLE = "API_ADMIN";
    private static final String BEARER_PREFIX = "Bearer ";

    private final String apiToken;
    private final ApiErrorWriter errorWriter;

    public AdminApiTokenFilter(String apiToken, ApiErrorWriter errorWriter) {
        this.apiToken = apiToken == null || apiToken.isBlank() ? null : apiToken;
        this.errorWriter = errorWriter;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/admin/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        if (apiToken == null) {
            errorWriter.write(request, response, HttpStatus.SERVICE_UNAVAILABLE, "Admin API is not configured");
            return;
        }
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        String presented = header != null && header.startsWith(BEARER_PREFIX)
                ? header.substring(BEARER_PREFIX.length()).trim()
                : null;
        if (!Digests.constantTimeEquals(apiToken, presented)) {
            log.warn("Rejected admin API call to {} from {}", request.getRequestURI(), request.getRemoteAddr());
            errorWriter.write(request, response, HttpStatus.UNAUTHORIZED, "Invalid API token");
            return;
        }
        var authentication = new UsernamePasswordAuthenticationToken(
                "admin-api", null, List.of(new SimpleGrantedAuthority("ROLE_" + ADMIN_ROLE)));
        SecurityContextHolder.getContext().setAuthentication(authentication);
        chain.doFilter(request, response);
    }
}
