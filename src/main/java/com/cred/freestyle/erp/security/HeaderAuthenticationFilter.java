package com.cred.freestyle.erp.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Custom authentication filter that extracts user identity from HTTP headers.
 *
 * Header-based Authentication:
 * - X-User-Id: User identifier (required for authenticated requests)
 * - X-User-Role: Comma-separated ERP roles, e.g. "admin" or "manager,accountant"
 *   (optional, defaults to USER)
 *
 * ERP role names are case-insensitive; each becomes a ROLE_-prefixed upper-case authority,
 * so "manager" is checked with hasRole('MANAGER').
 *
 * @author ERP Platform Team
 */
public class HeaderAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(HeaderAuthenticationFilter.class);

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ROLE_HEADER = "X-User-Role";

    private static final String DEFAULT_ROLE = "USER";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        String userId = request.getHeader(USER_ID_HEADER);

        if (userId != null && !userId.isBlank()) {
            List<SimpleGrantedAuthority> authorities = parseAuthorities(request.getHeader(USER_ROLE_HEADER));

            UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(userId.trim(), null, authorities);

            SecurityContextHolder.getContext().setAuthentication(authentication);

            logger.debug("Authenticated user: {} with roles: {}", userId, authorities);
        } else {
            logger.debug("No {} header found, request will be unauthenticated", USER_ID_HEADER);
        }

        filterChain.doFilter(request, response);
    }

    static List<SimpleGrantedAuthority> parseAuthorities(String roleHeader) {
        if (roleHeader == null || roleHeader.isBlank()) {
            return List.of(new SimpleGrantedAuthority("ROLE_" + DEFAULT_ROLE));
        }

        return Arrays.stream(roleHeader.split(","))
            .map(String::trim)
            .filter(role -> !role.isEmpty())
            .map(role -> role.toUpperCase(Locale.ROOT))
            .map(role -> role.startsWith("ROLE_") ? role : "ROLE_" + role)
            .distinct()
            .map(SimpleGrantedAuthority::new)
            .collect(Collectors.toList());
    }
}
