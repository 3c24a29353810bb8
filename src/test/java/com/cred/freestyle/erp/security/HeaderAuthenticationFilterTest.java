package com.cred.freestyle.erp.security;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for HeaderAuthenticationFilter.
 */
@DisplayName("HeaderAuthenticationFilter Tests")
class HeaderAuthenticationFilterTest {

    private final HeaderAuthenticationFilter filter = new HeaderAuthenticationFilter();

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("Role header - Comma-separated, mixed case: Should map to upper-case ROLE_ authorities")
    void parseAuthorities_MixedCaseList() {
        assertThat(HeaderAuthenticationFilter.parseAuthorities("Admin, manager ,admin"))
                .containsExactly(new SimpleGrantedAuthority("ROLE_ADMIN"), new SimpleGrantedAuthority("ROLE_MANAGER"));
    }

    @Test
    @DisplayName("Role header - Absent: Should default to ROLE_USER")
    void parseAuthorities_Missing_DefaultsToUser() {
        assertThat(HeaderAuthenticationFilter.parseAuthorities(null))
                .containsExactly(new SimpleGrantedAuthority("ROLE_USER"));
        assertThat(HeaderAuthenticationFilter.parseAuthorities("  "))
                .containsExactly(new SimpleGrantedAuthority("ROLE_USER"));
    }

    @Test
    @DisplayName("doFilter - User id present: Should authenticate the request")
    void doFilter_WithUserId_SetsAuthentication() throws Exception {
        // Given
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/backup/list");
        request.addHeader(HeaderAuthenticationFilter.USER_ID_HEADER, " emp-204 ");
        request.addHeader(HeaderAuthenticationFilter.USER_ROLE_HEADER, "manager");
        MockFilterChain chain = new MockFilterChain();

        // When
        filter.doFilter(request, new MockHttpServletResponse(), chain);

        // Then
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        assertThat(authentication).isNotNull();
        assertThat(authentication.getName()).isEqualTo("emp-204");
        assertThat(authentication.getAuthorities()).extracting(GrantedAuthority::getAuthority)
                .containsExactly("ROLE_MANAGER");
        assertThat(SecurityUtils.getCurrentUserId()).isEqualTo("emp-204");
        assertThat(chain.getRequest()).isSameAs(request);
    }

    @Test
    @DisplayName("doFilter - No user id: Should leave the request unauthenticated")
    void doFilter_WithoutUserId_NoAuthentication() throws Exception {
        // Given
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/backup/list");
        request.addHeader(HeaderAuthenticationFilter.USER_ROLE_HEADER, "admin");
        MockFilterChain chain = new MockFilterChain();

        // When
        filter.doFilter(request, new MockHttpServletResponse(), chain);

        // Then
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        assertThat(chain.getRequest()).isSameAs(request);
    }
}
