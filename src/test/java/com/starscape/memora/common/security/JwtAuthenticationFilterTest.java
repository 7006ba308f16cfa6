package com.starscape.memora.common.security;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import static org.junit.jupiter.api.Assertions.*;

class JwtAuthenticationFilterTest {
    
    private static final String SECRET = "unit-test-secret-key-that-is-at-least-32-bytes";
    
    private final JwtTokenProvider provider = new JwtTokenProvider(SECRET, 60_000, "memora");
    private final JwtAuthenticationFilter filter = new JwtAuthenticationFilter(provider);
    
    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }
    
    @Test
    void authenticatesBearerTokenAsPrincipalWithoutAuthorities() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/bookmarks");
        request.addHeader("Authorization", "Bearer " + provider.generateToken("usr_1", "a@example.com"));
        
        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());
        
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        assertNotNull(authentication);
        assertTrue(authentication.isAuthenticated());
        assertEquals(new UserPrincipal("usr_1", "a@example.com"), authentication.getPrincipal());
        assertTrue(authentication.getAuthorities().isEmpty());
    }
    
    @Test
    void leavesRequestUnauthenticatedForInvalidToken() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/bookmarks");
        request.addHeader("Authorization", "Bearer not-a-jwt");
        MockFilterChain chain = new MockFilterChain();
        
        filter.doFilter(request, new MockHttpServletResponse(), chain);
        
        assertNull(SecurityContextHolder.getContext().getAuthentication());
        assertNotNull(chain.getRequest());
    }
}
