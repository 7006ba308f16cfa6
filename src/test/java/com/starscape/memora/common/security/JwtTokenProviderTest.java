package com.starscape.memora.common.security;

import io.jsonwebtoken.Claims;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JwtTokenProviderTest {
    
    private static final String SECRET = "unit-test-secret-key-that-is-at-least-32-bytes";
    
    private final JwtTokenProvider provider = new JwtTokenProvider(SECRET, 60_000, "memora");
    
    @Test
    void roundTripsUserIdAndEmail() {
        String token = provider.generateToken("usr_1", "a@example.com");
        
        UserPrincipal principal = provider.toPrincipal(token);
        
        assertEquals(new UserPrincipal("usr_1", "a@example.com"), principal);
    }
    
    @Test
    void carriesOnlyIdentityClaims() {
        Claims claims = provider.validateToken(provider.generateToken("usr_1", "a@example.com"));
        
        assertEquals("usr_1", claims.getSubject());
        assertEquals("memora", claims.getIssuer());
        assertEquals("a@example.com", claims.get("email", String.class));
        assertFalse(claims.containsKey("scopes"));
    }
    
    @Test
    void rejectsTokenFromOtherIssuer() {
        JwtTokenProvider other = new JwtTokenProvider(SECRET, 60_000, "someone-else");
        String token = other.generateToken("usr_1", "a@example.com");
        
        assertNull(provider.toPrincipal(token));
    }
    
    @Test
    void rejectsExpiredAndGarbageTokens() {
        JwtTokenProvider expiring = new JwtTokenProvider(SECRET, -1_000, "memora");
        String expired = expiring.generateToken("usr_1", "a@example.com");
        
        assertNull(provider.toPrincipal(expired));
        assertNull(provider.toPrincipal("not-a-jwt"));
    }
}
