package com.starscape.memora.common.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.memora.common.api.ApiError;
import com.starscape.memora.common.api.ApiResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

import java.io.IOException;
import java.util.List;

/**
 * Writes the standard envelope for unauthenticated access to protected routes.
 */
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {
    
    private final ObjectMapper objectMapper;
    
    public RestAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }
    
    @Override
    public void commence(
            HttpServletRequest request,
            HttpServletResponse response,
            AuthenticationException authException) throws IOException {
        
        ApiResponse<Void> body = ApiResponse.failure(
            HttpStatus.UNAUTHORIZED,
            "Unauthorized",
            List.of(new ApiError("auth", "Bearer token is missing, invalid or expired."))
        );
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), body);
    }
}
