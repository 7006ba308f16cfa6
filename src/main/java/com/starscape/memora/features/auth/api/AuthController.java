package com.starscape.memora.features.auth.api;

import com.starscape.memora.common.api.ApiResponse;
import com.starscape.memora.features.auth.api.dto.ForgotPasswordRequest;
import com.starscape.memora.features.auth.api.dto.LoginRequest;
import com.starscape.memora.features.auth.api.dto.LoginResponse;
import com.starscape.memora.features.auth.api.dto.RegisterRequest;
import com.starscape.memora.features.auth.api.dto.ResetPasswordRequest;
import com.starscape.memora.features.auth.app.AuthService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/auth")
public class AuthController {
    
    private final AuthService authService;
    
    public AuthController(AuthService authService) {
        this.authService = authService;
    }
    
    @PostMapping("/register")
    public ResponseEntity<ApiResponse<LoginResponse>> register(@Valid @RequestBody RegisterRequest request) {
        LoginResponse response = authService.register(request);
        return ApiResponse.created("User registered successfully.", response);
    }
    
    @PostMapping("/login")
    public ResponseEntity<ApiResponse<LoginResponse>> login(@Valid @RequestBody LoginRequest request) {
        LoginResponse response = authService.login(request);
        return ApiResponse.ok("Login successful.", response);
    }
    
    /**
     * Always answers 200, whether or not the email is registered.
     */
    @PostMapping("/forgot-password")
    public ResponseEntity<ApiResponse<Void>> forgotPassword(@Valid @RequestBody ForgotPasswordRequest request) {
        authService.forgotPassword(request.email());
        return ApiResponse.ok("If an account exists for this email, a reset link has been sent.", null);
    }
    
    @PostMapping("/reset-password")
    public ResponseEntity<ApiResponse<Void>> resetPassword(@Valid @RequestBody ResetPasswordRequest request) {
        authService.resetPassword(request.token(), request.newPassword());
        return ApiResponse.ok("Password has been reset successfully.", null);
    }
}
