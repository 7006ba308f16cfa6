package com.starscape.memora.features.user.api;

import com.starscape.memora.common.api.ApiResponse;
import com.starscape.memora.common.security.UserPrincipal;
import com.starscape.memora.features.user.api.dto.UpdateProfileRequest;
import com.starscape.memora.features.user.api.dto.UserProfileResponse;
import com.starscape.memora.features.user.app.UserProfileHandler;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/user")
public class UserController {
    
    private final UserProfileHandler profileHandler;
    
    public UserController(UserProfileHandler profileHandler) {
        this.profileHandler = profileHandler;
    }
    
    @GetMapping
    public ResponseEntity<ApiResponse<UserProfileResponse>> get(
            @AuthenticationPrincipal UserPrincipal principal) {
        
        var user = profileHandler.get(principal.getUserId());
        return ApiResponse.ok("User information retrieved successfully.", UserProfileResponse.from(user));
    }
    
    @PutMapping
    public ResponseEntity<ApiResponse<UserProfileResponse>> update(
            @Valid @RequestBody UpdateProfileRequest request,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        var user = profileHandler.updateDisplayName(principal.getUserId(), request.displayName());
        return ApiResponse.ok("User information updated successfully.", UserProfileResponse.from(user));
    }
}
