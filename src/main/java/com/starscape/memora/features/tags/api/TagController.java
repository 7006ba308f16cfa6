package com.starscape.memora.features.tags.api;

import com.starscape.memora.common.api.ApiResponse;
import com.starscape.memora.common.security.UserPrincipal;
import com.starscape.memora.features.tags.api.dto.TagDetailResponse;
import com.starscape.memora.features.tags.api.dto.TagRequest;
import com.starscape.memora.features.tags.api.dto.TagResponse;
import com.starscape.memora.features.tags.app.TagStore;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Controller for tag management operations.
 */
@RestController
@RequestMapping("/tags")
public class TagController {
    
    private final TagStore tagStore;
    
    public TagController(TagStore tagStore) {
        this.tagStore = tagStore;
    }
    
    /**
     * Create a tag.
     * POST /tags
     */
    @PostMapping
    public ResponseEntity<ApiResponse<TagResponse>> create(
            @Valid @RequestBody TagRequest request,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        var tag = tagStore.create(principal.getUserId(), request.name());
        return ApiResponse.created("Tag created successfully.", TagResponse.from(tag));
    }
    
    /**
     * List the caller's tags with bookmark counts.
     * GET /tags
     */
    @GetMapping
    public ResponseEntity<ApiResponse<List<TagResponse>>> list(
            @AuthenticationPrincipal UserPrincipal principal) {
        
        var tags = tagStore.list(principal.getUserId()).stream()
                .map(TagResponse::from)
                .toList();
        return ApiResponse.ok("Tags retrieved successfully.", tags);
    }
    
    /**
     * Get a tag with the bookmarks it is applied to.
     * GET /tags/{tagId}
     */
    @GetMapping("/{tagId}")
    public ResponseEntity<ApiResponse<TagDetailResponse>> get(
            @PathVariable String tagId,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        var details = tagStore.get(principal.getUserId(), tagId);
        return ApiResponse.ok("Tag retrieved successfully.", TagDetailResponse.from(details));
    }
    
    /**
     * Rename a tag.
     * PUT /tags/{tagId}
     */
    @PutMapping("/{tagId}")
    public ResponseEntity<ApiResponse<TagResponse>> rename(
            @PathVariable String tagId,
            @Valid @RequestBody TagRequest request,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        var tag = tagStore.rename(principal.getUserId(), tagId, request.name());
        return ApiResponse.ok("Tag updated successfully.", TagResponse.from(tag));
    }
    
    /**
     * Delete a tag, detaching it from every bookmark first.
     * DELETE /tags/{tagId}
     */
    @DeleteMapping("/{tagId}")
    public ResponseEntity<ApiResponse<Void>> delete(
            @PathVariable String tagId,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        tagStore.detachAndDelete(principal.getUserId(), tagId);
        return ApiResponse.ok("Tag deleted successfully.", null);
    }
}
