package com.starscape.memora.features.collections.api;

import com.starscape.memora.common.api.ApiResponse;
import com.starscape.memora.common.security.UserPrincipal;
import com.starscape.memora.features.bookmarks.api.dto.BookmarkResponse;
import com.starscape.memora.features.bookmarks.app.BookmarkViewAssembler;
import com.starscape.memora.features.collections.api.dto.CollectionRequest;
import com.starscape.memora.features.collections.api.dto.CollectionResponse;
import com.starscape.memora.features.collections.app.CollectionStore;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Controller for collection management operations.
 */
@RestController
@RequestMapping("/collections")
public class CollectionController {
    
    private final CollectionStore collectionStore;
    private final BookmarkViewAssembler viewAssembler;
    
    public CollectionController(CollectionStore collectionStore, BookmarkViewAssembler viewAssembler) {
        this.collectionStore = collectionStore;
        this.viewAssembler = viewAssembler;
    }
    
    @PostMapping
    public ResponseEntity<ApiResponse<CollectionResponse>> create(
            @Valid @RequestBody CollectionRequest request,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        var collection = collectionStore.create(principal.getUserId(), request.name());
        return ApiResponse.created("Collection created successfully.", CollectionResponse.from(collection));
    }
    
    /**
     * List the caller's collections, including the system collection, with bookmark counts.
     * GET /collections
     */
    @GetMapping
    public ResponseEntity<ApiResponse<List<CollectionResponse>>> list(
            @AuthenticationPrincipal UserPrincipal principal) {
        
        var collections = collectionStore.list(principal.getUserId()).stream()
                .map(CollectionResponse::from)
                .toList();
        return ApiResponse.ok("Collections retrieved successfully.", collections);
    }
    
    @GetMapping("/{collectionId}")
    public ResponseEntity<ApiResponse<CollectionResponse>> get(
            @PathVariable String collectionId,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        var collection = collectionStore.get(principal.getUserId(), collectionId);
        return ApiResponse.ok("Collection retrieved successfully.", CollectionResponse.from(collection));
    }
    
    /**
     * Bookmarks in a collection, newest first.
     * GET /collections/{collectionId}/bookmarks
     */
    @GetMapping("/{collectionId}/bookmarks")
    public ResponseEntity<ApiResponse<List<BookmarkResponse>>> bookmarks(
            @PathVariable String collectionId,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        var bookmarks = viewAssembler.assemble(collectionStore.bookmarks(principal.getUserId(), collectionId));
        return ApiResponse.ok("Bookmarks retrieved successfully.", bookmarks);
    }
    
    @PutMapping("/{collectionId}")
    public ResponseEntity<ApiResponse<CollectionResponse>> rename(
            @PathVariable String collectionId,
            @Valid @RequestBody CollectionRequest request,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        var collection = collectionStore.rename(principal.getUserId(), collectionId, request.name());
        return ApiResponse.ok("Collection updated successfully.", CollectionResponse.from(collection));
    }
    
    /**
     * Delete a collection; bookmarks left without a collection move to the system collection.
     * DELETE /collections/{collectionId}
     */
    @DeleteMapping("/{collectionId}")
    public ResponseEntity<ApiResponse<Void>> delete(
            @PathVariable String collectionId,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        collectionStore.delete(principal.getUserId(), collectionId);
        return ApiResponse.ok("Collection deleted successfully.", null);
    }
}
