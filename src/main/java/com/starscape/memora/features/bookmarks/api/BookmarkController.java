package com.starscape.memora.features.bookmarks.api;

import com.starscape.memora.common.api.ApiResponse;
import com.starscape.memora.common.security.UserPrincipal;
import com.starscape.memora.features.bookmarks.api.dto.BookmarkCountResponse;
import com.starscape.memora.features.bookmarks.api.dto.BookmarkResponse;
import com.starscape.memora.features.bookmarks.api.dto.CreateBookmarkRequest;
import com.starscape.memora.features.bookmarks.api.dto.UpdateBookmarkRequest;
import com.starscape.memora.features.bookmarks.app.BookmarkPage;
import com.starscape.memora.features.bookmarks.app.CountBookmarksHandler;
import com.starscape.memora.features.bookmarks.app.CreateBookmarkHandler;
import com.starscape.memora.features.bookmarks.app.DeleteBookmarkHandler;
import com.starscape.memora.features.bookmarks.app.GetBookmarkHandler;
import com.starscape.memora.features.bookmarks.app.ListBookmarksHandler;
import com.starscape.memora.features.bookmarks.app.UpdateBookmarkHandler;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Controller for bookmark operations.
 */
@RestController
@RequestMapping("/bookmarks")
public class BookmarkController {
    
    private final CreateBookmarkHandler createHandler;
    private final UpdateBookmarkHandler updateHandler;
    private final GetBookmarkHandler getHandler;
    private final ListBookmarksHandler listHandler;
    private final CountBookmarksHandler countHandler;
    private final DeleteBookmarkHandler deleteHandler;
    
    public BookmarkController(
            CreateBookmarkHandler createHandler,
            UpdateBookmarkHandler updateHandler,
            GetBookmarkHandler getHandler,
            ListBookmarksHandler listHandler,
            CountBookmarksHandler countHandler,
            DeleteBookmarkHandler deleteHandler) {
        this.createHandler = createHandler;
        this.updateHandler = updateHandler;
        this.getHandler = getHandler;
        this.listHandler = listHandler;
        this.countHandler = countHandler;
        this.deleteHandler = deleteHandler;
    }
    
    /**
     * Save a URL; title, description and preview image are fetched from the page.
     * POST /bookmarks
     */
    @PostMapping
    public ResponseEntity<ApiResponse<BookmarkResponse>> create(
            @RequestBody CreateBookmarkRequest request,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        BookmarkResponse bookmark = createHandler.handle(principal.getUserId(), request.url());
        return ApiResponse.created("Bookmark added successfully.", bookmark);
    }
    
    /**
     * GET /bookmarks?page=1&pageSize=10&search=&collectionId=&tagId=
     */
    @GetMapping
    public ResponseEntity<ApiResponse<List<BookmarkResponse>>> list(
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String collectionId,
            @RequestParam(required = false) String tagId,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "10") int pageSize,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        BookmarkPage result = listHandler.handle(
            principal.getUserId(), search, collectionId, tagId, page, pageSize);
        return ResponseEntity.ok(ApiResponse.page("Bookmarks retrieved successfully.", result.items(), result.metadata()));
    }
    
    @GetMapping("/count")
    public ResponseEntity<ApiResponse<BookmarkCountResponse>> count(
            @AuthenticationPrincipal UserPrincipal principal) {
        
        long count = countHandler.handle(principal.getUserId());
        return ApiResponse.ok("Bookmark count retrieved successfully.", new BookmarkCountResponse(count));
    }
    
    @GetMapping("/{bookmarkId}")
    public ResponseEntity<ApiResponse<BookmarkResponse>> get(
            @PathVariable String bookmarkId,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        return ApiResponse.ok("Bookmark retrieved successfully.", getHandler.handle(principal.getUserId(), bookmarkId));
    }
    
    /**
     * Patch fields and replace tag/collection sets.
     * PUT /bookmarks/{bookmarkId}
     */
    @PutMapping("/{bookmarkId}")
    public ResponseEntity<ApiResponse<BookmarkResponse>> update(
            @PathVariable String bookmarkId,
            @Valid @RequestBody UpdateBookmarkRequest request,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        BookmarkResponse bookmark = updateHandler.handle(principal.getUserId(), bookmarkId, request);
        return ApiResponse.ok("Bookmark updated successfully.", bookmark);
    }
    
    @DeleteMapping("/{bookmarkId}")
    public ResponseEntity<ApiResponse<Void>> delete(
            @PathVariable String bookmarkId,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        deleteHandler.handle(principal.getUserId(), bookmarkId);
        return ApiResponse.ok("Bookmark deleted successfully.", null);
    }
}
