package com.starscape.memora.features.bookmarks.app;

import com.starscape.memora.common.api.PageMetadata;
import com.starscape.memora.common.exception.ValidationException;
import com.starscape.memora.features.bookmarks.domain.Bookmark;
import com.starscape.memora.features.bookmarks.infra.JpaBookmarkRepository;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import static com.starscape.memora.features.bookmarks.infra.BookmarkSpecifications.inCollection;
import static com.starscape.memora.features.bookmarks.infra.BookmarkSpecifications.matches;
import static com.starscape.memora.features.bookmarks.infra.BookmarkSpecifications.ownedBy;
import static com.starscape.memora.features.bookmarks.infra.BookmarkSpecifications.taggedWith;

/**
 * Handler for listing bookmarks with pagination and filtering.
 * Supports free-text search plus collection and tag filters; pages are 1-based, newest first.
 */
@Service
public class ListBookmarksHandler {
    
    public static final int MAX_PAGE_SIZE = 100;
    
    private final JpaBookmarkRepository bookmarkRepository;
    private final BookmarkViewAssembler viewAssembler;
    
    public ListBookmarksHandler(JpaBookmarkRepository bookmarkRepository, BookmarkViewAssembler viewAssembler) {
        this.bookmarkRepository = bookmarkRepository;
        this.viewAssembler = viewAssembler;
    }
    
    @Transactional(readOnly = true)
    public BookmarkPage handle(
            String userId,
            String search,
            String collectionId,
            String tagId,
            int page,
            int pageSize) {
        
        if (page < 1) {
            throw new ValidationException("page", "Page must be 1 or greater");
        }
        if (pageSize < 1) {
            throw new ValidationException("pageSize", "Page size must be 1 or greater");
        }
        // Limit page size
        pageSize = Math.min(pageSize, MAX_PAGE_SIZE);
        
        Specification<Bookmark> spec = ownedBy(userId);
        if (search != null && !search.isBlank()) {
            spec = spec.and(matches(search));
        }
        if (collectionId != null && !collectionId.isBlank()) {
            spec = spec.and(inCollection(collectionId));
        }
        if (tagId != null && !tagId.isBlank()) {
            spec = spec.and(taggedWith(tagId));
        }
        
        Pageable pageable = PageRequest.of(page - 1, pageSize,
            Sort.by(Sort.Direction.DESC, "createdAt").and(Sort.by(Sort.Direction.DESC, "bookmarkId")));
        Page<Bookmark> result = bookmarkRepository.findAll(spec, pageable);
        
        return new BookmarkPage(
            viewAssembler.assemble(result.getContent()),
            PageMetadata.of(result.getTotalElements(), page, pageSize)
        );
    }
}
