package com.starscape.memora.features.bookmarks.app;

import com.starscape.memora.common.exception.NotFoundException;
import com.starscape.memora.features.bookmarks.api.dto.BookmarkResponse;
import com.starscape.memora.features.bookmarks.domain.BookmarkRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class GetBookmarkHandler {
    
    private final BookmarkRepository bookmarkRepository;
    private final BookmarkViewAssembler viewAssembler;
    
    public GetBookmarkHandler(BookmarkRepository bookmarkRepository, BookmarkViewAssembler viewAssembler) {
        this.bookmarkRepository = bookmarkRepository;
        this.viewAssembler = viewAssembler;
    }
    
    @Transactional(readOnly = true)
    public BookmarkResponse handle(String userId, String bookmarkId) {
        return bookmarkRepository.findByBookmarkIdAndUserId(bookmarkId, userId)
                .map(viewAssembler::assemble)
                .orElseThrow(() -> new NotFoundException("bookmark", "Bookmark not found."));
    }
}
