package com.starscape.memora.features.bookmarks.app;

import com.starscape.memora.features.bookmarks.domain.BookmarkRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class CountBookmarksHandler {
    
    private final BookmarkRepository bookmarkRepository;
    
    public CountBookmarksHandler(BookmarkRepository bookmarkRepository) {
        this.bookmarkRepository = bookmarkRepository;
    }
    
    @Transactional(readOnly = true)
    public long handle(String userId) {
        return bookmarkRepository.countByUserId(userId);
    }
}
