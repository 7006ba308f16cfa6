package com.starscape.memora.features.bookmarks.app;

import com.starscape.memora.common.exception.NotFoundException;
import com.starscape.memora.features.bookmarks.domain.BookmarkRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Handler for deleting a bookmark. Tag and collection links are removed by the database cascade.
 */
@Service
public class DeleteBookmarkHandler {
    
    private static final Logger log = LoggerFactory.getLogger(DeleteBookmarkHandler.class);
    
    private final BookmarkRepository bookmarkRepository;
    
    public DeleteBookmarkHandler(BookmarkRepository bookmarkRepository) {
        this.bookmarkRepository = bookmarkRepository;
    }
    
    @Transactional
    public void handle(String userId, String bookmarkId) {
        int deleted = bookmarkRepository.deleteByBookmarkIdAndUserId(bookmarkId, userId);
        if (deleted == 0) {
            throw new NotFoundException("bookmark", "Bookmark not found or you do not have permission.");
        }
        log.info("Bookmark deleted: bookmarkId={}, userId={}", bookmarkId, userId);
    }
}
