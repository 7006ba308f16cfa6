package com.starscape.memora.features.bookmarks.app;

import com.starscape.memora.common.domain.Ids;
import com.starscape.memora.features.bookmarks.domain.Bookmark;
import com.starscape.memora.features.bookmarks.domain.BookmarkRepository;
import com.starscape.memora.features.bookmarks.domain.SuggestedDefaults;
import com.starscape.memora.features.collections.domain.BookmarkCollection;
import com.starscape.memora.features.collections.domain.BookmarkCollectionRepository;
import com.starscape.memora.features.metadata.domain.LinkMetadata;
import com.starscape.memora.features.tags.domain.BookmarkTag;
import com.starscape.memora.features.tags.domain.BookmarkTagRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Transactional half of bookmark creation: inserts the row and its seeded links together.
 */
@Service
public class BookmarkWriter {
    
    private static final Logger log = LoggerFactory.getLogger(BookmarkWriter.class);
    
    private final BookmarkRepository bookmarkRepository;
    private final BookmarkTagRepository bookmarkTagRepository;
    private final BookmarkCollectionRepository bookmarkCollectionRepository;
    private final BookmarkDefaultsSuggester defaultsSuggester;
    
    public BookmarkWriter(
            BookmarkRepository bookmarkRepository,
            BookmarkTagRepository bookmarkTagRepository,
            BookmarkCollectionRepository bookmarkCollectionRepository,
            BookmarkDefaultsSuggester defaultsSuggester) {
        this.bookmarkRepository = bookmarkRepository;
        this.bookmarkTagRepository = bookmarkTagRepository;
        this.bookmarkCollectionRepository = bookmarkCollectionRepository;
        this.defaultsSuggester = defaultsSuggester;
    }
    
    /**
     * Insert a bookmark with resolved metadata.
     * 
     * @throws org.springframework.dao.DataIntegrityViolationException if (user, url) already exists
     */
    @Transactional
    public Bookmark insert(String userId, String url, LinkMetadata metadata) {
        // Suggest before inserting so the new bookmark is not its own "most recent"
        SuggestedDefaults defaults = defaultsSuggester.suggest(userId);
        
        String title = metadata.title() != null ? metadata.title() : Bookmark.fallbackTitle(url);
        Bookmark bookmark = bookmarkRepository.saveAndFlush(new Bookmark(
            Ids.next(Ids.BOOKMARK),
            userId,
            url,
            title,
            metadata.description(),
            metadata.imageUrl()
        ));
        
        if (defaults.tagId() != null) {
            bookmarkTagRepository.save(new BookmarkTag(bookmark.getBookmarkId(), defaults.tagId()));
        }
        bookmarkCollectionRepository.save(new BookmarkCollection(bookmark.getBookmarkId(), defaults.collectionId()));
        
        log.info("Bookmark created: bookmarkId={}, userId={}, seededTag={}, collection={}",
            bookmark.getBookmarkId(), userId, defaults.tagId(), defaults.collectionId());
        return bookmark;
    }
}
