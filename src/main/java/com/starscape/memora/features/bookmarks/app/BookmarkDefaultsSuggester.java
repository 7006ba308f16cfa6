package com.starscape.memora.features.bookmarks.app;

import com.starscape.memora.features.bookmarks.domain.Bookmark;
import com.starscape.memora.features.bookmarks.domain.BookmarkRepository;
import com.starscape.memora.features.bookmarks.domain.SuggestedDefaults;
import com.starscape.memora.features.collections.app.CollectionStore;
import com.starscape.memora.features.collections.domain.BookmarkCollection;
import com.starscape.memora.features.collections.domain.BookmarkCollectionRepository;
import com.starscape.memora.features.tags.domain.BookmarkTag;
import com.starscape.memora.features.tags.domain.BookmarkTagRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Chooses the initial tag and collection for a new bookmark from the user's most recent one:
 * its earliest-linked tag and earliest-linked collection. Falls back to the system collection
 * when there is no previous bookmark or it has no collection.
 */
@Component
public class BookmarkDefaultsSuggester {
    
    private final BookmarkRepository bookmarkRepository;
    private final BookmarkTagRepository bookmarkTagRepository;
    private final BookmarkCollectionRepository bookmarkCollectionRepository;
    private final CollectionStore collectionStore;
    
    public BookmarkDefaultsSuggester(
            BookmarkRepository bookmarkRepository,
            BookmarkTagRepository bookmarkTagRepository,
            BookmarkCollectionRepository bookmarkCollectionRepository,
            CollectionStore collectionStore) {
        this.bookmarkRepository = bookmarkRepository;
        this.bookmarkTagRepository = bookmarkTagRepository;
        this.bookmarkCollectionRepository = bookmarkCollectionRepository;
        this.collectionStore = collectionStore;
    }
    
    @Transactional(readOnly = true)
    public SuggestedDefaults suggest(String userId) {
        Optional<String> latestId = bookmarkRepository.findFirstByUserIdOrderByCreatedAtDesc(userId)
                .map(Bookmark::getBookmarkId);
        
        String tagId = latestId
                .flatMap(bookmarkTagRepository::findFirstByBookmarkIdOrderByCreatedAtAsc)
                .map(BookmarkTag::getTagId)
                .orElse(null);
        
        String collectionId = latestId
                .flatMap(bookmarkCollectionRepository::findFirstByBookmarkIdOrderByCreatedAtAsc)
                .map(BookmarkCollection::getCollectionId)
                .orElseGet(() -> collectionStore.requireSystemCollection(userId).getCollectionId());
        
        return new SuggestedDefaults(tagId, collectionId);
    }
}
