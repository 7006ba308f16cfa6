package com.starscape.memora.features.bookmarks.app;

import com.starscape.memora.features.bookmarks.api.dto.BookmarkResponse;
import com.starscape.memora.features.bookmarks.api.dto.CollectionSummary;
import com.starscape.memora.features.bookmarks.api.dto.TagSummary;
import com.starscape.memora.features.bookmarks.domain.Bookmark;
import com.starscape.memora.features.collections.domain.BookmarkCollectionRepository;
import com.starscape.memora.features.collections.domain.CollectionLink;
import com.starscape.memora.features.tags.domain.BookmarkTagRepository;
import com.starscape.memora.features.tags.domain.TagLink;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds bookmark views with their tags and collections.
 * Links for a whole page are loaded with one query per association.
 */
@Component
public class BookmarkViewAssembler {
    
    private final BookmarkTagRepository bookmarkTagRepository;
    private final BookmarkCollectionRepository bookmarkCollectionRepository;
    
    public BookmarkViewAssembler(
            BookmarkTagRepository bookmarkTagRepository,
            BookmarkCollectionRepository bookmarkCollectionRepository) {
        this.bookmarkTagRepository = bookmarkTagRepository;
        this.bookmarkCollectionRepository = bookmarkCollectionRepository;
    }
    
    @Transactional(readOnly = true)
    public BookmarkResponse assemble(Bookmark bookmark) {
        return assemble(List.of(bookmark)).get(0);
    }
    
    @Transactional(readOnly = true)
    public List<BookmarkResponse> assemble(List<Bookmark> bookmarks) {
        if (bookmarks.isEmpty()) {
            return List.of();
        }
        
        Set<String> bookmarkIds = bookmarks.stream()
                .map(Bookmark::getBookmarkId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        
        Map<String, List<TagSummary>> tagsByBookmark = bookmarkTagRepository.findLinksByBookmarkIdIn(bookmarkIds).stream()
                .collect(Collectors.groupingBy(
                    TagLink::bookmarkId,
                    Collectors.mapping(link -> new TagSummary(link.tagId(), link.name()), Collectors.toList())
                ));
        
        Map<String, List<CollectionSummary>> collectionsByBookmark =
                bookmarkCollectionRepository.findLinksByBookmarkIdIn(bookmarkIds).stream()
                .collect(Collectors.groupingBy(
                    CollectionLink::bookmarkId,
                    Collectors.mapping(link -> new CollectionSummary(link.collectionId(), link.name()), Collectors.toList())
                ));
        
        return bookmarks.stream()
                .map(bookmark -> BookmarkResponse.of(
                    bookmark,
                    tagsByBookmark.getOrDefault(bookmark.getBookmarkId(), List.of()),
                    collectionsByBookmark.getOrDefault(bookmark.getBookmarkId(), List.of())))
                .toList();
    }
}
