package com.starscape.memora.features.bookmarks.app;

import com.starscape.memora.common.exception.NotFoundException;
import com.starscape.memora.common.exception.ValidationException;
import com.starscape.memora.features.bookmarks.api.dto.BookmarkResponse;
import com.starscape.memora.features.bookmarks.api.dto.CollectionRef;
import com.starscape.memora.features.bookmarks.api.dto.TagRef;
import com.starscape.memora.features.bookmarks.api.dto.UpdateBookmarkRequest;
import com.starscape.memora.features.bookmarks.domain.AssociationDiff;
import com.starscape.memora.features.bookmarks.domain.Bookmark;
import com.starscape.memora.features.bookmarks.domain.BookmarkRepository;
import com.starscape.memora.features.collections.app.CollectionStore;
import com.starscape.memora.features.collections.domain.BookmarkCollection;
import com.starscape.memora.features.collections.domain.BookmarkCollectionRepository;
import com.starscape.memora.features.tags.app.TagStore;
import com.starscape.memora.features.tags.domain.BookmarkTag;
import com.starscape.memora.features.tags.domain.BookmarkTagRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Handler for editing a bookmark.
 * Scalar fields are patched; supplied tag and collection lists replace the current sets
 * by applying the difference, so links present before and after are never removed.
 */
@Service
public class UpdateBookmarkHandler {
    
    private static final Logger log = LoggerFactory.getLogger(UpdateBookmarkHandler.class);
    
    private final BookmarkRepository bookmarkRepository;
    private final BookmarkTagRepository bookmarkTagRepository;
    private final BookmarkCollectionRepository bookmarkCollectionRepository;
    private final TagStore tagStore;
    private final CollectionStore collectionStore;
    private final BookmarkViewAssembler viewAssembler;
    
    public UpdateBookmarkHandler(
            BookmarkRepository bookmarkRepository,
            BookmarkTagRepository bookmarkTagRepository,
            BookmarkCollectionRepository bookmarkCollectionRepository,
            TagStore tagStore,
            CollectionStore collectionStore,
            BookmarkViewAssembler viewAssembler) {
        this.bookmarkRepository = bookmarkRepository;
        this.bookmarkTagRepository = bookmarkTagRepository;
        this.bookmarkCollectionRepository = bookmarkCollectionRepository;
        this.tagStore = tagStore;
        this.collectionStore = collectionStore;
        this.viewAssembler = viewAssembler;
    }
    
    @Transactional
    public BookmarkResponse handle(String userId, String bookmarkId, UpdateBookmarkRequest request) {
        Bookmark bookmark = bookmarkRepository.findByBookmarkIdAndUserId(bookmarkId, userId)
                .orElseThrow(() -> new NotFoundException("bookmark", "Bookmark not found."));
        
        bookmark.patch(request.title(), request.description(), request.imageUrl());
        
        if (request.tags() != null) {
            Set<String> desired = resolveTags(userId, request.tags());
            Set<String> current = bookmarkTagRepository.findByBookmarkId(bookmarkId).stream()
                    .map(BookmarkTag::getTagId)
                    .collect(Collectors.toSet());
            AssociationDiff diff = AssociationDiff.between(current, desired);
            if (!diff.toRemove().isEmpty()) {
                bookmarkTagRepository.deleteByBookmarkIdAndTagIdIn(bookmarkId, diff.toRemove());
            }
            diff.toAdd().forEach(tagId -> bookmarkTagRepository.save(new BookmarkTag(bookmarkId, tagId)));
            log.debug("Bookmark {} tags: +{} -{}", bookmarkId, diff.toAdd().size(), diff.toRemove().size());
        }
        
        if (request.collections() != null) {
            Set<String> desired = resolveCollections(userId, request.collections());
            Set<String> current = bookmarkCollectionRepository.findByBookmarkId(bookmarkId).stream()
                    .map(BookmarkCollection::getCollectionId)
                    .collect(Collectors.toSet());
            AssociationDiff diff = AssociationDiff.between(current, desired);
            if (!diff.toRemove().isEmpty()) {
                bookmarkCollectionRepository.deleteByBookmarkIdAndCollectionIdIn(bookmarkId, diff.toRemove());
            }
            diff.toAdd().forEach(collectionId ->
                bookmarkCollectionRepository.save(new BookmarkCollection(bookmarkId, collectionId)));
            log.debug("Bookmark {} collections: +{} -{}", bookmarkId, diff.toAdd().size(), diff.toRemove().size());
        }
        
        bookmarkRepository.save(bookmark);
        return viewAssembler.assemble(bookmark);
    }
    
    /**
     * Map tag references to tag ids. An owned id wins; otherwise the name is found or created.
     */
    private Set<String> resolveTags(String userId, List<TagRef> refs) {
        Set<String> requestedIds = refs.stream()
                .filter(Objects::nonNull)
                .map(TagRef::id)
                .filter(id -> id != null && !id.isBlank())
                .collect(Collectors.toSet());
        Set<String> ownedIds = tagStore.ownedIds(userId, requestedIds);
        
        Set<String> desired = new LinkedHashSet<>();
        for (TagRef ref : refs) {
            if (ref != null && ref.id() != null && ownedIds.contains(ref.id())) {
                desired.add(ref.id());
            } else if (ref != null && ref.name() != null && !ref.name().isBlank()) {
                desired.add(tagStore.findOrCreate(userId, ref.name()).getTagId());
            } else {
                throw new ValidationException("tags", "Each tag needs an existing id or a non-blank name.");
            }
        }
        return desired;
    }
    
    /**
     * Map collection references to ids the caller owns. Unknown and foreign ids are dropped.
     */
    private Set<String> resolveCollections(String userId, List<CollectionRef> refs) {
        Set<String> requested = refs.stream()
                .filter(Objects::nonNull)
                .map(CollectionRef::id)
                .filter(id -> id != null && !id.isBlank())
                .collect(Collectors.toCollection(LinkedHashSet::new));
        return collectionStore.ownedIds(userId, requested);
    }
}
