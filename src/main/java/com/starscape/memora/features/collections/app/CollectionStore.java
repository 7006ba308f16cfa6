package com.starscape.memora.features.collections.app;

import com.starscape.memora.common.config.AccountProperties;
import com.starscape.memora.common.domain.Ids;
import com.starscape.memora.common.exception.ConflictException;
import com.starscape.memora.common.exception.ForbiddenException;
import com.starscape.memora.common.exception.NotFoundException;
import com.starscape.memora.common.exception.ValidationException;
import com.starscape.memora.features.bookmarks.domain.Bookmark;
import com.starscape.memora.features.bookmarks.domain.BookmarkRepository;
import com.starscape.memora.features.collections.domain.BookmarkCollectionRepository;
import com.starscape.memora.features.collections.domain.Collection;
import com.starscape.memora.features.collections.domain.CollectionRepository;
import com.starscape.memora.features.collections.domain.CollectionUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Owns collection lifecycle, including the protected per-user system collection
 * and the delete cascade that moves orphaned bookmarks into it.
 */
@Service
public class CollectionStore {
    
    private static final Logger log = LoggerFactory.getLogger(CollectionStore.class);
    
    private static final String NOT_FOUND = "Collection not found or you do not have permission.";
    
    private final CollectionRepository collectionRepository;
    private final BookmarkCollectionRepository bookmarkCollectionRepository;
    private final BookmarkRepository bookmarkRepository;
    private final AccountProperties accountProperties;
    
    public CollectionStore(
            CollectionRepository collectionRepository,
            BookmarkCollectionRepository bookmarkCollectionRepository,
            BookmarkRepository bookmarkRepository,
            AccountProperties accountProperties) {
        this.collectionRepository = collectionRepository;
        this.bookmarkCollectionRepository = bookmarkCollectionRepository;
        this.bookmarkRepository = bookmarkRepository;
        this.accountProperties = accountProperties;
    }
    
    @Transactional
    public Collection create(String userId, String name) {
        String trimmed = validateName(name);
        if (collectionRepository.existsByUserIdAndName(userId, trimmed)) {
            throw new ConflictException("name", "A collection with this name already exists.");
        }
        Collection collection = collectionRepository.save(
            Collection.create(Ids.next(Ids.COLLECTION), userId, trimmed));
        log.info("Collection created: collectionId={}, userId={}", collection.getCollectionId(), userId);
        return collection;
    }
    
    @Transactional
    public Collection rename(String userId, String collectionId, String name) {
        Collection collection = requireOwned(userId, collectionId);
        if (collection.isSystem()) {
            throw new ForbiddenException("collection", "The system collection cannot be renamed.");
        }
        String trimmed = validateName(name);
        if (collectionRepository.existsByUserIdAndNameAndCollectionIdNot(userId, trimmed, collectionId)) {
            throw new ConflictException("name", "Another collection with this name already exists.");
        }
        collection.rename(trimmed);
        return collectionRepository.save(collection);
    }
    
    @Transactional(readOnly = true)
    public List<CollectionUsage> list(String userId) {
        return collectionRepository.findUsageByUserId(userId);
    }
    
    @Transactional(readOnly = true)
    public Collection get(String userId, String collectionId) {
        return requireOwned(userId, collectionId);
    }
    
    /**
     * Bookmarks linked to the collection, newest first.
     */
    @Transactional(readOnly = true)
    public List<Bookmark> bookmarks(String userId, String collectionId) {
        requireOwned(userId, collectionId);
        return bookmarkRepository.findByCollection(userId, collectionId);
    }
    
    /**
     * Delete a collection. Bookmarks whose only collection is the deleted one are
     * linked to the system collection first; bookmarks with other collections just lose this link.
     * Concurrent deletes for the same user serialize on the system collection row.
     */
    @Transactional
    public void delete(String userId, String collectionId) {
        Collection systemCollection = collectionRepository.lockSystemCollection(userId)
                .orElseThrow(() -> new IllegalStateException("System collection missing for user " + userId));
        
        Collection target = requireOwned(userId, collectionId);
        if (target.isSystem()) {
            throw new ForbiddenException("collection", "The system collection cannot be deleted.");
        }
        
        int relinked = bookmarkCollectionRepository.relinkOrphans(collectionId, systemCollection.getCollectionId());
        bookmarkCollectionRepository.deleteByCollectionId(collectionId);
        int deleted = collectionRepository.deleteNonSystem(collectionId, userId);
        if (deleted == 0) {
            throw new NotFoundException("collection", NOT_FOUND);
        }
        
        log.info("Collection deleted: collectionId={}, userId={}, movedToSystem={}", collectionId, userId, relinked);
    }
    
    /**
     * Create the system collection for a user if it does not exist yet.
     */
    @Transactional
    public Collection ensureSystemCollection(String userId) {
        return collectionRepository.findBySystemTrueAndUserId(userId)
                .orElseGet(() -> collectionRepository.save(Collection.system(
                    Ids.next(Ids.COLLECTION), userId, accountProperties.getSystemCollectionName())));
    }
    
    @Transactional(readOnly = true)
    public Collection requireSystemCollection(String userId) {
        return collectionRepository.findBySystemTrueAndUserId(userId)
                .orElseThrow(() -> new IllegalStateException("System collection missing for user " + userId));
    }
    
    /**
     * Filter the given ids down to collections the user owns. Unknown or foreign ids are dropped.
     */
    @Transactional(readOnly = true)
    public Set<String> ownedIds(String userId, Set<String> collectionIds) {
        if (collectionIds.isEmpty()) {
            return Set.of();
        }
        return collectionRepository.findByUserIdAndCollectionIdIn(userId, collectionIds).stream()
                .map(Collection::getCollectionId)
                .collect(Collectors.toSet());
    }
    
    private Collection requireOwned(String userId, String collectionId) {
        return collectionRepository.findByCollectionIdAndUserId(collectionId, userId)
                .orElseThrow(() -> new NotFoundException("collection", NOT_FOUND));
    }
    
    private static String validateName(String name) {
        try {
            return Collection.validateName(name);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("name", e.getMessage());
        }
    }
}
