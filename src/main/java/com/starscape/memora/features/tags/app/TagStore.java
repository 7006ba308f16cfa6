package com.starscape.memora.features.tags.app;

import com.starscape.memora.common.config.AccountProperties;
import com.starscape.memora.common.domain.Ids;
import com.starscape.memora.common.exception.ConflictException;
import com.starscape.memora.common.exception.NotFoundException;
import com.starscape.memora.common.exception.ValidationException;
import com.starscape.memora.features.bookmarks.domain.BookmarkRepository;
import com.starscape.memora.features.tags.domain.BookmarkTagRepository;
import com.starscape.memora.features.tags.domain.Tag;
import com.starscape.memora.features.tags.domain.TagRepository;
import com.starscape.memora.features.tags.domain.TagUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Owns tag lifecycle for a user: creation (explicit and implicit), rename,
 * listing and the detach-then-delete cascade.
 * Names are normalized before every lookup or write.
 */
@Service
public class TagStore {
    
    private static final Logger log = LoggerFactory.getLogger(TagStore.class);
    
    private final TagRepository tagRepository;
    private final BookmarkTagRepository bookmarkTagRepository;
    private final BookmarkRepository bookmarkRepository;
    private final AccountProperties accountProperties;
    
    public TagStore(
            TagRepository tagRepository,
            BookmarkTagRepository bookmarkTagRepository,
            BookmarkRepository bookmarkRepository,
            AccountProperties accountProperties) {
        this.tagRepository = tagRepository;
        this.bookmarkTagRepository = bookmarkTagRepository;
        this.bookmarkRepository = bookmarkRepository;
        this.accountProperties = accountProperties;
    }
    
    /**
     * Return the caller's tag with this name, creating it if needed.
     * Safe under concurrent calls with the same name: the loser of the insert race reads the winner's row.
     */
    @Transactional
    public Tag findOrCreate(String userId, String name) {
        String normalized = normalize(name);
        int inserted = tagRepository.insertIfAbsent(Ids.next(Ids.TAG), userId, normalized, Instant.now());
        if (inserted > 0) {
            log.debug("Created tag '{}' for user {}", normalized, userId);
        }
        return tagRepository.findByUserIdAndName(userId, normalized)
                .orElseThrow(() -> new IllegalStateException("Tag missing after insert: " + normalized));
    }
    
    @Transactional
    public Tag create(String userId, String name) {
        String normalized = normalize(name);
        if (tagRepository.existsByUserIdAndName(userId, normalized)) {
            throw new ConflictException("name", "Tag already exists.");
        }
        Tag tag = tagRepository.save(new Tag(Ids.next(Ids.TAG), userId, normalized));
        log.info("Tag created: tagId={}, userId={}", tag.getTagId(), userId);
        return tag;
    }
    
    @Transactional
    public Tag rename(String userId, String tagId, String name) {
        Tag tag = requireOwned(userId, tagId);
        String normalized = normalize(name);
        if (tagRepository.existsByUserIdAndNameAndTagIdNot(userId, normalized, tagId)) {
            throw new ConflictException("name", "Tag already exists.");
        }
        tag.rename(normalized);
        return tagRepository.save(tag);
    }
    
    @Transactional(readOnly = true)
    public List<TagUsage> list(String userId) {
        return tagRepository.findUsageByUserId(userId);
    }
    
    @Transactional(readOnly = true)
    public TagDetails get(String userId, String tagId) {
        Tag tag = requireOwned(userId, tagId);
        return new TagDetails(tag, bookmarkRepository.findSummariesByTag(userId, tagId));
    }
    
    /**
     * Detach the tag from every bookmark, then delete it. Runs as one unit;
     * a failure in either step leaves both the tag and its links intact.
     */
    @Transactional
    public void detachAndDelete(String userId, String tagId) {
        requireOwned(userId, tagId);
        int detached = bookmarkTagRepository.deleteByTagId(tagId);
        int deleted = tagRepository.deleteByTagIdAndUserId(tagId, userId);
        if (deleted == 0) {
            throw new NotFoundException("tag", "Tag not found or not accessible.");
        }
        log.info("Tag deleted: tagId={}, userId={}, detachedFrom={} bookmarks", tagId, userId, detached);
    }
    
    /**
     * Filter the given ids down to tags the user owns.
     */
    @Transactional(readOnly = true)
    public Set<String> ownedIds(String userId, Set<String> tagIds) {
        if (tagIds.isEmpty()) {
            return Set.of();
        }
        return tagRepository.findByUserIdAndTagIdIn(userId, tagIds).stream()
                .map(Tag::getTagId)
                .collect(Collectors.toSet());
    }
    
    /**
     * Create the configured starter tags for a new account.
     */
    @Transactional
    public void seedDefaults(String userId) {
        for (String name : accountProperties.getDefaultTags()) {
            findOrCreate(userId, name);
        }
    }
    
    /**
     * Trim and lower-case a tag name.
     * 
     * @throws ValidationException if the name is blank or too long
     */
    public static String normalize(String name) {
        try {
            return Tag.normalizeName(name);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("name", e.getMessage());
        }
    }
    
    private Tag requireOwned(String userId, String tagId) {
        return tagRepository.findByTagIdAndUserId(tagId, userId)
                .orElseThrow(() -> new NotFoundException("tag", "Tag not found or not accessible."));
    }
}
