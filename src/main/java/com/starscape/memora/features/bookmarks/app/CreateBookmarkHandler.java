package com.starscape.memora.features.bookmarks.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.starscape.memora.common.exception.ConflictException;
import com.starscape.memora.common.exception.ValidationException;
import com.starscape.memora.features.bookmarks.api.dto.BookmarkResponse;
import com.starscape.memora.features.bookmarks.domain.Bookmark;
import com.starscape.memora.features.bookmarks.domain.BookmarkRepository;
import com.starscape.memora.features.metadata.app.MetadataResolver;
import com.starscape.memora.features.metadata.domain.LinkMetadata;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Handler for saving a new URL.
 * Not transactional itself: the metadata fetch happens before any database transaction is opened,
 * and the insert runs in {@link BookmarkWriter}.
 */
@Service
public class CreateBookmarkHandler {
    
    private static final Logger log = LoggerFactory.getLogger(CreateBookmarkHandler.class);
    
    static final String DUPLICATE_MESSAGE = "Bookmark with this URL already exists.";
    static final String URL_CONSTRAINT = "bookmarks_user_url_unique";
    
    private final BookmarkRepository bookmarkRepository;
    private final MetadataResolver metadataResolver;
    private final BookmarkWriter bookmarkWriter;
    private final BookmarkViewAssembler viewAssembler;
    
    public CreateBookmarkHandler(
            BookmarkRepository bookmarkRepository,
            MetadataResolver metadataResolver,
            BookmarkWriter bookmarkWriter,
            BookmarkViewAssembler viewAssembler) {
        this.bookmarkRepository = bookmarkRepository;
        this.metadataResolver = metadataResolver;
        this.bookmarkWriter = bookmarkWriter;
        this.viewAssembler = viewAssembler;
    }
    
    public BookmarkResponse handle(String userId, JsonNode urlNode) {
        if (urlNode == null || !urlNode.isTextual() || urlNode.asText().isBlank()) {
            throw new ValidationException("url", "URL is required and must be a valid string.");
        }
        String url = urlNode.asText().trim();
        
        if (bookmarkRepository.existsByUserIdAndUrl(userId, url)) {
            throw new ConflictException("url", DUPLICATE_MESSAGE);
        }
        
        LinkMetadata metadata = metadataResolver.resolve(url);
        if (metadata.isEmpty()) {
            log.debug("No metadata found for {}, using URL as title", url);
        }
        
        Bookmark bookmark;
        try {
            bookmark = bookmarkWriter.insert(userId, url, metadata);
        } catch (DataIntegrityViolationException e) {
            if (violates(e, URL_CONSTRAINT)) {
                // Lost a race with a concurrent save of the same URL
                throw new ConflictException("url", DUPLICATE_MESSAGE);
            }
            // A seeded tag or collection was deleted between suggestion and insert
            log.warn("Bookmark insert for user {} rejected: {}", userId, e.getMostSpecificCause().getMessage());
            throw new ConflictException("bookmark",
                "A tag or collection changed while the bookmark was being saved. Please retry.");
        }
        return viewAssembler.assemble(bookmark);
    }
    
    /**
     * Whether the violation came from the named constraint, by Hibernate's extracted
     * constraint name or, failing that, the driver message.
     */
    static boolean violates(DataIntegrityViolationException e, String constraintName) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException violation
                    && constraintName.equalsIgnoreCase(violation.getConstraintName())) {
                return true;
            }
        }
        String message = e.getMostSpecificCause().getMessage();
        return message != null && message.contains(constraintName);
    }
}
