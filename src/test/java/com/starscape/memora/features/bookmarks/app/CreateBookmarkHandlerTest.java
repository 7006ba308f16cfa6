package com.starscape.memora.features.bookmarks.app;

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.starscape.memora.common.exception.ConflictException;
import com.starscape.memora.common.exception.ValidationException;
import com.starscape.memora.features.bookmarks.api.dto.BookmarkResponse;
import com.starscape.memora.features.bookmarks.domain.Bookmark;
import com.starscape.memora.features.bookmarks.domain.BookmarkRepository;
import com.starscape.memora.features.metadata.app.MetadataResolver;
import com.starscape.memora.features.metadata.domain.LinkMetadata;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;

import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CreateBookmarkHandlerTest {
    
    private static final String USER_ID = "usr_1";
    private static final String URL = "https://example.com/post";
    
    @Mock
    private BookmarkRepository bookmarkRepository;
    
    @Mock
    private MetadataResolver metadataResolver;
    
    @Mock
    private BookmarkWriter bookmarkWriter;
    
    @Mock
    private BookmarkViewAssembler viewAssembler;
    
    @InjectMocks
    private CreateBookmarkHandler handler;
    
    @Test
    void rejectsNonStringUrl() {
        ValidationException ex = assertThrows(ValidationException.class,
            () -> handler.handle(USER_ID, IntNode.valueOf(42)));
        
        assertEquals("url", ex.getField());
        verifyNoInteractions(metadataResolver, bookmarkWriter);
    }
    
    @Test
    void rejectsMissingOrBlankUrl() {
        assertThrows(ValidationException.class, () -> handler.handle(USER_ID, null));
        assertThrows(ValidationException.class, () -> handler.handle(USER_ID, NullNode.getInstance()));
        assertThrows(ValidationException.class, () -> handler.handle(USER_ID, TextNode.valueOf("   ")));
    }
    
    @Test
    void duplicateUrlIsConflictWithoutFetching() {
        when(bookmarkRepository.existsByUserIdAndUrl(USER_ID, URL)).thenReturn(true);
        
        assertThrows(ConflictException.class, () -> handler.handle(USER_ID, TextNode.valueOf(URL)));
        verifyNoInteractions(metadataResolver, bookmarkWriter);
    }
    
    @Test
    void passesResolvedMetadataToWriter() {
        LinkMetadata metadata = new LinkMetadata("Title", "Desc", "https://example.com/img.png");
        Bookmark bookmark = new Bookmark("bm_1", USER_ID, URL, "Title", "Desc", "https://example.com/img.png");
        BookmarkResponse response = BookmarkResponse.of(bookmark, List.of(), List.of());
        when(bookmarkRepository.existsByUserIdAndUrl(USER_ID, URL)).thenReturn(false);
        when(metadataResolver.resolve(URL)).thenReturn(metadata);
        when(bookmarkWriter.insert(USER_ID, URL, metadata)).thenReturn(bookmark);
        when(viewAssembler.assemble(bookmark)).thenReturn(response);
        
        BookmarkResponse result = handler.handle(USER_ID, TextNode.valueOf("  " + URL + " "));
        
        assertSame(response, result);
    }
    
    @Test
    void racingDuplicateInsertIsConflict() {
        when(bookmarkRepository.existsByUserIdAndUrl(USER_ID, URL)).thenReturn(false);
        when(metadataResolver.resolve(URL)).thenReturn(LinkMetadata.empty());
        when(bookmarkWriter.insert(eq(USER_ID), eq(URL), any()))
                .thenThrow(new DataIntegrityViolationException("bookmarks_user_url_unique"));
        
        ConflictException ex = assertThrows(ConflictException.class,
            () -> handler.handle(USER_ID, TextNode.valueOf(URL)));
        assertEquals("url", ex.getField());
    }
    
    @Test
    void urlConstraintReportedByHibernateIsDuplicateConflict() {
        when(bookmarkRepository.existsByUserIdAndUrl(USER_ID, URL)).thenReturn(false);
        when(metadataResolver.resolve(URL)).thenReturn(LinkMetadata.empty());
        when(bookmarkWriter.insert(eq(USER_ID), eq(URL), any())).thenThrow(new DataIntegrityViolationException(
            "could not execute statement",
            new ConstraintViolationException("could not execute statement",
                new SQLException("duplicate key value"), "bookmarks_user_url_unique")));
        
        ConflictException ex = assertThrows(ConflictException.class,
            () -> handler.handle(USER_ID, TextNode.valueOf(URL)));
        assertEquals("url", ex.getField());
        assertEquals(CreateBookmarkHandler.DUPLICATE_MESSAGE, ex.getMessage());
    }
    
    @Test
    void foreignKeyFailureIsNotReportedAsDuplicateUrl() {
        String fk = "bookmark_collections_collection_id_fkey";
        when(bookmarkRepository.existsByUserIdAndUrl(USER_ID, URL)).thenReturn(false);
        when(metadataResolver.resolve(URL)).thenReturn(LinkMetadata.empty());
        when(bookmarkWriter.insert(eq(USER_ID), eq(URL), any())).thenThrow(new DataIntegrityViolationException(
            "could not execute statement",
            new ConstraintViolationException("could not execute statement",
                new SQLException("insert or update violates foreign key constraint \"" + fk + "\""), fk)));
        
        ConflictException ex = assertThrows(ConflictException.class,
            () -> handler.handle(USER_ID, TextNode.valueOf(URL)));
        assertEquals("bookmark", ex.getField());
        assertNotEquals(CreateBookmarkHandler.DUPLICATE_MESSAGE, ex.getMessage());
    }
}
