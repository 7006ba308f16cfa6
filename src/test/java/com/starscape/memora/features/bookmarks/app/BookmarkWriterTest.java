package com.starscape.memora.features.bookmarks.app;

import com.starscape.memora.features.bookmarks.domain.Bookmark;
import com.starscape.memora.features.bookmarks.domain.BookmarkRepository;
import com.starscape.memora.features.bookmarks.domain.SuggestedDefaults;
import com.starscape.memora.features.collections.domain.BookmarkCollection;
import com.starscape.memora.features.collections.domain.BookmarkCollectionRepository;
import com.starscape.memora.features.metadata.domain.LinkMetadata;
import com.starscape.memora.features.tags.domain.BookmarkTag;
import com.starscape.memora.features.tags.domain.BookmarkTagRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BookmarkWriterTest {
    
    private static final String USER_ID = "usr_1";
    
    @Mock
    private BookmarkRepository bookmarkRepository;
    
    @Mock
    private BookmarkTagRepository bookmarkTagRepository;
    
    @Mock
    private BookmarkCollectionRepository bookmarkCollectionRepository;
    
    @Mock
    private BookmarkDefaultsSuggester defaultsSuggester;
    
    @InjectMocks
    private BookmarkWriter writer;
    
    @BeforeEach
    void setUp() {
        lenient().when(bookmarkRepository.saveAndFlush(any(Bookmark.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
    }
    
    @Test
    void fallsBackToUrlPrefixWhenPageHasNoTitle() {
        String url = "https://example.com/" + "x".repeat(150);
        when(defaultsSuggester.suggest(USER_ID)).thenReturn(new SuggestedDefaults(null, "col_system"));
        
        Bookmark bookmark = writer.insert(USER_ID, url, LinkMetadata.empty());
        
        assertEquals(url.substring(0, 100), bookmark.getTitle());
        assertNull(bookmark.getDescription());
        assertNull(bookmark.getImageUrl());
    }
    
    @Test
    void seedsSuggestedTagAndCollection() {
        when(defaultsSuggester.suggest(USER_ID)).thenReturn(new SuggestedDefaults("tag_work", "col_reading"));
        
        Bookmark bookmark = writer.insert(USER_ID, "https://example.com", new LinkMetadata("Example", null, null));
        
        ArgumentCaptor<BookmarkTag> tagLink = ArgumentCaptor.forClass(BookmarkTag.class);
        ArgumentCaptor<BookmarkCollection> collectionLink = ArgumentCaptor.forClass(BookmarkCollection.class);
        verify(bookmarkTagRepository).save(tagLink.capture());
        verify(bookmarkCollectionRepository).save(collectionLink.capture());
        
        assertEquals("Example", bookmark.getTitle());
        assertEquals(bookmark.getBookmarkId(), tagLink.getValue().getBookmarkId());
        assertEquals("tag_work", tagLink.getValue().getTagId());
        assertEquals("col_reading", collectionLink.getValue().getCollectionId());
    }
    
    @Test
    void skipsTagLinkWhenNothingToSeed() {
        when(defaultsSuggester.suggest(USER_ID)).thenReturn(new SuggestedDefaults(null, "col_system"));
        
        writer.insert(USER_ID, "https://example.com", LinkMetadata.empty());
        
        verifyNoInteractions(bookmarkTagRepository);
        verify(bookmarkCollectionRepository).save(any(BookmarkCollection.class));
    }
}
