package com.starscape.memora.features.tags.app;

import com.starscape.memora.common.config.AccountProperties;
import com.starscape.memora.common.exception.ConflictException;
import com.starscape.memora.common.exception.NotFoundException;
import com.starscape.memora.common.exception.ValidationException;
import com.starscape.memora.features.bookmarks.domain.BookmarkRepository;
import com.starscape.memora.features.tags.domain.BookmarkTagRepository;
import com.starscape.memora.features.tags.domain.Tag;
import com.starscape.memora.features.tags.domain.TagRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TagStoreTest {
    
    private static final String USER_ID = "usr_1";
    
    @Mock
    private TagRepository tagRepository;
    
    @Mock
    private BookmarkTagRepository bookmarkTagRepository;
    
    @Mock
    private BookmarkRepository bookmarkRepository;
    
    private AccountProperties accountProperties;
    private TagStore tagStore;
    
    @BeforeEach
    void setUp() {
        accountProperties = new AccountProperties();
        tagStore = new TagStore(tagRepository, bookmarkTagRepository, bookmarkRepository, accountProperties);
    }
    
    @Test
    void normalizeTrimsAndLowercases() {
        assertEquals("work", TagStore.normalize("Work "));
        assertEquals("work", TagStore.normalize(" work"));
        assertEquals("deep work", TagStore.normalize("  Deep Work  "));
    }
    
    @Test
    void normalizeRejectsBlank() {
        ValidationException ex = assertThrows(ValidationException.class, () -> TagStore.normalize("   "));
        assertEquals("name", ex.getField());
    }
    
    @Test
    void findOrCreateReturnsExistingRowWhenInsertIsNoOp() {
        Tag existing = new Tag("tag_existing", USER_ID, "work");
        when(tagRepository.insertIfAbsent(anyString(), eq(USER_ID), eq("work"), any(Instant.class))).thenReturn(0);
        when(tagRepository.findByUserIdAndName(USER_ID, "work")).thenReturn(Optional.of(existing));
        
        Tag result = tagStore.findOrCreate(USER_ID, " Work ");
        
        assertSame(existing, result);
    }
    
    @Test
    void createRejectsDuplicateNormalizedName() {
        when(tagRepository.existsByUserIdAndName(USER_ID, "reading")).thenReturn(true);
        
        assertThrows(ConflictException.class, () -> tagStore.create(USER_ID, "Reading"));
        verify(tagRepository, never()).save(any());
    }
    
    @Test
    void createSavesNormalizedTag() {
        when(tagRepository.existsByUserIdAndName(USER_ID, "reading")).thenReturn(false);
        when(tagRepository.save(any(Tag.class))).thenAnswer(invocation -> invocation.getArgument(0));
        
        Tag tag = tagStore.create(USER_ID, " Reading");
        
        assertEquals("reading", tag.getName());
        assertTrue(tag.getTagId().startsWith("tag_"));
    }
    
    @Test
    void renameRejectsNameUsedByAnotherTag() {
        Tag tag = new Tag("tag_1", USER_ID, "old");
        when(tagRepository.findByTagIdAndUserId("tag_1", USER_ID)).thenReturn(Optional.of(tag));
        when(tagRepository.existsByUserIdAndNameAndTagIdNot(USER_ID, "taken", "tag_1")).thenReturn(true);
        
        assertThrows(ConflictException.class, () -> tagStore.rename(USER_ID, "tag_1", "Taken"));
        assertEquals("old", tag.getName());
    }
    
    @Test
    void detachAndDeleteRemovesLinksBeforeTag() {
        when(tagRepository.findByTagIdAndUserId("tag_1", USER_ID))
                .thenReturn(Optional.of(new Tag("tag_1", USER_ID, "work")));
        when(bookmarkTagRepository.deleteByTagId("tag_1")).thenReturn(3);
        when(tagRepository.deleteByTagIdAndUserId("tag_1", USER_ID)).thenReturn(1);
        
        tagStore.detachAndDelete(USER_ID, "tag_1");
        
        InOrder order = inOrder(bookmarkTagRepository, tagRepository);
        order.verify(bookmarkTagRepository).deleteByTagId("tag_1");
        order.verify(tagRepository).deleteByTagIdAndUserId("tag_1", USER_ID);
    }
    
    @Test
    void detachAndDeleteOfForeignTagIsNotFound() {
        when(tagRepository.findByTagIdAndUserId("tag_other", USER_ID)).thenReturn(Optional.empty());
        
        assertThrows(NotFoundException.class, () -> tagStore.detachAndDelete(USER_ID, "tag_other"));
        verifyNoInteractions(bookmarkTagRepository);
    }
    
    @Test
    void seedDefaultsCreatesEveryConfiguredTag() {
        accountProperties.setDefaultTags(List.of("Work", "Tech"));
        when(tagRepository.insertIfAbsent(anyString(), eq(USER_ID), anyString(), any(Instant.class))).thenReturn(1);
        when(tagRepository.findByUserIdAndName(eq(USER_ID), anyString()))
                .thenAnswer(invocation -> Optional.of(new Tag("tag_x", USER_ID, invocation.getArgument(1))));
        
        tagStore.seedDefaults(USER_ID);
        
        verify(tagRepository).insertIfAbsent(anyString(), eq(USER_ID), eq("work"), any(Instant.class));
        verify(tagRepository).insertIfAbsent(anyString(), eq(USER_ID), eq("tech"), any(Instant.class));
    }
}
