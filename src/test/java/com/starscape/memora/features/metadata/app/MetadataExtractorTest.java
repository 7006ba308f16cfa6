package com.starscape.memora.features.metadata.app;

import com.starscape.memora.features.metadata.domain.LinkMetadata;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class MetadataExtractorTest {
    
    private static final String BASE = "https://example.com/articles/post";
    
    private final MetadataExtractor extractor = new MetadataExtractor();
    
    @Test
    void openGraphWinsOverTitleElement() {
        String html = "<html><head>"
                + "<title>Plain title</title>"
                + "<meta property=\"og:title\" content=\"OG title\">"
                + "<meta property=\"og:description\" content=\"OG description\">"
                + "<meta name=\"description\" content=\"Plain description\">"
                + "<meta property=\"og:image\" content=\"https://cdn.example.com/cover.png\">"
                + "</head><body></body></html>";
        
        LinkMetadata metadata = extractor.extract(html, BASE);
        
        assertEquals("OG title", metadata.title());
        assertEquals("OG description", metadata.description());
        assertEquals("https://cdn.example.com/cover.png", metadata.imageUrl());
    }
    
    @Test
    void fallsThroughBlankValuesToLaterRules() {
        String html = "<html><head>"
                + "<meta property=\"og:title\" content=\"   \">"
                + "<meta name=\"twitter:title\" content=\"Twitter title\">"
                + "<meta name=\"twitter:description\" content=\"Twitter description\">"
                + "<meta name=\"twitter:image:src\" content=\"/img/card.jpg\">"
                + "</head></html>";
        
        LinkMetadata metadata = extractor.extract(html, BASE);
        
        assertEquals("Twitter title", metadata.title());
        assertEquals("Twitter description", metadata.description());
        assertEquals("https://example.com/img/card.jpg", metadata.imageUrl());
    }
    
    @Test
    void usesTitleElementAndMetaDescriptionAsLastResort() {
        String html = "<html><head><title> Just a page </title>"
                + "<meta name=\"description\" content=\"About the page\"></head></html>";
        
        LinkMetadata metadata = extractor.extract(html, BASE);
        
        assertEquals("Just a page", metadata.title());
        assertEquals("About the page", metadata.description());
        assertNull(metadata.imageUrl());
    }
    
    @Test
    void resolvesRelativeIconAgainstBaseUrl() {
        String html = "<html><head><link rel=\"icon\" href=\"favicon.ico\"></head></html>";
        
        LinkMetadata metadata = extractor.extract(html, BASE);
        
        assertEquals("https://example.com/articles/favicon.ico", metadata.imageUrl());
    }
    
    @Test
    void dropsNonHttpImage() {
        String html = "<html><head><meta property=\"og:image\" content=\"javascript:alert(1)\"></head></html>";
        
        assertNull(extractor.extract(html, BASE).imageUrl());
    }
    
    @Test
    void truncatesLongTitleAndDescription() {
        String longTitle = "t".repeat(400);
        String longDescription = "d".repeat(2000);
        String html = "<html><head><meta property=\"og:title\" content=\"" + longTitle + "\">"
                + "<meta property=\"og:description\" content=\"" + longDescription + "\"></head></html>";
        
        LinkMetadata metadata = extractor.extract(html, BASE);
        
        assertEquals(MetadataExtractor.MAX_TITLE_LENGTH, metadata.title().length());
        assertEquals(MetadataExtractor.MAX_DESCRIPTION_LENGTH, metadata.description().length());
    }
    
    @Test
    void blankDocumentYieldsEmptyMetadata() {
        assertTrue(extractor.extract("", BASE).isEmpty());
        assertTrue(extractor.extract(null, BASE).isEmpty());
    }
    
    @Test
    void resolveAgainstRejectsUnresolvableReference() {
        assertNull(MetadataExtractor.resolveAgainst(BASE, "http://"));
        assertNull(MetadataExtractor.resolveAgainst(null, "/relative/only.png"));
        assertEquals("http://other.org/a.png", MetadataExtractor.resolveAgainst(BASE, "http://other.org/a.png"));
        assertEquals("https://cdn.example.com/a.png", MetadataExtractor.resolveAgainst(BASE, "//cdn.example.com/a.png"));
    }
    
    @Test
    void encodesSpacesInImageReference() {
        String html = "<html><head><meta property=\"og:image\" content=\"/img/my photo.png\"></head></html>";
        
        assertEquals("https://example.com/img/my%20photo.png", extractor.extract(html, "https://example.com/a").imageUrl());
    }
    
    @Test
    void detectsCharsetFromMetaWhenNoneDeclared() {
        byte[] body = ("<html><head><meta charset=\"ISO-8859-1\"><title>Caf\u00e9 cr\u00e8me</title></head></html>")
                .getBytes(StandardCharsets.ISO_8859_1);
        
        assertEquals("Caf\u00e9 cr\u00e8me", extractor.extract(body, null, BASE).title());
    }
    
    @Test
    void declaredCharsetIsUsedForBytes() {
        byte[] body = "<html><head><title>\u00fcber</title></head></html>".getBytes(StandardCharsets.UTF_8);
        
        assertEquals("\u00fcber", extractor.extract(body, "UTF-8", BASE).title());
        assertTrue(extractor.extract(new byte[0], null, BASE).isEmpty());
    }
}
