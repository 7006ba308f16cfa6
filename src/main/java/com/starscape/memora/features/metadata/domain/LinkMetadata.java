package com.starscape.memora.features.metadata.domain;

/**
 * Metadata scraped from a bookmarked page. Every field is optional;
 * {@link #empty()} is the result of any failed or unusable fetch.
 */
public record LinkMetadata(
    String title,
    String description,
    String imageUrl
) {
    
    private static final LinkMetadata EMPTY = new LinkMetadata(null, null, null);
    
    public static LinkMetadata empty() {
        return EMPTY;
    }
    
    public boolean isEmpty() {
        return title == null && description == null && imageUrl == null;
    }
}
