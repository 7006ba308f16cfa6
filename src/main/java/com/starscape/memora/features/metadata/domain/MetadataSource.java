package com.starscape.memora.features.metadata.domain;

/**
 * Origin of an extraction rule, in descending priority.
 */
public enum MetadataSource {
    OPEN_GRAPH,
    NAMED_META,
    TWITTER_CARD,
    FALLBACK
}
