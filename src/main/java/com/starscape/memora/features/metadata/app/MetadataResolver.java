package com.starscape.memora.features.metadata.app;

import com.starscape.memora.features.metadata.domain.LinkMetadata;

/**
 * Resolves display metadata for a URL.
 * Implementations never throw: any failure yields {@link LinkMetadata#empty()}.
 */
public interface MetadataResolver {
    
    LinkMetadata resolve(String url);
}
