package com.starscape.memora.common.domain;

import java.util.UUID;

/**
 * Generates prefixed opaque identifiers, e.g. {@code bm_3f2a...}.
 */
public final class Ids {
    
    public static final String USER = "usr_";
    public static final String BOOKMARK = "bm_";
    public static final String TAG = "tag_";
    public static final String COLLECTION = "col_";
    
    private Ids() {
    }
    
    public static String next(String prefix) {
        return prefix + UUID.randomUUID().toString().replace("-", "");
    }
}
