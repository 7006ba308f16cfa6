package com.starscape.memora.features.bookmarks.app;

import com.starscape.memora.common.api.PageMetadata;
import com.starscape.memora.features.bookmarks.api.dto.BookmarkResponse;

import java.util.List;

public record BookmarkPage(
    List<BookmarkResponse> items,
    PageMetadata metadata
) {}
