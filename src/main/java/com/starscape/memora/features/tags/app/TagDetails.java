package com.starscape.memora.features.tags.app;

import com.starscape.memora.features.bookmarks.domain.BookmarkSummary;
import com.starscape.memora.features.tags.domain.Tag;

import java.util.List;

public record TagDetails(
    Tag tag,
    List<BookmarkSummary> bookmarks
) {}
