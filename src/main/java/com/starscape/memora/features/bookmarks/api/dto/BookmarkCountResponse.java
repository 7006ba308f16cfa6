package com.starscape.memora.features.bookmarks.api.dto;

public record BookmarkCountResponse(long count) {}
