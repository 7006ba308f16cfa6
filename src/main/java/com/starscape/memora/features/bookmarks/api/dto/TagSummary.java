package com.starscape.memora.features.bookmarks.api.dto;

public record TagSummary(String id, String name) {}
