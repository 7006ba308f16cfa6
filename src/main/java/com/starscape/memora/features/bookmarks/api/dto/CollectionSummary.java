package com.starscape.memora.features.bookmarks.api.dto;

public record CollectionSummary(String id, String name) {}
