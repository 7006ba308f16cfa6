package com.starscape.memora.features.bookmarks.api.dto;

public record CollectionRef(String id) {}
