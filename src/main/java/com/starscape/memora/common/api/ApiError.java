package com.starscape.memora.common.api;

public record ApiError(
    String field,
    String message
) {}
