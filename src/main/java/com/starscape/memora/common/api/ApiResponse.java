package com.starscape.memora.common.api;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;

/**
 * Uniform response envelope used by every endpoint, success or failure.
 */
public record ApiResponse<T>(
    int status,
    String message,
    T data,
    PageMetadata metadata,
    List<ApiError> errors
) {
    
    public static <T> ApiResponse<T> success(HttpStatus status, String message, T data) {
        return new ApiResponse<>(status.value(), message, data, null, null);
    }
    
    public static <T> ApiResponse<T> page(String message, T data, PageMetadata metadata) {
        return new ApiResponse<>(HttpStatus.OK.value(), message, data, metadata, null);
    }
    
    public static <T> ApiResponse<T> failure(HttpStatus status, String message, List<ApiError> errors) {
        return new ApiResponse<>(status.value(), message, null, null, errors);
    }
    
    public static <T> ResponseEntity<ApiResponse<T>> ok(String message, T data) {
        return ResponseEntity.ok(success(HttpStatus.OK, message, data));
    }
    
    public static <T> ResponseEntity<ApiResponse<T>> created(String message, T data) {
        return ResponseEntity.status(HttpStatus.CREATED).body(success(HttpStatus.CREATED, message, data));
    }
}
