package com.starscape.memora.common.api;

/**
 * Pagination block attached to list responses.
 * Pages are 1-based; {@code nextPage}/{@code previousPage} are null at the edges.
 */
public record PageMetadata(
    long totalCount,
    int page,
    int pageSize,
    int totalPages,
    boolean hasNextPage,
    boolean hasPreviousPage,
    Integer nextPage,
    Integer previousPage
) {
    
    public static PageMetadata of(long totalCount, int page, int pageSize) {
        int totalPages = pageSize <= 0 ? 0 : (int) ((totalCount + pageSize - 1) / pageSize);
        boolean hasNext = page < totalPages;
        boolean hasPrevious = page > 1;
        return new PageMetadata(
            totalCount,
            page,
            pageSize,
            totalPages,
            hasNext,
            hasPrevious,
            hasNext ? page + 1 : null,
            hasPrevious ? page - 1 : null
        );
    }
}
