package dev.blogpress.dto;

/**
 * One article that could not be published during a pass.
 */
public record ItemFailure(
        Long articleId,
        String errorType,
        String message
) {

    public static ItemFailure of(Long articleId, Throwable error) {
        return new ItemFailure(articleId, error.getClass().getSimpleName(), error.getMessage());
    }
}
