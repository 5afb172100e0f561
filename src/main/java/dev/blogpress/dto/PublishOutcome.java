package dev.blogpress.dto;

import java.time.LocalDateTime;

/**
 * Result of one publish attempt for a single article.
 *
 * @param articleId   the article the attempt was made for
 * @param kind        what happened
 * @param reason      why the article was skipped, {@code null} otherwise
 * @param publishedAt publication time written by the attempt, only for {@link Kind#PROMOTED}
 * @param error       the failure, only for {@link Kind#FAILED}
 */
public record PublishOutcome(
        Long articleId,
        Kind kind,
        String reason,
        LocalDateTime publishedAt,
        Throwable error
) {

    public static final String CONCURRENT_MODIFICATION = "concurrent-modification";

    public enum Kind {
        PROMOTED,
        SKIPPED,
        FAILED
    }

    public static PublishOutcome promoted(Long articleId, LocalDateTime publishedAt) {
        return new PublishOutcome(articleId, Kind.PROMOTED, null, publishedAt, null);
    }

    public static PublishOutcome skipped(Long articleId, String reason) {
        return new PublishOutcome(articleId, Kind.SKIPPED, reason, null, null);
    }

    public static PublishOutcome failed(Long articleId, Throwable error) {
        return new PublishOutcome(articleId, Kind.FAILED, null, null, error);
    }

    public boolean isPromoted() {
        return kind == Kind.PROMOTED;
    }

    public boolean isSkipped() {
        return kind == Kind.SKIPPED;
    }

    public boolean isFailed() {
        return kind == Kind.FAILED;
    }
}
