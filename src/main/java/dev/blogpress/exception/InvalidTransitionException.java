package dev.blogpress.exception;

import dev.blogpress.entity.ArticleStatus;
import lombok.Getter;

/**
 * Thrown when the article state machine rejects a status change: the pair is not allowed,
 * the caller's view of the current status is stale, or the scheduled time has not been reached.
 */
@Getter
public class InvalidTransitionException extends RuntimeException {

    private final Long articleId;
    private final ArticleStatus from;
    private final ArticleStatus to;

    public InvalidTransitionException(Long articleId, ArticleStatus from, ArticleStatus to, String message) {
        super(message);
        this.articleId = articleId;
        this.from = from;
        this.to = to;
    }
}
