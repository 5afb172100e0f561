package dev.blogpress.exception;

import lombok.Getter;

/**
 * The conditional status update for one article failed with a store error (lost connection, timeout).
 *
 * <p>When {@link #isOutcomeUnknown()} is set the store did not answer in time, so the update may still
 * have been applied. Either way the next pass re-reads the row: a still scheduled article is retried, an
 * already published one is no longer due.
 */
@Getter
public class TransitionPersistenceException extends RuntimeException {

    private final Long articleId;
    private final boolean outcomeUnknown;

    public TransitionPersistenceException(Long articleId, Throwable cause) {
        this(articleId, "Failed to persist status transition for article " + articleId + ": " + cause.getMessage(),
                cause, false);
    }

    private TransitionPersistenceException(Long articleId, String message, Throwable cause, boolean outcomeUnknown) {
        super(message, cause);
        this.articleId = articleId;
        this.outcomeUnknown = outcomeUnknown;
    }

    public static TransitionPersistenceException timedOut(Long articleId, Throwable cause) {
        return new TransitionPersistenceException(articleId,
                "Status transition for article " + articleId + " timed out, it may still have been applied",
                cause, true);
    }
}
