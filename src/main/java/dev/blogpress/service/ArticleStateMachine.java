package dev.blogpress.service;

import dev.blogpress.entity.Article;
import dev.blogpress.entity.ArticleStatus;
import dev.blogpress.exception.InvalidTransitionException;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Legal article status transitions and the guards attached to them.
 * Pure: {@link #transition} returns a new value and never touches the store.
 *
 * <p>Only {@code SCHEDULED -> PUBLISHED} is driven by the publish scheduler; the other
 * transitions belong to the editing API and are listed so both sides agree on the table.
 */
@Component
public class ArticleStateMachine {

    private static final Map<ArticleStatus, Set<ArticleStatus>> TRANSITIONS = new EnumMap<>(ArticleStatus.class);

    static {
        TRANSITIONS.put(ArticleStatus.DRAFT,
                EnumSet.of(ArticleStatus.IN_REVIEW, ArticleStatus.SCHEDULED, ArticleStatus.PUBLISHED));
        TRANSITIONS.put(ArticleStatus.IN_REVIEW,
                EnumSet.of(ArticleStatus.DRAFT, ArticleStatus.SCHEDULED, ArticleStatus.PUBLISHED));
        TRANSITIONS.put(ArticleStatus.SCHEDULED,
                EnumSet.of(ArticleStatus.DRAFT, ArticleStatus.IN_REVIEW, ArticleStatus.PUBLISHED));
        // Unpublishing only; a published article is never rescheduled directly
        TRANSITIONS.put(ArticleStatus.PUBLISHED, EnumSet.of(ArticleStatus.DRAFT));
    }

    public boolean canTransition(ArticleStatus from, ArticleStatus to) {
        if (from == null || to == null) {
            return false;
        }
        return TRANSITIONS.getOrDefault(from, Set.of()).contains(to);
    }

    /**
     * Whether the article is scheduled and its time has been reached at {@code now}.
     */
    public boolean isDue(Article article, LocalDateTime now) {
        return article.shouldPublishAt(now);
    }

    public Article transition(Article article, ArticleStatus to, LocalDateTime now) {
        return transition(article, statusOf(article), to, now);
    }

    /**
     * Computes the article as it looks after moving to {@code to} at {@code now}.
     *
     * @param article      the article as read, carrying the requested publish time when {@code to} is SCHEDULED
     * @param expectedFrom the status the caller believes the article has
     * @throws InvalidTransitionException if the article is no longer in {@code expectedFrom}, the pair is
     *                                    not allowed, a scheduled article is not yet due, or a move to
     *                                    SCHEDULED has no publish time
     */
    public Article transition(Article article, ArticleStatus expectedFrom, ArticleStatus to, LocalDateTime now) {
        ArticleStatus current = statusOf(article);
        if (current != expectedFrom) {
            throw new InvalidTransitionException(article.getId(), current, to,
                    "Article " + article.getId() + " is " + current + ", expected " + expectedFrom);
        }
        if (!canTransition(current, to)) {
            throw new InvalidTransitionException(article.getId(), current, to,
                    "Transition " + current + " -> " + to + " is not allowed");
        }
        if (current == ArticleStatus.SCHEDULED && to == ArticleStatus.PUBLISHED && !isDue(article, now)) {
            throw new InvalidTransitionException(article.getId(), current, to,
                    "Article " + article.getId() + " is scheduled for " + article.getScheduledPublishAt()
                            + ", not due at " + now);
        }
        if (to == ArticleStatus.SCHEDULED && article.getScheduledPublishAt() == null) {
            throw new InvalidTransitionException(article.getId(), current, to,
                    "Article " + article.getId() + " cannot be scheduled without a publish time");
        }

        Article.ArticleBuilder next = article.toBuilder()
                .status(to.name())
                .updatedAt(now);
        if (to != ArticleStatus.SCHEDULED) {
            next.scheduledPublishAt(null);
        }
        if (to == ArticleStatus.PUBLISHED && article.getPublishedAt() == null) {
            next.publishedAt(now);
        }
        return next.build();
    }

    private static ArticleStatus statusOf(Article article) {
        try {
            return ArticleStatus.of(article.getStatus());
        } catch (IllegalArgumentException e) {
            throw new InvalidTransitionException(article.getId(), null, null,
                    "Article " + article.getId() + " has unknown status '" + article.getStatus() + "'");
        }
    }
}
