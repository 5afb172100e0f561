package dev.blogpress.service;

import dev.blogpress.config.PublishingProperties;
import dev.blogpress.dto.PublishOutcome;
import dev.blogpress.entity.Article;
import dev.blogpress.entity.ArticleStatus;
import dev.blogpress.exception.InvalidTransitionException;
import dev.blogpress.exception.TransitionPersistenceException;
import dev.blogpress.repository.ContentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.concurrent.TimeoutException;

/**
 * Moves one scheduled article to published with a conditional update.
 * Losing the race against an editor is an expected outcome, reported as skipped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PublishTransaction {

    private final ArticleStateMachine stateMachine;
    private final ContentStore contentStore;
    private final PublishingProperties properties;

    /**
     * @param article snapshot read by the due query; its status and revision form the CAS precondition
     * @param now     transition time, also used as the publication time
     */
    public Mono<PublishOutcome> attempt(Article article, LocalDateTime now) {
        Article next;
        try {
            next = stateMachine.transition(article, ArticleStatus.SCHEDULED, ArticleStatus.PUBLISHED, now);
        } catch (InvalidTransitionException e) {
            return Mono.just(PublishOutcome.failed(article.getId(), e));
        }

        return contentStore.conditionalTransition(article, next)
                .timeout(properties.storeTimeout())
                .defaultIfEmpty(false)
                .map(applied -> {
                    if (applied) {
                        log.info("Auto-published scheduled article: {} (scheduled for: {})",
                                article.getSlug() != null ? article.getSlug() : article.getId(),
                                article.getScheduledPublishAt());
                        return PublishOutcome.promoted(article.getId(), next.getPublishedAt());
                    }
                    log.debug("Article {} changed since it was read (revision {}), skipping",
                            article.getId(), article.getRevision());
                    return PublishOutcome.skipped(article.getId(), PublishOutcome.CONCURRENT_MODIFICATION);
                })
                .onErrorResume(e -> Mono.just(PublishOutcome.failed(article.getId(), e instanceof TimeoutException
                        ? TransitionPersistenceException.timedOut(article.getId(), e)
                        : new TransitionPersistenceException(article.getId(), e))));
    }
}
