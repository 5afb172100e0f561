package dev.blogpress.service;

import dev.blogpress.dto.PublishOutcome;
import dev.blogpress.entity.Article;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.function.Function;

/**
 * Runs the publish step for one article so that nothing it does can break the surrounding pass.
 * Every outcome lands in the pass tally; failures are logged one by one.
 */
@Component
@Slf4j
public class PublishErrorBoundary {

    public Mono<PublishOutcome> runSafely(Article article,
                                          Function<Article, Mono<PublishOutcome>> step,
                                          PassTally tally) {
        return Mono.defer(() -> step.apply(article))
                .switchIfEmpty(Mono.fromSupplier(() -> PublishOutcome.failed(article.getId(),
                        new IllegalStateException("Publish step completed without an outcome"))))
                .onErrorResume(e -> Mono.just(PublishOutcome.failed(article.getId(), e)))
                .doOnNext(outcome -> {
                    tally.record(article, outcome);
                    if (outcome.isFailed()) {
                        Throwable error = outcome.error();
                        log.warn("Failed to publish scheduled article {}: {} - {}",
                                article.getId(), error.getClass().getSimpleName(), error.getMessage());
                    }
                });
    }
}
