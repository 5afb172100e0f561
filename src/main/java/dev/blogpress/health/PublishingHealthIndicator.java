package dev.blogpress.health;

import dev.blogpress.config.PublishingProperties;
import dev.blogpress.dto.PassResult;
import dev.blogpress.dto.PublishingStatus;
import dev.blogpress.repository.ArticleRepository;
import dev.blogpress.scheduler.ArticlePublishScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.health.contributor.Health;
import org.springframework.boot.health.contributor.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Reports the article publish scheduler. Articles still scheduled two poll intervals after their due
 * time are the signal that passes are not getting through.
 */
@Component("publishing")
@RequiredArgsConstructor
@Slf4j
public class PublishingHealthIndicator implements ReactiveHealthIndicator {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final ArticlePublishScheduler scheduler;
    private final ArticleRepository articleRepository;
    private final PublishingProperties properties;
    private final Clock clock;

    @Override
    public Mono<Health> health() {
        PublishingStatus status = scheduler.status();
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(properties.pollInterval().multipliedBy(2));
        return articleRepository.countScheduledDueBefore(cutoff)
                .timeout(TIMEOUT)
                .map(overdue -> buildHealth(status, overdue))
                .defaultIfEmpty(buildHealth(status, null))
                .onErrorResume(ex -> {
                    log.warn("Could not count overdue articles: {}", ex.getMessage());
                    return Mono.just(buildHealth(status, null));
                });
    }

    private Health buildHealth(PublishingStatus status, Long overdueArticles) {
        Health.Builder builder;
        if (!status.running()) {
            builder = Health.down().withDetail("reason", "Scheduler is stopped");
        } else if (status.consecutiveFailingPasses() >= properties.staleErrorThreshold()) {
            builder = Health.down().withDetail("reason",
                    status.consecutiveFailingPasses() + " consecutive publishing passes failed");
        } else {
            builder = Health.up();
        }

        builder.withDetail("running", status.running())
                .withDetail("passInProgress", status.passInProgress())
                .withDetail("pollInterval", status.pollInterval().toString())
                .withDetail("skippedTicks", status.skippedTicks())
                .withDetail("consecutiveFailingPasses", status.consecutiveFailingPasses())
                .withDetail("lastPassAborted", status.lastPassAborted());
        if (status.nextTickAt() != null) {
            builder.withDetail("nextTickAt", status.nextTickAt().toString());
        }
        PassResult lastPass = status.lastPass();
        if (lastPass != null) {
            builder.withDetail("lastPassAt", lastPass.finishedAt().toString())
                    .withDetail("lastPassPromoted", lastPass.promoted())
                    .withDetail("lastPassFailed", lastPass.failed());
        }
        if (status.lastError() != null) {
            builder.withDetail("lastError", status.lastError());
        }
        if (overdueArticles != null) {
            builder.withDetail("overdueArticles", overdueArticles);
        }
        return builder.build();
    }
}
