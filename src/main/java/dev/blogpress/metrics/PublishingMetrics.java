package dev.blogpress.metrics;

import dev.blogpress.dto.PassResult;
import dev.blogpress.scheduler.PassObserver;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer view of the publishing passes.
 */
@Component
@RequiredArgsConstructor
public class PublishingMetrics implements PassObserver {

    private final MeterRegistry meterRegistry;

    private final AtomicLong lagSeconds = new AtomicLong(0);

    // Cached meter references to avoid registry lookup per pass
    private Counter promotedCounter;
    private Counter skippedCounter;
    private Counter failedCounter;
    private Counter completedPassCounter;
    private Counter abortedPassCounter;
    private Counter skippedTickCounter;
    private Timer passTimer;

    @PostConstruct
    public void init() {
        promotedCounter = Counter.builder("blog.publishing.articles")
                .description("Scheduled articles handled by the publisher")
                .tag("outcome", "promoted")
                .register(meterRegistry);
        skippedCounter = Counter.builder("blog.publishing.articles")
                .description("Scheduled articles handled by the publisher")
                .tag("outcome", "skipped")
                .register(meterRegistry);
        failedCounter = Counter.builder("blog.publishing.articles")
                .description("Scheduled articles handled by the publisher")
                .tag("outcome", "failed")
                .register(meterRegistry);

        completedPassCounter = Counter.builder("blog.publishing.passes")
                .tag("result", "completed")
                .register(meterRegistry);
        abortedPassCounter = Counter.builder("blog.publishing.passes")
                .tag("result", "aborted")
                .register(meterRegistry);

        skippedTickCounter = Counter.builder("blog.publishing.ticks.skipped")
                .description("Ticks dropped because the previous pass was still running")
                .register(meterRegistry);

        passTimer = Timer.builder("blog.publishing.pass.duration")
                .description("Wall time of one publishing pass")
                .register(meterRegistry);

        Gauge.builder("blog.publishing.lag.seconds", lagSeconds, AtomicLong::get)
                .description("Delay between the oldest due article of the last pass and the end of that pass")
                .register(meterRegistry);
    }

    @Override
    public void onPassCompleted(PassResult result) {
        promotedCounter.increment(result.promoted());
        skippedCounter.increment(result.skipped());
        failedCounter.increment(result.failed());
        (result.isAborted() ? abortedPassCounter : completedPassCounter).increment();
        passTimer.record(result.duration());

        if (result.oldestDueAt() == null) {
            lagSeconds.set(0);
        } else {
            Instant oldest = result.oldestDueAt().toInstant(ZoneOffset.UTC);
            lagSeconds.set(Math.max(0L, Duration.between(oldest, result.finishedAt()).getSeconds()));
        }
    }

    @Override
    public void onTickSkipped(Instant at, long totalSkipped) {
        skippedTickCounter.increment();
    }
}
