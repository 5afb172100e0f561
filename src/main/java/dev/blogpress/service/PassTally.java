package dev.blogpress.service;

import dev.blogpress.dto.ItemFailure;
import dev.blogpress.dto.PassResult;
import dev.blogpress.dto.PublishOutcome;
import dev.blogpress.entity.Article;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Running counters for one pass. Thread-safe: items of a pass may complete on different threads.
 */
public class PassTally {

    private final AtomicInteger examined = new AtomicInteger();
    private final AtomicInteger promoted = new AtomicInteger();
    private final AtomicInteger skipped = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final Queue<ItemFailure> failures = new ConcurrentLinkedQueue<>();
    private final AtomicReference<LocalDateTime> oldestDueAt = new AtomicReference<>();

    public void record(Article article, PublishOutcome outcome) {
        examined.incrementAndGet();
        LocalDateTime dueAt = article.getScheduledPublishAt();
        if (dueAt != null) {
            oldestDueAt.accumulateAndGet(dueAt, (a, b) -> a == null || b.isBefore(a) ? b : a);
        }
        switch (outcome.kind()) {
            case PROMOTED:
                promoted.incrementAndGet();
                break;
            case SKIPPED:
                skipped.incrementAndGet();
                break;
            case FAILED:
                failed.incrementAndGet();
                failures.add(ItemFailure.of(article.getId(), outcome.error()));
                break;
            default:
                throw new IllegalStateException("Unknown outcome " + outcome.kind());
        }
    }

    public int examined() {
        return examined.get();
    }

    public PassResult complete(Instant startedAt, Instant finishedAt) {
        return toResult(startedAt, finishedAt, null);
    }

    /**
     * Result for a pass that stopped early; whatever was already recorded is kept.
     */
    public PassResult abort(Instant startedAt, Instant finishedAt, String reason) {
        return toResult(startedAt, finishedAt, reason);
    }

    private PassResult toResult(Instant startedAt, Instant finishedAt, String abortReason) {
        return new PassResult(startedAt, finishedAt,
                examined.get(), promoted.get(), skipped.get(), failed.get(),
                new ArrayList<>(failures), abortReason, oldestDueAt.get());
    }
}
