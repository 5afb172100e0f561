package dev.blogpress.scheduler;

import dev.blogpress.config.PublishingProperties;
import dev.blogpress.config.SchedulingConfig;
import dev.blogpress.dto.ItemFailure;
import dev.blogpress.dto.PassResult;
import dev.blogpress.dto.PublishingStatus;
import dev.blogpress.exception.PassInProgressException;
import dev.blogpress.service.DueArticleSelector;
import dev.blogpress.service.PassTally;
import dev.blogpress.service.PublishErrorBoundary;
import dev.blogpress.service.PublishTransaction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Promotes scheduled articles to published on a fixed rate.
 *
 * <p>Lifecycle is driven by the application context ({@link SmartLifecycle}): {@link #start()} arms a
 * fixed-rate timer whose first tick fires immediately, {@link #stop()} disarms it, stops dispatching new
 * articles and waits for the pass in flight.
 *
 * <p>At most one pass runs at a time. A tick that finds a pass in flight is dropped and reported to the
 * {@link PassObserver}s; it does not queue up behind the running pass.
 */
@Component
@Slf4j
public class ArticlePublishScheduler implements SmartLifecycle {

    private final DueArticleSelector dueArticleSelector;
    private final PublishTransaction publishTransaction;
    private final PublishErrorBoundary errorBoundary;
    private final List<PassObserver> observers;
    private final TaskScheduler taskScheduler;
    private final PublishingProperties properties;
    private final Clock clock;

    private final Object lifecycleMonitor = new Object();
    private final AtomicReference<InFlightPass> inFlight = new AtomicReference<>();
    private final AtomicLong skippedTicks = new AtomicLong();

    private volatile boolean running;
    private volatile boolean stopRequested;
    private volatile ScheduledFuture<?> tickTask;
    private volatile Instant firstTickAt;
    private volatile Instant lastTickAt;

    private volatile PassResult lastPass;
    private volatile String lastError;
    private volatile Instant lastErrorAt;
    private volatile boolean lastPassAborted;
    // written only when a pass finishes, and passes never overlap
    private volatile int consecutiveFailingPasses;

    public ArticlePublishScheduler(DueArticleSelector dueArticleSelector,
                                   PublishTransaction publishTransaction,
                                   PublishErrorBoundary errorBoundary,
                                   List<PassObserver> observers,
                                   @Qualifier(SchedulingConfig.PUBLISHING_TASK_SCHEDULER) TaskScheduler taskScheduler,
                                   PublishingProperties properties,
                                   Clock clock) {
        this.dueArticleSelector = dueArticleSelector;
        this.publishTransaction = publishTransaction;
        this.errorBoundary = errorBoundary;
        this.observers = List.copyOf(observers);
        this.taskScheduler = taskScheduler;
        this.properties = properties;
        this.clock = clock;
    }

    // ==================== LIFECYCLE ====================

    /**
     * Arms the timer. No-op when already running.
     *
     * @throws IllegalStateException if the timer could not be scheduled; the scheduler stays stopped
     */
    @Override
    public void start() {
        synchronized (lifecycleMonitor) {
            if (running) {
                log.debug("Article publish scheduler is already running");
                return;
            }
            Instant firstTick = clock.instant();
            stopRequested = false;
            running = true;
            try {
                tickTask = taskScheduler.scheduleAtFixedRate(this::tick, firstTick, properties.pollInterval());
            } catch (RuntimeException e) {
                running = false;
                throw new IllegalStateException("Could not schedule article publishing: " + e.getMessage(), e);
            }
            firstTickAt = firstTick;
            lastTickAt = null;
            log.info("Article publish scheduler started, polling every {}", properties.pollInterval());
        }
    }

    /**
     * Disarms the timer and waits up to {@code app.publishing.shutdown-timeout} for the pass in flight.
     * A pass that does not finish in time is cancelled and reported through
     * {@link PublishingStatus#lastPassAborted()}.
     */
    @Override
    public void stop() {
        ScheduledFuture<?> task;
        synchronized (lifecycleMonitor) {
            if (!running) {
                return;
            }
            running = false;
            stopRequested = true;
            task = tickTask;
            tickTask = null;
        }
        if (task != null) {
            task.cancel(false);
        }
        awaitInFlightPass();
        log.info("Article publish scheduler stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.enabled();
    }

    // ==================== PASSES ====================

    /**
     * Timer callback. Never throws, so the fixed-rate task keeps firing.
     */
    void tick() {
        try {
            if (!running) {
                return;
            }
            Instant now = clock.instant();
            lastTickAt = now;
            InFlightPass pass = new InFlightPass();
            if (!inFlight.compareAndSet(null, pass)) {
                long total = skippedTicks.incrementAndGet();
                notifyObservers(observer -> observer.onTickSkipped(now, total));
                return;
            }
            if (stopping(pass)) {
                log.debug("Publishing tick at {} dropped, scheduler is stopping", now);
                return;
            }
            launch(pass);
        } catch (RuntimeException e) {
            log.error("Publishing tick failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Runs a pass now, outside the timer, under the same single-flight rule.
     *
     * @return the pass result; errors with {@link PassInProgressException} when a pass is already running
     * and with {@link IllegalStateException} when the scheduler is stopped
     */
    public Mono<PassResult> runOnce() {
        return Mono.defer(() -> {
            if (!running) {
                return Mono.error(new IllegalStateException("Article publish scheduler is not running"));
            }
            InFlightPass pass = new InFlightPass();
            if (!inFlight.compareAndSet(null, pass)) {
                return Mono.error(new PassInProgressException());
            }
            if (stopping(pass)) {
                return Mono.error(new IllegalStateException("Article publish scheduler is not running"));
            }
            return launch(pass);
        });
    }

    /**
     * Re-checks the lifecycle once the in-flight slot is held. {@link #stop()} clears {@code running}
     * before it looks at the slot, so either it sees this pass and waits for it, or this check sees
     * the stop and gives the slot back.
     */
    private boolean stopping(InFlightPass pass) {
        if (running && !stopRequested) {
            return false;
        }
        release(pass);
        return true;
    }

    private Mono<PassResult> launch(InFlightPass pass) {
        Sinks.One<PassResult> outcome = Sinks.one();
        try {
            pass.subscription = executePass()
                    .doOnCancel(() -> {
                        lastPassAborted = true;
                        recordError("Publishing pass cancelled during shutdown", clock.instant());
                        release(pass);
                        outcome.tryEmitError(new IllegalStateException("Publishing pass was aborted"));
                    })
                    .subscribe(result -> {
                        recordPass(result);
                        release(pass);
                        outcome.tryEmitValue(result);
                    }, error -> {
                        // executePass turns failures into aborted results, this is a defect
                        log.error("Publishing pass terminated unexpectedly: {}", error.getMessage(), error);
                        recordError(error.getMessage(), clock.instant());
                        release(pass);
                        outcome.tryEmitError(error);
                    });
        } catch (RuntimeException e) {
            release(pass);
            throw e;
        }
        return outcome.asMono();
    }

    /**
     * One pass: select due articles, then publish each in order. Never signals an error; a failed
     * due query comes back as an aborted {@link PassResult}.
     */
    Mono<PassResult> executePass() {
        return Mono.defer(() -> {
            Instant startedAt = clock.instant();
            LocalDateTime now = LocalDateTime.ofInstant(startedAt, ZoneOffset.UTC);
            PassTally tally = new PassTally();
            AtomicBoolean cutShort = new AtomicBoolean();

            return dueArticleSelector.findDue(now)
                    .takeWhile(article -> {
                        if (stopRequested) {
                            cutShort.set(true);
                            return false;
                        }
                        return true;
                    })
                    .flatMapSequential(article -> errorBoundary.runSafely(article,
                            due -> publishTransaction.attempt(due, now), tally), properties.concurrency())
                    .then(Mono.fromSupplier(() -> cutShort.get()
                            ? tally.abort(startedAt, clock.instant(), "Stop requested before all due articles were dispatched")
                            : tally.complete(startedAt, clock.instant())))
                    .onErrorResume(e -> Mono.just(tally.abort(startedAt, clock.instant(), e.getMessage())));
        });
    }

    private void recordPass(PassResult result) {
        lastPass = result;
        lastPassAborted = result.isAborted();
        if (result.isClean()) {
            consecutiveFailingPasses = 0;
            lastError = null;
            lastErrorAt = null;
        } else {
            consecutiveFailingPasses++;
            recordError(describeFailure(result), result.finishedAt());
        }
        notifyObservers(observer -> observer.onPassCompleted(result));
    }

    private void recordError(String message, Instant at) {
        lastError = message;
        lastErrorAt = at;
    }

    private static String describeFailure(PassResult result) {
        if (result.isAborted()) {
            return result.abortReason();
        }
        ItemFailure first = result.failures().get(0);
        return result.failed() + " article(s) failed to publish; article " + first.articleId()
                + ": " + first.errorType() + " - " + first.message();
    }

    private void release(InFlightPass pass) {
        inFlight.compareAndSet(pass, null);
        pass.done.countDown();
    }

    private void awaitInFlightPass() {
        InFlightPass pass = inFlight.get();
        if (pass == null) {
            return;
        }
        Duration timeout = properties.shutdownTimeout();
        log.info("Waiting up to {} for the in-flight publishing pass", timeout);
        try {
            if (pass.done.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        Disposable subscription = pass.subscription;
        if (subscription != null && !subscription.isDisposed()) {
            log.warn("Publishing pass did not finish within {}, aborting it", timeout);
            subscription.dispose();
        }
    }

    private void notifyObservers(Consumer<PassObserver> notification) {
        for (PassObserver observer : observers) {
            try {
                notification.accept(observer);
            } catch (RuntimeException e) {
                log.warn("Pass observer {} failed: {}", observer.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    // ==================== STATUS ====================

    public PublishingStatus status() {
        boolean isRunning = running;
        return PublishingStatus.builder()
                .running(isRunning)
                .passInProgress(inFlight.get() != null)
                .lastPass(lastPass)
                .lastError(lastError)
                .lastErrorAt(lastErrorAt)
                .lastPassAborted(lastPassAborted)
                .skippedTicks(skippedTicks.get())
                .consecutiveFailingPasses(consecutiveFailingPasses)
                .nextTickAt(isRunning ? nextTickAt() : null)
                .pollInterval(properties.pollInterval())
                .build();
    }

    private Instant nextTickAt() {
        Instant last = lastTickAt;
        return last != null ? last.plus(properties.pollInterval()) : firstTickAt;
    }

    private static final class InFlightPass {
        private final CountDownLatch done = new CountDownLatch(1);
        private volatile Disposable subscription;
    }
}
