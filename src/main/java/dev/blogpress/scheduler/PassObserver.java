package dev.blogpress.scheduler;

import dev.blogpress.dto.PassResult;

import java.time.Instant;

/**
 * Receives the outcome of every publishing pass. Implementations must not block; they run on the
 * thread that finished the pass.
 */
public interface PassObserver {

    void onPassCompleted(PassResult result);

    /**
     * A tick fired while the previous pass was still running and was dropped.
     *
     * @param totalSkipped ticks skipped since the scheduler was created
     */
    default void onTickSkipped(Instant at, long totalSkipped) {
    }
}
