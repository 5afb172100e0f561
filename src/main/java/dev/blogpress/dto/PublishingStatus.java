package dev.blogpress.dto;

import lombok.Builder;

import java.time.Duration;
import java.time.Instant;

/**
 * Read-only snapshot of the article publish scheduler for health checks and the admin API.
 */
@Builder
public record PublishingStatus(
        boolean running,
        boolean passInProgress,
        PassResult lastPass,
        String lastError,
        Instant lastErrorAt,
        boolean lastPassAborted,
        long skippedTicks,
        int consecutiveFailingPasses,
        Instant nextTickAt,
        Duration pollInterval
) {}
