package dev.blogpress.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Summary of one publishing pass. Never persisted; consumed by logging, metrics and the status endpoint.
 *
 * @param abortReason set when the pass stopped before handling its due articles
 * @param oldestDueAt earliest scheduled time among the articles examined, {@code null} if none
 */
public record PassResult(
        Instant startedAt,
        Instant finishedAt,
        int examined,
        int promoted,
        int skipped,
        int failed,
        List<ItemFailure> failures,
        String abortReason,
        LocalDateTime oldestDueAt
) {

    public PassResult {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public boolean isAborted() {
        return abortReason != null;
    }

    /**
     * A pass is clean when it ran to the end and every examined article was promoted or skipped.
     */
    @JsonIgnore
    public boolean isClean() {
        return !isAborted() && failed == 0;
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }
}
