package dev.blogpress.scheduler;

import dev.blogpress.dto.ItemFailure;
import dev.blogpress.dto.PassResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

@Component
@Slf4j
public class LoggingPassObserver implements PassObserver {

    @Override
    public void onPassCompleted(PassResult result) {
        if (result.isAborted()) {
            log.error("Publishing pass aborted after {} ms: {} ({} examined, {} published)",
                    result.duration().toMillis(), result.abortReason(), result.examined(), result.promoted());
            return;
        }
        if (result.failed() > 0) {
            log.warn("Publishing pass finished with failures: {} examined, {} published, {} skipped, {} failed",
                    result.examined(), result.promoted(), result.skipped(), result.failed());
            for (ItemFailure failure : result.failures()) {
                log.debug("Article {} failed: {} - {}", failure.articleId(), failure.errorType(), failure.message());
            }
            return;
        }
        if (result.promoted() > 0 || result.skipped() > 0) {
            log.info("Published {} scheduled article(s), {} skipped after concurrent edits ({} ms)",
                    result.promoted(), result.skipped(), result.duration().toMillis());
        } else {
            log.debug("Scheduled articles check completed, nothing due");
        }
    }

    @Override
    public void onTickSkipped(Instant at, long totalSkipped) {
        log.warn("Skipping publishing tick at {}: previous pass still running ({} ticks skipped so far). "
                + "The poll interval may be too short or the article store overloaded", at, totalSkipped);
    }
}
