package dev.blogpress.service;

import dev.blogpress.dto.PassResult;
import dev.blogpress.dto.PublishOutcome;
import dev.blogpress.entity.Article;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.concurrent.CompletableFuture;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class PassTallyTest {

    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");
    private static final LocalDateTime DUE = LocalDateTime.of(2026, 3, 1, 9, 0);

    private static Article article(long id, LocalDateTime dueAt) {
        return Article.builder().id(id).status("SCHEDULED").scheduledPublishAt(dueAt).build();
    }

    @Test
    @DisplayName("Should track the oldest due time across outcomes")
    void record_ShouldTrackOldestDueTime() {
        PassTally tally = new PassTally();

        tally.record(article(1L, DUE.plusMinutes(5)), PublishOutcome.promoted(1L, DUE));
        tally.record(article(2L, DUE), PublishOutcome.skipped(2L, PublishOutcome.CONCURRENT_MODIFICATION));
        tally.record(article(3L, DUE.plusMinutes(1)), PublishOutcome.failed(3L, new RuntimeException("x")));

        PassResult result = tally.complete(START, START.plusSeconds(2));
        assertThat(result.examined()).isEqualTo(3);
        assertThat(result.oldestDueAt()).isEqualTo(DUE);
        assertThat(result.isClean()).isFalse();
        assertThat(result.duration().getSeconds()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should keep partial counts when aborted")
    void abort_ShouldKeepPartialCounts() {
        PassTally tally = new PassTally();
        tally.record(article(1L, DUE), PublishOutcome.promoted(1L, DUE));

        PassResult result = tally.abort(START, START, "Stop requested before all due articles were dispatched");

        assertThat(result.promoted()).isEqualTo(1);
        assertThat(result.isAborted()).isTrue();
        assertThat(result.isClean()).isFalse();
    }

    @Test
    @DisplayName("Should count correctly from several threads")
    void record_ShouldBeThreadSafe() {
        PassTally tally = new PassTally();

        CompletableFuture.allOf(IntStream.range(0, 200)
                .mapToObj(i -> CompletableFuture.runAsync(() ->
                        tally.record(article(i, DUE.plusSeconds(i)), PublishOutcome.promoted((long) i, DUE))))
                .toArray(CompletableFuture[]::new)).join();

        PassResult result = tally.complete(START, START);
        assertThat(result.promoted()).isEqualTo(200);
        assertThat(result.oldestDueAt()).isEqualTo(DUE);
    }
}
