package dev.blogpress.service;

import dev.blogpress.entity.Article;
import dev.blogpress.entity.ArticleStatus;
import dev.blogpress.exception.InvalidTransitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ArticleStateMachine")
class ArticleStateMachineTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 10, 0);

    private final ArticleStateMachine stateMachine = new ArticleStateMachine();

    private Article scheduled(LocalDateTime publishAt) {
        return Article.builder()
                .id(42L)
                .slug("scheduled")
                .status(ArticleStatus.SCHEDULED.name())
                .scheduledPublishAt(publishAt)
                .revision(5L)
                .build();
    }

    @Nested
    @DisplayName("canTransition")
    class CanTransition {

        @ParameterizedTest(name = "{0} -> {1} = {2}")
        @CsvSource({
                "DRAFT, IN_REVIEW, true",
                "DRAFT, SCHEDULED, true",
                "IN_REVIEW, SCHEDULED, true",
                "SCHEDULED, PUBLISHED, true",
                "SCHEDULED, DRAFT, true",
                "PUBLISHED, DRAFT, true",
                "PUBLISHED, SCHEDULED, false",
                "PUBLISHED, IN_REVIEW, false",
                "SCHEDULED, SCHEDULED, false",
                "DRAFT, DRAFT, false"
        })
        void shouldFollowTransitionTable(ArticleStatus from, ArticleStatus to, boolean allowed) {
            assertThat(stateMachine.canTransition(from, to)).isEqualTo(allowed);
        }

        @Test
        @DisplayName("should reject null states")
        void shouldRejectNulls() {
            assertThat(stateMachine.canTransition(null, ArticleStatus.PUBLISHED)).isFalse();
            assertThat(stateMachine.canTransition(ArticleStatus.DRAFT, null)).isFalse();
        }
    }

    @Nested
    @DisplayName("transition to PUBLISHED")
    class TransitionToPublished {

        @Test
        @DisplayName("should publish a due article and clear its scheduled time")
        void shouldPublishDueArticle() {
            Article article = scheduled(NOW.minusMinutes(1));

            Article published = stateMachine.transition(article, ArticleStatus.PUBLISHED, NOW);

            assertThat(published.getStatus()).isEqualTo("PUBLISHED");
            assertThat(published.getPublishedAt()).isEqualTo(NOW);
            assertThat(published.getScheduledPublishAt()).isNull();
            assertThat(published.getUpdatedAt()).isEqualTo(NOW);
            assertThat(published.getRevision()).isEqualTo(5L);
        }

        @Test
        @DisplayName("should publish when now equals the scheduled time")
        void shouldPublishAtExactTime() {
            Article published = stateMachine.transition(scheduled(NOW), ArticleStatus.PUBLISHED, NOW);

            assertThat(published.getPublishedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("should not mutate the input article")
        void shouldNotMutateInput() {
            Article article = scheduled(NOW.minusMinutes(1));

            stateMachine.transition(article, ArticleStatus.PUBLISHED, NOW);

            assertThat(article.getStatus()).isEqualTo("SCHEDULED");
            assertThat(article.getScheduledPublishAt()).isEqualTo(NOW.minusMinutes(1));
            assertThat(article.getPublishedAt()).isNull();
        }

        @Test
        @DisplayName("should keep an existing publication time")
        void shouldKeepExistingPublishedAt() {
            LocalDateTime firstPublished = NOW.minusDays(10);
            Article article = scheduled(NOW.minusMinutes(1)).toBuilder().publishedAt(firstPublished).build();

            Article published = stateMachine.transition(article, ArticleStatus.PUBLISHED, NOW);

            assertThat(published.getPublishedAt()).isEqualTo(firstPublished);
        }

        @Test
        @DisplayName("should reject an article that is not due yet")
        void shouldRejectFutureArticle() {
            Article article = scheduled(NOW.plusSeconds(1));

            assertThatThrownBy(() -> stateMachine.transition(article, ArticleStatus.PUBLISHED, NOW))
                    .isInstanceOf(InvalidTransitionException.class)
                    .hasMessageContaining("not due")
                    .satisfies(e -> {
                        InvalidTransitionException ex = (InvalidTransitionException) e;
                        assertThat(ex.getArticleId()).isEqualTo(42L);
                        assertThat(ex.getFrom()).isEqualTo(ArticleStatus.SCHEDULED);
                        assertThat(ex.getTo()).isEqualTo(ArticleStatus.PUBLISHED);
                    });
        }

        @Test
        @DisplayName("should reject a scheduled article without a scheduled time")
        void shouldRejectMissingScheduledTime() {
            Article article = scheduled(null);

            assertThatThrownBy(() -> stateMachine.transition(article, ArticleStatus.PUBLISHED, NOW))
                    .isInstanceOf(InvalidTransitionException.class);
        }

        @Test
        @DisplayName("should reject a stale read")
        void shouldRejectStaleRead() {
            Article article = scheduled(NOW.minusMinutes(1)).toBuilder().status("DRAFT").build();

            assertThatThrownBy(() -> stateMachine.transition(
                    article, ArticleStatus.SCHEDULED, ArticleStatus.PUBLISHED, NOW))
                    .isInstanceOf(InvalidTransitionException.class)
                    .hasMessageContaining("expected SCHEDULED");
        }

        @Test
        @DisplayName("should never reschedule a published article")
        void shouldRejectPublishedToScheduled() {
            Article article = Article.builder().id(1L).status("PUBLISHED").publishedAt(NOW).build();

            assertThatThrownBy(() -> stateMachine.transition(article, ArticleStatus.SCHEDULED, NOW))
                    .isInstanceOf(InvalidTransitionException.class)
                    .hasMessageContaining("not allowed");
        }

        @Test
        @DisplayName("should reject unknown stored status")
        void shouldRejectUnknownStatus() {
            Article article = Article.builder().id(3L).status("ARCHIVED").build();

            assertThatThrownBy(() -> stateMachine.transition(article, ArticleStatus.PUBLISHED, NOW))
                    .isInstanceOf(InvalidTransitionException.class)
                    .hasMessageContaining("unknown status");
        }
    }

    @Nested
    @DisplayName("transition to SCHEDULED")
    class TransitionToScheduled {

        @ParameterizedTest(name = "from {0}")
        @CsvSource({"DRAFT", "IN_REVIEW"})
        @DisplayName("should refuse to schedule without a publish time")
        void shouldRejectMissingPublishTime(ArticleStatus from) {
            Article article = Article.builder().id(8L).status(from.name()).build();

            assertThatThrownBy(() -> stateMachine.transition(article, ArticleStatus.SCHEDULED, NOW))
                    .isInstanceOf(InvalidTransitionException.class)
                    .hasMessageContaining("without a publish time");
        }

        @Test
        @DisplayName("should keep the requested publish time")
        void shouldKeepPublishTime() {
            Article article = Article.builder()
                    .id(8L)
                    .status("IN_REVIEW")
                    .scheduledPublishAt(NOW.plusDays(2))
                    .build();

            Article scheduled = stateMachine.transition(article, ArticleStatus.SCHEDULED, NOW);

            assertThat(scheduled.getStatus()).isEqualTo("SCHEDULED");
            assertThat(scheduled.getScheduledPublishAt()).isEqualTo(NOW.plusDays(2));
            assertThat(scheduled.isScheduled()).isTrue();
        }
    }

    @Test
    @DisplayName("should clear the scheduled time when moving back to draft")
    void shouldClearScheduleWhenUnscheduling() {
        Article draft = stateMachine.transition(scheduled(NOW.plusDays(1)), ArticleStatus.DRAFT, NOW);

        assertThat(draft.getStatus()).isEqualTo("DRAFT");
        assertThat(draft.getScheduledPublishAt()).isNull();
        assertThat(draft.getPublishedAt()).isNull();
    }

    @Test
    @DisplayName("should report due articles only")
    void isDue_ShouldRequireScheduledAndPastTime() {
        assertThat(stateMachine.isDue(scheduled(NOW.minusSeconds(10)), NOW)).isTrue();
        assertThat(stateMachine.isDue(scheduled(NOW.plusSeconds(10)), NOW)).isFalse();
        assertThat(stateMachine.isDue(Article.builder().id(1L).status("PUBLISHED").build(), NOW)).isFalse();
    }
}
