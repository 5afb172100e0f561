package dev.blogpress.repository;

import dev.blogpress.entity.Article;
import lombok.RequiredArgsConstructor;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * {@link ContentStore} over R2DBC. Reads go through {@link ArticleRepository};
 * the conditional update is raw SQL so the precondition and the write are one statement.
 */
@Repository
@RequiredArgsConstructor
public class R2dbcContentStore implements ContentStore {

    private final ArticleRepository articleRepository;
    private final R2dbcEntityTemplate r2dbcTemplate;

    // published_at is only ever filled once
    static final String CONDITIONAL_TRANSITION =
            "UPDATE articles SET status = :newStatus, " +
            "scheduled_publish_at = :scheduledPublishAt, " +
            "published_at = COALESCE(published_at, :publishedAt), " +
            "updated_at = :updatedAt, " +
            "revision = revision + 1 " +
            "WHERE id = :id AND status = :expectedStatus AND revision = :expectedRevision";

    @Override
    public Flux<Article> query(ArticleQuery query) {
        if (query.hasCursor()) {
            return articleRepository.findByStatusDueBeforeAfter(query.status().name(), query.dueBefore(),
                    query.afterScheduledAt(), query.afterId(), query.limit());
        }
        return articleRepository.findByStatusDueBefore(query.status().name(), query.dueBefore(), query.limit());
    }

    @Override
    public Mono<Boolean> conditionalTransition(Article current, Article next) {
        DatabaseClient.GenericExecuteSpec spec = r2dbcTemplate.getDatabaseClient()
                .sql(CONDITIONAL_TRANSITION)
                .bind("newStatus", next.getStatus())
                .bind("id", current.getId())
                .bind("expectedStatus", current.getStatus())
                .bind("expectedRevision", current.getRevision());
        spec = bindNullable(spec, "scheduledPublishAt", next.getScheduledPublishAt());
        spec = bindNullable(spec, "publishedAt", next.getPublishedAt());
        spec = bindNullable(spec, "updatedAt", next.getUpdatedAt());
        return spec.fetch()
                .rowsUpdated()
                .map(rows -> rows > 0);
    }

    private static DatabaseClient.GenericExecuteSpec bindNullable(DatabaseClient.GenericExecuteSpec spec,
                                                                  String name, LocalDateTime value) {
        return value != null ? spec.bind(name, value) : spec.bindNull(name, LocalDateTime.class);
    }
}
