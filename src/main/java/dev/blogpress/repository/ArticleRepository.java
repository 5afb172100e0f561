package dev.blogpress.repository;

import dev.blogpress.entity.Article;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface ArticleRepository extends ReactiveCrudRepository<Article, Long> {

    // Due articles in processing order; the (status, scheduled_publish_at) index covers it
    @Query("SELECT * FROM articles WHERE status = :status AND scheduled_publish_at <= :dueBefore " +
           "ORDER BY scheduled_publish_at ASC, id ASC LIMIT :limit")
    Flux<Article> findByStatusDueBefore(String status, LocalDateTime dueBefore, int limit);

    // Next page after (afterAt, afterId) in the same order
    @Query("SELECT * FROM articles WHERE status = :status AND scheduled_publish_at <= :dueBefore " +
           "AND (scheduled_publish_at > :afterAt OR (scheduled_publish_at = :afterAt AND id > :afterId)) " +
           "ORDER BY scheduled_publish_at ASC, id ASC LIMIT :limit")
    Flux<Article> findByStatusDueBeforeAfter(String status, LocalDateTime dueBefore,
                                             LocalDateTime afterAt, Long afterId, int limit);

    // Scheduled articles whose time passed before the cutoff and are still waiting
    @Query("SELECT COUNT(*) FROM articles WHERE status = 'SCHEDULED' AND scheduled_publish_at <= :cutoff")
    Mono<Long> countScheduledDueBefore(LocalDateTime cutoff);
}
