package dev.blogpress.repository;

import dev.blogpress.entity.Article;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * The slice of the article store that scheduled publishing depends on.
 * The store is shared with the interactive editing paths, so writes go through compare-and-swap only.
 */
public interface ContentStore {

    /**
     * Articles matching the query, ordered by scheduled time then id.
     */
    Flux<Article> query(ArticleQuery query);

    /**
     * Applies {@code next}'s status fields to the stored row only if the row still has
     * {@code current}'s id, status and revision. The revision is incremented on success.
     *
     * @return {@code true} if the row was updated, {@code false} if the precondition no longer held
     */
    Mono<Boolean> conditionalTransition(Article current, Article next);
}
