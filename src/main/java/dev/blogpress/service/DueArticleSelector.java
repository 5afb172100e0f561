package dev.blogpress.service;

import dev.blogpress.config.PublishingProperties;
import dev.blogpress.entity.Article;
import dev.blogpress.exception.StoreUnavailableException;
import dev.blogpress.repository.ArticleQuery;
import dev.blogpress.repository.ContentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Finds the scheduled articles whose publication time has been reached.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DueArticleSelector {

    static final Comparator<Article> DUE_ORDER = Comparator
            .comparing(Article::getScheduledPublishAt)
            .thenComparing(Article::getId);

    private final ContentStore contentStore;
    private final PublishingProperties properties;

    /**
     * Every due article, ordered by scheduled time then id. Empty when nothing is due.
     * The store is read in pages of {@code batch-size} rows, fetched one at a time as the caller
     * consumes them. Any store failure is reported as {@link StoreUnavailableException}.
     */
    public Flux<Article> findDue(LocalDateTime now) {
        return pagesFrom(ArticleQuery.scheduledDueBy(now, properties.batchSize()))
                .onErrorMap(e -> !(e instanceof StoreUnavailableException),
                        e -> new StoreUnavailableException("Due article query failed: " + e.getMessage(), e))
                .doOnError(e -> log.debug("Due article query failed at {}", now, e));
    }

    // the next page is only queried once every article of this one has been taken
    private Flux<Article> pagesFrom(ArticleQuery query) {
        return fetchPage(query).flatMapMany(page -> page.isLast()
                ? Flux.fromIterable(page.articles())
                : Flux.fromIterable(page.articles()).concatWith(Flux.defer(() -> pagesFrom(page.next()))));
    }

    private Mono<Page> fetchPage(ArticleQuery query) {
        return Flux.defer(() -> contentStore.query(query))
                .timeout(properties.storeTimeout())
                .collectList()
                .map(rows -> {
                    // the store orders too, the pass relies on this order so it is enforced here
                    List<Article> articles = rows.stream()
                            .filter(article -> article.getScheduledPublishAt() != null && article.getId() != null)
                            .sorted(DUE_ORDER)
                            .collect(Collectors.toList());
                    return new Page(query, articles, rows.size() < query.limit() || articles.isEmpty());
                });
    }

    private record Page(ArticleQuery query, List<Article> articles, boolean isLast) {

        ArticleQuery next() {
            return query.after(articles.get(articles.size() - 1));
        }
    }
}
