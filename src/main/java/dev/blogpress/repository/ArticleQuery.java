package dev.blogpress.repository;

import dev.blogpress.entity.Article;
import dev.blogpress.entity.ArticleStatus;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Filter for {@link ContentStore#query}: articles in {@code status} whose scheduled time is at or
 * before {@code dueBefore}, ordered by scheduled time then id, at most {@code limit} rows.
 *
 * <p>When {@code afterScheduledAt}/{@code afterId} are set, only rows strictly after that position in
 * the ordering are returned, so a caller can page through every match.
 */
public record ArticleQuery(ArticleStatus status,
                           LocalDateTime dueBefore,
                           int limit,
                           LocalDateTime afterScheduledAt,
                           Long afterId) {

    public ArticleQuery {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(dueBefore, "dueBefore");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        if ((afterScheduledAt == null) != (afterId == null)) {
            throw new IllegalArgumentException("afterScheduledAt and afterId must be set together");
        }
    }

    public ArticleQuery(ArticleStatus status, LocalDateTime dueBefore, int limit) {
        this(status, dueBefore, limit, null, null);
    }

    public static ArticleQuery scheduledDueBy(LocalDateTime now, int limit) {
        return new ArticleQuery(ArticleStatus.SCHEDULED, now, limit);
    }

    public boolean hasCursor() {
        return afterId != null;
    }

    /**
     * Same filter, continuing after {@code last}.
     */
    public ArticleQuery after(Article last) {
        return new ArticleQuery(status, dueBefore, limit, last.getScheduledPublishAt(), last.getId());
    }
}
