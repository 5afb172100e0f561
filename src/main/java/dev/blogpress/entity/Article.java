package dev.blogpress.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Article row as seen by the publishing scheduler.
 * Only the status columns are ever written from this side; everything else belongs to the authoring API.
 */
@Table("articles")
@Getter
@Setter
@ToString(of = {"id", "slug", "status", "scheduledPublishAt", "publishedAt", "revision"})
@EqualsAndHashCode(of = "id")
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Article {

    @Id
    private Long id;

    private String slug;
    private String title;

    @Builder.Default
    private String status = "DRAFT";

    @Column("scheduled_publish_at")
    private LocalDateTime scheduledPublishAt;

    @Column("published_at")
    private LocalDateTime publishedAt;

    @Builder.Default
    private Long revision = 0L;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;

    public boolean isScheduled() {
        return ArticleStatus.SCHEDULED.matches(this.status) && this.scheduledPublishAt != null;
    }

    public boolean isPublished() {
        return ArticleStatus.PUBLISHED.matches(this.status);
    }

    /**
     * True once the scheduled time has been reached; {@code now} is expected in UTC.
     */
    public boolean shouldPublishAt(LocalDateTime now) {
        return isScheduled() && !now.isBefore(this.scheduledPublishAt);
    }
}
