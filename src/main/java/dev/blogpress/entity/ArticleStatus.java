package dev.blogpress.entity;

/**
 * Status values for articles.
 * Entity fields remain as String for R2DBC compatibility.
 * Use these constants instead of hardcoded strings for type-safe comparisons.
 */
public enum ArticleStatus {
    DRAFT,
    IN_REVIEW,
    SCHEDULED,
    PUBLISHED;

    /**
     * Check if the given status string matches this enum value.
     */
    public boolean matches(String status) {
        return this.name().equals(status);
    }

    /**
     * Resolves a stored status column value.
     *
     * @throws IllegalArgumentException if the value is null or not a known status
     */
    public static ArticleStatus of(String status) {
        if (status == null) {
            throw new IllegalArgumentException("Article status must not be null");
        }
        return valueOf(status);
    }
}
