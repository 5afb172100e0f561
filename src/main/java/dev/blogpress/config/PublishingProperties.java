package dev.blogpress.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings for the scheduled article publisher, bound from {@code app.publishing.*}.
 *
 * @param enabled             start the scheduler together with the application context
 * @param pollInterval        fixed rate between ticks
 * @param batchSize           rows fetched per page of the due query
 * @param concurrency         conditional updates allowed in flight within a pass
 * @param storeTimeout        timeout applied to every content store call
 * @param shutdownTimeout     how long {@code stop()} waits for an in-flight pass
 * @param staleErrorThreshold consecutive failing passes before the health check reports DOWN
 */
@ConfigurationProperties(prefix = "app.publishing")
@Validated
public record PublishingProperties(
        @DefaultValue("true") boolean enabled,
        @NotNull @DefaultValue("60s") Duration pollInterval,
        @Min(1) @DefaultValue("500") int batchSize,
        @Min(1) @DefaultValue("1") int concurrency,
        @NotNull @DefaultValue("10s") Duration storeTimeout,
        @NotNull @DefaultValue("30s") Duration shutdownTimeout,
        @Min(1) @DefaultValue("3") int staleErrorThreshold
) {

    public PublishingProperties {
        if (pollInterval != null && (pollInterval.isZero() || pollInterval.isNegative())) {
            throw new IllegalArgumentException("app.publishing.poll-interval must be positive");
        }
    }

    /**
     * Defaults matching the bound values, for code paths built without a Spring context.
     */
    public static PublishingProperties defaults() {
        return new PublishingProperties(true, Duration.ofSeconds(60), 500, 1,
                Duration.ofSeconds(10), Duration.ofSeconds(30), 3);
    }
}
