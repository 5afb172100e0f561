package dev.blogpress.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Time source and the dedicated timer thread for scheduled publishing.
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class SchedulingConfig {

    public static final String PUBLISHING_TASK_SCHEDULER = "publishingTaskScheduler";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Single thread: it only subscribes to passes, the store I/O runs on the R2DBC event loop.
     */
    @Bean(name = PUBLISHING_TASK_SCHEDULER)
    public ThreadPoolTaskScheduler publishingTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("article-publish-");
        scheduler.setDaemon(true);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        log.info("Configuring dedicated task scheduler for article publishing");
        return scheduler;
    }
}
