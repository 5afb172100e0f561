package dev.blogpress.controller;

import dev.blogpress.dto.PassResult;
import dev.blogpress.dto.PublishingStatus;
import dev.blogpress.scheduler.ArticlePublishScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/admin/publishing")
@RequiredArgsConstructor
@Slf4j
public class AdminPublishingController {

    private final ArticlePublishScheduler scheduler;

    @GetMapping("/status")
    public Mono<PublishingStatus> getStatus() {
        return Mono.fromSupplier(scheduler::status);
    }

    /**
     * Runs a pass immediately. 409 if one is already running, 503 if the scheduler is stopped.
     */
    @PostMapping("/run")
    public Mono<PassResult> runPass() {
        log.info("Admin triggered a publishing pass");
        return scheduler.runOnce();
    }
}
