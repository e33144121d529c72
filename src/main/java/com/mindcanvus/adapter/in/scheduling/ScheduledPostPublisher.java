package com.mindcanvus.adapter.in.scheduling;

import com.mindcanvus.application.port.in.PublishScheduledPostsUseCase;
import com.mindcanvus.domain.model.PublishReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Fires the scheduled-post publisher once a minute. Runs for the lifetime of the
 * application context; set {@code app.publisher.enabled=false} to switch it off.
 */
@Component
@ConditionalOnProperty(prefix = "app.publisher", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ScheduledPostPublisher {

    private static final Logger log = LoggerFactory.getLogger(ScheduledPostPublisher.class);

    private final PublishScheduledPostsUseCase publishScheduledPostsUseCase;

    public ScheduledPostPublisher(PublishScheduledPostsUseCase publishScheduledPostsUseCase) {
        this.publishScheduledPostsUseCase = publishScheduledPostsUseCase;
    }

    @Scheduled(cron = "${app.publisher.cron:0 * * * * *}")
    public void tick() {
        try {
            PublishReport report = publishScheduledPostsUseCase.publishDuePosts();
            if (report.due() > 0) {
                log.info("Publisher tick: due={}, published={}, failed={}", report.due(), report.published(), report.failed());
            }
        } catch (RuntimeException e) {
            // e.g. the due-post query itself failed; the next tick starts over
            log.error("Publisher tick failed: {}", e.getMessage(), e);
        }
    }
}
