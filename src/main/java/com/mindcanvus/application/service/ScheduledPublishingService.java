package com.mindcanvus.application.service;

import com.mindcanvus.application.port.in.PublishScheduledPostsUseCase;
import com.mindcanvus.application.port.out.MetricsPort;
import com.mindcanvus.application.port.out.PostRepository;
import com.mindcanvus.domain.model.Post;
import com.mindcanvus.domain.model.PublishReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Promotes due scheduled posts. Each post is updated on its own so one failure
 * does not hold back the rest; a failed post stays scheduled and is retried on the next tick.
 */
@Service
public class ScheduledPublishingService implements PublishScheduledPostsUseCase {

    private static final Logger log = LoggerFactory.getLogger(ScheduledPublishingService.class);

    private final PostRepository postRepository;
    private final MetricsPort metrics;
    private final Clock clock;

    public ScheduledPublishingService(PostRepository postRepository, MetricsPort metrics, Clock clock) {
        this.postRepository = postRepository;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public PublishReport publishDuePosts() {
        Instant now = clock.instant();
        List<Post> due = postRepository.findDueScheduled(now);
        if (due.isEmpty()) {
            return PublishReport.NOTHING_DUE;
        }

        log.debug("Found {} scheduled posts due at {}", due.size(), now);

        int published = 0;
        int failed = 0;
        for (Post post : due) {
            try {
                if (postRepository.publishScheduled(post.id(), now)) {
                    published++;
                    log.debug("Published scheduled post: id={}, scheduledFor={}", post.id(), post.scheduledFor());
                } else {
                    log.debug("Post {} was no longer scheduled, skipped", post.id());
                }
            } catch (RuntimeException e) {
                failed++;
                metrics.incrementPublishFailures();
                log.error("Failed to publish scheduled post {}: {}", post.id(), e.getMessage(), e);
            }
        }

        if (published > 0) {
            metrics.incrementPostsPublished(published);
            log.info("Published {} scheduled posts", published);
        }
        return new PublishReport(due.size(), published, failed);
    }
}
