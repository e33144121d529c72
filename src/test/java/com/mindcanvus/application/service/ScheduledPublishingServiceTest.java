package com.mindcanvus.application.service;

import com.mindcanvus.application.port.out.MetricsPort;
import com.mindcanvus.application.port.out.PostRepository;
import com.mindcanvus.domain.model.Category;
import com.mindcanvus.domain.model.Post;
import com.mindcanvus.domain.model.PostDraft;
import com.mindcanvus.domain.model.PostStatus;
import com.mindcanvus.domain.model.PublishReport;
import com.mindcanvus.domain.model.UserId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ScheduledPublishingService")
class ScheduledPublishingServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private PostRepository postRepository;

    @Mock
    private MetricsPort metrics;

    private ScheduledPublishingService service;

    @BeforeEach
    void setUp() {
        service = new ScheduledPublishingService(postRepository, metrics, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Post scheduled(Instant at) {
        var draft = new PostDraft("Title", "Body", null, Category.TRAVEL, PostStatus.SCHEDULED, at,
            null, null, null, null);
        return Post.create(UUID.randomUUID(), UserId.random(), draft, at.minusSeconds(3600)).getOrThrow();
    }

    @Test
    @DisplayName("Should do nothing when no post is due")
    void shouldDoNothingWhenNothingDue() {
        // Given
        when(postRepository.findDueScheduled(NOW)).thenReturn(List.of());

        // When
        PublishReport report = service.publishDuePosts();

        // Then
        assertEquals(PublishReport.NOTHING_DUE, report);
        verify(postRepository, never()).publishScheduled(any(), any());
        verifyNoInteractions(metrics);
    }

    @Test
    @DisplayName("Should publish every due post")
    void shouldPublishDuePosts() {
        // Given
        Post first = scheduled(NOW.minusSeconds(120));
        Post second = scheduled(NOW);
        when(postRepository.findDueScheduled(NOW)).thenReturn(List.of(first, second));
        when(postRepository.publishScheduled(first.id(), NOW)).thenReturn(true);
        when(postRepository.publishScheduled(second.id(), NOW)).thenReturn(true);

        // When
        PublishReport report = service.publishDuePosts();

        // Then
        assertEquals(new PublishReport(2, 2, 0), report);
        verify(metrics).incrementPostsPublished(2);
        verify(metrics, never()).incrementPublishFailures();
    }

    @Test
    @DisplayName("Should keep going when one post fails")
    void shouldIsolateFailures() {
        // Given
        Post broken = scheduled(NOW.minusSeconds(60));
        Post healthy = scheduled(NOW.minusSeconds(30));
        when(postRepository.findDueScheduled(NOW)).thenReturn(List.of(broken, healthy));
        when(postRepository.publishScheduled(broken.id(), NOW)).thenThrow(new QueryTimeoutException("timeout"));
        when(postRepository.publishScheduled(healthy.id(), NOW)).thenReturn(true);

        // When
        PublishReport report = service.publishDuePosts();

        // Then
        assertEquals(new PublishReport(2, 1, 1), report);
        verify(metrics).incrementPublishFailures();
        verify(metrics).incrementPostsPublished(1);
    }

    @Test
    @DisplayName("Should not count posts the author changed since the query")
    void shouldSkipPostsNoLongerScheduled() {
        // Given
        Post post = scheduled(NOW);
        when(postRepository.findDueScheduled(NOW)).thenReturn(List.of(post));
        when(postRepository.publishScheduled(post.id(), NOW)).thenReturn(false);

        // When
        PublishReport report = service.publishDuePosts();

        // Then
        assertEquals(new PublishReport(1, 0, 0), report);
        verify(metrics, never()).incrementPostsPublished(anyInt());
    }
}
