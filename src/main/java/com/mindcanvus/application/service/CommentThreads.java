package com.mindcanvus.application.service;

import com.mindcanvus.application.port.out.CommentRepository;
import com.mindcanvus.domain.model.CommentDetails;
import com.mindcanvus.domain.model.CommentThread;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Attaches replies to their top-level comments with a single reply query per page.
 */
final class CommentThreads {

    private CommentThreads() {}

    static List<CommentThread> assemble(CommentRepository commentRepository, List<CommentDetails> topLevel) {
        if (topLevel.isEmpty()) {
            return List.of();
        }
        List<UUID> parentIds = topLevel.stream().map(c -> c.comment().id()).toList();
        Map<UUID, List<CommentDetails>> repliesByParent = commentRepository.findRepliesOf(parentIds).stream()
            .collect(Collectors.groupingBy(r -> r.comment().parentId()));
        return topLevel.stream()
            .map(c -> new CommentThread(c, repliesByParent.getOrDefault(c.comment().id(), List.of())))
            .toList();
    }
}
