package com.agentgraph.service;

import com.agentgraph.model.entity.InboxItem;
import com.agentgraph.repository.InboxItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Records user-facing notifications for published advice. Delivery is handled elsewhere.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InboxNotifier {

    private final InboxItemRepository inboxItemRepository;

    /**
     * Record an unread inbox item pointing at a node.
     *
     * @param agentId Agent ID
     * @param nodeId  Node the notification is about
     * @param title   Notification title
     * @param content Notification body
     * @return the persisted inbox item
     */
    public Mono<InboxItem> notify(UUID agentId, UUID nodeId, String title, String content) {
        InboxItem item = InboxItem.builder()
                .agentId(agentId)
                .nodeId(nodeId)
                .title(title)
                .content(content)
                .read(false)
                .createdAt(LocalDateTime.now())
                .build();

        return inboxItemRepository.save(item)
                .doOnNext(saved -> log.info("Recorded inbox item {} for agent {}: {}", saved.getId(), agentId, title));
    }

    public Flux<InboxItem> listForAgent(UUID agentId) {
        return inboxItemRepository.findByAgentIdOrderByCreatedAtDesc(agentId);
    }
}
