package com.agentgraph.repository;

import com.agentgraph.model.entity.InboxItem;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.util.UUID;

/**
 * Repository for inbox notifications.
 */
@Repository
public interface InboxItemRepository extends ReactiveCrudRepository<InboxItem, UUID> {

    Flux<InboxItem> findByAgentIdOrderByCreatedAtDesc(UUID agentId);
}
