package com.agentgraph.repository;

import com.agentgraph.model.entity.GraphType;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Repository for node and edge type definitions.
 */
@Repository
public interface GraphTypeRepository extends ReactiveCrudRepository<GraphType, UUID> {

    /**
     * Find an agent-specific type by kind and name.
     */
    Mono<GraphType> findByAgentIdAndKindAndName(UUID agentId, String kind, String name);

    /**
     * Find a global type by kind and name.
     */
    Mono<GraphType> findByAgentIdIsNullAndKindAndName(String kind, String name);

    /**
     * Types visible to an agent: its own plus the global ones.
     */
    @Query("SELECT * FROM graph_types WHERE kind = :kind AND (agent_id = :agentId OR agent_id IS NULL) ORDER BY name")
    Flux<GraphType> findVisibleToAgent(UUID agentId, String kind);

    /**
     * Global types only.
     */
    Flux<GraphType> findByAgentIdIsNullAndKindOrderByName(String kind);
}
