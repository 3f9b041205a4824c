package com.agentgraph.repository;

import com.agentgraph.model.entity.GraphNode;
import com.agentgraph.model.entity.TypeCount;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Repository for graph nodes.
 */
@Repository
public interface GraphNodeRepository extends ReactiveCrudRepository<GraphNode, UUID> {

    /**
     * Find the node identified by (agent, type, name).
     */
    Mono<GraphNode> findByAgentIdAndTypeAndName(UUID agentId, String type, String name);

    /**
     * Most recently created nodes of an agent.
     */
    @Query("SELECT * FROM graph_nodes WHERE agent_id = :agentId ORDER BY created_at DESC LIMIT :limit")
    Flux<GraphNode> findRecentByAgent(UUID agentId, int limit);

    /**
     * Most recently created nodes of an agent with the given type.
     */
    @Query("SELECT * FROM graph_nodes WHERE agent_id = :agentId AND type = :type ORDER BY created_at DESC LIMIT :limit")
    Flux<GraphNode> findRecentByAgentAndType(UUID agentId, String type, int limit);

    Mono<Long> countByAgentId(UUID agentId);

    @Query("SELECT type, COUNT(*) AS count FROM graph_nodes WHERE agent_id = :agentId GROUP BY type")
    Flux<TypeCount> countByTypeForAgent(UUID agentId);
}
