package com.agentgraph.repository;

import com.agentgraph.model.entity.GraphEdge;
import com.agentgraph.model.entity.TypeCount;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Repository for graph edges.
 */
@Repository
public interface GraphEdgeRepository extends ReactiveCrudRepository<GraphEdge, UUID> {

    /**
     * Find the edge identified by (agent, type, source, target).
     */
    Mono<GraphEdge> findByAgentIdAndTypeAndSourceIdAndTargetId(UUID agentId, String type, UUID sourceId, UUID targetId);

    /**
     * Edges where the node is either endpoint.
     */
    @Query("SELECT * FROM graph_edges WHERE source_id = :nodeId OR target_id = :nodeId")
    Flux<GraphEdge> findIncident(UUID nodeId);

    Mono<Long> countByAgentId(UUID agentId);

    @Query("SELECT type, COUNT(*) AS count FROM graph_edges WHERE agent_id = :agentId GROUP BY type")
    Flux<TypeCount> countByTypeForAgent(UUID agentId);
}
