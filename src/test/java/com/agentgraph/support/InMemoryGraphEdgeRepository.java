package com.agentgraph.support;

import com.agentgraph.model.entity.GraphEdge;
import com.agentgraph.model.entity.TypeCount;
import com.agentgraph.repository.GraphEdgeRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

public class InMemoryGraphEdgeRepository extends InMemoryCrudRepository<GraphEdge> implements GraphEdgeRepository {

    @Override
    protected UUID idOf(GraphEdge entity) {
        return entity.getId();
    }

    @Override
    protected void assignId(GraphEdge entity, UUID id) {
        entity.setId(id);
    }

    @Override
    protected GraphEdge copy(GraphEdge entity) {
        return GraphEdge.builder()
                .id(entity.getId())
                .agentId(entity.getAgentId())
                .type(entity.getType())
                .sourceId(entity.getSourceId())
                .targetId(entity.getTargetId())
                .properties(entity.getProperties())
                .createdAt(entity.getCreatedAt())
                .build();
    }

    @Override
    protected Object uniqueKey(GraphEdge entity) {
        return Arrays.asList(entity.getAgentId(), entity.getType(), entity.getSourceId(), entity.getTargetId());
    }

    @Override
    public Mono<GraphEdge> findByAgentIdAndTypeAndSourceIdAndTargetId(UUID agentId, String type, UUID sourceId,
                                                                      UUID targetId) {
        return select(edge -> agentId.equals(edge.getAgentId()) && type.equals(edge.getType())
                && sourceId.equals(edge.getSourceId()) && targetId.equals(edge.getTargetId())).next();
    }

    @Override
    public Flux<GraphEdge> findIncident(UUID nodeId) {
        return select(edge -> nodeId.equals(edge.getSourceId()) || nodeId.equals(edge.getTargetId()));
    }

    @Override
    public Mono<Long> countByAgentId(UUID agentId) {
        return select(edge -> agentId.equals(edge.getAgentId())).count();
    }

    @Override
    public Flux<TypeCount> countByTypeForAgent(UUID agentId) {
        Map<String, Long> counts = new TreeMap<>();
        rows().stream()
                .filter(edge -> agentId.equals(edge.getAgentId()))
                .forEach(edge -> counts.merge(edge.getType(), 1L, Long::sum));
        return Flux.fromIterable(counts.entrySet())
                .map(entry -> new TypeCount(entry.getKey(), entry.getValue()));
    }
}
