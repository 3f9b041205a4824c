package com.agentgraph.support;

import com.agentgraph.model.entity.GraphNode;
import com.agentgraph.model.entity.TypeCount;
import com.agentgraph.repository.GraphNodeRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Predicate;

public class InMemoryGraphNodeRepository extends InMemoryCrudRepository<GraphNode> implements GraphNodeRepository {

    @Override
    protected UUID idOf(GraphNode entity) {
        return entity.getId();
    }

    @Override
    protected void assignId(GraphNode entity, UUID id) {
        entity.setId(id);
    }

    @Override
    protected GraphNode copy(GraphNode entity) {
        return GraphNode.builder()
                .id(entity.getId())
                .agentId(entity.getAgentId())
                .type(entity.getType())
                .name(entity.getName())
                .properties(entity.getProperties())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    @Override
    protected Object uniqueKey(GraphNode entity) {
        return Arrays.asList(entity.getAgentId(), entity.getType(), entity.getName());
    }

    @Override
    public Mono<GraphNode> findByAgentIdAndTypeAndName(UUID agentId, String type, String name) {
        return select(node -> agentId.equals(node.getAgentId()) && type.equals(node.getType())
                && name.equals(node.getName())).next();
    }

    @Override
    public Flux<GraphNode> findRecentByAgent(UUID agentId, int limit) {
        return newestFirst(node -> agentId.equals(node.getAgentId()), limit);
    }

    @Override
    public Flux<GraphNode> findRecentByAgentAndType(UUID agentId, String type, int limit) {
        return newestFirst(node -> agentId.equals(node.getAgentId()) && type.equals(node.getType()), limit);
    }

    @Override
    public Mono<Long> countByAgentId(UUID agentId) {
        return select(node -> agentId.equals(node.getAgentId())).count();
    }

    @Override
    public Flux<TypeCount> countByTypeForAgent(UUID agentId) {
        Map<String, Long> counts = new TreeMap<>();
        rows().stream()
                .filter(node -> agentId.equals(node.getAgentId()))
                .forEach(node -> counts.merge(node.getType(), 1L, Long::sum));
        return Flux.fromIterable(counts.entrySet())
                .map(entry -> new TypeCount(entry.getKey(), entry.getValue()));
    }

    // Later inserts win ties on created_at
    private Flux<GraphNode> newestFirst(Predicate<GraphNode> filter, int limit) {
        List<GraphNode> matches = new ArrayList<>(matching(filter));
        Collections.reverse(matches);
        matches.sort(Comparator.comparing(GraphNode::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder())));
        return Flux.fromIterable(matches).take(limit);
    }
}
