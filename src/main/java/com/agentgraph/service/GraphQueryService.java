package com.agentgraph.service;

import com.agentgraph.exception.ErrorCode;
import com.agentgraph.exception.GraphException;
import com.agentgraph.exception.ReferenceNotFoundException;
import com.agentgraph.model.dto.EdgeResponse;
import com.agentgraph.model.dto.GraphQueryRequest;
import com.agentgraph.model.dto.GraphQueryResponse;
import com.agentgraph.model.dto.GraphSummaryResponse;
import com.agentgraph.model.dto.NodeResponse;
import com.agentgraph.model.entity.GraphEdge;
import com.agentgraph.model.entity.GraphNode;
import com.agentgraph.model.entity.TypeCount;
import com.agentgraph.repository.GraphEdgeRepository;
import com.agentgraph.repository.GraphNodeRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Read side of an agent's graph.
 */
@Slf4j
@Service
public class GraphQueryService {

    private final GraphNodeRepository nodeRepository;
    private final GraphEdgeRepository edgeRepository;
    private final GraphResponseMapper mapper;
    private final int defaultLimit;
    private final int maxLimit;

    public GraphQueryService(GraphNodeRepository nodeRepository,
                             GraphEdgeRepository edgeRepository,
                             GraphResponseMapper mapper,
                             @Value("${agentgraph.query.default-limit:20}") int defaultLimit,
                             @Value("${agentgraph.query.max-limit:100}") int maxLimit) {
        this.nodeRepository = nodeRepository;
        this.edgeRepository = edgeRepository;
        this.mapper = mapper;
        this.defaultLimit = defaultLimit;
        this.maxLimit = maxLimit;
    }

    /**
     * Find the newest nodes of an agent, optionally filtered by type and by a
     * case-insensitive name substring, together with every edge touching them.
     *
     * The limit is applied before the name filter.
     *
     * @param agentId Agent ID
     * @param request Optional node type, search term and limit
     * @return matching nodes and their incident edges, each edge once
     */
    public Mono<GraphQueryResponse> queryGraph(UUID agentId, GraphQueryRequest request) {
        int limit = request.getLimit() == null ? defaultLimit : request.getLimit();
        if (limit < 1 || limit > maxLimit) {
            return Mono.error(new GraphException(ErrorCode.INVALID_PARAMETERS,
                    String.format("limit must be between 1 and %d, got %d", maxLimit, limit)));
        }

        Flux<GraphNode> candidates = isBlank(request.getNodeType())
                ? nodeRepository.findRecentByAgent(agentId, limit)
                : nodeRepository.findRecentByAgentAndType(agentId, request.getNodeType(), limit);

        String term = isBlank(request.getSearchTerm()) ? null : request.getSearchTerm().toLowerCase(Locale.ROOT);

        return candidates
                .filter(node -> term == null || node.getName().toLowerCase(Locale.ROOT).contains(term))
                .collectList()
                .flatMap(nodes -> Flux.fromIterable(nodes)
                        .concatMap(node -> edgeRepository.findIncident(node.getId()))
                        .distinct(GraphEdge::getId)
                        .map(mapper::toResponse)
                        .collectList()
                        .map(edges -> {
                            List<NodeResponse> nodeResponses = nodes.stream()
                                    .map(mapper::toResponse)
                                    .collect(Collectors.toList());
                            log.debug("Graph query for agent {} returned {} nodes and {} edges",
                                    agentId, nodeResponses.size(), edges.size());
                            return GraphQueryResponse.builder()
                                    .nodes(nodeResponses)
                                    .edges(edges)
                                    .build();
                        }));
    }

    /**
     * Count nodes and edges of an agent, in total and per type.
     */
    public Mono<GraphSummaryResponse> getGraphSummary(UUID agentId) {
        return Mono.zip(
                        nodeRepository.countByAgentId(agentId),
                        edgeRepository.countByAgentId(agentId),
                        toCountMap(nodeRepository.countByTypeForAgent(agentId)),
                        toCountMap(edgeRepository.countByTypeForAgent(agentId)))
                .map(counts -> GraphSummaryResponse.builder()
                        .nodeCount(counts.getT1())
                        .edgeCount(counts.getT2())
                        .nodesByType(counts.getT3())
                        .edgesByType(counts.getT4())
                        .build());
    }

    /**
     * Read back a single node. Nodes of other agents are reported as not found.
     */
    public Mono<NodeResponse> getNode(UUID agentId, UUID nodeId) {
        return nodeRepository.findById(nodeId)
                .filter(node -> agentId.equals(node.getAgentId()))
                .map(mapper::toResponse)
                .switchIfEmpty(Mono.error(new ReferenceNotFoundException(
                        ErrorCode.NODE_NOT_FOUND, "Node", nodeId.toString())));
    }

    /**
     * Edges touching a node of the agent.
     */
    public Flux<EdgeResponse> getNodeEdges(UUID agentId, UUID nodeId) {
        return getNode(agentId, nodeId)
                .flatMapMany(node -> edgeRepository.findIncident(nodeId))
                .map(mapper::toResponse);
    }

    private static Mono<Map<String, Long>> toCountMap(Flux<TypeCount> counts) {
        return counts
                .sort((a, b) -> a.getType().compareTo(b.getType()))
                .collectMap(TypeCount::getType, TypeCount::getCount, LinkedHashMap::new);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
