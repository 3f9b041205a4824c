package com.agentgraph.controller;

import com.agentgraph.model.dto.AdviceResult;
import com.agentgraph.model.dto.DerivedNodeRequest;
import com.agentgraph.model.dto.EdgeResponse;
import com.agentgraph.model.dto.EdgeUpsertRequest;
import com.agentgraph.model.dto.GraphQueryRequest;
import com.agentgraph.model.dto.GraphQueryResponse;
import com.agentgraph.model.dto.GraphSummaryResponse;
import com.agentgraph.model.dto.NodeResponse;
import com.agentgraph.model.dto.NodeUpsertRequest;
import com.agentgraph.model.dto.UpsertResult;
import com.agentgraph.model.entity.InboxItem;
import com.agentgraph.service.DerivedKnowledgeService;
import com.agentgraph.service.EdgeService;
import com.agentgraph.service.GraphQueryService;
import com.agentgraph.service.InboxNotifier;
import com.agentgraph.service.NodeService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Controller for an agent's graph data.
 */
@RestController
@RequestMapping("/v1/agents/{agentId}")
@RequiredArgsConstructor
public class GraphController {

    private final NodeService nodeService;
    private final EdgeService edgeService;
    private final GraphQueryService graphQueryService;
    private final DerivedKnowledgeService derivedKnowledgeService;
    private final InboxNotifier inboxNotifier;

    @PostMapping("/nodes")
    public Mono<UpsertResult> upsertNode(
            @PathVariable UUID agentId,
            @Valid @RequestBody NodeUpsertRequest request) {
        return nodeService.upsertNode(agentId, request.getType(), request.getName(), request.getProperties());
    }

    @GetMapping("/nodes/{nodeId}")
    public Mono<NodeResponse> getNode(@PathVariable UUID agentId, @PathVariable UUID nodeId) {
        return graphQueryService.getNode(agentId, nodeId);
    }

    @GetMapping("/nodes/{nodeId}/edges")
    public Flux<EdgeResponse> getNodeEdges(@PathVariable UUID agentId, @PathVariable UUID nodeId) {
        return graphQueryService.getNodeEdges(agentId, nodeId);
    }

    @PostMapping("/edges")
    public Mono<UpsertResult> upsertEdge(
            @PathVariable UUID agentId,
            @Valid @RequestBody EdgeUpsertRequest request) {
        return edgeService.upsertEdge(agentId, request);
    }

    @GetMapping("/graph")
    public Mono<GraphQueryResponse> queryGraph(
            @PathVariable UUID agentId,
            @RequestParam(required = false) String nodeType,
            @RequestParam(required = false) String searchTerm,
            @RequestParam(required = false) Integer limit) {
        GraphQueryRequest request = GraphQueryRequest.builder()
                .nodeType(nodeType)
                .searchTerm(searchTerm)
                .limit(limit)
                .build();
        return graphQueryService.queryGraph(agentId, request);
    }

    @GetMapping("/graph/summary")
    public Mono<GraphSummaryResponse> getGraphSummary(@PathVariable UUID agentId) {
        return graphQueryService.getGraphSummary(agentId);
    }

    @PostMapping("/analyses")
    public Mono<UpsertResult> addAnalysis(
            @PathVariable UUID agentId,
            @Valid @RequestBody DerivedNodeRequest request) {
        return derivedKnowledgeService.addAnalysisNode(agentId, request);
    }

    @PostMapping("/advice")
    public Mono<AdviceResult> addAdvice(
            @PathVariable UUID agentId,
            @Valid @RequestBody DerivedNodeRequest request) {
        return derivedKnowledgeService.addAdviceNode(agentId, request);
    }

    @GetMapping("/inbox")
    public Flux<InboxItem> listInbox(@PathVariable UUID agentId) {
        return inboxNotifier.listForAgent(agentId);
    }
}
