package com.agentgraph.tool.impl;

import com.agentgraph.model.dto.GraphQueryRequest;
import com.agentgraph.model.dto.GraphQueryResponse;
import com.agentgraph.service.GraphQueryService;
import com.agentgraph.tool.GraphTool;
import com.agentgraph.tool.ToolContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
@RequiredArgsConstructor
public class QueryGraphTool implements GraphTool<GraphQueryRequest> {

    private final GraphQueryService graphQueryService;

    @Override
    public String name() {
        return "queryGraph";
    }

    @Override
    public String description() {
        return "Query the knowledge graph. Optionally filter by node type and a search term matched against "
                + "node names; limit defaults to 20. Returns nodes and their edges with ids usable in "
                + "[node:uuid] / [edge:uuid] citations.";
    }

    @Override
    public Class<GraphQueryRequest> parameterType() {
        return GraphQueryRequest.class;
    }

    @Override
    public Mono<GraphQueryResponse> execute(ToolContext context, GraphQueryRequest params) {
        return graphQueryService.queryGraph(context.getAgentId(), params);
    }
}
