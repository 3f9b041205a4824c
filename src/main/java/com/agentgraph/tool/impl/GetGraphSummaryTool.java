package com.agentgraph.tool.impl;

import com.agentgraph.model.dto.GraphSummaryResponse;
import com.agentgraph.service.GraphQueryService;
import com.agentgraph.tool.EmptyParams;
import com.agentgraph.tool.GraphTool;
import com.agentgraph.tool.ToolContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
@RequiredArgsConstructor
public class GetGraphSummaryTool implements GraphTool<EmptyParams> {

    private final GraphQueryService graphQueryService;

    @Override
    public String name() {
        return "getGraphSummary";
    }

    @Override
    public String description() {
        return "Get node and edge counts of the knowledge graph, in total and per type.";
    }

    @Override
    public Class<EmptyParams> parameterType() {
        return EmptyParams.class;
    }

    @Override
    public Mono<GraphSummaryResponse> execute(ToolContext context, EmptyParams params) {
        return graphQueryService.getGraphSummary(context.getAgentId());
    }
}
