package com.agentgraph.tool.impl;

import com.agentgraph.model.dto.EdgeUpsertRequest;
import com.agentgraph.model.dto.UpsertResult;
import com.agentgraph.service.EdgeService;
import com.agentgraph.tool.GraphTool;
import com.agentgraph.tool.ToolContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
@RequiredArgsConstructor
public class AddGraphEdgeTool implements GraphTool<EdgeUpsertRequest> {

    private final EdgeService edgeService;

    @Override
    public String name() {
        return "addGraphEdge";
    }

    @Override
    public String description() {
        return "Connect two existing nodes, each addressed by type and name, with a typed edge. Adding an edge "
                + "that already exists is a no-op.";
    }

    @Override
    public Class<EdgeUpsertRequest> parameterType() {
        return EdgeUpsertRequest.class;
    }

    @Override
    public Mono<UpsertResult> execute(ToolContext context, EdgeUpsertRequest params) {
        return edgeService.upsertEdge(context.getAgentId(), params);
    }
}
