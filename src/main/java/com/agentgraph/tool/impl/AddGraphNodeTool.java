package com.agentgraph.tool.impl;

import com.agentgraph.model.dto.NodeUpsertRequest;
import com.agentgraph.model.dto.UpsertResult;
import com.agentgraph.service.NodeService;
import com.agentgraph.tool.GraphTool;
import com.agentgraph.tool.ToolContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
@RequiredArgsConstructor
public class AddGraphNodeTool implements GraphTool<NodeUpsertRequest> {

    private final NodeService nodeService;

    @Override
    public String name() {
        return "addGraphNode";
    }

    @Override
    public String description() {
        return "Add a node to the knowledge graph, or merge properties into the node with the same type and "
                + "name. Properties must match the node type's schema.";
    }

    @Override
    public Class<NodeUpsertRequest> parameterType() {
        return NodeUpsertRequest.class;
    }

    @Override
    public Mono<UpsertResult> execute(ToolContext context, NodeUpsertRequest params) {
        return nodeService.upsertNode(context.getAgentId(), params.getType(), params.getName(),
                params.getProperties());
    }
}
