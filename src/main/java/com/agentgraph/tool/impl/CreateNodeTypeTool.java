package com.agentgraph.tool.impl;

import com.agentgraph.model.TypeKind;
import com.agentgraph.model.dto.NodeTypeCreateRequest;
import com.agentgraph.service.TypeRegistry;
import com.agentgraph.tool.GraphTool;
import com.agentgraph.tool.ToolContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Map;

@Component
@RequiredArgsConstructor
public class CreateNodeTypeTool implements GraphTool<NodeTypeCreateRequest> {

    private final TypeRegistry typeRegistry;

    @Override
    public String name() {
        return "createNodeType";
    }

    @Override
    public String description() {
        return "Create a new node type when no existing type fits. Names are capitalized words separated by "
                + "single spaces (e.g. \"Company\", \"Market Event\"). Requires a description, a JSON properties "
                + "schema, example properties and a justification of why existing types are not enough.";
    }

    @Override
    public Class<NodeTypeCreateRequest> parameterType() {
        return NodeTypeCreateRequest.class;
    }

    @Override
    public Mono<Map<String, String>> execute(ToolContext context, NodeTypeCreateRequest params) {
        return typeRegistry.createType(context.getAgentId(), TypeKind.NODE, params.toDefinition())
                .map(type -> Map.of("id", type.getId().toString(), "name", type.getName()));
    }
}
