package com.agentgraph.tool.impl;

import com.agentgraph.model.TypeKind;
import com.agentgraph.model.dto.EdgeTypeCreateRequest;
import com.agentgraph.service.TypeRegistry;
import com.agentgraph.tool.GraphTool;
import com.agentgraph.tool.ToolContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Map;

@Component
@RequiredArgsConstructor
public class CreateEdgeTypeTool implements GraphTool<EdgeTypeCreateRequest> {

    private final TypeRegistry typeRegistry;

    @Override
    public String name() {
        return "createEdgeType";
    }

    @Override
    public String description() {
        return "Create a new edge type when no existing relationship fits. Names are lowercase snake_case "
                + "(e.g. \"published_by\"). Requires a description and a justification; a properties schema and "
                + "example properties are optional.";
    }

    @Override
    public Class<EdgeTypeCreateRequest> parameterType() {
        return EdgeTypeCreateRequest.class;
    }

    @Override
    public Mono<Map<String, String>> execute(ToolContext context, EdgeTypeCreateRequest params) {
        return typeRegistry.createType(context.getAgentId(), TypeKind.EDGE, params.toDefinition())
                .map(type -> Map.of("id", type.getId().toString(), "name", type.getName()));
    }
}
