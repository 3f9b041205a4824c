package com.agentgraph.tool.impl;

import com.agentgraph.model.TypeKind;
import com.agentgraph.model.dto.TypeResponse;
import com.agentgraph.service.GraphResponseMapper;
import com.agentgraph.service.TypeRegistry;
import com.agentgraph.tool.EmptyParams;
import com.agentgraph.tool.GraphTool;
import com.agentgraph.tool.ToolContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

@Component
@RequiredArgsConstructor
public class ListNodeTypesTool implements GraphTool<EmptyParams> {

    private final TypeRegistry typeRegistry;
    private final GraphResponseMapper mapper;

    @Override
    public String name() {
        return "listNodeTypes";
    }

    @Override
    public String description() {
        return "List the node types available in this agent's knowledge graph, with their property schemas and examples. Call this before creating nodes or new node types.";
    }

    @Override
    public Class<EmptyParams> parameterType() {
        return EmptyParams.class;
    }

    @Override
    public Mono<List<TypeResponse>> execute(ToolContext context, EmptyParams params) {
        return typeRegistry.listTypes(context.getAgentId(), TypeKind.NODE)
                .map(mapper::toResponse)
                .collectList();
    }
}
