package com.agentgraph.tool.impl;

import com.agentgraph.model.dto.DerivedNodeRequest;
import com.agentgraph.model.dto.UpsertResult;
import com.agentgraph.service.DerivedKnowledgeService;
import com.agentgraph.tool.GraphTool;
import com.agentgraph.tool.ToolContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
@RequiredArgsConstructor
public class AddAgentAnalysisNodeTool implements GraphTool<DerivedNodeRequest> {

    private final DerivedKnowledgeService derivedKnowledgeService;

    @Override
    public String name() {
        return "addAgentAnalysisNode";
    }

    @Override
    public String description() {
        return "Create an AgentAnalysis node for an observation or pattern. Properties: type (observation|pattern), "
                + "summary, content, confidence (0-1, optional), generated_at (ISO date-time). The content must cite "
                + "existing graph elements as [node:uuid] or [edge:uuid]. Does not notify the user.";
    }

    @Override
    public Class<DerivedNodeRequest> parameterType() {
        return DerivedNodeRequest.class;
    }

    @Override
    public Mono<UpsertResult> execute(ToolContext context, DerivedNodeRequest params) {
        return derivedKnowledgeService.addAnalysisNode(context.getAgentId(), params);
    }
}
