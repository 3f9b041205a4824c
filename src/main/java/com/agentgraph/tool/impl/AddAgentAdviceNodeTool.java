package com.agentgraph.tool.impl;

import com.agentgraph.model.dto.AdviceResult;
import com.agentgraph.model.dto.DerivedNodeRequest;
import com.agentgraph.service.DerivedKnowledgeService;
import com.agentgraph.tool.GraphTool;
import com.agentgraph.tool.ToolContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
@RequiredArgsConstructor
public class AddAgentAdviceNodeTool implements GraphTool<DerivedNodeRequest> {

    private final DerivedKnowledgeService derivedKnowledgeService;

    @Override
    public String name() {
        return "addAgentAdviceNode";
    }

    @Override
    public String description() {
        return "Create an AgentAdvice node with an actionable recommendation and notify the user through the inbox. "
                + "Properties: action (BUY|SELL|HOLD), summary, content, confidence (0-1, optional), generated_at "
                + "(ISO date-time). The content may cite only AgentAnalysis nodes, as [node:uuid].";
    }

    @Override
    public Class<DerivedNodeRequest> parameterType() {
        return DerivedNodeRequest.class;
    }

    @Override
    public Mono<AdviceResult> execute(ToolContext context, DerivedNodeRequest params) {
        return derivedKnowledgeService.addAdviceNode(context.getAgentId(), params);
    }
}
