package com.agentgraph.service;

import com.agentgraph.citation.CitationPolicy;
import com.agentgraph.citation.CitationVerifier;
import com.agentgraph.exception.TypeNotFoundException;
import com.agentgraph.model.TypeKind;
import com.agentgraph.model.dto.AdviceResult;
import com.agentgraph.model.dto.DerivedNodeRequest;
import com.agentgraph.model.dto.UpsertResult;
import com.agentgraph.model.entity.GraphType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.UUID;

/**
 * Writes agent-derived analysis and advice nodes. Both must be grounded in citations of
 * existing graph elements owned by the same agent.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DerivedKnowledgeService {

    private static final String CONTENT = "content";
    private static final String SUMMARY = "summary";
    private static final String ACTION = "action";

    private final TypeRegistry typeRegistry;
    private final NodeService nodeService;
    private final CitationVerifier citationVerifier;
    private final InboxNotifier inboxNotifier;

    /**
     * Write an AgentAnalysis node. Its content may cite any node or edge of the agent.
     *
     * @param agentId Agent ID
     * @param request Name and properties of the analysis
     * @return node id and upsert action
     */
    public Mono<UpsertResult> addAnalysisNode(UUID agentId, DerivedNodeRequest request) {
        CitationPolicy policy = CitationPolicy.analysis(SeedCatalog.ANALYSIS_TYPE);
        return write(agentId, SeedCatalog.ANALYSIS_TYPE, request, policy);
    }

    /**
     * Write an AgentAdvice node and record an inbox notification for it. Its content may
     * cite only AgentAnalysis nodes.
     *
     * @param agentId Agent ID
     * @param request Name and properties of the advice
     * @return node id, upsert action and notification id
     */
    public Mono<AdviceResult> addAdviceNode(UUID agentId, DerivedNodeRequest request) {
        CitationPolicy policy = CitationPolicy.advice(SeedCatalog.ADVICE_TYPE, SeedCatalog.ANALYSIS_TYPE);
        Map<String, Object> properties = propertiesOf(request);

        return write(agentId, SeedCatalog.ADVICE_TYPE, request, policy)
                .flatMap(result -> inboxNotifier.notify(agentId, result.getId(),
                                properties.get(ACTION) + ": " + request.getName(),
                                asText(properties.get(SUMMARY)))
                        .map(item -> AdviceResult.builder()
                                .id(result.getId())
                                .action(result.getAction())
                                .notificationId(item.getId())
                                .build()));
    }

    private Mono<UpsertResult> write(UUID agentId, String typeName, DerivedNodeRequest request,
                                     CitationPolicy policy) {
        Map<String, Object> properties = propertiesOf(request);

        return requireSeedType(agentId, typeName)
                .flatMap(type -> {
                    Object content = properties.get(CONTENT);
                    // Non-string content is left to the schema check
                    Mono<Void> citations = content instanceof String
                            ? citationVerifier.verify(agentId, (String) content, policy)
                            : Mono.empty();
                    return citations.then(Mono.defer(() ->
                            nodeService.upsertNode(agentId, typeName, request.getName(), properties)));
                });
    }

    private Mono<GraphType> requireSeedType(UUID agentId, String typeName) {
        return typeRegistry.getType(agentId, TypeKind.NODE, typeName)
                .switchIfEmpty(Mono.defer(() -> {
                    log.warn("Seed type {} missing for agent {}", typeName, agentId);
                    return Mono.error(new TypeNotFoundException(TypeKind.NODE.getNotFoundCode(), String.format(
                            "%s node type does not exist. Seed the baseline types for this agent first.",
                            typeName)));
                }));
    }

    private static Map<String, Object> propertiesOf(DerivedNodeRequest request) {
        return request.getProperties() == null ? Map.of() : request.getProperties();
    }

    private static String asText(Object value) {
        return value == null ? null : value.toString();
    }
}
