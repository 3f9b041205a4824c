package com.agentgraph.citation;

import com.agentgraph.exception.CitationException;
import com.agentgraph.repository.GraphEdgeRepository;
import com.agentgraph.repository.GraphNodeRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Checks that derived content is grounded in graph elements the agent owns.
 */
@Slf4j
@Service
public class CitationVerifier {

    private static final int MAX_REPORTED_INVALID = 5;

    /**
     * Problem categories in reporting order.
     */
    enum Finding {
        RESOLVED(null),
        MISSING_NODE("missing nodes"),
        CROSS_AGENT_NODE("cross-agent nodes"),
        NON_ANALYSIS_NODE("non-analysis nodes"),
        MISSING_EDGE("missing edges"),
        CROSS_AGENT_EDGE("cross-agent edges"),
        EDGE_NOT_ALLOWED("edge citations not allowed");

        private final String label;

        Finding(String label) {
            this.label = label;
        }
    }

    private final GraphNodeRepository nodeRepository;
    private final GraphEdgeRepository edgeRepository;
    private final int lookupConcurrency;

    public CitationVerifier(GraphNodeRepository nodeRepository,
                            GraphEdgeRepository edgeRepository,
                            @Value("${agentgraph.citation.lookup-concurrency:8}") int lookupConcurrency) {
        this.nodeRepository = nodeRepository;
        this.edgeRepository = edgeRepository;
        this.lookupConcurrency = Math.max(1, lookupConcurrency);
    }

    /**
     * Verify the citations in {@code content}.
     *
     * Fails when there are no citations, when any citation id is not a UUID (checked before
     * any lookup), or when cited ids are missing, owned by another agent, or not allowed by
     * the policy. All unresolved references are reported together.
     *
     * @param agentId Agent that owns the content
     * @param content Free text with citation markers
     * @param policy  What the content may cite
     * @return empty on success, error otherwise
     */
    public Mono<Void> verify(UUID agentId, String content, CitationPolicy policy) {
        List<Citation> citations = CitationParser.parse(content);
        if (citations.isEmpty()) {
            log.warn("Rejected {} content without citations for agent {}", policy.getSubject(), agentId);
            return Mono.error(new CitationException(CitationException.Reason.NO_CITATIONS, String.format(
                    "%s content must include at least one citation using %s.",
                    policy.getSubject(), policy.markerHint())));
        }

        List<String> malformed = citations.stream()
                .filter(citation -> !citation.hasWellFormedId())
                .map(Citation::getRaw)
                .collect(Collectors.toList());
        if (!malformed.isEmpty()) {
            log.warn("Rejected {} content with malformed citations for agent {}: {}",
                    policy.getSubject(), agentId, malformed);
            return Mono.error(new CitationException(CitationException.Reason.INVALID_FORMAT, String.format(
                    "Invalid citation format in %s content. Citations must look like %s with a valid UUID. "
                            + "Invalid citations: %s",
                    policy.getSubject(), policy.markerHint(),
                    String.join(", ", malformed.subList(0, Math.min(MAX_REPORTED_INVALID, malformed.size()))))));
        }

        Set<UUID> nodeIds = uniqueIds(citations, CitationKind.NODE);
        Set<UUID> edgeIds = uniqueIds(citations, CitationKind.EDGE);

        Flux<Map.Entry<Finding, UUID>> nodeFindings = Flux.fromIterable(nodeIds)
                .flatMapSequential(id -> checkNode(agentId, id, policy).map(finding -> Map.entry(finding, id)),
                        lookupConcurrency);
        Flux<Map.Entry<Finding, UUID>> edgeFindings = policy.isEdgesAllowed()
                ? Flux.fromIterable(edgeIds)
                        .flatMapSequential(id -> checkEdge(agentId, id).map(finding -> Map.entry(finding, id)),
                                lookupConcurrency)
                : Flux.fromIterable(edgeIds).map(id -> Map.entry(Finding.EDGE_NOT_ALLOWED, id));

        return Flux.concat(nodeFindings, edgeFindings)
                .filter(entry -> entry.getKey() != Finding.RESOLVED)
                .collect(() -> new EnumMap<Finding, List<String>>(Finding.class),
                        (problems, entry) -> problems.computeIfAbsent(entry.getKey(), key -> new ArrayList<>())
                                .add(entry.getValue().toString()))
                .flatMap(problems -> {
                    if (problems.isEmpty()) {
                        return Mono.empty();
                    }
                    String detail = problems.entrySet().stream()
                            .map(entry -> entry.getKey().label + ": " + String.join(", ", entry.getValue()))
                            .collect(Collectors.joining("; "));
                    log.warn("Rejected {} content with unresolved citations for agent {}: {}",
                            policy.getSubject(), agentId, detail);
                    return Mono.error(new CitationException(CitationException.Reason.UNRESOLVED, String.format(
                            "%s content cites unknown or unauthorized graph references (%s)",
                            policy.getSubject(), detail)));
                });
    }

    private Mono<Finding> checkNode(UUID agentId, UUID id, CitationPolicy policy) {
        return nodeRepository.findById(id)
                .map(node -> {
                    if (!agentId.equals(node.getAgentId())) {
                        return Finding.CROSS_AGENT_NODE;
                    }
                    if (policy.getRequiredNodeType() != null && !policy.getRequiredNodeType().equals(node.getType())) {
                        return Finding.NON_ANALYSIS_NODE;
                    }
                    return Finding.RESOLVED;
                })
                .defaultIfEmpty(Finding.MISSING_NODE);
    }

    private Mono<Finding> checkEdge(UUID agentId, UUID id) {
        return edgeRepository.findById(id)
                .map(edge -> agentId.equals(edge.getAgentId()) ? Finding.RESOLVED : Finding.CROSS_AGENT_EDGE)
                .defaultIfEmpty(Finding.MISSING_EDGE);
    }

    private static Set<UUID> uniqueIds(List<Citation> citations, CitationKind kind) {
        Set<UUID> ids = new LinkedHashSet<>();
        for (Citation citation : citations) {
            if (citation.getKind() == kind) {
                ids.add(UUID.fromString(citation.getId().toLowerCase(Locale.ROOT)));
            }
        }
        return ids;
    }
}
