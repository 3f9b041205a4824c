package com.agentgraph.citation;

import com.agentgraph.exception.CitationException;
import com.agentgraph.model.entity.GraphEdge;
import com.agentgraph.model.entity.GraphNode;
import com.agentgraph.support.GraphFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for CitationVerifier.
 */
class CitationVerifierTest {

    private GraphFixture graph;
    private CitationVerifier verifier;
    private UUID agentId;
    private UUID otherAgentId;

    @BeforeEach
    void setUp() {
        graph = new GraphFixture();
        verifier = graph.citationVerifier;
        agentId = UUID.randomUUID();
        otherAgentId = UUID.randomUUID();
    }

    @Test
    void verify_OwnNodesAndEdgesResolve() {
        GraphNode company = graph.node(agentId, "Company", "Acme");
        GraphNode report = graph.node(agentId, "Report", "Q4");
        GraphEdge edge = edge(agentId, report, company);

        String content = "Q4 [node:" + report.getId() + "] covers [node:" + company.getId() + "] via [edge:"
                + edge.getId() + "], see also [node:" + company.getId() + "]";

        StepVerifier.create(verifier.verify(agentId, content, CitationPolicy.analysis("AgentAnalysis")))
                .verifyComplete();
    }

    @Test
    void verify_NoCitations() {
        StepVerifier.create(verifier.verify(agentId, "Nothing to see here.", CitationPolicy.analysis("AgentAnalysis")))
                .expectErrorSatisfies(error -> assertCitationError(error, CitationException.Reason.NO_CITATIONS,
                        "AgentAnalysis content must include at least one citation using [node:uuid] or [edge:uuid]."))
                .verify();
    }

    @Test
    void verify_MalformedIdsFailBeforeLookup() {
        GraphNode company = graph.node(agentId, "Company", "Acme");
        String content = "[node:" + company.getId() + "] [node:abc] [edge:123]";

        StepVerifier.create(verifier.verify(agentId, content, CitationPolicy.analysis("AgentAnalysis")))
                .expectErrorSatisfies(error -> {
                    assertCitationError(error, CitationException.Reason.INVALID_FORMAT, null);
                    assertThat(error.getMessage())
                            .startsWith("Invalid citation format in AgentAnalysis content.")
                            .endsWith("Invalid citations: [node:abc], [edge:123]");
                })
                .verify();
    }

    @Test
    void verify_NestedMarkerFailsFormatCheck() {
        GraphNode company = graph.node(agentId, "Company", "Acme");
        String content = "Margins grew [node:[node:" + company.getId() + "]";

        StepVerifier.create(verifier.verify(agentId, content, CitationPolicy.analysis("AgentAnalysis")))
                .expectErrorSatisfies(error -> {
                    assertCitationError(error, CitationException.Reason.INVALID_FORMAT, null);
                    assertThat(error.getMessage())
                            .endsWith("Invalid citations: [node:[node:" + company.getId() + "]");
                })
                .verify();
    }

    @Test
    void verify_ReportsAtMostFiveMalformedCitations() {
        String content = "[node:a] [node:b] [node:c] [node:d] [node:e] [node:f]";

        StepVerifier.create(verifier.verify(agentId, content, CitationPolicy.analysis("AgentAnalysis")))
                .expectErrorSatisfies(error -> assertThat(error.getMessage())
                        .endsWith("Invalid citations: [node:a], [node:b], [node:c], [node:d], [node:e]"))
                .verify();
    }

    @Test
    void verify_MissingAndCrossAgentReferencesAreAggregated() {
        GraphNode foreignNode = graph.node(otherAgentId, "Company", "Globex");
        GraphNode foreignTarget = graph.node(otherAgentId, "Company", "Initech");
        GraphEdge foreignEdge = edge(otherAgentId, foreignNode, foreignTarget);
        UUID missingNode = UUID.randomUUID();
        UUID missingEdge = UUID.randomUUID();

        String content = "[node:" + missingNode + "] [node:" + foreignNode.getId() + "] [edge:" + missingEdge
                + "] [edge:" + foreignEdge.getId() + "]";

        StepVerifier.create(verifier.verify(agentId, content, CitationPolicy.analysis("AgentAnalysis")))
                .expectErrorSatisfies(error -> assertCitationError(error, CitationException.Reason.UNRESOLVED,
                        "AgentAnalysis content cites unknown or unauthorized graph references (missing nodes: "
                                + missingNode + "; cross-agent nodes: " + foreignNode.getId() + "; missing edges: "
                                + missingEdge + "; cross-agent edges: " + foreignEdge.getId() + ")"))
                .verify();
    }

    @Test
    void verify_UppercaseIdMatchesStoredNode() {
        GraphNode company = graph.node(agentId, "Company", "Acme");

        String content = "[node:" + company.getId().toString().toUpperCase() + "]";

        StepVerifier.create(verifier.verify(agentId, content, CitationPolicy.analysis("AgentAnalysis")))
                .verifyComplete();
    }

    @Test
    void verify_AdviceRejectsEdgesAndNonAnalysisNodes() {
        GraphNode analysis = graph.node(agentId, "AgentAnalysis", "Services growth");
        GraphNode company = graph.node(agentId, "Company", "Acme");
        GraphEdge edge = edge(agentId, analysis, company);

        String content = "[node:" + analysis.getId() + "] [node:" + company.getId() + "] [edge:" + edge.getId() + "]";

        StepVerifier.create(verifier.verify(agentId, content, CitationPolicy.advice("AgentAdvice", "AgentAnalysis")))
                .expectErrorSatisfies(error -> assertCitationError(error, CitationException.Reason.UNRESOLVED,
                        "AgentAdvice content cites unknown or unauthorized graph references (non-analysis nodes: "
                                + company.getId() + "; edge citations not allowed: " + edge.getId() + ")"))
                .verify();
    }

    @Test
    void verify_AdviceCitingOnlyAnalysesPasses() {
        GraphNode analysis = graph.node(agentId, "AgentAnalysis", "Services growth");

        StepVerifier.create(verifier.verify(agentId, "Based on [node:" + analysis.getId() + "]",
                        CitationPolicy.advice("AgentAdvice", "AgentAnalysis")))
                .verifyComplete();
    }

    @Test
    void verify_AdviceWithoutCitationsMentionsNodeMarkersOnly() {
        StepVerifier.create(verifier.verify(agentId, "Trust me.", CitationPolicy.advice("AgentAdvice", "AgentAnalysis")))
                .expectErrorSatisfies(error -> assertCitationError(error, CitationException.Reason.NO_CITATIONS,
                        "AgentAdvice content must include at least one citation using [node:uuid]."))
                .verify();
    }

    private GraphEdge edge(UUID owner, GraphNode source, GraphNode target) {
        return graph.edgeRepository.insert(GraphEdge.builder()
                .agentId(owner)
                .type("about")
                .sourceId(source.getId())
                .targetId(target.getId())
                .properties("{}")
                .createdAt(LocalDateTime.now())
                .build());
    }

    private static void assertCitationError(Throwable error, CitationException.Reason reason, String message) {
        assertThat(error).isInstanceOf(CitationException.class);
        assertThat(((CitationException) error).getReason()).isEqualTo(reason);
        if (message != null) {
            assertThat(error.getMessage()).isEqualTo(message);
        }
    }
}
