package com.agentgraph.controller;

import com.agentgraph.exception.ErrorCode;
import com.agentgraph.tool.GraphTool;
import com.agentgraph.tool.ToolDispatcher;
import com.agentgraph.tool.ToolRegistry;
import com.agentgraph.tool.ToolResult;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Integration tests for ToolController.
 */
@WebFluxTest(controllers = ToolController.class, properties = "agentgraph.database.initialize-schema=false")
class ToolControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private ToolRegistry toolRegistry;

    @MockBean
    private ToolDispatcher toolDispatcher;

    private final UUID agentId = UUID.randomUUID();

    @Test
    void listTools_ReturnsNamesAndDescriptions() {
        GraphTool<?> tool = mock(GraphTool.class);
        when(tool.name()).thenReturn("queryGraph");
        when(tool.description()).thenReturn("Query the knowledge graph.");
        when(toolRegistry.getTools()).thenReturn(List.of(tool));

        webTestClient.get()
                .uri("/v1/tools")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].name").isEqualTo("queryGraph")
                .jsonPath("$[0].description").isEqualTo("Query the knowledge graph.");
    }

    @Test
    void callTool_PassesArguments() {
        when(toolDispatcher.dispatch(eq(agentId), eq("queryGraph"), any(JsonNode.class)))
                .thenReturn(Mono.just(ToolResult.success(List.of())));

        webTestClient.post()
                .uri("/v1/agents/{agentId}/tools/{toolName}", agentId, "queryGraph")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"searchTerm\": \"acme\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.error").doesNotExist();

        ArgumentCaptor<JsonNode> params = ArgumentCaptor.forClass(JsonNode.class);
        verify(toolDispatcher).dispatch(eq(agentId), eq("queryGraph"), params.capture());
        assertThat(params.getValue().get("searchTerm").asText()).isEqualTo("acme");
    }

    @Test
    void callTool_FailuresAreStillOk() {
        when(toolDispatcher.dispatch(eq(agentId), eq("dropGraph"), isNull()))
                .thenReturn(Mono.just(ToolResult.failure(ErrorCode.UNKNOWN_TOOL,
                        "Unknown tool \"dropGraph\". Available tools: queryGraph")));

        webTestClient.post()
                .uri("/v1/agents/{agentId}/tools/{toolName}", agentId, "dropGraph")
                .contentType(MediaType.APPLICATION_JSON)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.error.code").isEqualTo("UNKNOWN_TOOL")
                .jsonPath("$.error.message")
                .isEqualTo("UNKNOWN_TOOL: Unknown tool \"dropGraph\". Available tools: queryGraph");
    }
}
