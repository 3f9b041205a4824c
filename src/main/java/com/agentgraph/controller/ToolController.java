package com.agentgraph.controller;

import com.agentgraph.tool.ToolDispatcher;
import com.agentgraph.tool.ToolRegistry;
import com.agentgraph.tool.ToolResult;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.UUID;

/**
 * Controller exposing the graph tools to agent runtimes. Tool calls always answer 200;
 * failures are reported inside the {@link ToolResult}.
 */
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class ToolController {

    private final ToolRegistry toolRegistry;
    private final ToolDispatcher toolDispatcher;

    @GetMapping("/tools")
    public Flux<Map<String, String>> listTools() {
        return Flux.fromIterable(toolRegistry.getTools())
                .map(tool -> Map.of("name", tool.name(), "description", tool.description()));
    }

    @PostMapping("/agents/{agentId}/tools/{toolName}")
    public Mono<ToolResult> callTool(
            @PathVariable UUID agentId,
            @PathVariable String toolName,
            @RequestBody(required = false) JsonNode params) {
        return toolDispatcher.dispatch(agentId, toolName, params);
    }
}
