package com.agentgraph.controller;

import com.agentgraph.service.SeedCatalog;
import com.agentgraph.tool.ToolRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Service info and liveness, with the size of the tool surface and the baseline type catalog.
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private static final String SERVICE = "AgentGraph";
    private static final String VERSION = "1.0.0";

    private final ToolRegistry toolRegistry;
    private final SeedCatalog seedCatalog;

    @GetMapping("/")
    public Mono<Map<String, Object>> root() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("service", SERVICE);
        info.put("version", VERSION);
        info.put("tools", toolRegistry.getToolNames());
        return Mono.just(info);
    }

    @GetMapping("/v1/health")
    public Mono<Map<String, Object>> health() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", "healthy");
        status.put("version", VERSION);
        status.put("toolCount", toolRegistry.getToolNames().size());
        status.put("seedNodeTypes", seedCatalog.getNodeTypes().size());
        status.put("seedEdgeTypes", seedCatalog.getEdgeTypes().size());
        return Mono.just(status);
    }
}
