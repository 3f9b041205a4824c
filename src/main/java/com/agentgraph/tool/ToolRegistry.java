package com.agentgraph.tool;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable name to tool mapping, built once from the tool beans in the context.
 */
@Slf4j
@Component
public class ToolRegistry {

    private final Map<String, GraphTool<?>> tools;

    public ToolRegistry(List<GraphTool<?>> graphTools) {
        List<GraphTool<?>> sorted = new ArrayList<>(graphTools);
        sorted.sort(Comparator.comparing(GraphTool::name));

        Map<String, GraphTool<?>> byName = new LinkedHashMap<>();
        for (GraphTool<?> tool : sorted) {
            if (byName.putIfAbsent(tool.name(), tool) != null) {
                throw new IllegalStateException("Tool with name '" + tool.name() + "' already registered.");
            }
        }
        this.tools = Collections.unmodifiableMap(byName);
        log.info("Registered {} graph tools: {}", tools.size(), tools.keySet());
    }

    public Optional<GraphTool<?>> getTool(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public Collection<GraphTool<?>> getTools() {
        return tools.values();
    }

    public Collection<String> getToolNames() {
        return tools.keySet();
    }
}
