package com.agentgraph.service;

import com.agentgraph.model.TypeOrigin;
import com.agentgraph.model.dto.TypeDefinition;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Baseline node and edge types every agent graph starts with, read from
 * {@code graph/seed-types.json} on the classpath.
 */
@Slf4j
@Getter
@Component
public class SeedCatalog {

    public static final String RESOURCE = "graph/seed-types.json";
    public static final String ANALYSIS_TYPE = "AgentAnalysis";
    public static final String ADVICE_TYPE = "AgentAdvice";

    private final List<TypeDefinition> nodeTypes;
    private final List<TypeDefinition> edgeTypes;

    public SeedCatalog(ObjectMapper objectMapper) {
        SeedFile file;
        try (InputStream in = new ClassPathResource(RESOURCE).getInputStream()) {
            file = objectMapper.readValue(in, SeedFile.class);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read seed types from " + RESOURCE, e);
        }
        this.nodeTypes = asSystemTypes(file.getNodeTypes());
        this.edgeTypes = asSystemTypes(file.getEdgeTypes());
        log.debug("Loaded {} seed node types and {} seed edge types", nodeTypes.size(), edgeTypes.size());
    }

    private static List<TypeDefinition> asSystemTypes(List<TypeDefinition> definitions) {
        List<TypeDefinition> result = new ArrayList<>();
        if (definitions != null) {
            for (TypeDefinition definition : definitions) {
                definition.setCreatedBy(TypeOrigin.SYSTEM);
                result.add(definition);
            }
        }
        return List.copyOf(result);
    }

    @Data
    static class SeedFile {
        private List<TypeDefinition> nodeTypes;
        private List<TypeDefinition> edgeTypes;
    }
}
