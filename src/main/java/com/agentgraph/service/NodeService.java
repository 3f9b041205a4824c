package com.agentgraph.service;

import com.agentgraph.exception.SchemaValidationException;
import com.agentgraph.model.TypeKind;
import com.agentgraph.model.UpsertAction;
import com.agentgraph.model.dto.UpsertResult;
import com.agentgraph.model.entity.GraphNode;
import com.agentgraph.model.entity.GraphType;
import com.agentgraph.repository.GraphNodeRepository;
import com.agentgraph.schema.SchemaValidator;
import com.agentgraph.schema.Violation;
import com.agentgraph.util.JsonCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Idempotent create-or-merge of named, typed nodes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NodeService {

    private final GraphNodeRepository nodeRepository;
    private final TypeRegistry typeRegistry;
    private final SchemaValidator schemaValidator;
    private final JsonCodec jsonCodec;

    /**
     * Create a node, or merge properties into the node already identified by (agent, type, name).
     *
     * On merge the incoming keys win, and the merged result must still satisfy the type's
     * schema; otherwise nothing is written.
     *
     * @param agentId    Agent ID
     * @param type       Node type name
     * @param name       Node name
     * @param properties Properties to set (may be null)
     * @return node id and whether it was created or updated
     */
    public Mono<UpsertResult> upsertNode(UUID agentId, String type, String name, Map<String, Object> properties) {
        Map<String, Object> incoming = properties == null ? Map.of() : properties;

        return typeRegistry.requireType(agentId, TypeKind.NODE, type)
                .flatMap(nodeType -> nodeRepository.findByAgentIdAndTypeAndName(agentId, type, name)
                        .flatMap(existing -> merge(existing, nodeType, incoming))
                        .switchIfEmpty(Mono.defer(() -> create(agentId, nodeType, name, incoming))));
    }

    private Mono<UpsertResult> create(UUID agentId, GraphType nodeType, String name, Map<String, Object> properties) {
        List<Violation> violations = validate(properties, nodeType);
        if (!violations.isEmpty()) {
            // A concurrent create may have landed since the lookup; its row makes this a merge
            return nodeRepository.findByAgentIdAndTypeAndName(agentId, nodeType.getName(), name)
                    .flatMap(existing -> merge(existing, nodeType, properties))
                    .switchIfEmpty(Mono.defer(() -> {
                        log.warn("Node property schema validation failed on create: agent={}, type={}, name={}, "
                                + "errors={}", agentId, nodeType.getName(), name, violations);
                        return Mono.error(new SchemaValidationException(
                                TypeKind.NODE.getSchemaFailureCode(), violations));
                    }));
        }

        LocalDateTime now = LocalDateTime.now();
        GraphNode node = GraphNode.builder()
                .agentId(agentId)
                .type(nodeType.getName())
                .name(name)
                .properties(jsonCodec.write(properties))
                .createdAt(now)
                .updatedAt(now)
                .build();

        return nodeRepository.save(node)
                .map(saved -> UpsertResult.of(saved.getId(), UpsertAction.CREATED))
                .onErrorResume(DataIntegrityViolationException.class, e -> {
                    // Lost a race with an identical create; the winner's row is the one to merge into
                    log.info("Node {}:{} for agent {} was created concurrently, merging instead",
                            nodeType.getName(), name, agentId);
                    return nodeRepository.findByAgentIdAndTypeAndName(agentId, nodeType.getName(), name)
                            .flatMap(existing -> merge(existing, nodeType, properties))
                            .switchIfEmpty(Mono.error(e));
                });
    }

    private Mono<UpsertResult> merge(GraphNode existing, GraphType nodeType, Map<String, Object> incoming) {
        Map<String, Object> merged = new LinkedHashMap<>();
        Map<String, Object> current = jsonCodec.readMap(existing.getProperties());
        if (current != null) {
            merged.putAll(current);
        }
        merged.putAll(incoming);

        List<Violation> violations = validate(merged, nodeType);
        if (!violations.isEmpty()) {
            log.warn("Node property schema validation failed on update: agent={}, type={}, name={}, errors={}",
                    existing.getAgentId(), existing.getType(), existing.getName(), violations);
            return Mono.error(new SchemaValidationException(TypeKind.NODE.getSchemaFailureCode(), violations));
        }

        existing.setProperties(jsonCodec.write(merged));
        existing.setUpdatedAt(LocalDateTime.now());
        return nodeRepository.save(existing)
                .map(saved -> UpsertResult.of(saved.getId(), UpsertAction.UPDATED));
    }

    private List<Violation> validate(Map<String, Object> properties, GraphType nodeType) {
        return schemaValidator.validateProperties(properties, jsonCodec.readTree(nodeType.getPropertiesSchema()));
    }
}
