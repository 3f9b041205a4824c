package com.agentgraph.service;

import com.agentgraph.exception.ErrorCode;
import com.agentgraph.exception.ReferenceNotFoundException;
import com.agentgraph.exception.SchemaValidationException;
import com.agentgraph.model.TypeKind;
import com.agentgraph.model.UpsertAction;
import com.agentgraph.model.dto.EdgeUpsertRequest;
import com.agentgraph.model.dto.UpsertResult;
import com.agentgraph.model.entity.GraphEdge;
import com.agentgraph.model.entity.GraphNode;
import com.agentgraph.repository.GraphEdgeRepository;
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
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Idempotent create-or-no-op of typed relationships between existing nodes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EdgeService {

    private final GraphEdgeRepository edgeRepository;
    private final GraphNodeRepository nodeRepository;
    private final TypeRegistry typeRegistry;
    private final SchemaValidator schemaValidator;
    private final JsonCodec jsonCodec;

    /**
     * Create an edge between two nodes addressed by (type, name). If an edge of the same
     * type already links the same source and target, it is returned untouched.
     *
     * @param agentId Agent ID
     * @param request Edge type, endpoints and optional properties
     * @return edge id and whether it was created or already existed
     */
    public Mono<UpsertResult> upsertEdge(UUID agentId, EdgeUpsertRequest request) {
        String descriptor = String.format("%s:%s -[%s]-> %s:%s", request.getSourceType(), request.getSourceName(),
                request.getType(), request.getTargetType(), request.getTargetName());
        Map<String, Object> properties = request.getProperties() == null ? Map.of() : request.getProperties();

        return typeRegistry.requireType(agentId, TypeKind.EDGE, request.getType())
                .flatMap(edgeType -> {
                    List<Violation> violations = schemaValidator.validateProperties(properties,
                            jsonCodec.readTree(edgeType.getPropertiesSchema()));
                    if (!violations.isEmpty()) {
                        log.warn("Edge property schema validation failed: agent={}, edge={}, errors={}",
                                agentId, descriptor, violations);
                        return Mono.error(new SchemaValidationException(
                                TypeKind.EDGE.getSchemaFailureCode(), violations));
                    }
                    return resolveEndpoint(agentId, request.getSourceType(), request.getSourceName(),
                            ErrorCode.SOURCE_NODE_NOT_FOUND, "Source", descriptor)
                            .flatMap(source -> resolveEndpoint(agentId, request.getTargetType(),
                                    request.getTargetName(), ErrorCode.TARGET_NODE_NOT_FOUND, "Target", descriptor)
                                    .flatMap(target -> findOrCreate(agentId, edgeType.getName(), source, target,
                                            properties)));
                });
    }

    private Mono<GraphNode> resolveEndpoint(UUID agentId, String type, String name, ErrorCode code,
                                            String side, String descriptor) {
        return nodeRepository.findByAgentIdAndTypeAndName(agentId, type, name)
                .switchIfEmpty(Mono.defer(() -> {
                    log.warn("{} node missing: agent={}, edge={}", side, agentId, descriptor);
                    return Mono.error(new ReferenceNotFoundException(code, String.format(
                            "%s node \"%s\" of type \"%s\" not found. Create it first.", side, name, type)));
                }));
    }

    private Mono<UpsertResult> findOrCreate(UUID agentId, String type, GraphNode source, GraphNode target,
                                            Map<String, Object> properties) {
        Mono<UpsertResult> existing = edgeRepository
                .findByAgentIdAndTypeAndSourceIdAndTargetId(agentId, type, source.getId(), target.getId())
                .map(edge -> UpsertResult.of(edge.getId(), UpsertAction.ALREADY_EXISTS));

        return existing.switchIfEmpty(Mono.defer(() -> {
            GraphEdge edge = GraphEdge.builder()
                    .agentId(agentId)
                    .type(type)
                    .sourceId(source.getId())
                    .targetId(target.getId())
                    .properties(jsonCodec.write(properties))
                    .createdAt(LocalDateTime.now())
                    .build();

            return edgeRepository.save(edge)
                    .doOnNext(saved -> log.debug("Created edge {} ({} -> {}) for agent {}",
                            type, source.getName(), target.getName(), agentId))
                    .map(saved -> UpsertResult.of(saved.getId(), UpsertAction.CREATED))
                    .onErrorResume(DataIntegrityViolationException.class, e -> edgeRepository
                            .findByAgentIdAndTypeAndSourceIdAndTargetId(agentId, type, source.getId(), target.getId())
                            .map(winner -> UpsertResult.of(winner.getId(), UpsertAction.ALREADY_EXISTS))
                            .switchIfEmpty(Mono.error(e)));
        }));
    }
}
