package com.agentgraph.service;

import com.agentgraph.exception.DuplicateTypeException;
import com.agentgraph.exception.InvalidNameException;
import com.agentgraph.exception.TypeNotFoundException;
import com.agentgraph.model.TypeKind;
import com.agentgraph.model.TypeOrigin;
import com.agentgraph.model.dto.TypeDefinition;
import com.agentgraph.model.entity.GraphType;
import com.agentgraph.repository.GraphTypeRepository;
import com.agentgraph.util.JsonCodec;
import com.agentgraph.util.TypeNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Owns node and edge type definitions per scope.
 *
 * A scope is an agent id, or {@code null} for the global scope. Lookups in an agent scope
 * resolve the agent's own type first and fall back to a global type of the same name.
 * Types are never updated once created.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TypeRegistry {

    private final GraphTypeRepository typeRepository;
    private final JsonCodec jsonCodec;

    /**
     * Check whether a type is resolvable in scope.
     *
     * @param agentId Agent ID, or null for the global scope
     * @param kind    Node or edge
     * @param name    Type name
     * @return true if the type exists
     */
    public Mono<Boolean> typeExists(UUID agentId, TypeKind kind, String name) {
        return getType(agentId, kind, name).hasElement();
    }

    /**
     * Resolve a type in scope.
     *
     * @param agentId Agent ID, or null for the global scope
     * @param kind    Node or edge
     * @param name    Type name
     * @return the type, or empty if not defined
     */
    public Mono<GraphType> getType(UUID agentId, TypeKind kind, String name) {
        Mono<GraphType> global = Mono.defer(() ->
                typeRepository.findByAgentIdIsNullAndKindAndName(kind.getValue(), name));
        if (agentId == null) {
            return global;
        }
        return typeRepository.findByAgentIdAndKindAndName(agentId, kind.getValue(), name)
                .switchIfEmpty(global);
    }

    /**
     * Resolve a type or fail with a not-found error that lists the available names.
     */
    public Mono<GraphType> requireType(UUID agentId, TypeKind kind, String name) {
        return getType(agentId, kind, name)
                .switchIfEmpty(Mono.defer(() -> availableTypeNames(agentId, kind)
                        .flatMap(available -> {
                            log.warn("Missing {} type '{}' for agent {}; available: {}",
                                    kind.getValue(), name, agentId, available);
                            return Mono.error(new TypeNotFoundException(kind.getNotFoundCode(), String.format(
                                    "%s type \"%s\" does not exist. Available %s types: %s. Use %s first, then "
                                            + "create%sType only if necessary.",
                                    kind.getLabel(), name, kind.getValue(), TypeNames.formatAvailable(available),
                                    kind.getListToolName(), kind.getLabel())));
                        })));
    }

    /**
     * List the types visible in scope: the agent's own plus global ones, or only global
     * ones for the global scope.
     */
    public Flux<GraphType> listTypes(UUID agentId, TypeKind kind) {
        if (agentId == null) {
            return typeRepository.findByAgentIdIsNullAndKindOrderByName(kind.getValue());
        }
        return typeRepository.findVisibleToAgent(agentId, kind.getValue());
    }

    public Mono<List<String>> availableTypeNames(UUID agentId, TypeKind kind) {
        return listTypes(agentId, kind)
                .map(GraphType::getName)
                .distinct()
                .collectList();
    }

    /**
     * Create a type. Fails on a naming-convention violation or when the name is already
     * resolvable in scope; an existing type is never overwritten.
     *
     * @param agentId    Agent ID, or null for the global scope
     * @param kind       Node or edge
     * @param definition Type definition
     * @return the persisted type
     */
    public Mono<GraphType> createType(UUID agentId, TypeKind kind, TypeDefinition definition) {
        String name = definition.getName();
        if (!TypeNames.isValid(kind, name)) {
            return Mono.error(new InvalidNameException(TypeNames.describeRule(kind, name)));
        }

        TypeOrigin origin = definition.getCreatedBy() == null ? TypeOrigin.AGENT : definition.getCreatedBy();

        return typeExists(agentId, kind, name)
                .flatMap(exists -> {
                    if (exists) {
                        return Mono.error(new DuplicateTypeException(kind.getLabel(), name));
                    }

                    GraphType type = GraphType.builder()
                            .agentId(agentId)
                            .kind(kind.getValue())
                            .name(name)
                            .description(definition.getDescription())
                            .justification(definition.getJustification())
                            .propertiesSchema(jsonCodec.write(definition.getPropertiesSchema()))
                            .exampleProperties(jsonCodec.write(definition.getExampleProperties()))
                            .createdBy(origin.getValue())
                            .createdAt(LocalDateTime.now())
                            .build();

                    return typeRepository.save(type)
                            .doOnNext(saved -> log.info("Created {} type '{}' ({}) for {}", kind.getValue(), name,
                                    saved.getCreatedBy(), agentId == null ? "global scope" : "agent " + agentId))
                            // A concurrent create of the same name hit the unique index first
                            .onErrorMap(DataIntegrityViolationException.class,
                                    e -> new DuplicateTypeException(kind.getLabel(), name));
                });
    }
}
