package com.agentgraph.service;

import com.agentgraph.exception.DuplicateTypeException;
import com.agentgraph.model.TypeKind;
import com.agentgraph.model.dto.TypeDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Installs the baseline type set into a scope. Safe to call any number of times.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SeedTypeProvisioner {

    private final TypeRegistry typeRegistry;
    private final SeedCatalog seedCatalog;

    /**
     * Create every seed type that is not yet resolvable in scope.
     *
     * @param agentId Agent ID, or null for the global scope
     * @return number of types created by this call
     */
    public Mono<Long> ensureSeedTypes(UUID agentId) {
        Flux<Boolean> nodes = Flux.fromIterable(seedCatalog.getNodeTypes())
                .concatMap(definition -> ensure(agentId, TypeKind.NODE, definition));
        Flux<Boolean> edges = Flux.fromIterable(seedCatalog.getEdgeTypes())
                .concatMap(definition -> ensure(agentId, TypeKind.EDGE, definition));

        return Flux.concat(nodes, edges)
                .filter(Boolean::booleanValue)
                .count()
                .doOnNext(created -> {
                    if (created > 0) {
                        log.info("Seeded {} baseline types for {}", created,
                                agentId == null ? "global scope" : "agent " + agentId);
                    }
                });
    }

    private Mono<Boolean> ensure(UUID agentId, TypeKind kind, TypeDefinition definition) {
        return typeRegistry.typeExists(agentId, kind, definition.getName())
                .flatMap(exists -> {
                    if (exists) {
                        return Mono.just(false);
                    }
                    return typeRegistry.createType(agentId, kind, definition)
                            .thenReturn(true)
                            // Another initializer got there first
                            .onErrorResume(DuplicateTypeException.class, e -> Mono.just(false));
                });
    }
}
