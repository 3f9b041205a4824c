package com.agentgraph.controller;

import com.agentgraph.model.TypeKind;
import com.agentgraph.model.dto.EdgeTypeCreateRequest;
import com.agentgraph.model.dto.NodeTypeCreateRequest;
import com.agentgraph.model.dto.TypeDefinition;
import com.agentgraph.model.dto.TypeResponse;
import com.agentgraph.service.GraphResponseMapper;
import com.agentgraph.service.SeedTypeProvisioner;
import com.agentgraph.service.TypeRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.UUID;

/**
 * Controller for node and edge type definitions, per agent and global.
 */
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class GraphTypeController {

    private final TypeRegistry typeRegistry;
    private final SeedTypeProvisioner seedTypeProvisioner;
    private final GraphResponseMapper mapper;

    @GetMapping("/agents/{agentId}/node-types")
    public Flux<TypeResponse> listNodeTypes(@PathVariable UUID agentId) {
        return list(agentId, TypeKind.NODE);
    }

    @PostMapping("/agents/{agentId}/node-types")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<TypeResponse> createNodeType(
            @PathVariable UUID agentId,
            @Valid @RequestBody NodeTypeCreateRequest request) {
        return create(agentId, TypeKind.NODE, request.toDefinition());
    }

    @GetMapping("/agents/{agentId}/edge-types")
    public Flux<TypeResponse> listEdgeTypes(@PathVariable UUID agentId) {
        return list(agentId, TypeKind.EDGE);
    }

    @PostMapping("/agents/{agentId}/edge-types")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<TypeResponse> createEdgeType(
            @PathVariable UUID agentId,
            @Valid @RequestBody EdgeTypeCreateRequest request) {
        return create(agentId, TypeKind.EDGE, request.toDefinition());
    }

    @GetMapping("/global/node-types")
    public Flux<TypeResponse> listGlobalNodeTypes() {
        return list(null, TypeKind.NODE);
    }

    @PostMapping("/global/node-types")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<TypeResponse> createGlobalNodeType(@Valid @RequestBody NodeTypeCreateRequest request) {
        return create(null, TypeKind.NODE, request.toDefinition());
    }

    @GetMapping("/global/edge-types")
    public Flux<TypeResponse> listGlobalEdgeTypes() {
        return list(null, TypeKind.EDGE);
    }

    @PostMapping("/global/edge-types")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<TypeResponse> createGlobalEdgeType(@Valid @RequestBody EdgeTypeCreateRequest request) {
        return create(null, TypeKind.EDGE, request.toDefinition());
    }

    @PostMapping("/agents/{agentId}/seed")
    public Mono<Map<String, Long>> seed(@PathVariable UUID agentId) {
        return seedTypeProvisioner.ensureSeedTypes(agentId)
                .map(created -> Map.of("created", created));
    }

    private Flux<TypeResponse> list(UUID agentId, TypeKind kind) {
        return typeRegistry.listTypes(agentId, kind).map(mapper::toResponse);
    }

    private Mono<TypeResponse> create(UUID agentId, TypeKind kind, TypeDefinition definition) {
        return typeRegistry.createType(agentId, kind, definition).map(mapper::toResponse);
    }
}
