package com.agentgraph.service;

import com.agentgraph.model.TypeKind;
import com.agentgraph.model.entity.GraphType;
import com.agentgraph.support.GraphFixture;
import com.agentgraph.support.InMemoryGraphTypeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for SeedTypeProvisioner.
 */
class SeedTypeProvisionerTest {

    private GraphFixture graph;
    private SeedTypeProvisioner provisioner;
    private UUID agentId;

    @BeforeEach
    void setUp() {
        graph = new GraphFixture();
        provisioner = graph.seedTypeProvisioner;
        agentId = UUID.randomUUID();
    }

    @Test
    void ensureSeedTypes_CreatesBaselineSet() {
        StepVerifier.create(provisioner.ensureSeedTypes(agentId))
                .expectNext(8L)
                .verifyComplete();

        assertThat(names(TypeKind.NODE)).containsExactly("AgentAdvice", "AgentAnalysis");
        assertThat(names(TypeKind.EDGE)).containsExactly(
                "about", "based_on", "contradicts", "correlates_with", "derived_from", "supports");
        assertThat(graph.typeRepository.rows()).allMatch(type -> "system".equals(type.getCreatedBy()));
    }

    @Test
    void ensureSeedTypes_RepeatedCallsAreNoOps() {
        for (int i = 0; i < 3; i++) {
            provisioner.ensureSeedTypes(agentId).block();
        }

        StepVerifier.create(provisioner.ensureSeedTypes(agentId))
                .expectNext(0L)
                .verifyComplete();
        assertThat(graph.typeRepository.rows()).hasSize(8);
    }

    @Test
    void ensureSeedTypes_OnlyFillsGaps() {
        graph.edgeType(agentId, "about", null);

        StepVerifier.create(provisioner.ensureSeedTypes(agentId))
                .expectNext(7L)
                .verifyComplete();
        assertThat(graph.typeRepository.rows()).hasSize(8);
    }

    @Test
    void ensureSeedTypes_GlobalSeedsSatisfyAgents() {
        provisioner.ensureSeedTypes(null).block();

        StepVerifier.create(provisioner.ensureSeedTypes(agentId))
                .expectNext(0L)
                .verifyComplete();
        assertThat(graph.typeRepository.rows()).allMatch(type -> type.getAgentId() == null);
    }

    @Test
    void seedSchemas_AcceptTheirOwnExamples() {
        provisioner.ensureSeedTypes(agentId).block();

        for (GraphType type : graph.typeRepository.rows()) {
            if (type.getPropertiesSchema() == null) {
                continue;
            }
            assertThat(graph.schemaValidator.validateProperties(
                    graph.jsonCodec.readMap(type.getExampleProperties()),
                    graph.jsonCodec.readTree(type.getPropertiesSchema())))
                    .as(type.getName())
                    .isEmpty();
        }
    }

    @Test
    void ensureSeedTypes_ConcurrentCreatorWinsBeforeCreate() {
        InMemoryGraphTypeRepository racing = racingRepository("about", 1);

        StepVerifier.create(provisionerOver(racing).ensureSeedTypes(agentId))
                .expectNext(7L)
                .verifyComplete();
        assertThat(racing.rows()).hasSize(8);
    }

    @Test
    void ensureSeedTypes_ConcurrentCreatorWinsTheInsert() {
        InMemoryGraphTypeRepository racing = racingRepository("about", 2);

        StepVerifier.create(provisionerOver(racing).ensureSeedTypes(agentId))
                .expectNext(7L)
                .verifyComplete();
        assertThat(racing.rows()).hasSize(8);
    }

    private SeedTypeProvisioner provisionerOver(InMemoryGraphTypeRepository repository) {
        return new SeedTypeProvisioner(new TypeRegistry(repository, graph.jsonCodec), graph.seedCatalog);
    }

    /**
     * A repository where another writer stores {@code name} during its n-th agent-scope lookup,
     * which still misses.
     */
    private static InMemoryGraphTypeRepository racingRepository(String name, int raceOnLookup) {
        return new InMemoryGraphTypeRepository() {
            private final AtomicInteger lookups = new AtomicInteger();

            @Override
            public Mono<GraphType> findByAgentIdAndKindAndName(UUID agentId, String kind, String typeName) {
                if (name.equals(typeName) && lookups.incrementAndGet() == raceOnLookup) {
                    insert(GraphType.builder().agentId(agentId).kind(kind).name(typeName)
                            .createdBy("agent").createdAt(LocalDateTime.now()).build());
                    return Mono.empty();
                }
                return super.findByAgentIdAndKindAndName(agentId, kind, typeName);
            }
        };
    }

    private List<String> names(TypeKind kind) {
        return graph.typeRegistry.listTypes(agentId, kind)
                .map(GraphType::getName)
                .collect(Collectors.toList())
                .block();
    }
}
