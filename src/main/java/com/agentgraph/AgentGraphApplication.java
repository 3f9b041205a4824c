package com.agentgraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * AgentGraph Server Application
 *
 * Per-agent knowledge graph with a runtime-extensible type schema, built with
 * Spring Boot WebFlux and R2DBC.
 */
@SpringBootApplication
public class AgentGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentGraphApplication.class, args);
    }

}
