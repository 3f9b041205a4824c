package com.agentgraph.tool;

import com.agentgraph.exception.ErrorCode;
import com.agentgraph.exception.GraphException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Runs a tool call: binds and validates the arguments, executes the tool, and turns every
 * outcome into a {@link ToolResult}. Dispatch never fails.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ToolDispatcher {

    private final ToolRegistry toolRegistry;
    private final ObjectMapper objectMapper;
    private final Validator validator;

    /**
     * Dispatch a call.
     *
     * @param agentId  Calling agent
     * @param toolName Tool name
     * @param params   Raw JSON arguments, may be null
     * @return the tagged result
     */
    public Mono<ToolResult> dispatch(UUID agentId, String toolName, JsonNode params) {
        Optional<GraphTool<?>> tool = toolRegistry.getTool(toolName);
        if (tool.isEmpty()) {
            log.warn("Agent {} called unknown tool '{}'", agentId, toolName);
            return Mono.just(ToolResult.failure(ErrorCode.UNKNOWN_TOOL, String.format(
                    "Unknown tool \"%s\". Available tools: %s",
                    toolName, String.join(", ", toolRegistry.getToolNames()))));
        }
        return invoke(tool.get(), new ToolContext(agentId), params);
    }

    private <P> Mono<ToolResult> invoke(GraphTool<P> tool, ToolContext context, JsonNode params) {
        JsonNode arguments = params == null || params.isNull() ? objectMapper.createObjectNode() : params;

        P bound;
        try {
            bound = objectMapper.treeToValue(arguments, tool.parameterType());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Rejected arguments for tool {} from agent {}: {}", tool.name(), context.getAgentId(),
                    e.getMessage());
            return Mono.just(ToolResult.failure(ErrorCode.INVALID_PARAMETERS,
                    "Invalid parameters: " + describe(e)));
        }

        Set<ConstraintViolation<P>> violations = validator.validate(bound);
        if (!violations.isEmpty()) {
            String detail = violations.stream()
                    .map(violation -> violation.getPropertyPath() + ": " + violation.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            log.warn("Rejected arguments for tool {} from agent {}: {}", tool.name(), context.getAgentId(), detail);
            return Mono.just(ToolResult.failure(ErrorCode.INVALID_PARAMETERS, "Invalid parameters: " + detail));
        }

        return Mono.defer(() -> tool.execute(context, bound))
                .map(data -> ToolResult.success(data))
                .defaultIfEmpty(ToolResult.success(null))
                .onErrorResume(GraphException.class,
                        e -> Mono.just(ToolResult.failure(e.getCode(), e.getMessage())))
                .onErrorResume(e -> !(e instanceof GraphException), e -> {
                    log.error("Tool {} failed unexpectedly for agent {}", tool.name(), context.getAgentId(), e);
                    return Mono.just(ToolResult.failure(ErrorCode.UNEXPECTED_ERROR,
                            e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()));
                });
    }

    private static String describe(Exception e) {
        if (e instanceof JsonProcessingException) {
            return ((JsonProcessingException) e).getOriginalMessage();
        }
        return e.getMessage();
    }
}
