package com.agentgraph.tool;

import reactor.core.publisher.Mono;

/**
 * A named graph operation callable by an agent.
 *
 * @param <P> parameter object the raw call arguments are bound to
 */
public interface GraphTool<P> {

    String name();

    String description();

    /**
     * Class the call arguments are converted to. Bean Validation constraints on it are
     * checked before {@link #execute} runs.
     */
    Class<P> parameterType();

    /**
     * Run the operation. The emitted value becomes the {@code data} of a successful result;
     * errors are reported by the dispatcher.
     */
    Mono<?> execute(ToolContext context, P params);
}
