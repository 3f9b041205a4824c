package com.agentgraph.tool;

import com.agentgraph.exception.ErrorCode;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Tagged outcome of a tool call: either {@code data} or an {@code error}, never both.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolResult {

    private boolean success;
    private Object data;
    private ToolError error;

    public static ToolResult success(Object data) {
        return ToolResult.builder()
                .success(true)
                .data(data)
                .build();
    }

    /**
     * Failed result whose message carries the code prefix, e.g. {@code "UNKNOWN_TOOL: ..."}.
     */
    public static ToolResult failure(ErrorCode code, String message) {
        return ToolResult.builder()
                .success(false)
                .error(new ToolError(code.name(), code.name() + ": " + message))
                .build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToolError {
        private String code;
        private String message;
    }
}
