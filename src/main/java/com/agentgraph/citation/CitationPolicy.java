package com.agentgraph.citation;

import lombok.Builder;
import lombok.Value;

/**
 * What a piece of derived content may cite.
 */
@Value
@Builder
public class CitationPolicy {

    /** Label used in error messages, e.g. "AgentAnalysis". */
    String subject;

    boolean edgesAllowed;

    /** When set, every cited node must be of this type. */
    String requiredNodeType;

    public static CitationPolicy analysis(String analysisType) {
        return CitationPolicy.builder()
                .subject(analysisType)
                .edgesAllowed(true)
                .build();
    }

    public static CitationPolicy advice(String adviceType, String analysisType) {
        return CitationPolicy.builder()
                .subject(adviceType)
                .edgesAllowed(false)
                .requiredNodeType(analysisType)
                .build();
    }

    String markerHint() {
        return edgesAllowed ? "[node:uuid] or [edge:uuid]" : "[node:uuid]";
    }
}
