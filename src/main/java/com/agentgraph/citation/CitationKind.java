package com.agentgraph.citation;

import java.util.Locale;
import java.util.Optional;

/**
 * What a citation marker points at.
 */
public enum CitationKind {

    NODE("node"),
    EDGE("edge");

    private final String keyword;

    CitationKind(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    /**
     * Match a marker keyword case-insensitively.
     */
    public static Optional<CitationKind> fromKeyword(String keyword) {
        String normalized = keyword.toLowerCase(Locale.ROOT);
        for (CitationKind kind : values()) {
            if (kind.keyword.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
