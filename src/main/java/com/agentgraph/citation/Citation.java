package com.agentgraph.citation;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.regex.Pattern;

/**
 * One {@code [node:<id>]} or {@code [edge:<id>]} marker found in free text.
 */
@Data
@AllArgsConstructor
public class Citation {

    private static final Pattern UUID_SHAPE =
            Pattern.compile("^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$", Pattern.CASE_INSENSITIVE);

    private CitationKind kind;

    /** Trimmed id token. */
    private String id;

    /** The marker exactly as written, brackets included. */
    private String raw;

    /** Offset of the opening bracket in the source text. */
    private int offset;

    public boolean hasWellFormedId() {
        return UUID_SHAPE.matcher(id).matches();
    }
}
