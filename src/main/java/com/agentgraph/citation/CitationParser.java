package com.agentgraph.citation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Single-pass lexer for citation markers.
 *
 * A marker is {@code '['} followed by a kind keyword ({@code node} or {@code edge}, any case),
 * a {@code ':'}, an id token and {@code ']'}. The id token runs up to the closing bracket and
 * must contain at least one character; it is trimmed. Brackets inside the id token belong to
 * the id, so {@code [node:[node:<id>]} is a single marker with a malformed id. Text that does
 * not form a marker is ignored. Markers are returned in source order, repeats included.
 */
public final class CitationParser {

    private CitationParser() {
    }

    public static List<Citation> parse(String content) {
        List<Citation> citations = new ArrayList<>();
        if (content == null || content.isEmpty()) {
            return citations;
        }

        int length = content.length();
        int position = content.indexOf('[');
        while (position >= 0 && position < length) {
            int next = scanMarker(content, position, citations);
            position = content.indexOf('[', next);
        }
        return citations;
    }

    /**
     * Try to read a marker whose opening bracket is at {@code start}.
     *
     * @return index to resume searching for the next opening bracket
     */
    private static int scanMarker(String content, int start, List<Citation> out) {
        int length = content.length();

        // kind token
        int cursor = start + 1;
        while (cursor < length && Character.isLetter(content.charAt(cursor))) {
            cursor++;
        }
        Optional<CitationKind> kind = CitationKind.fromKeyword(content.substring(start + 1, cursor));
        if (kind.isEmpty() || cursor >= length || content.charAt(cursor) != ':') {
            return start + 1;
        }

        // id token
        int idStart = cursor + 1;
        cursor = idStart;
        while (cursor < length) {
            char c = content.charAt(cursor);
            if (c == ']') {
                break;
            }
            cursor++;
        }
        if (cursor >= length || cursor == idStart) {
            return idStart;
        }

        String id = content.substring(idStart, cursor).trim();
        out.add(new Citation(kind.get(), id, content.substring(start, cursor + 1), start));
        return cursor + 1;
    }
}
