package com.agentgraph.util;

import com.agentgraph.model.TypeKind;

import java.util.Collection;
import java.util.Comparator;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Naming conventions for dynamic types.
 */
public class TypeNames {

    /** Capitalized, single spaces allowed between words: "Company", "Market Event". */
    private static final Pattern NODE_TYPE_NAME = Pattern.compile("^[A-Z][A-Za-z0-9]*(?: [A-Za-z0-9]+)*$");

    /** snake_case: "issued_by", "competes_with". */
    private static final Pattern EDGE_TYPE_NAME = Pattern.compile("^[a-z][a-z_]*$");

    private static final Comparator<String> DISPLAY_ORDER =
            Comparator.comparing((String name) -> name.toLowerCase()).thenComparing(Comparator.naturalOrder());

    private TypeNames() {
    }

    /**
     * Check a type name against the convention of its kind.
     *
     * @param kind node or edge
     * @param name candidate name
     * @return true if the name is acceptable
     */
    public static boolean isValid(TypeKind kind, String name) {
        if (name == null) {
            return false;
        }
        Pattern rule = kind == TypeKind.NODE ? NODE_TYPE_NAME : EDGE_TYPE_NAME;
        return rule.matcher(name).matches();
    }

    /**
     * Human-readable explanation of the naming rule, used in InvalidName errors.
     */
    public static String describeRule(TypeKind kind, String name) {
        if (kind == TypeKind.NODE) {
            return String.format("Node type name must start with a capital letter and may contain spaces "
                    + "(e.g., \"Regulation\", \"Market Event\"). Got: \"%s\"", name);
        }
        return String.format("Edge type name must be snake_case (e.g., \"regulates\", \"competes_with\"). Got: \"%s\"",
                name);
    }

    /**
     * Sorted, comma-separated list of names, or "(none)".
     */
    public static String formatAvailable(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            return "(none)";
        }
        return names.stream().sorted(DISPLAY_ORDER).collect(Collectors.joining(", "));
    }
}
