package io.structor.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Hard failure raised under key checking: the input named fields the schema
 * does not declare, or required fields were absent after defaulting.
 *
 * @param kind   which check failed
 * @param keys   the offending keys, in input or declaration order
 * @param detail human-readable description
 */
public record KeyError(Kind kind, List<String> keys, String detail) {

    /** Which key check failed. */
    public enum Kind {
        UNKNOWN_KEYS,
        MISSING_REQUIRED
    }

    public KeyError {
        Objects.requireNonNull(kind, "kind must not be null");
        keys = List.copyOf(keys);
        Objects.requireNonNull(detail, "detail must not be null");
    }

    public static KeyError unknownKeys(String schemaName, List<String> keys) {
        return new KeyError(Kind.UNKNOWN_KEYS, keys, "unknown key(s) for '" + schemaName + "': " + keys);
    }

    public static KeyError missingRequired(String schemaName, List<String> keys) {
        return new KeyError(
                Kind.MISSING_REQUIRED, keys, "missing required key(s) for '" + schemaName + "': " + keys);
    }
}
