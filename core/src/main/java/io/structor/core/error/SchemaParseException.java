package io.structor.core.error;

/**
 * Thrown when a schema document has invalid syntax, violates the schema
 * definition format, or references a nested schema that is not registered.
 */
public final class SchemaParseException extends SchemaLoadException {

    private static final long serialVersionUID = 1L;

    public SchemaParseException(String message, String schemaName, String source) {
        super(message, schemaName, source);
    }

    public SchemaParseException(String message, Throwable cause, String schemaName, String source) {
        super(message, cause, schemaName, source);
    }
}
