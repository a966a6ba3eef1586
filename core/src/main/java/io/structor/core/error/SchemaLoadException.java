package io.structor.core.error;

/**
 * Abstract parent for schema definition errors. Thrown while a schema document
 * is parsed or registered. Carries an additional {@code source} field
 * identifying the file or resource that caused the error.
 */
public abstract class SchemaLoadException extends StructorException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected SchemaLoadException(String message, String schemaName, String source) {
        super(message, schemaName, Phase.LOAD);
        this.source = source;
    }

    protected SchemaLoadException(String message, Throwable cause, String schemaName, String source) {
        super(message, cause, schemaName, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
