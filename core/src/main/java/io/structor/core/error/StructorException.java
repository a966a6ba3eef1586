package io.structor.core.error;

/**
 * Abstract base for all structor exceptions. Never thrown directly; use the
 * concrete subclasses under {@link SchemaLoadException} or
 * {@link ConstructionFailureException}.
 */
public abstract class StructorException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        CONSTRUCTION
    }

    private final String schemaName;
    private final Phase phase;

    protected StructorException(String message, String schemaName, Phase phase) {
        super(message);
        this.schemaName = schemaName;
        this.phase = phase;
    }

    protected StructorException(String message, Throwable cause, String schemaName, Phase phase) {
        super(message, cause);
        this.schemaName = schemaName;
        this.phase = phase;
    }

    /** The schema that triggered the error, or {@code null} if not yet identified. */
    public String schemaName() {
        return schemaName;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
