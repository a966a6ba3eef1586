package io.structor.core.error;

/**
 * Thrown when a conversion step throws instead of returning a failure value.
 * This is a defect in the step, not invalid input: it aborts the whole call,
 * including the enclosing list or parent record, and is never turned into a
 * field error.
 */
public final class StepInvocationException extends ConstructionFailureException {

    private static final long serialVersionUID = 1L;

    private final String fieldName;

    public StepInvocationException(String message, Throwable cause, String schemaName, String fieldName) {
        super(message, cause, schemaName);
        this.fieldName = fieldName;
    }

    /** The field whose chain threw. */
    public String fieldName() {
        return fieldName;
    }
}
