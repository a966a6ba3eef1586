package io.structor.core.error;

/**
 * Abstract parent for errors raised while building a record. Only
 * {@code Constructor.constructOrThrow} raises the value-level failures;
 * {@link StepInvocationException} is the one defect that escapes
 * {@code construct} as well.
 */
public abstract class ConstructionFailureException extends StructorException {

    private static final long serialVersionUID = 1L;

    protected ConstructionFailureException(String message, String schemaName) {
        super(message, schemaName, Phase.CONSTRUCTION);
    }

    protected ConstructionFailureException(String message, Throwable cause, String schemaName) {
        super(message, cause, schemaName, Phase.CONSTRUCTION);
    }
}
