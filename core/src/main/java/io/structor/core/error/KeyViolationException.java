package io.structor.core.error;

import io.structor.core.model.KeyError;

/**
 * Thrown by {@code constructOrThrow} when key checking rejects the input:
 * unknown keys, or required fields absent after defaulting.
 */
public final class KeyViolationException extends ConstructionFailureException {

    private static final long serialVersionUID = 1L;

    private final transient KeyError keyError;

    public KeyViolationException(String schemaName, KeyError keyError) {
        super(keyError.detail(), schemaName);
        this.keyError = keyError;
    }

    public KeyError keyError() {
        return keyError;
    }
}
