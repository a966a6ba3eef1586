package io.structor.core.error;

import io.structor.core.model.ErrorReport;
import java.util.Objects;

/** Thrown by {@code constructOrThrow} when one or more fields failed. Carries the full report. */
public final class ConstructionException extends ConstructionFailureException {

    private static final long serialVersionUID = 1L;

    private final transient ErrorReport errorReport;

    public ConstructionException(String schemaName, ErrorReport errorReport) {
        super("Failed to construct '" + schemaName + "': " + errorReport, schemaName);
        this.errorReport = Objects.requireNonNull(errorReport, "errorReport must not be null");
    }

    /** Every field (or list index) failure of the call. */
    public ErrorReport errorReport() {
        return errorReport;
    }
}
