package io.structor.core.library;

import io.structor.core.model.StepResult;
import java.util.UUID;

/** Conversion-plus-validation shortcuts for the most common field types. */
public final class Construct {

    private Construct() {}

    public static StepResult string(Object value) {
        return Convert.toStringValue(value);
    }

    public static StepResult integer(Object value) {
        return Convert.toInteger(value);
    }

    /** Validates a UUID string, or generates a random one for {@code null} and {@code ""}. */
    public static StepResult uuid(Object value) {
        if (value == null || "".equals(value)) {
            return StepResult.ok(UUID.randomUUID().toString());
        }
        return Validate.isUuid(value);
    }
}
