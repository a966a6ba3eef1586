package io.structor.core.spi;

import io.structor.core.model.StepResult;

/**
 * A single conversion or validation function applied to one field value.
 *
 * <p>
 * Implementations MUST be pure and thread-safe: the same instance is shared by
 * every construction call of every schema that references it. Failures are
 * returned as {@link StepResult#error(String)}, never thrown. A step that
 * throws is treated as a defect and aborts the whole construction call.
 */
@FunctionalInterface
public interface Conversion {

    /**
     * Converts or validates {@code value}.
     *
     * @param value the current field value, possibly {@code null}
     * @return the converted value, or a failure
     */
    StepResult apply(Object value);
}
