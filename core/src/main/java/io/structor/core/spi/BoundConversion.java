package io.structor.core.spi;

import io.structor.core.model.StepResult;
import java.util.List;

/**
 * A conversion function that takes extra arguments bound at schema definition
 * time, e.g. a minimum length. The live field value is always the first
 * argument; {@code args} are the declared constants in declaration order.
 *
 * <p>
 * Same contract as {@link Conversion}: pure, thread-safe, failures returned as
 * values.
 */
@FunctionalInterface
public interface BoundConversion {

    StepResult apply(Object value, List<Object> args);
}
