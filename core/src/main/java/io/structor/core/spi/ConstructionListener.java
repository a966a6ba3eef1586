package io.structor.core.spi;

import io.structor.core.model.ConstructionResult;
import io.structor.core.model.InputShape;

/**
 * SPI for observability hooks. Bridges to metrics or tracing systems live
 * outside the core; this is a plain Java interface.
 *
 * <p>
 * Single-record constructions emit exactly one completed or failed event. List
 * constructions emit one event per element and none for the list itself.
 *
 * <p>
 * Implementations MUST be thread-safe and non-blocking. Exceptions thrown by
 * listeners are caught and logged and do NOT affect construction.
 */
public interface ConstructionListener {

    /** Called when a record was built successfully. */
    default void onConstructionCompleted(ConstructionCompletedEvent event) {}

    /** Called when a construction call ended in a failure result. */
    default void onConstructionFailed(ConstructionFailedEvent event) {}

    /** Called when a schema was registered or loaded. */
    default void onSchemaLoaded(SchemaLoadedEvent event) {}

    /** Called when a schema document was rejected at load time. */
    default void onSchemaRejected(SchemaRejectedEvent event) {}

    // --- Event records ---

    /** Event emitted when a record was built. */
    record ConstructionCompletedEvent(String schemaName, InputShape inputShape, long durationNanos) {}

    /** Event emitted when a construction failed. {@code errorCount} is 0 for hard failures. */
    record ConstructionFailedEvent(
            String schemaName,
            InputShape inputShape,
            ConstructionResult.Type failureType,
            int errorCount,
            long durationNanos) {}

    /** Event emitted when a schema was registered. {@code source} is null for programmatic schemas. */
    record SchemaLoadedEvent(String schemaName, int fieldCount, String source) {}

    /** Event emitted when a schema document was rejected. */
    record SchemaRejectedEvent(String source, String errorDetail) {}
}
