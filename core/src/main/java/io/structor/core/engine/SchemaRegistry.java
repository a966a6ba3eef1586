package io.structor.core.engine;

import io.structor.core.model.Schema;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable snapshot of all registered schemas and their constructors.
 *
 * <p>
 * This is the unit of atomic swap in {@link ConstructionEngine}. The engine
 * holds a {@code SchemaRegistry} via
 * {@link java.util.concurrent.atomic.AtomicReference}; every registration
 * builds a new snapshot and swaps it in. Calls that captured the old snapshot
 * keep using it.
 *
 * <p>
 * Thread-safe: all fields are final and collections are unmodifiable.
 */
public final class SchemaRegistry {

    private final Map<String, Constructor> constructors;

    /**
     * Creates a registry from the given constructors, keyed by schema name.
     * The map is copied.
     */
    public SchemaRegistry(Map<String, Constructor> constructors) {
        this.constructors = Collections.unmodifiableMap(new LinkedHashMap<>(constructors));
    }

    public static SchemaRegistry empty() {
        return new SchemaRegistry(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up a constructor by schema name.
     *
     * @return the constructor, or null if not registered
     */
    public Constructor getConstructor(String schemaName) {
        return constructors.get(schemaName);
    }

    /**
     * Looks up a schema by name.
     *
     * @return the schema, or null if not registered
     */
    public Schema getSchema(String schemaName) {
        Constructor constructor = constructors.get(schemaName);
        return constructor != null ? constructor.schema() : null;
    }

    /** Unmodifiable view of all constructors, in registration order. */
    public Map<String, Constructor> allConstructors() {
        return constructors;
    }

    public int schemaCount() {
        return constructors.size();
    }

    /** Returns a new registry with {@code constructor} added or replaced. */
    public SchemaRegistry with(Constructor constructor) {
        return builder().addAll(this).add(constructor).build();
    }

    /** Builder for constructing a {@link SchemaRegistry} incrementally. */
    public static final class Builder {

        private final Map<String, Constructor> constructors = new LinkedHashMap<>();

        Builder() {}

        public Builder add(Constructor constructor) {
            constructors.put(constructor.name(), constructor);
            return this;
        }

        public Builder addAll(SchemaRegistry registry) {
            constructors.putAll(registry.constructors);
            return this;
        }

        public SchemaRegistry build() {
            return new SchemaRegistry(constructors);
        }
    }
}
