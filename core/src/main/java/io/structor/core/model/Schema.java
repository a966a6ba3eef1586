package io.structor.core.model;

import io.structor.core.spi.ConstructionHooks;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered field descriptors for one record type, plus the schema-level
 * {@link ConstructionOptions} and {@link ConstructionHooks}.
 *
 * <p>
 * Built once, typically at startup, and read-only afterwards. A name → field
 * lookup table is computed at build time so that input keys are resolved
 * without scanning the field list.
 *
 * <p>
 * Thread-safe: all fields are final and collections are unmodifiable.
 */
public final class Schema {

    private final String name;
    private final List<FieldDescriptor> fields;
    private final Map<String, FieldDescriptor> lookup;
    private final ConstructionOptions options;
    private final ConstructionHooks hooks;

    private Schema(
            String name, List<FieldDescriptor> fields, ConstructionOptions options, ConstructionHooks hooks) {
        this.name = name;
        this.fields = List.copyOf(fields);
        Map<String, FieldDescriptor> table = new LinkedHashMap<>();
        for (FieldDescriptor field : this.fields) {
            if (table.put(field.name(), field) != null) {
                throw new IllegalArgumentException(
                        "Duplicate field '" + field.name() + "' in schema '" + name + "'");
            }
        }
        this.lookup = Collections.unmodifiableMap(table);
        this.options = options;
        this.hooks = hooks;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    /** Field descriptors in declaration order. */
    public List<FieldDescriptor> fields() {
        return fields;
    }

    /** Field names in declaration order. */
    public List<String> fieldNames() {
        return List.copyOf(lookup.keySet());
    }

    /** Looks up a field by its canonical name, or returns {@code null}. */
    public FieldDescriptor field(String fieldName) {
        return lookup.get(fieldName);
    }

    public boolean hasField(String fieldName) {
        return lookup.containsKey(fieldName);
    }

    /** Schema-level options; unset components fall through to the library defaults. */
    public ConstructionOptions options() {
        return options;
    }

    public ConstructionHooks hooks() {
        return hooks;
    }

    public int size() {
        return fields.size();
    }

    @Override
    public String toString() {
        return "Schema[" + name + ", fields=" + lookup.keySet() + "]";
    }

    /** Builder for a {@link Schema}. */
    public static final class Builder {

        private final String name;
        private final List<FieldDescriptor> fields = new ArrayList<>();
        private ConstructionOptions options = ConstructionOptions.NONE;
        private ConstructionHooks hooks = ConstructionHooks.NONE;

        Builder(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
        }

        public Builder field(FieldDescriptor field) {
            fields.add(Objects.requireNonNull(field, "field must not be null"));
            return this;
        }

        /** Adds an optional field without default. */
        public Builder field(String fieldName, ConversionStep... steps) {
            return field(FieldDescriptor.builder(fieldName).steps(steps).build());
        }

        /** Adds a required field without default. */
        public Builder requiredField(String fieldName, ConversionStep... steps) {
            return field(FieldDescriptor.builder(fieldName).required().steps(steps).build());
        }

        /** Adds an optional field with a default value. */
        public Builder fieldWithDefault(String fieldName, Object defaultValue, ConversionStep... steps) {
            return field(FieldDescriptor.builder(fieldName)
                    .defaultValue(defaultValue)
                    .steps(steps)
                    .build());
        }

        public Builder options(ConstructionOptions options) {
            this.options = Objects.requireNonNull(options, "options must not be null");
            return this;
        }

        public Builder hooks(ConstructionHooks hooks) {
            this.hooks = Objects.requireNonNull(hooks, "hooks must not be null");
            return this;
        }

        /**
         * Builds the schema.
         *
         * @throws IllegalArgumentException if two fields share a name
         */
        public Schema build() {
            return new Schema(name, fields, options, hooks);
        }
    }
}
