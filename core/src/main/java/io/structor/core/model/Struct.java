package io.structor.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A record built against a {@link Schema}: one value per declared field, in
 * declaration order. Values may be {@code null}.
 *
 * <p>
 * Immutable. {@link #with(String, Object)} returns a modified copy, which is
 * how {@code afterConstruct} hooks adjust a record.
 */
public final class Struct {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final Schema schema;
    private final Map<String, Object> values;

    private Struct(Schema schema, Map<String, Object> values) {
        this.schema = schema;
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * Creates a struct from field values. Fields missing from {@code values}
     * are {@code null}; values are reordered into declaration order.
     *
     * @throws IllegalArgumentException if {@code values} names a field the
     *                                  schema does not declare
     */
    public static Struct of(Schema schema, Map<String, ?> values) {
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(values, "values must not be null");
        for (String key : values.keySet()) {
            if (!schema.hasField(key)) {
                throw new IllegalArgumentException(
                        "Field '" + key + "' is not declared by schema '" + schema.name() + "'");
            }
        }
        Map<String, Object> ordered = new LinkedHashMap<>();
        for (FieldDescriptor field : schema.fields()) {
            ordered.put(field.name(), values.get(field.name()));
        }
        return new Struct(schema, ordered);
    }

    public Schema schema() {
        return schema;
    }

    /** Shorthand for {@code schema().name()}. */
    public String schemaName() {
        return schema.name();
    }

    /**
     * Returns the value of a field.
     *
     * @throws IllegalArgumentException if the schema does not declare the field
     */
    public Object get(String field) {
        requireField(field);
        return values.get(field);
    }

    /** Returns the value of a field cast to {@code type}. */
    public <T> T get(String field, Class<T> type) {
        return type.cast(get(field));
    }

    /** All field values in declaration order; unmodifiable. */
    public Map<String, Object> values() {
        return values;
    }

    /** Returns a copy with one field replaced. */
    public Struct with(String field, Object value) {
        requireField(field);
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(field, value);
        return new Struct(schema, copy);
    }

    /** Renders the struct as a JSON object; nested structs are rendered recursively. */
    public ObjectNode toJson() {
        return MAPPER.valueToTree(toPlainMap());
    }

    /**
     * Binds the struct to a Java type (typically a {@code record}) through
     * Jackson, matching field names to properties.
     *
     * @throws IllegalArgumentException if the values cannot be bound to {@code type}
     */
    public <T> T as(Class<T> type) {
        return MAPPER.convertValue(toPlainMap(), type);
    }

    /** Field values with nested structs (also inside lists) converted to plain maps. */
    public Map<String, Object> toPlainMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        values.forEach((key, value) -> out.put(key, plain(value)));
        return out;
    }

    private static Object plain(Object value) {
        if (value instanceof Struct s) {
            return s.toPlainMap();
        }
        if (value instanceof List<?> list) {
            return list.stream().map(Struct::plain).collect(Collectors.toList());
        }
        return value;
    }

    private void requireField(String field) {
        if (!schema.hasField(field)) {
            throw new IllegalArgumentException(
                    "Field '" + field + "' is not declared by schema '" + schema.name() + "'");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Struct that)) return false;
        return schema.name().equals(that.schema.name()) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema.name(), values);
    }

    @Override
    public String toString() {
        return schema.name() + values;
    }
}
