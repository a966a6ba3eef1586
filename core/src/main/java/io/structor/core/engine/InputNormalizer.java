package io.structor.core.engine;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.structor.core.model.ConstructionResult;
import io.structor.core.model.InputShape;
import io.structor.core.model.KeyError;
import io.structor.core.model.Schema;
import io.structor.core.model.Struct;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Classifies construction input and reshapes it into a canonical
 * field → value mapping.
 *
 * <p>
 * Jackson trees and Java {@code record} instances are accepted at this
 * boundary: JSON objects and records become mappings (a record by its
 * components), JSON arrays become lists, JSON null becomes {@code null}. Everything downstream only sees
 * {@link Map}s keyed by field name.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class InputNormalizer {

    private static final ObjectMapper MAPPER = new ObjectMapper().registerModule(new JavaTimeModule());
    private static final TypeReference<LinkedHashMap<Object, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<ArrayList<Object>> LIST_TYPE = new TypeReference<>() {};

    private InputNormalizer() {}

    /**
     * Determines the shape of {@code input}.
     *
     * <ul>
     * <li>{@code null}, JSON null, missing node → {@link InputShape#NULL}</li>
     * <li>{@link Map}, JSON object, Java record → {@link InputShape#MAPPING}</li>
     * <li>non-empty list of {@link Map.Entry} → {@link InputShape#ORDERED_PAIRS}</li>
     * <li>{@link Struct} → {@link InputShape#EXISTING_RECORD}</li>
     * <li>any other {@link List}, JSON array → {@link InputShape#LIST}</li>
     * <li>anything else → {@link InputShape#UNRECOGNIZED}</li>
     * </ul>
     */
    public static InputShape classify(Object input) {
        if (input == null) {
            return InputShape.NULL;
        }
        if (input instanceof JsonNode node) {
            if (node.isNull() || node.isMissingNode()) {
                return InputShape.NULL;
            }
            if (node.isObject()) {
                return InputShape.MAPPING;
            }
            return node.isArray() ? InputShape.LIST : InputShape.UNRECOGNIZED;
        }
        if (input instanceof Struct) {
            return InputShape.EXISTING_RECORD;
        }
        if (input instanceof Map) {
            return InputShape.MAPPING;
        }
        if (input instanceof List<?> list) {
            return isOrderedPairs(list) ? InputShape.ORDERED_PAIRS : InputShape.LIST;
        }
        if (input instanceof Record) {
            return InputShape.MAPPING;
        }
        return InputShape.UNRECOGNIZED;
    }

    /**
     * Extracts a raw (not yet key-normalized) mapping from single-record input.
     * Ordered pairs are folded with last-write-wins; an existing struct
     * contributes its current field values.
     *
     * @throws IllegalArgumentException if {@code shape} is not a single-record shape
     */
    public static Map<?, ?> toRawMapping(Object input, InputShape shape) {
        return switch (shape) {
            case NULL -> Map.of();
            case MAPPING -> mappingOf(input);
            case ORDERED_PAIRS -> foldPairs((List<?>) input);
            case EXISTING_RECORD -> ((Struct) input).values();
            default -> throw new IllegalArgumentException("Not a single-record input shape: " + shape);
        };
    }

    /**
     * Returns the elements of list input. JSON arrays are converted element
     * by element, so JSON objects inside become maps.
     */
    public static List<Object> toList(Object input) {
        if (input instanceof JsonNode node) {
            return MAPPER.convertValue(node, LIST_TYPE);
        }
        return new ArrayList<>((List<?>) input);
    }

    /**
     * Resolves every key of {@code raw} against the schema's lookup table and
     * drops keys without a declared field (unless key checking rejects them).
     *
     * @see #normalizeKeys(Map, Schema, boolean, boolean)
     */
    public static Normalized normalizeKeys(Map<?, ?> raw, Schema schema, boolean checkKeys) {
        return normalizeKeys(raw, schema, checkKeys, false);
    }

    /**
     * Resolves every key of {@code raw} against the schema's lookup table.
     * Keys are canonicalized first: enum constants by {@link Enum#name()},
     * anything else by {@link String#valueOf(Object)}.
     *
     * @param checkKeys   when {@code true}, a key without a declared field
     *                    yields a {@link KeyError}
     * @param keepUnknown when key checking is off, keep undeclared keys (in
     *                    canonical form) instead of dropping them
     * @return the normalized mapping, or a KEY_ERROR terminal result
     */
    public static Normalized normalizeKeys(Map<?, ?> raw, Schema schema, boolean checkKeys, boolean keepUnknown) {
        Map<String, Object> mapping = new LinkedHashMap<>();
        List<String> unknown = new ArrayList<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            String key = canonicalKey(entry.getKey());
            if (schema.hasField(key)) {
                mapping.put(key, entry.getValue());
            } else {
                unknown.add(key);
                if (keepUnknown) {
                    mapping.put(key, entry.getValue());
                }
            }
        }
        if (checkKeys && !unknown.isEmpty()) {
            return Normalized.terminal(
                    ConstructionResult.keyError(KeyError.unknownKeys(schema.name(), unknown)));
        }
        return Normalized.mapping(mapping);
    }

    /** Canonical string form of an input key. */
    public static String canonicalKey(Object key) {
        if (key instanceof Enum<?> e) {
            return e.name();
        }
        return String.valueOf(key);
    }

    private static boolean isOrderedPairs(List<?> list) {
        if (list.isEmpty()) {
            return false;
        }
        for (Object element : list) {
            if (!(element instanceof Map.Entry)) {
                return false;
            }
        }
        return true;
    }

    private static Map<?, ?> mappingOf(Object input) {
        if (input instanceof Map<?, ?> map) {
            return map;
        }
        if (input instanceof Record record) {
            return componentsOf(record);
        }
        return MAPPER.convertValue(input, MAP_TYPE);
    }

    /**
     * Record components by name, values untouched (nested records stay records).
     * Accessors are read reflectively; records declared non-public (nested or
     * package-private types are common for input records) need
     * {@code setAccessible(true)} before their accessors can be invoked from
     * this package.
     *
     * @throws IllegalArgumentException if an accessor cannot be made accessible
     *                                  (e.g. a record in a module that does not
     *                                  open its package) or throws
     */
    private static Map<Object, Object> componentsOf(Record record) {
        Map<Object, Object> components = new LinkedHashMap<>();
        for (RecordComponent component : record.getClass().getRecordComponents()) {
            Method accessor = component.getAccessor();
            try {
                accessor.setAccessible(true);
                components.put(component.getName(), accessor.invoke(record));
            } catch (ReflectiveOperationException | RuntimeException e) {
                throw new IllegalArgumentException(
                        "Cannot read component '" + component.getName() + "' of " + record.getClass().getName(), e);
            }
        }
        return components;
    }

    private static Map<Object, Object> foldPairs(List<?> pairs) {
        Map<Object, Object> folded = new LinkedHashMap<>();
        for (Object element : pairs) {
            Map.Entry<?, ?> entry = (Map.Entry<?, ?>) element;
            folded.put(entry.getKey(), entry.getValue());
        }
        return folded;
    }

    /**
     * Result of key normalization: a mapping keyed by field name, or a
     * terminal result that ends the call.
     *
     * @param mapping  the normalized mapping, or {@code null} when terminal
     * @param terminal the result that ends the call, or {@code null}
     */
    public record Normalized(Map<String, Object> mapping, ConstructionResult terminal) {

        static Normalized mapping(Map<String, Object> mapping) {
            return new Normalized(Collections.unmodifiableMap(mapping), null);
        }

        static Normalized terminal(ConstructionResult result) {
            return new Normalized(null, result);
        }

        public boolean isTerminal() {
            return terminal != null;
        }
    }
}
