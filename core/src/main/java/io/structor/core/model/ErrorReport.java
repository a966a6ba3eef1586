package io.structor.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Structured report of everything that went wrong in one construction call.
 *
 * <p>
 * Keys are field names ({@link String}) for single-record construction, or
 * list positions ({@link Integer}) for list construction. Each value is either
 * a message {@link String} or a nested {@link ErrorReport} produced by a
 * nested-record field or a list element.
 *
 * <p>
 * Immutable once built. Every construction call builds its own report through
 * {@link #builder()}; reports are never shared between calls.
 */
public final class ErrorReport {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<Object, Object> entries;

    private ErrorReport(Map<Object, Object> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    /** Returns a fresh builder. */
    public static Builder builder() {
        return new Builder();
    }

    /** Convenience factory for a single field message. */
    public static ErrorReport of(String field, String message) {
        return builder().put(field, message).build();
    }

    /** The keys in insertion order: field names or list indices. */
    public Set<Object> keys() {
        return entries.keySet();
    }

    /** Returns the raw entry (message or nested report), or {@code null}. */
    public Object get(Object key) {
        return entries.get(key);
    }

    /** Returns the message stored under {@code key}, or {@code null} if absent or nested. */
    public String message(Object key) {
        Object value = entries.get(key);
        return value instanceof String s ? s : null;
    }

    /** Returns the nested report stored under {@code key}, or {@code null} if absent or a message. */
    public ErrorReport nested(Object key) {
        Object value = entries.get(key);
        return value instanceof ErrorReport r ? r : null;
    }

    public boolean containsKey(Object key) {
        return entries.containsKey(key);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    /**
     * Converts the report into plain nested maps: messages stay strings, nested
     * reports become {@code Map<Object, Object>}.
     */
    public Map<Object, Object> toMap() {
        Map<Object, Object> out = new LinkedHashMap<>();
        entries.forEach((key, value) -> out.put(key, value instanceof ErrorReport r ? r.toMap() : value));
        return out;
    }

    /** Renders the report as a JSON object. Integer indices become string property names. */
    public ObjectNode toJson() {
        ObjectNode node = MAPPER.createObjectNode();
        entries.forEach((key, value) -> {
            String name = String.valueOf(key);
            if (value instanceof ErrorReport r) {
                node.set(name, r.toJson());
            } else {
                node.put(name, (String) value);
            }
        });
        return node;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ErrorReport that)) return false;
        return entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }

    /** Accumulates entries for one report. Not thread-safe; owned by a single call. */
    public static final class Builder {

        private final Map<Object, Object> entries = new LinkedHashMap<>();

        Builder() {}

        public Builder put(String field, String message) {
            return putEntry(Objects.requireNonNull(field, "field must not be null"), message);
        }

        public Builder put(String field, ErrorReport nested) {
            return putEntry(Objects.requireNonNull(field, "field must not be null"), nested);
        }

        public Builder put(int index, String message) {
            return putEntry(index, message);
        }

        public Builder put(int index, ErrorReport nested) {
            return putEntry(index, nested);
        }

        /**
         * Records a step failure detail, which must be a message or a nested
         * report.
         *
         * @throws IllegalArgumentException if {@code detail} is neither
         */
        public Builder putDetail(Object key, Object detail) {
            if (!(detail instanceof String) && !(detail instanceof ErrorReport)) {
                throw new IllegalArgumentException("error detail must be a String or an ErrorReport, got: "
                        + (detail == null ? "null" : detail.getClass().getName()));
            }
            return putEntry(key, detail);
        }

        public boolean isEmpty() {
            return entries.isEmpty();
        }

        public ErrorReport build() {
            return new ErrorReport(entries);
        }

        private Builder putEntry(Object key, Object value) {
            Objects.requireNonNull(value, "error detail must not be null");
            entries.put(key, value);
            return this;
        }
    }
}
