package io.structor.core.model;

/** The recognized shapes of construction input. */
public enum InputShape {
    /** {@code null}, or a JSON null / missing node. */
    NULL,

    /** A {@link java.util.Map}, JSON object or Java record. */
    MAPPING,

    /** A non-empty list whose every element is a {@link java.util.Map.Entry}. */
    ORDERED_PAIRS,

    /** A {@link Struct} of the same or another schema. */
    EXISTING_RECORD,

    /** Any other list, or a JSON array. */
    LIST,

    /** Anything else. */
    UNRECOGNIZED
}
