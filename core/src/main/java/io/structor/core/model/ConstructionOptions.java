package io.structor.core.model;

/**
 * Options that steer one construction call.
 *
 * <p>
 * A {@code null} component means "not set at this level". Options resolve per
 * call in three layers: call-site options, then the schema's own options, then
 * {@link #DEFAULTS}. Use {@link #resolve(ConstructionOptions)} to layer them.
 *
 * <p>
 * Immutable and thread-safe.
 *
 * @param nilToEmpty {@code true}: a {@code null} input builds a record from
 *                   defaults; {@code false}: a {@code null} input yields a
 *                   {@code null} result
 * @param checkKeys  {@code true}: unknown input keys and missing required
 *                   fields are hard failures
 */
public record ConstructionOptions(Boolean nilToEmpty, Boolean checkKeys) {

    /** Library-wide defaults. */
    public static final ConstructionOptions DEFAULTS = new ConstructionOptions(true, false);

    /** Sets nothing; every option falls through to the next layer. */
    public static final ConstructionOptions NONE = new ConstructionOptions(null, null);

    public ConstructionOptions withNilToEmpty(boolean value) {
        return new ConstructionOptions(value, checkKeys);
    }

    public ConstructionOptions withCheckKeys(boolean value) {
        return new ConstructionOptions(nilToEmpty, value);
    }

    /**
     * Fills every unset option from {@code fallback}. Options set here always
     * win.
     */
    public ConstructionOptions resolve(ConstructionOptions fallback) {
        if (fallback == null) {
            return this;
        }
        return new ConstructionOptions(
                nilToEmpty != null ? nilToEmpty : fallback.nilToEmpty,
                checkKeys != null ? checkKeys : fallback.checkKeys);
    }

    /** Resolved value of {@code nilToEmpty}; unset counts as the library default. */
    public boolean isNilToEmpty() {
        return nilToEmpty != null ? nilToEmpty : DEFAULTS.nilToEmpty;
    }

    /** Resolved value of {@code checkKeys}; unset counts as the library default. */
    public boolean isCheckKeys() {
        return checkKeys != null ? checkKeys : DEFAULTS.checkKeys;
    }
}
