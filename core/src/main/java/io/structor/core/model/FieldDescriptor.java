package io.structor.core.model;

import java.util.Objects;

/**
 * Per-field metadata of a {@link Schema}: name, optional default, required
 * flag and conversion chain.
 *
 * <p>
 * A default is distinct from "no default": {@code hasDefault} tells them apart
 * so that {@code null} can itself be a declared default. Defaults are shared by
 * every construction call and should be immutable values.
 *
 * @param name         the canonical field identifier
 * @param hasDefault   whether a default was declared
 * @param defaultValue the declared default, or {@code null}
 * @param required     whether the field must be present after defaulting
 *                     (enforced only when key checking is on)
 * @param chain        the conversion chain, {@link ConversionStep#NONE} for
 *                     pass-through
 */
public record FieldDescriptor(
        String name, boolean hasDefault, Object defaultValue, boolean required, ConversionStep chain) {

    public FieldDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("field name must not be blank");
        }
        Objects.requireNonNull(chain, "chain must not be null");
        if (!hasDefault && defaultValue != null) {
            throw new IllegalArgumentException("defaultValue given for field '" + name + "' without hasDefault");
        }
    }

    /** A field with no default, not required, and the given chain. */
    public static FieldDescriptor of(String name, ConversionStep chain) {
        return new FieldDescriptor(name, false, null, false, chain);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /** Fluent builder for a single descriptor. */
    public static final class Builder {

        private final String name;
        private boolean hasDefault;
        private Object defaultValue;
        private boolean required;
        private ConversionStep chain = ConversionStep.NONE;

        Builder(String name) {
            this.name = name;
        }

        public Builder defaultValue(Object value) {
            this.hasDefault = true;
            this.defaultValue = value;
            return this;
        }

        public Builder required() {
            return required(true);
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        public Builder chain(ConversionStep chain) {
            this.chain = chain;
            return this;
        }

        /** Shorthand for {@code chain(ConversionStep.chain(steps))}. */
        public Builder steps(ConversionStep... steps) {
            return chain(steps.length == 1 ? steps[0] : ConversionStep.chain(steps));
        }

        public FieldDescriptor build() {
            return new FieldDescriptor(name, hasDefault, defaultValue, required, chain);
        }
    }
}
