package io.structor.core.model;

import io.structor.core.spi.BoundConversion;
import io.structor.core.spi.Conversion;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The conversion chain attached to a field.
 *
 * <p>
 * Implementations are a sealed hierarchy: a plain function, a function with
 * bound extra arguments, or an ordered chain of steps. All variants are
 * interpreted by {@link io.structor.core.engine.FieldPipelineExecutor}.
 *
 * <p>
 * Thread-safe and immutable, provided the wrapped functions are.
 */
public sealed interface ConversionStep {

    /** The empty chain: passes the value through unchanged. */
    ConversionStep NONE = new Chain(List.of());

    /** Wraps a single-argument function. */
    static ConversionStep of(Conversion fn) {
        return new Direct(fn);
    }

    /** Wraps a function whose extra arguments are fixed here. */
    static ConversionStep bound(BoundConversion fn, Object... args) {
        return new BoundArgs(fn, Arrays.asList(args));
    }

    /** Chains steps left to right; the first failure stops the chain. */
    static ConversionStep chain(ConversionStep... steps) {
        return new Chain(Arrays.asList(steps));
    }

    static ConversionStep chain(List<ConversionStep> steps) {
        return new Chain(steps);
    }

    /** Chains plain functions left to right. */
    static ConversionStep chainOf(Conversion... fns) {
        List<ConversionStep> steps = new ArrayList<>(fns.length);
        for (Conversion fn : fns) {
            steps.add(new Direct(fn));
        }
        return new Chain(steps);
    }

    // ── Implementations ──

    /** Invokes {@code fn(value)}. */
    record Direct(Conversion fn) implements ConversionStep {
        public Direct {
            Objects.requireNonNull(fn, "fn must not be null");
        }
    }

    /**
     * Invokes {@code fn(value, args)}. Arguments may contain {@code null}
     * entries.
     */
    record BoundArgs(BoundConversion fn, List<Object> args) implements ConversionStep {
        public BoundArgs {
            Objects.requireNonNull(fn, "fn must not be null");
            Objects.requireNonNull(args, "args must not be null");
            args = Collections.unmodifiableList(new ArrayList<>(args));
        }
    }

    /** Folds {@code steps} left to right, stopping at the first failure. */
    record Chain(List<ConversionStep> steps) implements ConversionStep {
        public Chain {
            steps = List.copyOf(Objects.requireNonNull(steps, "steps must not be null"));
        }

        public boolean isEmpty() {
            return steps.isEmpty();
        }
    }
}
