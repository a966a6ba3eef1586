package io.structor.core.engine;

import io.structor.core.error.ConstructionException;
import io.structor.core.error.KeyViolationException;
import io.structor.core.error.ShapeException;
import io.structor.core.model.ConstructionOptions;
import io.structor.core.model.ConstructionResult;
import io.structor.core.model.ConversionStep;
import io.structor.core.model.FieldDescriptor;
import io.structor.core.model.HookResult;
import io.structor.core.model.InputShape;
import io.structor.core.model.KeyError;
import io.structor.core.model.Schema;
import io.structor.core.model.ShapeError;
import io.structor.core.model.StepResult;
import io.structor.core.model.Struct;
import io.structor.core.spi.ConstructionHooks;
import io.structor.core.spi.ConstructionListener;
import io.structor.core.spi.Conversion;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point that builds records of one {@link Schema} from loosely-typed
 * input.
 *
 * <p>
 * One call runs: shape classification and key normalization →
 * {@code beforeConstruct} → defaults (and the required-key check when key
 * checking is on) → every field's conversion chain → error aggregation →
 * {@code afterConstruct}. Field failures are collected across all fields and
 * returned together; shape and key errors end the call immediately.
 *
 * <p>
 * {@link #construct} never throws for invalid input; {@link #constructOrThrow}
 * is the raising variant. A conversion step that throws is a defect and
 * surfaces as {@link io.structor.core.error.StepInvocationException} from
 * both.
 *
 * <p>
 * A constructor is itself a {@link Conversion}, so it can be used as a step of
 * another schema's field; its failures then nest under that field.
 *
 * <p>
 * Thread-safe: holds only immutable state. Each call allocates its own working
 * values and error report.
 */
public final class Constructor implements Conversion {

    private static final Logger LOG = LoggerFactory.getLogger(Constructor.class);

    private final Schema schema;
    private final ConstructionListener listener;

    /**
     * Creates a constructor without a listener.
     *
     * @param schema the schema to build
     */
    public Constructor(Schema schema) {
        this(schema, null);
    }

    /**
     * Creates a constructor with an optional listener.
     *
     * @param schema   the schema to build
     * @param listener lifecycle listener, may be null
     */
    public Constructor(Schema schema, ConstructionListener listener) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.listener = listener; // nullable
    }

    public Schema schema() {
        return schema;
    }

    public String name() {
        return schema.name();
    }

    /** Builds with the schema's options. */
    public ConstructionResult construct(Object input) {
        return construct(input, ConstructionOptions.NONE);
    }

    /**
     * Builds a record (or a list of records) from {@code input}.
     *
     * @param input   a map, ordered pairs, struct, JSON node, Java record, a
     *                list of those, or {@code null}
     * @param options call-site options; unset components fall back to the
     *                schema's options, then to the library defaults
     * @return the result; never {@code null}
     */
    public ConstructionResult construct(Object input, ConstructionOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        ConstructionOptions resolved = options.resolve(schema.options()).resolve(ConstructionOptions.DEFAULTS);

        InputShape shape = InputNormalizer.classify(input);
        switch (shape) {
            case NULL:
                if (!resolved.isNilToEmpty()) {
                    return ConstructionResult.success(null);
                }
                return constructOne(Map.of(), shape, resolved);
            case LIST:
                return constructList(InputNormalizer.toList(input), options);
            case UNRECOGNIZED:
                long start = System.nanoTime();
                ConstructionResult rejected = ConstructionResult.shapeError(ShapeError.unrecognized(schema.name(), input));
                finish(rejected, shape, start);
                return rejected;
            default:
                return constructOne(InputNormalizer.toRawMapping(input, shape), shape, resolved);
        }
    }

    /** Same as {@link #constructOrThrow(Object, ConstructionOptions)} with the schema's options. */
    public Object constructOrThrow(Object input) {
        return constructOrThrow(input, ConstructionOptions.NONE);
    }

    /**
     * Builds like {@link #construct(Object, ConstructionOptions)} but returns the
     * bare value and throws on failure.
     *
     * @return the struct, list or {@code null}
     * @throws ConstructionException  if fields or list elements failed
     * @throws ShapeException         if the input shape is not recognized
     * @throws KeyViolationException  if key checking rejected the input
     */
    public Object constructOrThrow(Object input, ConstructionOptions options) {
        ConstructionResult result = construct(input, options);
        return switch (result.type()) {
            case SUCCESS -> result.value();
            case INVALID -> throw new ConstructionException(schema.name(), result.errorReport());
            case SHAPE_ERROR -> throw new ShapeException(schema.name(), result.shapeError());
            case KEY_ERROR -> throw new KeyViolationException(schema.name(), result.keyError());
        };
    }

    /**
     * Builds a single record and throws if the input yields anything else.
     *
     * @throws IllegalArgumentException if the input was a list or produced {@code null}
     */
    public Struct constructStruct(Object input) {
        Object value = constructOrThrow(input);
        if (!(value instanceof Struct struct)) {
            throw new IllegalArgumentException(
                    "Expected a single '" + schema.name() + "' record, got: " + value);
        }
        return struct;
    }

    /**
     * Nested-record delegation: builds {@code value} with this schema's own
     * options. An invalid nested record fails with its report; a shape or key
     * error fails with its message.
     */
    @Override
    public StepResult apply(Object value) {
        ConstructionResult result = construct(value);
        return switch (result.type()) {
            case SUCCESS -> StepResult.ok(result.value());
            case INVALID -> StepResult.error(result.errorReport());
            case SHAPE_ERROR, KEY_ERROR -> StepResult.error(result.failureDetail());
        };
    }

    /** This constructor as a field step. */
    public ConversionStep asStep() {
        return ConversionStep.of(this);
    }

    // --- Private helpers ---

    private ConstructionResult constructList(List<Object> elements, ConstructionOptions options) {
        if (elements.isEmpty()) {
            return ConstructionResult.success(List.of());
        }
        List<ConstructionResult> results = new ArrayList<>(elements.size());
        for (Object element : elements) {
            results.add(construct(element, options));
        }
        ConstructionResult aggregated = ErrorAggregator.aggregateIndexed(results);
        if (aggregated.isFailure()) {
            LOG.debug(
                    "List construction invalid: schema={}, elements={}, failed_indices={}",
                    schema.name(),
                    elements.size(),
                    aggregated.errorReport().keys());
        }
        return aggregated;
    }

    private ConstructionResult constructOne(Map<?, ?> raw, InputShape shape, ConstructionOptions resolved) {
        long start = System.nanoTime();
        ConstructionResult result = build(raw, resolved);
        finish(result, shape, start);
        return result;
    }

    private ConstructionResult build(Map<?, ?> raw, ConstructionOptions resolved) {
        boolean checkKeys = resolved.isCheckKeys();
        ConstructionHooks hooks = schema.hooks();

        // Undeclared keys reach beforeConstruct so it can rename or merge them
        InputNormalizer.Normalized normalized = InputNormalizer.normalizeKeys(raw, schema, checkKeys, true);
        if (normalized.isTerminal()) {
            return normalized.terminal();
        }

        HookResult<Map<String, Object>> before =
                hooks.beforeConstruct(normalized.mapping(), ConstructionHooks.DEFAULT_BEFORE);
        Objects.requireNonNull(before, "beforeConstruct must not return null");
        if (before.isRejected()) {
            return ConstructionResult.invalid(before.rejection());
        }
        Objects.requireNonNull(before.value(), "beforeConstruct must not proceed with null");
        InputNormalizer.Normalized reshaped = InputNormalizer.normalizeKeys(before.value(), schema, checkKeys);
        if (reshaped.isTerminal()) {
            return reshaped.terminal();
        }
        Map<String, Object> input = reshaped.mapping();

        Map<String, Object> working = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        for (FieldDescriptor field : schema.fields()) {
            if (input.containsKey(field.name())) {
                working.put(field.name(), input.get(field.name()));
            } else if (field.hasDefault()) {
                working.put(field.name(), field.defaultValue());
            } else {
                working.put(field.name(), null);
                if (field.required()) {
                    missing.add(field.name());
                }
            }
        }
        if (checkKeys && !missing.isEmpty()) {
            return ConstructionResult.keyError(KeyError.missingRequired(schema.name(), missing));
        }

        List<FieldPipelineExecutor.FieldOutcome> outcomes = FieldPipelineExecutor.runFields(schema, working);
        ConstructionResult aggregated = ErrorAggregator.aggregate(schema, outcomes, working);
        if (aggregated.isFailure()) {
            return aggregated;
        }

        HookResult<Struct> after = hooks.afterConstruct(aggregated.struct());
        Objects.requireNonNull(after, "afterConstruct must not return null");
        if (after.isRejected()) {
            return ConstructionResult.invalid(after.rejection());
        }
        return ConstructionResult.success(after.value());
    }

    private void finish(ConstructionResult result, InputShape shape, long startNanos) {
        long elapsed = System.nanoTime() - startNanos;
        if (result.isSuccess()) {
            notifyCompleted(shape, elapsed);
            return;
        }
        int errorCount = result.errorReport() != null ? result.errorReport().size() : 0;
        LOG.debug(
                "Construction failed: schema={}, failure={}, error_count={}, detail={}",
                schema.name(),
                result.type(),
                errorCount,
                result.failureDetail());
        notifyFailed(shape, result.type(), errorCount, elapsed);
    }

    private void notifyCompleted(InputShape shape, long durationNanos) {
        if (listener == null) return;
        try {
            listener.onConstructionCompleted(
                    new ConstructionListener.ConstructionCompletedEvent(schema.name(), shape, durationNanos));
        } catch (Exception e) {
            LOG.warn("ConstructionListener.onConstructionCompleted failed", e);
        }
    }

    private void notifyFailed(InputShape shape, ConstructionResult.Type type, int errorCount, long durationNanos) {
        if (listener == null) return;
        try {
            listener.onConstructionFailed(new ConstructionListener.ConstructionFailedEvent(
                    schema.name(), shape, type, errorCount, durationNanos));
        } catch (Exception e) {
            LOG.warn("ConstructionListener.onConstructionFailed failed", e);
        }
    }

    @Override
    public String toString() {
        return "Constructor[" + schema.name() + "]";
    }
}
