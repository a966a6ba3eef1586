package io.structor.core.engine;

import io.structor.core.error.StepInvocationException;
import io.structor.core.model.ConversionStep;
import io.structor.core.model.FieldDescriptor;
import io.structor.core.model.Schema;
import io.structor.core.model.StepResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs conversion chains against field values.
 *
 * <p>
 * A {@link ConversionStep.Chain} is folded left to right: each success feeds
 * the next step, the first failure is returned and the remaining steps are not
 * invoked. Failure details pass through untouched, so a nested record's
 * {@link io.structor.core.model.ErrorReport} keeps its structure.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class FieldPipelineExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(FieldPipelineExecutor.class);

    private FieldPipelineExecutor() {}

    /**
     * Runs one step (or chain) against a value.
     *
     * @throws IllegalStateException if a conversion returns {@code null}
     *                               instead of a {@link StepResult}
     */
    public static StepResult run(ConversionStep step, Object value) {
        if (step instanceof ConversionStep.Direct direct) {
            return requireResult(direct.fn().apply(value));
        }
        if (step instanceof ConversionStep.BoundArgs bound) {
            return requireResult(bound.fn().apply(value, bound.args()));
        }
        ConversionStep.Chain chain = (ConversionStep.Chain) step;
        Object current = value;
        for (ConversionStep inner : chain.steps()) {
            StepResult result = run(inner, current);
            if (result.isError()) {
                return result;
            }
            current = result.value();
        }
        return StepResult.ok(current);
    }

    /**
     * Runs every field's chain against its current value. Every field is run,
     * whatever the outcome of the others.
     *
     * @param schema the schema whose fields are run
     * @param values the working values, keyed by field name
     * @return one outcome per field, in declaration order
     * @throws StepInvocationException if a step throws
     */
    public static List<FieldOutcome> runFields(Schema schema, Map<String, Object> values) {
        List<FieldOutcome> outcomes = new ArrayList<>(schema.size());
        for (FieldDescriptor field : schema.fields()) {
            outcomes.add(new FieldOutcome(field.name(), runField(schema, field, values.get(field.name()))));
        }
        return outcomes;
    }

    private static StepResult runField(Schema schema, FieldDescriptor field, Object value) {
        try {
            return run(field.chain(), value);
        } catch (StepInvocationException e) {
            // Raised by a nested constructor; already carries its own field context
            throw e;
        } catch (RuntimeException e) {
            LOG.warn(
                    "Conversion step threw: schema={}, field={}, exception={}",
                    schema.name(),
                    field.name(),
                    e.toString());
            throw new StepInvocationException(
                    "Conversion step for field '" + field.name() + "' of '" + schema.name() + "' threw: "
                            + e.getMessage(),
                    e,
                    schema.name(),
                    field.name());
        }
    }

    private static StepResult requireResult(StepResult result) {
        if (result == null) {
            throw new IllegalStateException("conversion returned null instead of a StepResult");
        }
        return result;
    }

    /**
     * Outcome of one field's chain.
     *
     * @param field  the field name
     * @param result the chain's result
     */
    public record FieldOutcome(String field, StepResult result) {}
}
