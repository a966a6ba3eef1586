package io.structor.core.engine;

import io.structor.core.model.ConstructionResult;
import io.structor.core.model.ErrorReport;
import io.structor.core.model.Schema;
import io.structor.core.model.Struct;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Merges per-field or per-element outcomes into a single result: the updated
 * record (or list) when nothing failed, otherwise an {@link ErrorReport}
 * holding every failure.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class ErrorAggregator {

    private ErrorAggregator() {}

    /**
     * Writes successful field values into {@code working} and collects every
     * failure under its field name.
     *
     * @param schema   the schema being built
     * @param outcomes one outcome per field
     * @param working  the call's working values; updated in place
     * @return SUCCESS with the record, or INVALID keyed by exactly the failed fields
     */
    public static ConstructionResult aggregate(
            Schema schema, List<FieldPipelineExecutor.FieldOutcome> outcomes, Map<String, Object> working) {
        ErrorReport.Builder errors = ErrorReport.builder();
        for (FieldPipelineExecutor.FieldOutcome outcome : outcomes) {
            if (outcome.result().isOk()) {
                working.put(outcome.field(), outcome.result().value());
            } else {
                errors.putDetail(outcome.field(), outcome.result().errorDetail());
            }
        }
        if (errors.isEmpty()) {
            return ConstructionResult.success(Struct.of(schema, working));
        }
        return ConstructionResult.invalid(errors.build());
    }

    /**
     * Combines the results of list elements by position. The list succeeds only
     * if every element did; otherwise the report holds every failing index,
     * with a nested report for invalid elements and a message for hard
     * failures.
     *
     * @param results one result per element, in input order
     * @return SUCCESS with the values in input order, or INVALID keyed by index
     */
    public static ConstructionResult aggregateIndexed(List<ConstructionResult> results) {
        List<Object> values = new ArrayList<>(results.size());
        ErrorReport.Builder errors = ErrorReport.builder();
        for (int i = 0; i < results.size(); i++) {
            ConstructionResult result = results.get(i);
            switch (result.type()) {
                case SUCCESS -> values.add(result.value());
                case INVALID -> errors.put(i, result.errorReport());
                case SHAPE_ERROR, KEY_ERROR -> errors.put(i, result.failureDetail());
            }
        }
        if (errors.isEmpty()) {
            return ConstructionResult.success(Collections.unmodifiableList(values));
        }
        return ConstructionResult.invalid(errors.build());
    }
}
