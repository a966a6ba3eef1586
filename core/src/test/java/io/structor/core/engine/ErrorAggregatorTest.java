package io.structor.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.structor.core.model.ConstructionResult;
import io.structor.core.model.ErrorReport;
import io.structor.core.model.KeyError;
import io.structor.core.model.Schema;
import io.structor.core.model.StepResult;
import io.structor.core.testkit.TestSchemas;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link ErrorAggregator}. */
@DisplayName("ErrorAggregator")
class ErrorAggregatorTest {

    @Test
    @DisplayName("Successful outcomes replace the working values")
    void successReplacesValues() {
        Schema schema = TestSchemas.loose();
        Map<String, Object> working = new LinkedHashMap<>(Map.of("a", "raw", "b", "raw"));

        ConstructionResult result = ErrorAggregator.aggregate(
                schema,
                List.of(
                        new FieldPipelineExecutor.FieldOutcome("a", StepResult.ok("A")),
                        new FieldPipelineExecutor.FieldOutcome("b", StepResult.ok("B"))),
                working);

        assertThat(result.struct().values()).containsExactly(Map.entry("a", "A"), Map.entry("b", "B"));
    }

    @Test
    @DisplayName("Failures are collected by field; messages and nested reports keep their form")
    void failuresCollected() {
        ErrorReport nested = ErrorReport.of("x", "bad x");

        ConstructionResult result = ErrorAggregator.aggregate(
                TestSchemas.loose(),
                List.of(
                        new FieldPipelineExecutor.FieldOutcome("a", StepResult.error("bad a")),
                        new FieldPipelineExecutor.FieldOutcome("b", StepResult.error(nested))),
                new LinkedHashMap<>());

        assertThat(result.type()).isEqualTo(ConstructionResult.Type.INVALID);
        assertThat(result.errorReport().message("a")).isEqualTo("bad a");
        assertThat(result.errorReport().nested("b")).isEqualTo(nested);
    }

    @Test
    @DisplayName("Indexed aggregation keeps successful values in order")
    void indexedSuccess() {
        ConstructionResult result =
                ErrorAggregator.aggregateIndexed(List.of(ConstructionResult.success("x"), ConstructionResult.success(null)));

        assertThat(result.list()).containsExactly("x", null);
    }

    @Test
    @DisplayName("Indexed aggregation reports every failing index")
    void indexedFailures() {
        ConstructionResult result = ErrorAggregator.aggregateIndexed(List.of(
                ConstructionResult.invalid(ErrorReport.of("a", "bad")),
                ConstructionResult.success("ok"),
                ConstructionResult.keyError(KeyError.unknownKeys("S", List.of("z")))));

        ErrorReport report = result.errorReport();
        assertThat(report.keys()).containsExactly(0, 2);
        assertThat(report.nested(0).message("a")).isEqualTo("bad");
        assertThat(report.message(2)).isEqualTo("unknown key(s) for 'S': [z]");
    }
}
