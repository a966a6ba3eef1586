package io.structor.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import io.structor.core.model.ErrorReport;
import io.structor.core.model.KeyError;
import io.structor.core.model.ShapeError;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for the two-tier exception hierarchy and its common fields. */
class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void structorExceptionIsAbstractAndRoot() {
        assertThat(StructorException.class).isAbstract();
        assertThat(StructorException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void schemaLoadExceptionIsAbstract() {
        assertThat(SchemaLoadException.class).isAbstract();
        assertThat(SchemaLoadException.class.getSuperclass()).isEqualTo(StructorException.class);
    }

    @Test
    void constructionFailureExceptionIsAbstract() {
        assertThat(ConstructionFailureException.class).isAbstract();
        assertThat(ConstructionFailureException.class.getSuperclass()).isEqualTo(StructorException.class);
    }

    // --- Load-time exceptions ---

    @Test
    void schemaParseExceptionExtendsLoadException() {
        var ex = new SchemaParseException("bad yaml", "Person", "/schemas/person.yaml");

        assertThat(ex).isInstanceOf(SchemaLoadException.class);
        assertThat(ex.schemaName()).isEqualTo("Person");
        assertThat(ex.detail()).isEqualTo("bad yaml");
        assertThat(ex.phase()).isEqualTo(StructorException.Phase.LOAD);
        assertThat(ex.source()).isEqualTo("/schemas/person.yaml");
    }

    @Test
    void schemaParseExceptionKeepsCause() {
        var cause = new IllegalStateException("boom");
        var ex = new SchemaParseException("failed", cause, null, "inline");

        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.schemaName()).isNull();
    }

    @Test
    void conversionResolveExceptionCarriesId() {
        var ex = new ConversionResolveException("unknown", "to-money", "Order", "/order.yaml");

        assertThat(ex).isInstanceOf(SchemaLoadException.class);
        assertThat(ex.conversionId()).isEqualTo("to-money");
        assertThat(ex.phase()).isEqualTo(StructorException.Phase.LOAD);
    }

    // --- Construction-time exceptions ---

    @Test
    void constructionExceptionCarriesReport() {
        ErrorReport report = ErrorReport.of("name", "is required");
        var ex = new ConstructionException("Person", report);

        assertThat(ex).isInstanceOf(ConstructionFailureException.class);
        assertThat(ex.errorReport()).isSameAs(report);
        assertThat(ex.getMessage()).isEqualTo("Failed to construct 'Person': {name=is required}");
        assertThat(ex.phase()).isEqualTo(StructorException.Phase.CONSTRUCTION);
    }

    @Test
    void shapeExceptionUsesShapeDetail() {
        ShapeError error = ShapeError.unrecognized("Person", 3.5);
        var ex = new ShapeException("Person", error);

        assertThat(ex.shapeError()).isSameAs(error);
        assertThat(ex.detail()).isEqualTo("cannot build 'Person' from input of type Double");
    }

    @Test
    void keyViolationExceptionUsesKeyDetail() {
        KeyError error = KeyError.missingRequired("Account", List.of("id"));
        var ex = new KeyViolationException("Account", error);

        assertThat(ex.keyError()).isSameAs(error);
        assertThat(ex.detail()).isEqualTo("missing required key(s) for 'Account': [id]");
        assertThat(ex.schemaName()).isEqualTo("Account");
    }

    @Test
    void stepInvocationExceptionNamesField() {
        var cause = new ArithmeticException("/ by zero");
        var ex = new StepInvocationException("step threw", cause, "Ratio", "value");

        assertThat(ex).isInstanceOf(ConstructionFailureException.class);
        assertThat(ex.fieldName()).isEqualTo("value");
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.phase()).isEqualTo(StructorException.Phase.CONSTRUCTION);
    }

    // --- Catch-all ---

    @Test
    void allExceptionsCatchableAsStructorException() {
        List<StructorException> all = List.of(
                new SchemaParseException("a", null, null),
                new ConversionResolveException("b", "x", null, null),
                new ConstructionException("S", ErrorReport.of("f", "m")),
                new ShapeException("S", ShapeError.unrecognized("S", 1)),
                new KeyViolationException("S", KeyError.unknownKeys("S", List.of("k"))),
                new StepInvocationException("e", new RuntimeException(), "S", "f"));

        assertThat(all).allSatisfy(ex -> assertThat(ex).isInstanceOf(RuntimeException.class));
    }
}
