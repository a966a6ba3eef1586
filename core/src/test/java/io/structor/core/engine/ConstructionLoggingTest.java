package io.structor.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.structor.core.error.StepInvocationException;
import io.structor.core.library.BuiltinConversions;
import io.structor.core.model.ConversionStep;
import io.structor.core.model.Schema;
import io.structor.core.parser.SchemaParser;
import io.structor.core.testkit.TestSchemas;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/** Tests for the log entries emitted around schema loading and construction. */
@DisplayName("ConstructionLoggingTest")
class ConstructionLoggingTest {

    private final List<Logger> loggers = List.of(
            (Logger) LoggerFactory.getLogger(ConstructionEngine.class),
            (Logger) LoggerFactory.getLogger(FieldPipelineExecutor.class),
            (Logger) LoggerFactory.getLogger(Constructor.class));

    private ListAppender<ILoggingEvent> logAppender;

    @BeforeEach
    void setUp() {
        logAppender = new ListAppender<>();
        logAppender.start();
        loggers.forEach(logger -> logger.addAppender(logAppender));
    }

    @AfterEach
    void tearDown() {
        loggers.forEach(logger -> logger.detachAppender(logAppender));
        logAppender.stop();
    }

    private List<ILoggingEvent> eventsAt(Level level) {
        return logAppender.list.stream().filter(e -> e.getLevel() == level).toList();
    }

    @Test
    @DisplayName("Schema registration is logged at INFO")
    void registrationLogged() {
        ConstructionEngine engine = new ConstructionEngine(new SchemaParser(BuiltinConversions.newRegistry()));

        engine.register(TestSchemas.person());

        assertThat(eventsAt(Level.INFO))
                .extracting(ILoggingEvent::getFormattedMessage)
                .anySatisfy(m -> assertThat(m).contains("schema=Person").contains("fields=2"));
    }

    @Test
    @DisplayName("Rejected schema document is logged at WARN")
    void rejectionLogged() {
        ConstructionEngine engine = new ConstructionEngine(new SchemaParser(BuiltinConversions.newRegistry()));

        assertThatThrownBy(() -> engine.loadSchema("schema: X", "x.yaml")).isInstanceOf(RuntimeException.class);

        assertThat(eventsAt(Level.WARN))
                .extracting(ILoggingEvent::getFormattedMessage)
                .anySatisfy(m -> assertThat(m).contains("source=x.yaml"));
    }

    @Test
    @DisplayName("Throwing step is logged at WARN with schema and field")
    void throwingStepLogged() {
        Schema schema = Schema.builder("Boom")
                .field("x", ConversionStep.of(v -> {
                    throw new IllegalArgumentException("bad input");
                }))
                .build();
        Constructor constructor = new Constructor(schema);

        assertThatThrownBy(() -> constructor.construct(Map.of("x", 1))).isInstanceOf(StepInvocationException.class);

        assertThat(eventsAt(Level.WARN))
                .extracting(ILoggingEvent::getFormattedMessage)
                .anySatisfy(m -> assertThat(m).contains("schema=Boom").contains("field=x"));
    }

    @Test
    @DisplayName("Failed construction is logged at DEBUG with its failure type")
    void failureLoggedAtDebug() {
        new Constructor(TestSchemas.person()).construct(Map.of("name", ""));

        assertThat(eventsAt(Level.DEBUG))
                .extracting(ILoggingEvent::getFormattedMessage)
                .anySatisfy(m -> assertThat(m).contains("schema=Person").contains("failure=INVALID"));
    }
}
