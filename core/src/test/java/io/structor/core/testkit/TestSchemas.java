package io.structor.core.testkit;

import io.structor.core.engine.Constructor;
import io.structor.core.library.Convert;
import io.structor.core.library.Validate;
import io.structor.core.model.ConstructionOptions;
import io.structor.core.model.ConversionStep;
import io.structor.core.model.Schema;

/**
 * Schemas shared across tests.
 *
 * <ul>
 * <li>{@code Person { name: required non-blank string; age: integer, default 0 }}</li>
 * <li>{@code Team { lead: Person }}</li>
 * <li>{@code Account { id: required; name }} with key checking on</li>
 * </ul>
 */
public final class TestSchemas {

    private TestSchemas() {
        /* utility class */
    }

    public static Schema person() {
        return Schema.builder("Person")
                .requiredField("name", ConversionStep.of(Validate::notBlank))
                .fieldWithDefault("age", 0L, ConversionStep.of(Convert::toInteger))
                .build();
    }

    public static Schema team() {
        return team(new Constructor(person()));
    }

    public static Schema team(Constructor personConstructor) {
        return Schema.builder("Team").field("lead", personConstructor.asStep()).build();
    }

    public static Schema account() {
        return Schema.builder("Account")
                .requiredField("id", ConversionStep.of(Validate::isString))
                .field("name")
                .options(ConstructionOptions.NONE.withCheckKeys(true))
                .build();
    }

    /** Two optional pass-through fields; {@code b} defaults to "dflt". */
    public static Schema loose() {
        return Schema.builder("Loose").field("a").fieldWithDefault("b", "dflt").build();
    }
}
