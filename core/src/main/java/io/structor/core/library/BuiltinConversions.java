package io.structor.core.library;

import io.structor.core.engine.ConversionRegistry;

/**
 * Registers the library's conversions under the ids used in YAML schema
 * documents.
 */
public final class BuiltinConversions {

    private BuiltinConversions() {}

    /** Registers every built-in conversion. Existing entries with the same ids are replaced. */
    public static ConversionRegistry registerAll(ConversionRegistry registry) {
        registry.register("is-string", Validate::isString);
        registry.register("is-string-or-null", Validate::isStringOrNull);
        registry.register("is-string-list", Validate::isStringList);
        registry.register("is-integer", Validate::isInteger);
        registry.register("is-float", Validate::isFloat);
        registry.register("is-boolean", Validate::isBoolean);
        registry.register("is-list", Validate::isList);
        registry.register("is-date", Validate::isDate);
        registry.register("is-uuid", Validate::isUuid);
        registry.register("is-nonempty-string", Validate::isNonemptyString);
        registry.register("not-blank", Validate::notBlank);
        registry.registerBound("min-length", Validate::minLength);
        registry.registerBound("max-length", Validate::maxLength);
        registry.registerBound("min", Validate::min);
        registry.registerBound("max", Validate::max);
        registry.registerBound("one-of", Validate::oneOf);
        registry.registerBound("matches", Validate::matches);

        registry.register("to-string", Convert::toStringValue);
        registry.register("to-string-or-null", Convert::toStringOrNull);
        registry.register("to-integer", Convert::toInteger);
        registry.register("to-integer-or-null", Convert::toIntegerOrNull);
        registry.register("to-float", Convert::toFloat);
        registry.register("to-float-or-null", Convert::toFloatOrNull);
        registry.register("to-boolean", Convert::toBoolean);
        registry.register("to-boolean-or-null", Convert::toBooleanOrNull);
        registry.register("nil-to-list", Convert::nilToList);
        registry.register("to-enum-string", Convert::toEnumString);
        registry.register("to-date", Convert::toDate);
        registry.registerBound("to-enum", Convert::toEnum);

        registry.register("construct-string", Construct::string);
        registry.register("construct-integer", Construct::integer);
        registry.register("construct-uuid", Construct::uuid);
        return registry;
    }

    /** A fresh registry holding only the built-ins. */
    public static ConversionRegistry newRegistry() {
        return registerAll(new ConversionRegistry());
    }
}
