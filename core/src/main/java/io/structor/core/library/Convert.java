package io.structor.core.library;

import io.structor.core.model.StepResult;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Lenient conversions. Each one coerces the common loose representations of a
 * type (strings from forms or query parameters, {@code null}, numbers) and then
 * validates the result with the matching {@link Validate} check, so anything
 * it cannot coerce fails with that check's message.
 */
public final class Convert {

    private Convert() {}

    /**
     * Renders numbers, booleans, characters and enum constants as strings.
     * {@code null} becomes {@code ""}.
     */
    public static StepResult toStringValue(Object value) {
        Object converted;
        if (value == null) {
            converted = "";
        } else if (value instanceof Enum<?> e) {
            converted = e.name();
        } else if (value instanceof Number || value instanceof Boolean || value instanceof Character) {
            converted = String.valueOf(value);
        } else {
            converted = value;
        }
        return Validate.isString(converted);
    }

    public static StepResult toStringOrNull(Object value) {
        return value == null ? StepResult.ok(null) : toStringValue(value);
    }

    /** {@code null} and {@code ""} become 0; decimal strings are parsed. */
    public static StepResult toInteger(Object value) {
        Object converted = value;
        if (value == null || "".equals(value)) {
            converted = 0L;
        } else if (value instanceof String s) {
            converted = parseIntegral(s);
        }
        return Validate.isInteger(converted);
    }

    public static StepResult toIntegerOrNull(Object value) {
        return value == null ? StepResult.ok(null) : toInteger(value);
    }

    /** {@code null} and {@code ""} become 0.0; integral numbers are widened; strings are parsed. */
    public static StepResult toFloat(Object value) {
        Object converted = value;
        if (value == null || "".equals(value)) {
            converted = 0.0d;
        } else if (value instanceof String s) {
            converted = parseFloating(s);
        } else if (Validate.normalizeIntegral(value) != null) {
            converted = ((Number) value).doubleValue();
        }
        return Validate.isFloat(converted);
    }

    public static StepResult toFloatOrNull(Object value) {
        return value == null ? StepResult.ok(null) : toFloat(value);
    }

    /**
     * {@code "true"}/{@code "false"} and 1/0 map to booleans; {@code null} and
     * {@code ""} become {@code false}.
     */
    public static StepResult toBoolean(Object value) {
        Object converted = value;
        if (value == null || "".equals(value) || "false".equals(value)) {
            converted = Boolean.FALSE;
        } else if ("true".equals(value)) {
            converted = Boolean.TRUE;
        } else {
            Object integral = Validate.normalizeIntegral(value);
            if (Long.valueOf(1L).equals(integral)) {
                converted = Boolean.TRUE;
            } else if (Long.valueOf(0L).equals(integral)) {
                converted = Boolean.FALSE;
            }
        }
        return Validate.isBoolean(converted);
    }

    public static StepResult toBooleanOrNull(Object value) {
        return value == null ? StepResult.ok(null) : toBoolean(value);
    }

    /** {@code null} becomes the empty list; anything else must already be a list. */
    public static StepResult nilToList(Object value) {
        return Validate.isList(value == null ? new ArrayList<>() : value);
    }

    /**
     * Renders an identifier or enum constant in upper snake case:
     * {@code "fooBar"} → {@code "FOO_BAR"}. {@code null} and {@code ""} become
     * {@code null}.
     */
    public static StepResult toEnumString(Object value) {
        if (value == null || "".equals(value)) {
            return StepResult.ok(null);
        }
        if (value instanceof Enum<?> e) {
            return StepResult.ok(upperSnake(e.name()));
        }
        if (value instanceof String s) {
            return StepResult.ok(upperSnake(s));
        }
        return Validate.isStringOrNull(value);
    }

    /** Parses ISO-8601 dates ({@code 2024-01-31}); {@code null} passes through. */
    public static StepResult toDate(Object value) {
        if (value instanceof String s) {
            try {
                return StepResult.ok(LocalDate.parse(s));
            } catch (DateTimeParseException e) {
                return StepResult.error("must be a Date");
            }
        }
        return Validate.isDate(value);
    }

    /**
     * Maps a value onto an enum constant. With a single enum {@link Class}
     * argument the result is that enum's constant; otherwise the arguments are
     * the allowed names and the result is the matching name. Matching is done on
     * the {@link #toEnumString upper snake case} form.
     */
    public static StepResult toEnum(Object value, List<Object> args) {
        if (args.isEmpty()) {
            throw new IllegalArgumentException("to-enum expects an enum class or the allowed names");
        }
        if (value == null) {
            return StepResult.ok(null);
        }
        StepResult name = toEnumString(value);
        if (name.isError()) {
            return name;
        }
        String key = (String) name.value();
        if (args.size() == 1 && args.get(0) instanceof Class<?> type && type.isEnum()) {
            for (Object constant : type.getEnumConstants()) {
                if (((Enum<?>) constant).name().equals(key)) {
                    return StepResult.ok(constant);
                }
            }
            return StepResult.error("must be one of " + List.of(type.getEnumConstants()));
        }
        for (Object allowed : args) {
            if (key.equals(upperSnake(String.valueOf(allowed)))) {
                return StepResult.ok(allowed);
            }
        }
        return StepResult.error("must be one of " + args);
    }

    // --- Helpers ---

    private static Object parseIntegral(String s) {
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            try {
                return new BigInteger(s);
            } catch (NumberFormatException notANumber) {
                return s;
            }
        }
    }

    private static Object parseFloating(String s) {
        try {
            double parsed = Double.parseDouble(s);
            return Double.isFinite(parsed) ? (Object) parsed : s;
        } catch (NumberFormatException e) {
            return s;
        }
    }

    /** {@code "HTTPServer"} → {@code "HTTP_SERVER"}, {@code "foo-bar"} → {@code "FOO_BAR"}. */
    static String upperSnake(String s) {
        StringBuilder out = new StringBuilder(s.length() + 4);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '-' || c == ' ') {
                out.append('_');
                continue;
            }
            if (Character.isUpperCase(c) && i > 0) {
                char prev = s.charAt(i - 1);
                boolean nextIsLower = i + 1 < s.length() && Character.isLowerCase(s.charAt(i + 1));
                if (Character.isLowerCase(prev) || Character.isDigit(prev) || (Character.isUpperCase(prev) && nextIsLower)) {
                    out.append('_');
                }
            }
            out.append(c);
        }
        return out.toString().toUpperCase(Locale.ROOT);
    }
}
