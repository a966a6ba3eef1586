package io.structor.core.library;

import io.structor.core.model.StepResult;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Common validations for field values. Each check returns the (possibly
 * normalized) value on success and a short message on failure, so it can be
 * used directly as a {@link io.structor.core.spi.Conversion} via a method
 * reference ({@code Validate::isString}).
 *
 * <p>
 * Integral numbers of any boxed width are normalized to {@link Long};
 * floating-point numbers to {@link Double}.
 *
 * <p>
 * Checks that take extra arguments ({@link #minLength}, {@link #min},
 * {@link #oneOf}, ...) match {@link io.structor.core.spi.BoundConversion} and
 * let {@code null} through, so optional fields can carry them.
 */
public final class Validate {

    static final Pattern UUID_PATTERN =
            Pattern.compile("[a-f0-9]{8}-[a-f0-9]{4}-4[a-f0-9]{3}-[89aAbB][a-f0-9]{3}-[a-f0-9]{12}");

    private Validate() {}

    /** Passes {@code null} and {@link LocalDate}s. */
    public static StepResult isDate(Object value) {
        if (value == null || value instanceof LocalDate) {
            return StepResult.ok(value);
        }
        return StepResult.error("must be a Date");
    }

    public static StepResult isBoolean(Object value) {
        return value instanceof Boolean ? StepResult.ok(value) : StepResult.error("must be a boolean");
    }

    public static StepResult isString(Object value) {
        return value instanceof String ? StepResult.ok(value) : StepResult.error("must be a string");
    }

    public static StepResult isStringOrNull(Object value) {
        return value == null ? StepResult.ok(null) : isString(value);
    }

    /**
     * Passes lists whose elements are all strings (including the empty list).
     * Fails with "must be a list" for non-lists and "must be a list of strings"
     * if any element is not a string.
     */
    public static StepResult isStringList(Object value) {
        if (!(value instanceof List<?> list)) {
            return StepResult.error("must be a list");
        }
        for (Object element : list) {
            if (!(element instanceof String)) {
                return StepResult.error("must be a list of strings");
            }
        }
        return StepResult.ok(value);
    }

    /** Passes integral numbers; {@code Byte}, {@code Short} and {@code Integer} become {@code Long}. */
    public static StepResult isInteger(Object value) {
        Object normalized = normalizeIntegral(value);
        return normalized != null ? StepResult.ok(normalized) : StepResult.error("must be an integer");
    }

    /** Passes floating-point numbers; {@code Float} and {@code BigDecimal} become {@code Double}. */
    public static StepResult isFloat(Object value) {
        if (value instanceof Double) {
            return StepResult.ok(value);
        }
        if (value instanceof Float || value instanceof BigDecimal) {
            return StepResult.ok(((Number) value).doubleValue());
        }
        return StepResult.error("must be a float");
    }

    public static StepResult isList(Object value) {
        return value instanceof List ? StepResult.ok(value) : StepResult.error("must be a list");
    }

    /**
     * Passes version-4 UUID strings; a {@link java.util.UUID} is rendered to its
     * string form first.
     */
    public static StepResult isUuid(Object value) {
        Object candidate = value instanceof java.util.UUID uuid ? uuid.toString() : value;
        if (candidate instanceof String s && UUID_PATTERN.matcher(s).matches()) {
            return StepResult.ok(s);
        }
        return StepResult.error("must be a UUID");
    }

    /** Fails {@code null} and {@code ""} with "is required"; non-strings with "must be a string". */
    public static StepResult isNonemptyString(Object value) {
        if (value == null || "".equals(value)) {
            return StepResult.error("is required");
        }
        return isString(value);
    }

    /** Like {@link #isString} but also rejects whitespace-only strings. */
    public static StepResult notBlank(Object value) {
        if (!(value instanceof String s)) {
            return StepResult.error("must be a string");
        }
        return s.isBlank() ? StepResult.error("must not be blank") : StepResult.ok(s);
    }

    // --- Checks with arguments ---

    /**
     * Minimum length of a string, or minimum size of a list or map.
     * Argument: the minimum (integral).
     */
    public static StepResult minLength(Object value, List<Object> args) {
        long min = longArg(args, "min-length");
        if (value == null) {
            return StepResult.ok(null);
        }
        long length = lengthOf(value);
        if (length < 0) {
            return StepResult.error("must be a string or a collection");
        }
        if (length < min) {
            return StepResult.error(value instanceof String
                    ? "must be at least " + min + " characters"
                    : "must have at least " + min + " elements");
        }
        return StepResult.ok(value);
    }

    /** Maximum length of a string, or maximum size of a list or map. */
    public static StepResult maxLength(Object value, List<Object> args) {
        long max = longArg(args, "max-length");
        if (value == null) {
            return StepResult.ok(null);
        }
        long length = lengthOf(value);
        if (length < 0) {
            return StepResult.error("must be a string or a collection");
        }
        if (length > max) {
            return StepResult.error(value instanceof String
                    ? "must be at most " + max + " characters"
                    : "must have at most " + max + " elements");
        }
        return StepResult.ok(value);
    }

    /** Inclusive lower bound on a number. */
    public static StepResult min(Object value, List<Object> args) {
        BigDecimal bound = numberArg(args, "min");
        if (value == null) {
            return StepResult.ok(null);
        }
        if (!(value instanceof Number number) || isNonFinite(number)) {
            return StepResult.error("must be a number");
        }
        return toBigDecimal(number).compareTo(bound) < 0
                ? StepResult.error("must be greater than or equal to " + args.get(0))
                : StepResult.ok(value);
    }

    /** Inclusive upper bound on a number. */
    public static StepResult max(Object value, List<Object> args) {
        BigDecimal bound = numberArg(args, "max");
        if (value == null) {
            return StepResult.ok(null);
        }
        if (!(value instanceof Number number) || isNonFinite(number)) {
            return StepResult.error("must be a number");
        }
        return toBigDecimal(number).compareTo(bound) > 0
                ? StepResult.error("must be less than or equal to " + args.get(0))
                : StepResult.ok(value);
    }

    /** Membership in the argument list. Integral numbers compare by value. */
    public static StepResult oneOf(Object value, List<Object> args) {
        if (value == null) {
            return StepResult.ok(null);
        }
        Object candidate = normalizeIntegralOrSelf(value);
        for (Object allowed : args) {
            if (candidate.equals(normalizeIntegralOrSelf(allowed))) {
                return StepResult.ok(value);
            }
        }
        return StepResult.error("must be one of " + args);
    }

    /** Full match of a string against the regular expression given as the argument. */
    public static StepResult matches(Object value, List<Object> args) {
        if (args.size() != 1 || !(args.get(0) instanceof String regex)) {
            throw new IllegalArgumentException("matches expects one regular expression argument, got: " + args);
        }
        if (value == null) {
            return StepResult.ok(null);
        }
        if (!(value instanceof String s)) {
            return StepResult.error("must be a string");
        }
        try {
            return Pattern.compile(regex).matcher(s).matches()
                    ? StepResult.ok(s)
                    : StepResult.error("must match " + regex);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("invalid regular expression: " + regex, e);
        }
    }

    // --- Helpers ---

    /** Integral value widened to Long (BigInteger kept as is), or null if not integral. */
    static Object normalizeIntegral(Object value) {
        if (value instanceof Long || value instanceof BigInteger) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        return null;
    }

    private static Object normalizeIntegralOrSelf(Object value) {
        Object normalized = normalizeIntegral(value);
        return normalized != null ? normalized : value;
    }

    private static long lengthOf(Object value) {
        if (value instanceof String s) {
            return s.codePointCount(0, s.length());
        }
        if (value instanceof Collection<?> c) {
            return c.size();
        }
        if (value instanceof Map<?, ?> m) {
            return m.size();
        }
        return -1;
    }

    private static long longArg(List<Object> args, String check) {
        if (args.size() != 1 || normalizeIntegral(args.get(0)) == null) {
            throw new IllegalArgumentException(check + " expects one integer argument, got: " + args);
        }
        return ((Number) args.get(0)).longValue();
    }

    private static BigDecimal numberArg(List<Object> args, String check) {
        if (args.size() != 1 || !(args.get(0) instanceof Number number) || isNonFinite(number)) {
            throw new IllegalArgumentException(check + " expects one finite numeric argument, got: " + args);
        }
        return toBigDecimal(number);
    }

    /** NaN and the infinities have no decimal form and are not comparable as bounds. */
    private static boolean isNonFinite(Number number) {
        if (number instanceof Double d) {
            return !Double.isFinite(d);
        }
        if (number instanceof Float f) {
            return !Float.isFinite(f);
        }
        return false;
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal bd) {
            return bd;
        }
        if (number instanceof BigInteger bi) {
            return new BigDecimal(bi);
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return BigDecimal.valueOf(number.longValue());
    }
}
