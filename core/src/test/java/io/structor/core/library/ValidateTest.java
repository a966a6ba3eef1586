package io.structor.core.library;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.structor.core.model.StepResult;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Tests for {@link Validate}. */
class ValidateTest {

    @Nested
    @DisplayName("Type checks")
    class TypeChecks {

        @Test
        void isString() {
            assertThat(Validate.isString("a")).isEqualTo(StepResult.ok("a"));
            assertThat(Validate.isString(1).errorMessage()).isEqualTo("must be a string");
            assertThat(Validate.isString(null).errorMessage()).isEqualTo("must be a string");
        }

        @Test
        void isStringOrNull() {
            assertThat(Validate.isStringOrNull(null)).isEqualTo(StepResult.ok(null));
            assertThat(Validate.isStringOrNull(false).isError()).isTrue();
        }

        @Test
        void isStringList() {
            assertThat(Validate.isStringList(List.of("a", "b")).isOk()).isTrue();
            assertThat(Validate.isStringList(List.of()).isOk()).isTrue();
            assertThat(Validate.isStringList(List.of("a", 1)).errorMessage()).isEqualTo("must be a list of strings");
            assertThat(Validate.isStringList("a").errorMessage()).isEqualTo("must be a list");
        }

        @Test
        void isIntegerNormalizesToLong() {
            assertThat(Validate.isInteger(5).value()).isEqualTo(5L);
            assertThat(Validate.isInteger((short) 5).value()).isEqualTo(5L);
            assertThat(Validate.isInteger(5L).value()).isEqualTo(5L);
            assertThat(Validate.isInteger(5.0).errorMessage()).isEqualTo("must be an integer");
            assertThat(Validate.isInteger("5").errorMessage()).isEqualTo("must be an integer");
        }

        @Test
        void isFloatNormalizesToDouble() {
            assertThat(Validate.isFloat(1.5).value()).isEqualTo(1.5);
            assertThat(Validate.isFloat(1.5f).value()).isEqualTo(1.5);
            assertThat(Validate.isFloat(new BigDecimal("2.25")).value()).isEqualTo(2.25);
            assertThat(Validate.isFloat(1).errorMessage()).isEqualTo("must be a float");
        }

        @Test
        void isBoolean() {
            assertThat(Validate.isBoolean(true).isOk()).isTrue();
            assertThat(Validate.isBoolean("true").errorMessage()).isEqualTo("must be a boolean");
        }

        @Test
        void isList() {
            assertThat(Validate.isList(List.of(1)).isOk()).isTrue();
            assertThat(Validate.isList(Map.of()).errorMessage()).isEqualTo("must be a list");
        }

        @Test
        void isDate() {
            assertThat(Validate.isDate(null).isOk()).isTrue();
            assertThat(Validate.isDate(LocalDate.of(2024, 1, 1)).isOk()).isTrue();
            assertThat(Validate.isDate("2024-01-01").errorMessage()).isEqualTo("must be a Date");
        }

        @Test
        void isUuid() {
            String uuid = UUID.randomUUID().toString();

            assertThat(Validate.isUuid(uuid).value()).isEqualTo(uuid);
            assertThat(Validate.isUuid(UUID.fromString(uuid)).value()).isEqualTo(uuid);
            assertThat(Validate.isUuid("not-a-uuid").errorMessage()).isEqualTo("must be a UUID");
            assertThat(Validate.isUuid("x" + uuid).isError()).isTrue();
            assertThat(Validate.isUuid(null).isError()).isTrue();
        }

        @Test
        void isNonemptyString() {
            assertThat(Validate.isNonemptyString(null).errorMessage()).isEqualTo("is required");
            assertThat(Validate.isNonemptyString("").errorMessage()).isEqualTo("is required");
            assertThat(Validate.isNonemptyString(3).errorMessage()).isEqualTo("must be a string");
            assertThat(Validate.isNonemptyString(" ").isOk()).isTrue();
        }

        @ParameterizedTest
        @ValueSource(strings = {"", " ", "\t\n"})
        void notBlankRejectsBlank(String blank) {
            assertThat(Validate.notBlank(blank).errorMessage()).isEqualTo("must not be blank");
        }

        @Test
        void notBlankAcceptsText() {
            assertThat(Validate.notBlank(" a ").value()).isEqualTo(" a ");
            assertThat(Validate.notBlank(null).errorMessage()).isEqualTo("must be a string");
        }
    }

    @Nested
    @DisplayName("Checks with arguments")
    class WithArguments {

        @Test
        void minLength() {
            assertThat(Validate.minLength("abc", List.of(3L)).isOk()).isTrue();
            assertThat(Validate.minLength("ab", List.of(3L)).errorMessage()).isEqualTo("must be at least 3 characters");
            assertThat(Validate.minLength(List.of(1), List.of(2)).errorMessage())
                    .isEqualTo("must have at least 2 elements");
            assertThat(Validate.minLength(null, List.of(3L)).isOk()).isTrue();
            assertThat(Validate.minLength(5, List.of(3L)).isError()).isTrue();
        }

        @Test
        void maxLength() {
            assertThat(Validate.maxLength("abc", List.of(3L)).isOk()).isTrue();
            assertThat(Validate.maxLength("abcd", List.of(3L)).errorMessage()).isEqualTo("must be at most 3 characters");
        }

        @Test
        void minAndMaxCompareAcrossNumberTypes() {
            assertThat(Validate.min(5L, List.of(5)).isOk()).isTrue();
            assertThat(Validate.min(4.9, List.of(5)).errorMessage()).isEqualTo("must be greater than or equal to 5");
            assertThat(Validate.max(5.5, List.of(5L)).errorMessage()).isEqualTo("must be less than or equal to 5");
            assertThat(Validate.max("5", List.of(5L)).errorMessage()).isEqualTo("must be a number");
            assertThat(Validate.min(null, List.of(5L)).isOk()).isTrue();
        }

        @ParameterizedTest
        @ValueSource(doubles = {Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY})
        void minAndMaxRejectNonFiniteValues(double value) {
            assertThat(Validate.min(value, List.of(0L)).errorMessage()).isEqualTo("must be a number");
            assertThat(Validate.max(value, List.of(10L)).errorMessage()).isEqualTo("must be a number");
        }

        @Test
        void minAndMaxRejectNonFiniteFloats() {
            assertThat(Validate.min(Float.NaN, List.of(0L)).errorMessage()).isEqualTo("must be a number");
            assertThat(Validate.max(Float.POSITIVE_INFINITY, List.of(10L)).errorMessage())
                    .isEqualTo("must be a number");
        }

        @Test
        void nonFiniteBoundIsADefect() {
            assertThatThrownBy(() -> Validate.min(1, List.of(Double.NaN)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("finite");
        }

        @Test
        void oneOfComparesIntegralsByValue() {
            assertThat(Validate.oneOf(2, List.of(1L, 2L)).value()).isEqualTo(2);
            assertThat(Validate.oneOf("c", List.of("a", "b")).errorMessage()).isEqualTo("must be one of [a, b]");
        }

        @Test
        void oneOfAllowsNullArgument() {
            assertThat(Validate.oneOf("a", Arrays.asList(null, "a")).isOk()).isTrue();
        }

        @Test
        void matchesIsFullMatch() {
            assertThat(Validate.matches("ab12", List.of("[a-z]+\\d+")).isOk()).isTrue();
            assertThat(Validate.matches("ab12x", List.of("[a-z]+\\d+")).errorMessage())
                    .isEqualTo("must match [a-z]+\\d+");
        }

        @Test
        void wrongArgumentsAreDefects() {
            assertThatThrownBy(() -> Validate.minLength("a", List.of())).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> Validate.min(1, List.of("x"))).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> Validate.matches("a", List.of("("))).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
