package io.structor.core.library;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.structor.core.model.StepResult;
import java.math.BigInteger;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

/** Tests for {@link Convert}. */
class ConvertTest {

    @Nested
    @DisplayName("Scalars")
    class Scalars {

        @Test
        void toStringValue() {
            assertThat(Convert.toStringValue(null).value()).isEqualTo("");
            assertThat(Convert.toStringValue(42L).value()).isEqualTo("42");
            assertThat(Convert.toStringValue(true).value()).isEqualTo("true");
            assertThat(Convert.toStringValue(TimeUnit.SECONDS).value()).isEqualTo("SECONDS");
            assertThat(Convert.toStringValue(List.of()).errorMessage()).isEqualTo("must be a string");
        }

        @Test
        void toStringOrNullKeepsNull() {
            assertThat(Convert.toStringOrNull(null)).isEqualTo(StepResult.ok(null));
            assertThat(Convert.toStringOrNull(7).value()).isEqualTo("7");
        }

        @Test
        void toInteger() {
            assertThat(Convert.toInteger(null).value()).isEqualTo(0L);
            assertThat(Convert.toInteger("").value()).isEqualTo(0L);
            assertThat(Convert.toInteger("-17").value()).isEqualTo(-17L);
            assertThat(Convert.toInteger(3).value()).isEqualTo(3L);
            assertThat(Convert.toInteger("99999999999999999999").value())
                    .isEqualTo(new BigInteger("99999999999999999999"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"abc", "1.5", "1e3", " 1"})
        void toIntegerRejectsNonIntegralStrings(String input) {
            assertThat(Convert.toInteger(input).errorMessage()).isEqualTo("must be an integer");
        }

        @Test
        void toIntegerOrNullKeepsNull() {
            assertThat(Convert.toIntegerOrNull(null).value()).isNull();
            assertThat(Convert.toIntegerOrNull("").value()).isEqualTo(0L);
        }

        @Test
        void toFloat() {
            assertThat(Convert.toFloat(null).value()).isEqualTo(0.0);
            assertThat(Convert.toFloat("2.5").value()).isEqualTo(2.5);
            assertThat(Convert.toFloat(4).value()).isEqualTo(4.0);
            assertThat(Convert.toFloat("1e3").value()).isEqualTo(1000.0);
            assertThat(Convert.toFloat("NaN").errorMessage()).isEqualTo("must be a float");
            assertThat(Convert.toFloat("x").errorMessage()).isEqualTo("must be a float");
            assertThat(Convert.toFloatOrNull(null).value()).isNull();
        }

        @ParameterizedTest
        @CsvSource({"true, true", "false, false", "'', false"})
        void toBooleanFromStrings(String input, boolean expected) {
            assertThat(Convert.toBoolean(input).value()).isEqualTo(expected);
        }

        @Test
        void toBooleanFromNumbersAndNull() {
            assertThat(Convert.toBoolean(1).value()).isEqualTo(true);
            assertThat(Convert.toBoolean(0L).value()).isEqualTo(false);
            assertThat(Convert.toBoolean(null).value()).isEqualTo(false);
            assertThat(Convert.toBoolean(2).errorMessage()).isEqualTo("must be a boolean");
            assertThat(Convert.toBoolean("yes").errorMessage()).isEqualTo("must be a boolean");
            assertThat(Convert.toBooleanOrNull(null).value()).isNull();
        }

        @Test
        void toDate() {
            assertThat(Convert.toDate("2024-01-31").value()).isEqualTo(LocalDate.of(2024, 1, 31));
            assertThat(Convert.toDate(null).value()).isNull();
            assertThat(Convert.toDate("2024-02-30").errorMessage()).isEqualTo("must be a Date");
            assertThat(Convert.toDate(20240131).errorMessage()).isEqualTo("must be a Date");
        }
    }

    @Nested
    @DisplayName("Lists and enums")
    class ListsAndEnums {

        @Test
        void nilToList() {
            assertThat(Convert.nilToList(null).value()).isEqualTo(List.of());
            assertThat(Convert.nilToList(List.of(1)).value()).isEqualTo(List.of(1));
            assertThat(Convert.nilToList("a").errorMessage()).isEqualTo("must be a list");
        }

        @ParameterizedTest
        @CsvSource({
            "fooBar, FOO_BAR",
            "HTTPServer, HTTP_SERVER",
            "foo-bar, FOO_BAR",
            "version2Beta, VERSION2_BETA",
            "ALREADY_SNAKE, ALREADY_SNAKE",
            "paid, PAID"
        })
        void upperSnake(String input, String expected) {
            assertThat(Convert.upperSnake(input)).isEqualTo(expected);
        }

        @Test
        void toEnumString() {
            assertThat(Convert.toEnumString("inProgress").value()).isEqualTo("IN_PROGRESS");
            assertThat(Convert.toEnumString(TimeUnit.MILLISECONDS).value()).isEqualTo("MILLISECONDS");
            assertThat(Convert.toEnumString("").value()).isNull();
            assertThat(Convert.toEnumString(null).value()).isNull();
            assertThat(Convert.toEnumString(5).errorMessage()).isEqualTo("must be a string");
        }

        @Test
        void toEnumWithEnumClass() {
            List<Object> args = List.of(TimeUnit.class);

            assertThat(Convert.toEnum("seconds", args).value()).isEqualTo(TimeUnit.SECONDS);
            assertThat(Convert.toEnum(TimeUnit.HOURS, args).value()).isEqualTo(TimeUnit.HOURS);
            assertThat(Convert.toEnum("fortnights", args).errorMessage()).startsWith("must be one of [NANOSECONDS");
        }

        @Test
        void toEnumWithAllowedNames() {
            List<Object> args = List.of("PENDING", "PAID");

            assertThat(Convert.toEnum("paid", args).value()).isEqualTo("PAID");
            assertThat(Convert.toEnum("lost", args).errorMessage()).isEqualTo("must be one of [PENDING, PAID]");
            assertThat(Convert.toEnum(null, args).value()).isNull();
        }

        @Test
        void toEnumWithoutArgumentsIsADefect() {
            assertThatThrownBy(() -> Convert.toEnum("x", List.of())).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
