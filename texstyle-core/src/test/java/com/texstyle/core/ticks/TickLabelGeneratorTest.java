package com.texstyle.core.ticks;

import com.texstyle.core.error.InvalidTickCountException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TickLabelGenerator}.
 */
class TickLabelGeneratorTest {

    private static final String PI = "\\pi";

    @Test
    @DisplayName("Should split the unit interval into quarters")
    void shouldSplitUnitInterval() {
        TickSet ticks = TickLabelGenerator.ticks(0, 1, 5);

        assertThat(ticks.getPositions()).containsExactly(0.0, 0.25, 0.5, 0.75, 1.0);
        assertThat(ticks.getLabels()).containsExactly("$0$", "$1/4$", "$1/2$", "$3/4$", "$1$");
    }

    @Test
    @DisplayName("Should default to ten ticks")
    void shouldDefaultToTenTicks() {
        TickSet ticks = TickLabelGenerator.ticks(0, 9);

        assertThat(ticks.size()).isEqualTo(10);
        assertThat(ticks.getLabels()).startsWith("$0$", "$1$").endsWith("$9$");
    }

    @Test
    @DisplayName("Should label multiples of pi with the symbol")
    void shouldLabelUnitMultiples() {
        TickSet ticks = TickLabelGenerator.ticks(-Math.PI, Math.PI, piOptions(3));

        assertThat(ticks.getLabels()).containsExactly("$-\\pi$", "$0$", "$\\pi$");
        assertThat(ticks.getPositions()).containsExactly(-Math.PI, 0.0, Math.PI);
    }

    @Test
    @DisplayName("Should label fractional multiples of pi")
    void shouldLabelFractionalMultiples() {
        TickSet ticks = TickLabelGenerator.ticks(-2 * Math.PI, 2 * Math.PI, piOptions(9));

        assertThat(ticks.getLabels()).containsExactly(
                "$-2\\pi$", "$-3\\pi/2$", "$-\\pi$", "$-\\pi/2$", "$0$",
                "$\\pi/2$", "$\\pi$", "$3\\pi/2$", "$2\\pi$");
        assertThat(ticks.getPositions().get(1)).isEqualTo(-1.5 * Math.PI);
    }

    @Test
    @DisplayName("Should label negative fractions without a symbol")
    void shouldLabelNegativeFractions() {
        TickSet ticks = TickLabelGenerator.ticks(-1, 0, 3);

        assertThat(ticks.getLabels()).containsExactly("$-1$", "$-1/2$", "$0$");
        assertThat(ticks.getPositions()).containsExactly(-1.0, -0.5, 0.0);
    }

    @Test
    @DisplayName("Should reduce fractions exactly")
    void shouldReduceExactly() {
        TickSet ticks = TickLabelGenerator.ticks(0, 0.6, 4);

        assertThat(ticks.getLabels()).containsExactly("$0$", "$1/5$", "$2/5$", "$3/5$");
        assertThat(ticks.getPositions()).containsExactly(0.0, 0.2, 0.4, 0.6);
    }

    @Test
    @DisplayName("Should round bounds to the requested digits")
    void shouldRoundBounds() {
        TickOptions options = TickOptions.builder().count(2).digits(2).build();

        TickSet ticks = TickLabelGenerator.ticks(0, 1.0 / 3.0, options);

        assertThat(ticks.getLabels()).containsExactly("$0$", "$33/100$");
        assertThat(ticks.getPositions()).containsExactly(0.0, 0.33);
    }

    @Test
    @DisplayName("Should handle descending intervals")
    void shouldHandleDescendingInterval() {
        TickSet ticks = TickLabelGenerator.ticks(1, -1, 3);

        assertThat(ticks.getLabels()).containsExactly("$1$", "$0$", "$-1$");
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 0, -3 })
    @DisplayName("Should reject fewer than two ticks")
    void shouldRejectSmallCounts(int count) {
        assertThatThrownBy(() -> TickLabelGenerator.ticks(0, 1, count))
                .isInstanceOf(InvalidTickCountException.class)
                .hasMessageContaining(">= 2");
    }

    @Test
    @DisplayName("Should reject a zero divisor")
    void shouldRejectZeroDivisor() {
        assertThatThrownBy(() -> TickOptions.builder().divisor(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("divisor");
    }

    @Test
    @DisplayName("Should reject non-finite bounds")
    void shouldRejectNonFiniteBounds() {
        assertThatThrownBy(() -> TickLabelGenerator.ticks(Double.NaN, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TickLabelGenerator.ticks(0, Double.POSITIVE_INFINITY))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject bounds that overflow when divided by the divisor")
    void shouldRejectOverflowingQuotient() {
        TickOptions options = TickOptions.builder().divisor(1e-10).build();

        assertThatThrownBy(() -> TickLabelGenerator.ticks(1e300, 2e300, options))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("overflows");
    }

    @Test
    @DisplayName("Label rules for symbolic divisors")
    void shouldFormatSymbolicLabels() {
        assertThat(TickLabelGenerator.label(Fraction.of(3, 4), PI)).isEqualTo("3\\pi/4");
        assertThat(TickLabelGenerator.label(Fraction.of(-3, 4), PI)).isEqualTo("-3\\pi/4");
        assertThat(TickLabelGenerator.label(Fraction.of(1, 3), PI)).isEqualTo("\\pi/3");
        assertThat(TickLabelGenerator.label(Fraction.of(-1, 3), PI)).isEqualTo("-\\pi/3");
        assertThat(TickLabelGenerator.label(Fraction.of(2, 6), PI))
                .isEqualTo(TickLabelGenerator.label(Fraction.of(1, 3), PI));
        assertThat(TickLabelGenerator.label(Fraction.of(-4), PI)).isEqualTo("-4\\pi");
        assertThat(TickLabelGenerator.label(Fraction.ZERO, PI)).isEqualTo("0");
        assertThat(TickLabelGenerator.label(Fraction.of(5, 2), null)).isEqualTo("5/2");
    }

    private static TickOptions piOptions(int count) {
        return TickOptions.builder().count(count).divisor(Math.PI).symbol(PI).build();
    }
}
