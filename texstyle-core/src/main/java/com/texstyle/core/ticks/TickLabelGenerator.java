package com.texstyle.core.ticks;

import com.texstyle.core.error.InvalidTickCountException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Evenly spaced ticks with exact fractional labels for typeset axes.
 *
 * <p>
 * The interval {@code [start/divisor, stop/divisor]} is rounded to the configured
 * number of decimal digits, converted to exact fractions and split into
 * {@code count - 1} equal steps. Labels are LaTeX math strings:
 * </p>
 * <ul>
 * <li>no symbol, or zero: the fraction itself, {@code $-3/4$}</li>
 * <li>integer multiples: {@code $\pi$}, {@code $-\pi$}, {@code $2\pi$}</li>
 * <li>unit numerators: {@code $\pi/2$}, {@code $-\pi/2$}</li>
 * <li>otherwise: {@code $3\pi/4$}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class TickLabelGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(TickLabelGenerator.class);

    private TickLabelGenerator() {
        // utility class
    }

    public static TickSet ticks(double start, double stop) {
        return ticks(start, stop, TickOptions.defaults());
    }

    /**
     * @throws InvalidTickCountException if {@code count < 2}
     */
    public static TickSet ticks(double start, double stop, int count) {
        return ticks(start, stop, TickOptions.builder().count(count).build());
    }

    /**
     * Generate ticks over an interval.
     *
     * @param start   first tick, in plot units
     * @param stop    last tick, in plot units
     * @param options tick parameters; must not be {@code null}
     * @return positions in plot units and their labels
     * @throws IllegalArgumentException if {@code start} or {@code stop} is not finite, or
     *                                  is not finite once divided by the divisor
     */
    public static TickSet ticks(double start, double stop, TickOptions options) {
        Objects.requireNonNull(options, "TickOptions must not be null");
        if (!Double.isFinite(start) || !Double.isFinite(stop)) {
            throw new IllegalArgumentException("Interval bounds must be finite, got: [" + start + ", " + stop + "]");
        }

        int count = options.getCount();
        double divisor = options.getDivisor();
        String symbol = options.getSymbol().orElse(null);

        double scaledStart = start / divisor;
        double scaledStop = stop / divisor;
        if (!Double.isFinite(scaledStart) || !Double.isFinite(scaledStop)) {
            throw new IllegalArgumentException("Interval [" + start + ", " + stop
                    + "] overflows when divided by " + divisor);
        }

        Fraction first = round(scaledStart, options.getDigits());
        Fraction last = round(scaledStop, options.getDigits());
        Fraction step = last.subtract(first).divide(count - 1);
        LOG.trace("Ticks over [{}, {}] in {} steps of {}", first, last, count - 1, step);

        List<Double> positions = new ArrayList<>(count);
        List<String> labels = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Fraction f = first.add(step.multiply(i));
            positions.add(divisor * f.doubleValue());
            labels.add("$" + label(f, symbol) + "$");
        }
        return new TickSet(positions, labels);
    }

    /**
     * Label body (without math delimiters) for a value in units of {@code symbol}.
     *
     * @param f      tick value
     * @param symbol unit symbol, or {@code null} for plain numbers
     * @return the label
     */
    static String label(Fraction f, String symbol) {
        if (symbol == null || f.signum() == 0) {
            return f.toString();
        }
        BigInteger numerator = f.getNumerator();
        if (f.isInteger()) {
            if (numerator.equals(BigInteger.ONE)) {
                return symbol;
            }
            if (numerator.equals(BigInteger.ONE.negate())) {
                return "-" + symbol;
            }
            return numerator + symbol;
        }
        if (numerator.abs().equals(BigInteger.ONE)) {
            return (f.signum() > 0 ? "" : "-") + symbol + "/" + f.getDenominator();
        }
        return numerator + symbol + "/" + f.getDenominator();
    }

    // Half-even on the exact binary value of the double.
    private static Fraction round(double value, int digits) {
        return Fraction.of(new BigDecimal(value).setScale(digits, RoundingMode.HALF_EVEN));
    }
}
