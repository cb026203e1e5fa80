package com.texstyle.core.ticks;

import com.texstyle.core.error.InvalidTickCountException;

import java.util.Optional;

/**
 * Parameters for {@link TickLabelGenerator}.
 *
 * <p>
 * Bounds are divided by {@code divisor} before being rounded to {@code digits} decimal
 * places; labels then express tick values in units of {@code symbol}, e.g. a divisor of
 * {@code Math.PI} with symbol {@code \pi}.
 * </p>
 *
 * @since 1.0.0
 */
public final class TickOptions {

    public static final int DEFAULT_COUNT = 10;
    public static final double DEFAULT_DIVISOR = 1.0;
    public static final int DEFAULT_DIGITS = 5;

    private static final TickOptions DEFAULTS = builder().build();

    private final int count;
    private final double divisor;
    private final String symbol;
    private final int digits;

    private TickOptions(Builder b) {
        this.count = b.count;
        this.divisor = b.divisor;
        this.symbol = b.symbol;
        this.digits = b.digits;
    }

    public static TickOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getCount() {
        return count;
    }

    public double getDivisor() {
        return divisor;
    }

    public Optional<String> getSymbol() {
        return Optional.ofNullable(symbol);
    }

    public int getDigits() {
        return digits;
    }

    @Override
    public String toString() {
        return "TickOptions{" +
                "count=" + count +
                ", divisor=" + divisor +
                ", symbol='" + symbol + '\'' +
                ", digits=" + digits +
                '}';
    }

    /**
     * Fluent builder for {@link TickOptions}. Defaults: ten ticks, divisor 1, no symbol,
     * five digits.
     */
    public static final class Builder {
        private int count = DEFAULT_COUNT;
        private double divisor = DEFAULT_DIVISOR;
        private String symbol;
        private int digits = DEFAULT_DIGITS;

        private Builder() {
        }

        public Builder count(int v) {
            this.count = v;
            return this;
        }

        public Builder divisor(double v) {
            this.divisor = v;
            return this;
        }

        /**
         * @param v typeset symbol for one divisor unit, or {@code null} for plain numbers
         * @return this builder
         */
        public Builder symbol(String v) {
            this.symbol = v;
            return this;
        }

        public Builder digits(int v) {
            this.digits = v;
            return this;
        }

        /**
         * Build and validate the options.
         *
         * @return validated options
         * @throws InvalidTickCountException if {@code count < 2}
         * @throws IllegalArgumentException  if {@code divisor} is zero or not finite
         */
        public TickOptions build() {
            if (count < 2) {
                throw new InvalidTickCountException(count);
            }
            if (divisor == 0.0 || !Double.isFinite(divisor)) {
                throw new IllegalArgumentException("divisor must be finite and non-zero, got: " + divisor);
            }
            return new TickOptions(this);
        }
    }
}
