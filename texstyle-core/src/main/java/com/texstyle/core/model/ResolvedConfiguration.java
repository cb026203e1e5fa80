package com.texstyle.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Flat, fully expanded set of renderer options produced by the resolver.
 *
 * <p>
 * This is the only artifact handed to the rendering layer. It serializes to a plain
 * JSON object of option name to value.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Instances are immutable and may be shared freely.
 * </p>
 *
 * @since 1.0.0
 */
public final class ResolvedConfiguration {

    private final Map<String, Object> options;

    private ResolvedConfiguration(Map<String, Object> options) {
        this.options = options;
    }

    /**
     * @param options resolved options; copied with list values frozen, order preserved
     * @return immutable configuration
     * @throws NullPointerException if {@code options} is {@code null}
     */
    public static ResolvedConfiguration of(Map<String, ?> options) {
        Objects.requireNonNull(options, "Resolved options must not be null");
        return new ResolvedConfiguration(Values.freezeAll(options));
    }

    /**
     * @return unmodifiable, ordered map of option name to value
     */
    @JsonValue
    public Map<String, Object> asMap() {
        return options;
    }

    public Optional<Object> get(String option) {
        return Optional.ofNullable(options.get(option));
    }

    /**
     * Retrieve a string option.
     *
     * @param option option name
     * @return the value's string form, or empty if not set
     */
    public Optional<String> getString(String option) {
        Object raw = options.get(option);
        return raw == null ? Optional.empty() : Optional.of(raw.toString());
    }

    /**
     * Retrieve a two-component numeric option such as a figure size.
     *
     * @param option option name
     * @return the components, or empty if not set or not a list of numbers
     */
    public Optional<double[]> getPair(String option) {
        if (options.get(option) instanceof List<?> list
                && list.size() == 2
                && list.get(0) instanceof Number first
                && list.get(1) instanceof Number second) {
            return Optional.of(new double[] { first.doubleValue(), second.doubleValue() });
        }
        return Optional.empty();
    }

    public boolean contains(String option) {
        return options.containsKey(option);
    }

    public Set<String> optionNames() {
        return options.keySet();
    }

    public int size() {
        return options.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ResolvedConfiguration that))
            return false;
        return options.equals(that.options);
    }

    @Override
    public int hashCode() {
        return options.hashCode();
    }

    @Override
    public String toString() {
        return "ResolvedConfiguration" + options;
    }
}
