package com.texstyle.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A named, immutable block of low-level renderer options stored in the registry.
 *
 * <p>
 * Option order is preserved from the source data. List values are copied into
 * unmodifiable lists so a fragment can never be changed through a value it hands out.
 * </p>
 *
 * @since 1.0.0
 */
public final class Fragment {

    private final String name;
    private final Map<String, Object> options;

    private Fragment(String name, Map<String, Object> options) {
        this.name = name;
        this.options = options;
    }

    /**
     * Create a fragment.
     *
     * @param name    registry name, e.g. {@code texstyle.doc.aps}
     * @param options option name to value; keys and values must not be {@code null}
     * @return the fragment
     * @throws NullPointerException if {@code name}, {@code options} or any entry is
     *                              {@code null}
     */
    public static Fragment of(String name, Map<String, ?> options) {
        Objects.requireNonNull(name, "Fragment name must not be null");
        Objects.requireNonNull(options, "Fragment options must not be null");

        Map<String, Object> copy = new LinkedHashMap<>();
        options.forEach((key, value) -> {
            Objects.requireNonNull(key, "Option name in fragment '" + name + "' must not be null");
            Objects.requireNonNull(value,
                    "Option '" + key + "' in fragment '" + name + "' must not be null");
            copy.put(key, Values.freeze(value));
        });
        return new Fragment(name, Collections.unmodifiableMap(copy));
    }

    public String getName() {
        return name;
    }

    /**
     * @return unmodifiable, insertion-ordered view of the options
     */
    public Map<String, Object> getOptions() {
        return options;
    }

    public Optional<Object> get(String option) {
        return Optional.ofNullable(options.get(option));
    }

    public int size() {
        return options.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Fragment that))
            return false;
        return name.equals(that.name) && options.equals(that.options);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, options);
    }

    @Override
    public String toString() {
        return "Fragment{" + name + '=' + options + '}';
    }
}
