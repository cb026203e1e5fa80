package com.texstyle.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered set of style intents supplied by a caller.
 *
 * <p>
 * Keys are either a family ({@code texstyle.doc}), a meta key
 * ({@code texstyle.wide}) or a renderer option used as an override
 * ({@code font.family}). Entry order is significant: fragments are merged in the
 * order their families appear.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #builder()} or {@link #of(Map)}. Neither accepts {@code null} keys or
 * values.
 * </p>
 *
 * @since 1.0.0
 */
public final class StyleRequest {

    private static final StyleRequest EMPTY = new StyleRequest(Collections.emptyMap());

    private final Map<String, Object> entries;

    private StyleRequest(Map<String, Object> entries) {
        this.entries = entries;
    }

    public static StyleRequest empty() {
        return EMPTY;
    }

    /**
     * Copy a map into a request, keeping its iteration order.
     *
     * @param entries request entries; must not be {@code null}
     * @return new request
     * @throws NullPointerException if the map, a key or a value is {@code null}
     */
    public static StyleRequest of(Map<String, ?> entries) {
        Objects.requireNonNull(entries, "Request entries must not be null");
        Builder builder = builder();
        entries.forEach(builder::put);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return unmodifiable, ordered view of all entries
     */
    public Map<String, Object> getEntries() {
        return entries;
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof StyleRequest that))
            return false;
        return entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "StyleRequest" + entries;
    }

    /**
     * Fluent builder for {@link StyleRequest}. Putting an existing key again replaces its
     * value but keeps its original position. List values are copied.
     */
    public static final class Builder {

        private final Map<String, Object> entries = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String key, Object value) {
            Objects.requireNonNull(key, "Request key must not be null");
            Objects.requireNonNull(value, "Value for request key '" + key + "' must not be null");
            entries.put(key, Values.freeze(value));
            return this;
        }

        public StyleRequest build() {
            return new StyleRequest(Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
        }
    }
}
