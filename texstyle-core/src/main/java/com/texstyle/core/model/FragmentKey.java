package com.texstyle.core.model;

import java.util.Objects;

/**
 * Dotted registry key made of a family and a value, e.g. {@code texstyle.doc} and
 * {@code aps} for {@code texstyle.doc.aps}.
 *
 * <p>
 * The reserved value {@value #COMMON} names the fragment merged whenever its family
 * is referenced, regardless of the requested value.
 * </p>
 *
 * @since 1.0.0
 */
public final class FragmentKey {

    /** Reserved value for the fragment shared by every member of a family. */
    public static final String COMMON = "common";

    private final String family;
    private final String value;

    private FragmentKey(String family, String value) {
        this.family = family;
        this.value = value;
    }

    /**
     * @param family the request key, e.g. {@code texstyle.doc}; must not be blank
     * @param value  the requested value; rendered with {@link String#valueOf(Object)}
     * @return the key {@code family.value}
     * @throws NullPointerException     if either argument is {@code null}
     * @throws IllegalArgumentException if {@code family} is blank
     */
    public static FragmentKey of(String family, Object value) {
        Objects.requireNonNull(family, "Family must not be null");
        Objects.requireNonNull(value, "Value must not be null");
        if (family.isBlank()) {
            throw new IllegalArgumentException("Family must not be blank");
        }
        return new FragmentKey(family, String.valueOf(value));
    }

    /**
     * @param family the request key
     * @return the key {@code family.common}
     */
    public static FragmentKey common(String family) {
        return of(family, COMMON);
    }

    public boolean isCommon() {
        return COMMON.equals(value);
    }

    /** @return the registry name, {@code family.value} */
    public String name() {
        return family + '.' + value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FragmentKey that))
            return false;
        return family.equals(that.family) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(family, value);
    }

    @Override
    public String toString() {
        return name();
    }
}
