package com.texstyle.core.config;

import com.texstyle.core.model.Fragment;
import com.texstyle.core.model.FragmentKey;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable table of named fragments plus the catalogue of renderer options.
 *
 * <p>
 * Lookups are exact string matches on the dotted fragment name. Two registries built
 * from the same data are {@linkplain #equals(Object) equal}.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Read-only after construction; safe to share between threads without locking.
 * </p>
 *
 * @since 1.0.0
 */
public final class StyleRegistry {

    private final Map<String, Fragment> fragments;
    private final Set<String> rendererOptions;

    private StyleRegistry(Map<String, Fragment> fragments, Set<String> rendererOptions) {
        this.fragments = fragments;
        this.rendererOptions = rendererOptions;
    }

    /**
     * Freeze a validated configuration into a registry.
     *
     * @param config registry data; must not be {@code null}
     * @return immutable registry
     * @throws IllegalStateException if {@code config} does not validate
     */
    public static StyleRegistry of(RegistryConfig config) {
        Objects.requireNonNull(config, "RegistryConfig must not be null");
        config.validate();

        Map<String, Fragment> fragments = new LinkedHashMap<>();
        config.getFragments().forEach((name, options) -> fragments.put(name, Fragment.of(name, options)));

        return new StyleRegistry(
                Collections.unmodifiableMap(fragments),
                Collections.unmodifiableSet(new LinkedHashSet<>(config.getOptions())));
    }

    /**
     * The registry bundled on the classpath, loaded on first use.
     *
     * @return shared built-in registry
     */
    public static StyleRegistry builtin() {
        return BuiltinHolder.INSTANCE;
    }

    public Optional<Fragment> lookup(String name) {
        return Optional.ofNullable(fragments.get(name));
    }

    public Optional<Fragment> lookup(FragmentKey key) {
        return lookup(key.name());
    }

    /**
     * @param key request key
     * @return {@code true} if {@code key} is a renderer option a request may set directly
     */
    public boolean isRendererOption(String key) {
        return rendererOptions.contains(key);
    }

    /**
     * @return the fragment merged when typeset rendering is requested
     */
    public Fragment typesetFragment() {
        return fragments.get(StyleKeys.TYPESET_FRAGMENT);
    }

    public Set<String> fragmentNames() {
        return fragments.keySet();
    }

    public Set<String> rendererOptions() {
        return rendererOptions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof StyleRegistry that))
            return false;
        return fragments.equals(that.fragments) && rendererOptions.equals(that.rendererOptions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fragments, rendererOptions);
    }

    @Override
    public String toString() {
        return "StyleRegistry{fragments=" + fragments.keySet()
                + ", rendererOptions=" + rendererOptions.size() + '}';
    }

    private static final class BuiltinHolder {
        private static final StyleRegistry INSTANCE = RegistryLoader.fromClasspath(RegistryLoader.DEFAULT_RESOURCE);
    }
}
