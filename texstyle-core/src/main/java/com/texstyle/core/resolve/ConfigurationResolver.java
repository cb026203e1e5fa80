package com.texstyle.core.resolve;

import com.texstyle.core.config.StyleKeys;
import com.texstyle.core.config.StyleRegistry;
import com.texstyle.core.error.InvalidOptionValueException;
import com.texstyle.core.error.InvalidSquareIndexException;
import com.texstyle.core.model.Fragment;
import com.texstyle.core.model.FragmentKey;
import com.texstyle.core.model.ResolvedConfiguration;
import com.texstyle.core.model.StyleRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Expands a {@link StyleRequest} into a flat {@link ResolvedConfiguration}.
 *
 * <h3>Precedence</h3>
 * <ol>
 * <li>Family fragments, in request order: {@code family.common} first, then
 * {@code family.value}. Later writes win, except for the preamble, which is
 * appended to.</li>
 * <li>Renderer options named directly in the request override any fragment.</li>
 * <li>Meta keys are applied last: typeset fragment, wide size, square size, then
 * the preamble suffix.</li>
 * </ol>
 *
 * <p>
 * Weed keys are removed before the result is returned. Resolution either returns a
 * complete configuration or throws; nothing partial escapes.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Stateless apart from the immutable registry; one instance may serve any number of
 * threads.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigurationResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationResolver.class);

    private final StyleRegistry registry;

    /**
     * @param registry fragment registry; must not be {@code null}
     */
    public ConfigurationResolver(StyleRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "StyleRegistry must not be null");
    }

    /**
     * Resolver backed by {@link StyleRegistry#builtin()}.
     *
     * @return new resolver
     */
    public static ConfigurationResolver withBuiltinRegistry() {
        return new ConfigurationResolver(StyleRegistry.builtin());
    }

    /**
     * Resolve a plain map, keeping its iteration order.
     *
     * @param request request entries
     * @return resolved configuration
     * @see #resolve(StyleRequest)
     */
    public ResolvedConfiguration resolve(Map<String, ?> request) {
        return resolve(StyleRequest.of(request));
    }

    /**
     * Resolve a request against the registry.
     *
     * @param request the request; must not be {@code null}
     * @return fully expanded renderer options
     * @throws InvalidOptionValueException if a {@code family.value} is not registered, or
     *                                     the figure size to square is malformed
     * @throws InvalidSquareIndexException if the square meta key is not 0 or 1
     */
    public ResolvedConfiguration resolve(StyleRequest request) {
        Objects.requireNonNull(request, "StyleRequest must not be null");

        Map<String, Object> options = new LinkedHashMap<>();
        Map<String, Object> overrides = new LinkedHashMap<>();

        for (Map.Entry<String, Object> entry : request.getEntries().entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();

            if (StyleKeys.isMetaKey(key)) {
                continue;
            }
            if (registry.isRendererOption(key)) {
                overrides.put(key, value);
                continue;
            }

            registry.lookup(FragmentKey.common(key)).ifPresent(common -> merge(options, common));

            FragmentKey fragmentKey = FragmentKey.of(key, value);
            Fragment fragment = registry.lookup(fragmentKey)
                    .orElseThrow(() -> new InvalidOptionValueException(key, value));
            merge(options, fragment);
        }

        if (!overrides.isEmpty()) {
            LOG.debug("Applying {} renderer option override(s): {}", overrides.size(), overrides.keySet());
            options.putAll(overrides);
        }

        if (isTruthy(request.get(StyleKeys.TEX))) {
            merge(options, registry.typesetFragment());
        }

        if (isTruthy(request.get(StyleKeys.WIDE))
                && options.containsKey(StyleKeys.FIGURE_SIZE)
                && options.containsKey(StyleKeys.WIDE_FIGURE_SIZE)) {
            options.put(StyleKeys.FIGURE_SIZE, options.get(StyleKeys.WIDE_FIGURE_SIZE));
        }

        Optional<Object> square = request.get(StyleKeys.SQUARE);
        if (square.isPresent()) {
            applySquare(options, squareIndex(square.get()));
        }

        applyPreamble(options, request.get(StyleKeys.TEX_PREAMBLE));

        StyleKeys.WEED_KEYS.forEach(options::remove);

        return ResolvedConfiguration.of(options);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    // Last write wins, except the preamble, which fragments append to.
    private static void merge(Map<String, Object> options, Fragment fragment) {
        LOG.debug("Merging fragment [{}] ({} option(s))", fragment.getName(), fragment.size());
        fragment.getOptions().forEach((option, value) -> {
            if (StyleKeys.PREAMBLE.equals(option) && options.containsKey(option)) {
                options.put(option, options.get(option).toString() + value);
            } else {
                options.put(option, value);
            }
        });
    }

    private static int squareIndex(Object value) {
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (d == 0.0) {
                return 0;
            }
            if (d == 1.0) {
                return 1;
            }
        }
        throw new InvalidSquareIndexException(StyleKeys.SQUARE, value);
    }

    private static void applySquare(Map<String, Object> options, int index) {
        Object size = options.get(StyleKeys.FIGURE_SIZE);
        if (size == null) {
            LOG.debug("No {} to square, skipping", StyleKeys.FIGURE_SIZE);
            return;
        }
        if (!(size instanceof List<?> pair) || pair.size() != 2) {
            throw new InvalidOptionValueException(StyleKeys.FIGURE_SIZE, size,
                    "'" + StyleKeys.FIGURE_SIZE + "' must be a two-element list to square it, got: " + size);
        }
        Object side = pair.get(index);
        options.put(StyleKeys.FIGURE_SIZE, List.of(side, side));
    }

    private static void applyPreamble(Map<String, Object> options, Optional<Object> extra) {
        if (extra.isEmpty()) {
            return;
        }
        Object accumulated = options.get(StyleKeys.PREAMBLE);
        String preamble = (accumulated != null ? accumulated.toString() : "") + extra.get();
        options.put(StyleKeys.PREAMBLE, preamble);
    }

    static boolean isTruthy(Optional<Object> value) {
        return value.isPresent() && isTruthy(value.get());
    }

    static boolean isTruthy(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0;
        }
        if (value instanceof CharSequence s) {
            return s.length() > 0;
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        return value != null;
    }
}
