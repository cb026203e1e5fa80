package com.texstyle.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Top-level POJO for the registry YAML.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * options:
 *   - font.family
 *   - font.size
 * fragments:
 *   texstyle.doc.common:
 *     axes.linewidth: 0.5
 *   texstyle.doc.aps:
 *     figure.figsize: [3.4166666666666665, 2.1116174185981786]
 * </pre>
 *
 * <p>
 * {@code options} lists the renderer options a request may set directly.
 * Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class RegistryConfig {

    private List<String> options = new ArrayList<>();

    private Map<String, Map<String, Object>> fragments = new LinkedHashMap<>();

    /**
     * @return unmodifiable list of renderer option names
     */
    public List<String> getOptions() {
        return Collections.unmodifiableList(options);
    }

    /**
     * Set the renderer options (used by SnakeYAML during deserialization).
     *
     * @param options renderer option names
     */
    public void setOptions(List<String> options) {
        this.options = options != null ? new ArrayList<>(options) : new ArrayList<>();
    }

    /**
     * @return unmodifiable, ordered map of fragment name to options
     */
    public Map<String, Map<String, Object>> getFragments() {
        return Collections.unmodifiableMap(fragments);
    }

    /**
     * Set the fragments (used by SnakeYAML during deserialization).
     *
     * @param fragments fragment name to options
     */
    public void setFragments(Map<String, Map<String, Object>> fragments) {
        this.fragments = fragments != null ? new LinkedHashMap<>(fragments) : new LinkedHashMap<>();
    }

    /**
     * Validate names and values of every option and fragment.
     *
     * <p>
     * Collects all errors and throws a single exception if anything is invalid.
     * </p>
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        for (int i = 0; i < options.size(); i++) {
            String option = options.get(i);
            if (option == null || option.isBlank()) {
                errors.add("Renderer option at index " + i + " is blank");
            }
        }

        fragments.forEach((name, body) -> {
            if (name == null || name.isBlank()) {
                errors.add("Fragment name must not be blank");
                return;
            }
            if (body == null) {
                errors.add("Fragment '" + name + "' has no options");
                return;
            }
            body.forEach((option, value) -> {
                if (option == null || option.isBlank()) {
                    errors.add("Fragment '" + name + "' contains a blank option name");
                } else if (value == null) {
                    errors.add("Option '" + option + "' in fragment '" + name + "' has no value");
                }
            });
        });

        if (!fragments.containsKey(StyleKeys.TYPESET_FRAGMENT)) {
            errors.add("Typeset fragment '" + StyleKeys.TYPESET_FRAGMENT + "' is required");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Registry configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "RegistryConfig{options=" + options.size() + ", fragments=" + fragments.keySet() + '}';
    }
}
