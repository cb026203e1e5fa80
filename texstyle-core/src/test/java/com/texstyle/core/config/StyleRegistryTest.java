package com.texstyle.core.config;

import com.texstyle.core.model.Fragment;
import com.texstyle.core.model.FragmentKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link StyleRegistry}.
 */
class StyleRegistryTest {

    @Test
    @DisplayName("Should build identical registries from identical data")
    void shouldBeDeterministic() {
        StyleRegistry first = RegistryLoader.fromClasspath("test-registry.yml");
        StyleRegistry second = RegistryLoader.fromClasspath("test-registry.yml");

        assertThat(first).isEqualTo(second);
        assertThat(first.hashCode()).isEqualTo(second.hashCode());
        for (String name : first.fragmentNames()) {
            assertThat(first.lookup(name)).isEqualTo(second.lookup(name));
        }
    }

    @Test
    @DisplayName("Should look up fragments by exact name only")
    void shouldLookUpByExactName() {
        StyleRegistry registry = RegistryLoader.fromClasspath("test-registry.yml");

        assertThat(registry.lookup("demo.doc.paper")).isPresent();
        assertThat(registry.lookup(FragmentKey.of("demo.doc", "paper"))).isPresent();
        assertThat(registry.lookup("demo.doc")).isEmpty();
        assertThat(registry.lookup("DEMO.DOC.PAPER")).isEmpty();
        assertThat(registry.lookup("demo.doc.paper ")).isEmpty();
    }

    @Test
    @DisplayName("Should expose immutable fragments")
    void shouldExposeImmutableFragments() {
        StyleRegistry registry = RegistryLoader.fromClasspath("test-registry.yml");
        Fragment paper = registry.lookup("demo.doc.paper").orElseThrow();

        assertThat(paper.getOptions().get("figure.figsize")).isEqualTo(List.of(4.0, 3.0));
        assertThatThrownBy(() -> paper.getOptions().put("font.size", 1))
                .isInstanceOf(UnsupportedOperationException.class);
        @SuppressWarnings("unchecked")
        List<Object> size = (List<Object>) paper.getOptions().get("figure.figsize");
        assertThatThrownBy(() -> size.set(0, 1.0))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should not be affected by later changes to its source config")
    void shouldCopySourceConfig() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text.usetex", true);
        Map<String, Map<String, Object>> fragments = new LinkedHashMap<>();
        fragments.put(StyleKeys.TYPESET_FRAGMENT, body);
        RegistryConfig config = new RegistryConfig();
        config.setFragments(fragments);

        StyleRegistry registry = StyleRegistry.of(config);
        body.put("text.usetex", false);

        assertThat(registry.typesetFragment().getOptions()).containsEntry("text.usetex", true);
    }

    @Test
    @DisplayName("Should collect every validation error")
    void shouldCollectValidationErrors() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(" ", 1);
        body.put("font.size", null);
        Map<String, Map<String, Object>> fragments = new LinkedHashMap<>();
        fragments.put("demo.doc.paper", body);
        RegistryConfig config = new RegistryConfig();
        config.setFragments(fragments);
        config.setOptions(List.of(""));

        assertThatThrownBy(() -> StyleRegistry.of(config))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Renderer option at index 0 is blank")
                .hasMessageContaining("blank option name")
                .hasMessageContaining("'font.size' in fragment 'demo.doc.paper' has no value")
                .hasMessageContaining("Typeset fragment");
    }

    @Test
    @DisplayName("Built-in registry is shared")
    void builtinShouldBeShared() {
        assertThat(StyleRegistry.builtin()).isSameAs(StyleRegistry.builtin());
        assertThat(StyleRegistry.builtin())
                .isEqualTo(RegistryLoader.fromClasspath(RegistryLoader.DEFAULT_RESOURCE));
    }
}
