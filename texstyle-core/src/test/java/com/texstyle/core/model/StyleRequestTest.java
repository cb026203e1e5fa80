package com.texstyle.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link StyleRequest} and {@link FragmentKey}.
 */
class StyleRequestTest {

    @Test
    @DisplayName("Should keep entry order")
    void shouldKeepOrder() {
        Map<String, Object> source = new LinkedHashMap<>();
        source.put("b", 1);
        source.put("a", 2);
        source.put("c", 3);

        StyleRequest request = StyleRequest.of(source);

        assertThat(request.getEntries().keySet()).containsExactly("b", "a", "c");
    }

    @Test
    @DisplayName("Should reject null keys and values")
    void shouldRejectNulls() {
        Map<String, Object> withNullValue = new HashMap<>();
        withNullValue.put("texstyle.doc", null);

        assertThatThrownBy(() -> StyleRequest.of(withNullValue))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("texstyle.doc");
        assertThatThrownBy(() -> StyleRequest.builder().put(null, "x"))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Should not be affected by later builder changes")
    void shouldSnapshotBuilder() {
        StyleRequest.Builder builder = StyleRequest.builder().put("texstyle.doc", "aps");
        StyleRequest request = builder.build();
        builder.put("texstyle.wide", true);

        assertThat(request.contains("texstyle.wide")).isFalse();
        assertThat(request.get("texstyle.doc")).contains("aps");
    }

    @Test
    @DisplayName("Should build dotted fragment names")
    void shouldBuildFragmentKeys() {
        assertThat(FragmentKey.of("texstyle.doc", "aps").name()).isEqualTo("texstyle.doc.aps");
        assertThat(FragmentKey.of("texstyle.square", 1).name()).isEqualTo("texstyle.square.1");
        assertThat(FragmentKey.common("texstyle.doc").isCommon()).isTrue();
        assertThat(FragmentKey.common("texstyle.doc")).isEqualTo(FragmentKey.of("texstyle.doc", "common"));
        assertThatThrownBy(() -> FragmentKey.of(" ", "aps"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
