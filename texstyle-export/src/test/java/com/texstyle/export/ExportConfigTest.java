package com.texstyle.export;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ExportConfig}, {@link ArtifactType} and {@link ExternalTool}.
 */
class ExportConfigTest {

    @Test
    @DisplayName("Builder should apply defaults")
    void shouldApplyDefaults() {
        ExportConfig config = ExportConfig.builder().build();

        assertThat(config.isCrop()).isFalse();
        assertThat(config.isOptimize()).isFalse();
        assertThat(config.getToolTimeout()).isEqualTo(Duration.ofMinutes(2));
    }

    @Test
    @DisplayName("Builder should reject a non-positive timeout")
    void shouldRejectBadTimeout() {
        assertThatThrownBy(() -> ExportConfig.builder().toolTimeout(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("toolTimeout");
        assertThatThrownBy(() -> ExportConfig.builder().toolTimeout(null).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should detect artifact types by extension")
    void shouldDetectArtifactType() {
        assertThat(ArtifactType.of(Path.of("out/plot.pdf"))).contains(ArtifactType.PDF);
        assertThat(ArtifactType.of(Path.of("plot.Png"))).contains(ArtifactType.PNG);
        assertThat(ArtifactType.of(Path.of("plot.eps"))).isEmpty();
        assertThat(ArtifactType.of(Path.of("plot"))).isEmpty();
    }

    @Test
    @DisplayName("Should pair each artifact type with a crop and an optimize tool")
    void shouldSelectTools() {
        assertThat(ExternalTool.forArtifact(ArtifactType.PDF, ExternalTool.Role.CROP)).isEqualTo(ExternalTool.PDFCROP);
        assertThat(ExternalTool.forArtifact(ArtifactType.PNG, ExternalTool.Role.OPTIMIZE))
                .isEqualTo(ExternalTool.OPTIPNG);
        assertThat(ExternalTool.MOGRIFY.command(Path.of("a.png"))).containsExactly("mogrify", "-trim", "a.png");
    }
}
