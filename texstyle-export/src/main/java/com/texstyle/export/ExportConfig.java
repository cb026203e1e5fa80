package com.texstyle.export;

import java.time.Duration;

/**
 * Typed, immutable configuration for artifact post-processing.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so a build
 * script can switch cropping or optimization on without code changes.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} in applications, or the {@link Builder} in tests.
 * The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ExportConfig {

    public static final String ENV_CROP = "TEXSTYLE_CROP";
    public static final String ENV_OPTIMIZE = "TEXSTYLE_OPTIMIZE";
    public static final String ENV_TOOL_TIMEOUT_SECONDS = "TEXSTYLE_TOOL_TIMEOUT_SECONDS";

    private final boolean crop;
    private final boolean optimize;
    private final Duration toolTimeout;

    private ExportConfig(Builder b) {
        this.crop = b.crop;
        this.optimize = b.optimize;
        this.toolTimeout = b.toolTimeout;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build an {@link ExportConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ExportConfig fromEnvironment() {
        try {
            return new Builder()
                    .crop(Boolean.parseBoolean(env(ENV_CROP, "false")))
                    .optimize(Boolean.parseBoolean(env(ENV_OPTIMIZE, "false")))
                    .toolTimeout(Duration.ofSeconds(Long.parseLong(env(ENV_TOOL_TIMEOUT_SECONDS, "120"))))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public boolean isCrop() {
        return crop;
    }

    public boolean isOptimize() {
        return optimize;
    }

    public Duration getToolTimeout() {
        return toolTimeout;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ExportConfig}. Cropping and optimization are off by
     * default; the tool timeout defaults to two minutes.
     */
    public static class Builder {
        private boolean crop;
        private boolean optimize;
        private Duration toolTimeout = Duration.ofMinutes(2);

        public Builder crop(boolean v) {
            this.crop = v;
            return this;
        }

        public Builder optimize(boolean v) {
            this.optimize = v;
            return this;
        }

        public Builder toolTimeout(Duration v) {
            this.toolTimeout = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ExportConfig}
         * @throws IllegalArgumentException if the timeout is missing, zero or negative
         */
        public ExportConfig build() {
            if (toolTimeout == null || toolTimeout.isZero() || toolTimeout.isNegative()) {
                throw new IllegalArgumentException("toolTimeout must be positive, got: " + toolTimeout);
            }
            return new ExportConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "ExportConfig{" +
                "crop=" + crop +
                ", optimize=" + optimize +
                ", toolTimeout=" + toolTimeout +
                '}';
    }
}
