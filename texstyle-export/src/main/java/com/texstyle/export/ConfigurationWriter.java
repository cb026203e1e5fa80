package com.texstyle.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.texstyle.core.model.ResolvedConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes a {@link ResolvedConfiguration} as a JSON object for the host rendering layer.
 *
 * @since 1.0.0
 */
public class ConfigurationWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationWriter.class);

    private final ObjectMapper mapper;

    public ConfigurationWriter() {
        this.mapper = new ObjectMapper();
        mapper.configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    /**
     * @param configuration resolved options; must not be {@code null}
     * @return pretty-printed JSON
     * @throws IllegalStateException if an option value cannot be serialized
     */
    public String toJson(ResolvedConfiguration configuration) {
        Objects.requireNonNull(configuration, "ResolvedConfiguration must not be null");
        try {
            return mapper.writeValueAsString(configuration);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Write the configuration to a file, replacing any existing content.
     *
     * @param configuration resolved options; must not be {@code null}
     * @param target        destination file; must not be {@code null}
     * @throws UncheckedIOException if the file cannot be written
     */
    public void write(ResolvedConfiguration configuration, Path target) {
        Objects.requireNonNull(configuration, "ResolvedConfiguration must not be null");
        Objects.requireNonNull(target, "Target path must not be null");
        try {
            mapper.writeValue(target.toFile(), configuration);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write configuration to " + target, e);
        }
        LOG.info("Wrote {} option(s) to {}", configuration.size(), target);
    }
}
