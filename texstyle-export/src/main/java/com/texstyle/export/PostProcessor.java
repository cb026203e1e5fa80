package com.texstyle.export;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Crops and optimizes a rendered artifact in place with external tools.
 *
 * <h3>Tool selection</h3>
 * <ul>
 * <li>PDF: {@code pdfcrop}, then {@code pdfsizeopt}</li>
 * <li>PNG: {@code mogrify -trim}, then {@code optipng}</li>
 * </ul>
 *
 * <p>
 * Other file types, and paths that are not regular files, are left untouched. A tool
 * missing from the {@code PATH} is logged as a warning and skipped; every other tool
 * failure propagates.
 * </p>
 *
 * @since 1.0.0
 */
public class PostProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(PostProcessor.class);

    private final ExportConfig config;
    private final ToolRunner runner;

    public PostProcessor(ExportConfig config) {
        this(config, new ProcessToolRunner());
    }

    /**
     * @param config post-processing configuration; must not be {@code null}
     * @param runner process launcher; must not be {@code null}
     */
    public PostProcessor(ExportConfig config, ToolRunner runner) {
        this.config = Objects.requireNonNull(config, "ExportConfig must not be null");
        this.runner = Objects.requireNonNull(runner, "ToolRunner must not be null");
    }

    /**
     * Process an artifact with the crop/optimize flags from the configuration.
     *
     * @param artifact rendered file
     * @return tools that ran successfully, in order
     */
    public List<ExternalTool> process(Path artifact) {
        return process(artifact, config.isCrop(), config.isOptimize());
    }

    /**
     * Process an artifact.
     *
     * @param artifact rendered file; must not be {@code null}
     * @param crop     run the crop tool
     * @param optimize run the optimize tool
     * @return tools that ran successfully, in order
     * @throws ExternalToolException if a tool fails for a reason other than being absent
     */
    public List<ExternalTool> process(Path artifact, boolean crop, boolean optimize) {
        Objects.requireNonNull(artifact, "Artifact path must not be null");
        if (!Files.isRegularFile(artifact)) {
            LOG.debug("{} is not a regular file, nothing to post-process", artifact);
            return Collections.emptyList();
        }
        Optional<ArtifactType> type = ArtifactType.of(artifact);
        if (type.isEmpty()) {
            LOG.debug("No post-processing tools for {}", artifact);
            return Collections.emptyList();
        }

        List<ExternalTool> ran = new ArrayList<>(2);
        if (crop) {
            runTool(ExternalTool.forArtifact(type.get(), ExternalTool.Role.CROP), artifact, ran);
        }
        if (optimize) {
            runTool(ExternalTool.forArtifact(type.get(), ExternalTool.Role.OPTIMIZE), artifact, ran);
        }
        return Collections.unmodifiableList(ran);
    }

    private void runTool(ExternalTool tool, Path artifact, List<ExternalTool> ran) {
        try {
            runner.run(tool.command(artifact), config.getToolTimeout());
            ran.add(tool);
            LOG.info("Ran {} on {}", tool.getExecutable(), artifact);
        } catch (ExternalToolUnavailableException e) {
            LOG.warn(e.getMessage());
        }
    }
}
