package com.texstyle.export;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * External executables run over rendered artifacts. Each one either crops or
 * optimizes one artifact type in place.
 *
 * @since 1.0.0
 */
public enum ExternalTool {

    PDFCROP(ArtifactType.PDF, Role.CROP, "pdfcrop", List.of("--pdfversion", "none"), true),
    PDFSIZEOPT(ArtifactType.PDF, Role.OPTIMIZE, "pdfsizeopt",
            List.of("--quiet", "--do-optimize-images=no"), true),
    MOGRIFY(ArtifactType.PNG, Role.CROP, "mogrify", List.of("-trim"), false),
    OPTIPNG(ArtifactType.PNG, Role.OPTIMIZE, "optipng", List.of("-clobber", "-quiet"), false);

    /** What a tool does to the artifact. */
    public enum Role {
        CROP,
        OPTIMIZE
    }

    private final ArtifactType artifactType;
    private final Role role;
    private final String executable;
    private final List<String> flags;
    private final boolean separateOutput;

    ExternalTool(ArtifactType artifactType, Role role, String executable, List<String> flags,
            boolean separateOutput) {
        this.artifactType = artifactType;
        this.role = role;
        this.executable = executable;
        this.flags = flags;
        this.separateOutput = separateOutput;
    }

    public ArtifactType getArtifactType() {
        return artifactType;
    }

    public Role getRole() {
        return role;
    }

    public String getExecutable() {
        return executable;
    }

    /**
     * Command line that rewrites {@code artifact} in place.
     *
     * @param artifact file to process
     * @return executable followed by its arguments
     */
    public List<String> command(Path artifact) {
        String file = artifact.toString();
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.addAll(flags);
        command.add(file);
        if (separateOutput) {
            command.add(file);
        }
        return List.copyOf(command);
    }

    /**
     * @param type artifact type
     * @param role crop or optimize
     * @return the tool for that combination
     */
    public static ExternalTool forArtifact(ArtifactType type, Role role) {
        for (ExternalTool tool : values()) {
            if (tool.artifactType == type && tool.role == role) {
                return tool;
            }
        }
        throw new IllegalArgumentException("No " + role + " tool for " + type);
    }
}
