package com.texstyle.export;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Rendered artifact formats that have post-processing tools.
 *
 * @since 1.0.0
 */
public enum ArtifactType {

    PDF("pdf"),
    PNG("png");

    private final String extension;

    ArtifactType(String extension) {
        this.extension = extension;
    }

    /**
     * Detect the artifact type from a file name, ignoring case.
     *
     * @param path artifact path
     * @return the type, or empty if the extension is not supported
     */
    public static Optional<ArtifactType> of(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return Optional.empty();
        }
        String ext = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        for (ArtifactType type : values()) {
            if (type.extension.equals(ext)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
