package com.texstyle.export;

import com.texstyle.core.error.StyleException;

/**
 * Thrown by a {@link ToolRunner} when an executable cannot be started, typically
 * because it is not on the {@code PATH}. {@link PostProcessor} downgrades it to a
 * warning.
 */
public final class ExternalToolUnavailableException extends StyleException {

    private static final long serialVersionUID = 1L;

    private final String executable;

    public ExternalToolUnavailableException(String executable, Throwable cause) {
        super(executable + " not in path, skipping", cause);
        this.executable = executable;
    }

    public String executable() {
        return executable;
    }
}
