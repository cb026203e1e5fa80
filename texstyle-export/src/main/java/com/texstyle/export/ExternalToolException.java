package com.texstyle.export;

import com.texstyle.core.error.StyleException;

/** Thrown when an external tool started but failed, timed out or was interrupted. */
public final class ExternalToolException extends StyleException {

    private static final long serialVersionUID = 1L;

    private final String executable;

    public ExternalToolException(String executable, String message) {
        super(message);
        this.executable = executable;
    }

    public ExternalToolException(String executable, String message, Throwable cause) {
        super(message, cause);
        this.executable = executable;
    }

    public String executable() {
        return executable;
    }
}
