package com.texstyle.core.error;

/**
 * Abstract base for all TeXStyle exceptions. Never thrown directly; use the concrete
 * subclasses.
 *
 * <p>
 * Every subclass carries the offending input so callers can report it without parsing
 * the message.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class StyleException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected StyleException(String message) {
        super(message);
    }

    protected StyleException(String message, Throwable cause) {
        super(message, cause);
    }
}
