package com.texstyle.core.error;

/** Thrown when the square-layout meta key holds anything other than index 0 or 1. */
public final class InvalidSquareIndexException extends StyleException {

    private static final long serialVersionUID = 1L;

    private final transient Object value;

    public InvalidSquareIndexException(String key, Object value) {
        super("'" + key + "' must be 0 or 1, got: " + value);
        this.value = value;
    }

    public Object value() {
        return value;
    }
}
