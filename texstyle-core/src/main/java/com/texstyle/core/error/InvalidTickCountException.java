package com.texstyle.core.error;

/** Thrown when fewer than two ticks are requested. */
public final class InvalidTickCountException extends StyleException {

    private static final long serialVersionUID = 1L;

    private final int count;

    public InvalidTickCountException(int count) {
        super("Tick count must be >= 2, got: " + count);
        this.count = count;
    }

    public int count() {
        return count;
    }
}
