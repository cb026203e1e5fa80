package com.texstyle.core.error;

/**
 * Thrown when a requested {@code family.value} combination has no registry fragment,
 * or when an option holds a value the resolver cannot work with.
 *
 * @since 1.0.0
 */
public final class InvalidOptionValueException extends StyleException {

    private static final long serialVersionUID = 1L;

    private final String key;
    private final transient Object value;

    public InvalidOptionValueException(String key, Object value) {
        this(key, value, "'" + key + "': '" + value + "' is an invalid option value");
    }

    public InvalidOptionValueException(String key, Object value, String message) {
        super(message);
        this.key = key;
        this.value = value;
    }

    /** The request key (family) or option name that was rejected. */
    public String key() {
        return key;
    }

    /** The rejected value. */
    public Object value() {
        return value;
    }
}
