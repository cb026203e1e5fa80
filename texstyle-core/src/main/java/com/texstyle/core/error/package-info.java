/**
 * Exception hierarchy for style resolution and tick generation.
 *
 * <p>
 * All exceptions extend {@link com.texstyle.core.error.StyleException} and are
 * unchecked. They are raised synchronously and never carry a partial result.
 * </p>
 *
 * @since 1.0.0
 */
package com.texstyle.core.error;
