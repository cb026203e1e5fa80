/**
 * Cascading resolution of style requests into renderer options.
 *
 * <p>
 * {@link com.texstyle.core.resolve.ConfigurationResolver} is the single entry point.
 * </p>
 *
 * @since 1.0.0
 */
package com.texstyle.core.resolve;
