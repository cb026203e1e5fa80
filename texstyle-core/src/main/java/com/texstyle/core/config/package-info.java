/**
 * Style registry data and loading.
 *
 * <p>
 * Fragments and the renderer option catalogue are defined in YAML and loaded by
 * {@link com.texstyle.core.config.RegistryLoader} into an immutable
 * {@link com.texstyle.core.config.StyleRegistry}. Validation runs right after parsing.
 * Fixed meta and weed keys live in {@link com.texstyle.core.config.StyleKeys}.
 * </p>
 *
 * @since 1.0.0
 */
package com.texstyle.core.config;
