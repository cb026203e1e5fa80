/**
 * Value types shared by the registry and the resolver.
 *
 * <ul>
 * <li>{@link com.texstyle.core.model.Fragment}: named block of renderer options</li>
 * <li>{@link com.texstyle.core.model.FragmentKey}: {@code family.value} registry
 * key</li>
 * <li>{@link com.texstyle.core.model.StyleRequest}: ordered caller intents</li>
 * <li>{@link com.texstyle.core.model.ResolvedConfiguration}: expanded renderer
 * options</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.texstyle.core.model;
