/**
 * Fractional tick positions and labels for typeset axes.
 *
 * <p>
 * Entry point is {@link com.texstyle.core.ticks.TickLabelGenerator}. All arithmetic on
 * tick values is exact, through {@link com.texstyle.core.ticks.Fraction}.
 * </p>
 *
 * @since 1.0.0
 */
package com.texstyle.core.ticks;
