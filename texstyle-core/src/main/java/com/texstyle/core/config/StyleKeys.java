package com.texstyle.core.config;

import java.util.Set;

/**
 * Fixed key names understood by the resolver.
 *
 * <p>
 * Meta keys steer post-processing and are never merged as option data. Weed keys may
 * appear inside registry fragments but are stripped from every resolved configuration.
 * </p>
 *
 * @since 1.0.0
 */
public final class StyleKeys {

    /** Namespace shared by every family and meta key. */
    public static final String PREFIX = "texstyle";

    /** Meta key: merge the typeset fragment when truthy. */
    public static final String TEX = PREFIX + ".tex";

    /** Meta key: swap in the wide figure size when truthy. */
    public static final String WIDE = PREFIX + ".wide";

    /** Meta key: index (0 or 1) of the size component used for a square figure. */
    public static final String SQUARE = PREFIX + ".square";

    /** Meta key: literal text appended to the typeset preamble. */
    public static final String TEX_PREAMBLE = PREFIX + ".tex.preamble";

    /** Registry name of the fragment that turns typeset rendering on. */
    public static final String TYPESET_FRAGMENT = TEX;

    /** Renderer option holding the primary figure size. */
    public static final String FIGURE_SIZE = "figure.figsize";

    /** Registry-only option holding the alternate wide figure size. */
    public static final String WIDE_FIGURE_SIZE = "figure.widefigsize";

    /** Renderer option holding the typeset preamble. */
    public static final String PREAMBLE = "text.latex.preamble";

    public static final Set<String> META_KEYS = Set.of(TEX, WIDE, SQUARE, TEX_PREAMBLE);

    public static final Set<String> WEED_KEYS = Set.of(WIDE_FIGURE_SIZE);

    private StyleKeys() {
        // constants holder
    }

    public static boolean isMetaKey(String key) {
        return META_KEYS.contains(key);
    }
}
