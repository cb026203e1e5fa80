/**
 * Hand-off from the resolver to the rendering layer and clean-up of its output.
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.texstyle.export.ConfigurationWriter}: resolved options as
 * JSON</li>
 * <li>{@link com.texstyle.export.PostProcessor}: crop and optimize rendered
 * artifacts</li>
 * <li>{@link com.texstyle.export.ExportConfig}: environment-driven
 * configuration</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.texstyle.export;
