/**
 * Configuration loading for building sample entries from YAML descriptors.
 * <p><strong>Errors:</strong> Unreadable files raise {@link java.io.IOException}; structural problems raise
 * {@link IllegalArgumentException} with the offending key.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.hvcbox.config;
