/**
 * Application services that run the box codecs against files on behalf of the CLI.
 *
 * @since 0.1.0
 */
package ca.gc.cra.hvcbox.application;
