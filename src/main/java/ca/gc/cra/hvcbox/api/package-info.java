/**
 * CLI entry points for inspecting and building {@code hvc1} boxes.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging, and invokes
 * application services.</p>
 * <p><strong>Errors:</strong> Every failure maps to an {@link ca.gc.cra.hvcbox.api.ExitCode} and an ERROR log line;
 * commands never throw.</p>
 */
package ca.gc.cra.hvcbox.api;
