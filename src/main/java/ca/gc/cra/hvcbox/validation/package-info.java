/**
 * <strong>Purpose:</strong> Validation helpers used by box constructors, CLI parsing, and configuration loading.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct logging; failures surface via {@link IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.hvcbox.validation;
