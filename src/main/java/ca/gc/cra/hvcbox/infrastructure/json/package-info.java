/**
 * JSON rendering of box structural dumps backed by Jackson Core.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.hvcbox.infrastructure.json.BoxJsonWriter} holds only a
 * thread-safe {@link com.fasterxml.jackson.core.JsonFactory}; instances may be shared.</p>
 */
package ca.gc.cra.hvcbox.infrastructure.json;
