/**
 * Byte-stream primitives shared by box decoders and encoders.
 * <p><strong>Role:</strong> Wraps seekable channels and output streams with big-endian scalar access,
 * position capture, bounded skipping, and byte counting.</p>
 * <p><strong>Concurrency:</strong> Not thread-safe; callers serialize access to a shared stream.</p>
 * <p><strong>Errors:</strong> Short reads surface as {@link java.io.EOFException}; other failures propagate
 * unchanged from the underlying channel.</p>
 */
package ca.gc.cra.hvcbox.domain.io;
