package ca.gc.cra.hvcbox.domain.box;

import java.io.IOException;

/**
 * Checked exception thrown when box bytes are readable but structurally invalid.
 * <p>Extends {@link IOException} so malformed data and stream failures abort a decode through the same path.</p>
 *
 * @since 0.1.0
 */
public final class MalformedBoxException extends IOException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public MalformedBoxException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause root cause
   */
  public MalformedBoxException(String msg, Throwable cause) { super(msg, cause); }
}
