package ca.gc.cra.hvcbox.domain.box;

import ca.gc.cra.hvcbox.domain.io.BoxOutput;
import java.io.IOException;
import java.util.Map;

/**
 * <strong>What:</strong> Contract shared by every box this codec can encode.
 * <p><strong>Why:</strong> Gives callers a uniform way to size, write, and describe boxes without knowing the
 * concrete kind.</p>
 * <p><strong>Role:</strong> Encode-side seam; decoding is exposed through {@link BoxReader} so that decoded values
 * stay immutable.</p>
 * <p><strong>Thread-safety:</strong> Implementations are immutable values.</p>
 *
 * @since 0.1.0
 * @see BoxReader
 */
public interface Mp4Box {
  /**
   * Returns the four-character type written in this box's header.
   *
   * @return box type
   */
  BoxType boxType();

  /**
   * Computes the serialized size from current field values, header included.
   *
   * @return total number of bytes {@link #write(BoxOutput)} produces
   */
  long boxSize();

  /**
   * Writes header and payload.
   *
   * @param out destination
   * @return number of bytes written, always equal to {@link #boxSize()}
   * @throws IOException if writing fails
   */
  long write(BoxOutput out) throws IOException;

  /**
   * Returns an ordered key/value dump of every field, nested boxes included.
   *
   * <p>Values are {@link Number}, {@link Boolean}, {@link String}, {@code byte[]}, nested {@link Map}s, or
   * {@link java.util.List}s of those.</p>
   *
   * @return structural description of this box
   */
  Map<String, Object> describe();

  /**
   * Returns a one-line human-readable summary of the most salient fields.
   *
   * @return summary text
   */
  String summary();
}
