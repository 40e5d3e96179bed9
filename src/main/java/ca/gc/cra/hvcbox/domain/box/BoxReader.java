package ca.gc.cra.hvcbox.domain.box;

import ca.gc.cra.hvcbox.domain.io.BoxInput;
import java.io.IOException;

/**
 * Decodes a box whose header has already been consumed.
 *
 * <p>Implementations capture the box start, decode the fields they know, and finish by skipping to
 * {@code start + declaredSize} so that the caller stays aligned whatever trailing data the box carries.</p>
 *
 * @param <T> decoded box type
 * @since 0.1.0
 */
@FunctionalInterface
public interface BoxReader<T extends Mp4Box> {
  /**
   * Decodes the payload of a box.
   *
   * @param in input positioned immediately after the box header
   * @param header header that was just read for this box
   * @return decoded box
   * @throws MalformedBoxException if the payload is structurally invalid
   * @throws IOException if reading or seeking fails
   */
  T read(BoxInput in, BoxHeader header) throws IOException;
}
