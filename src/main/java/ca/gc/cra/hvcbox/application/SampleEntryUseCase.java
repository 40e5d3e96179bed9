package ca.gc.cra.hvcbox.application;

import ca.gc.cra.hvcbox.domain.hevc.HevcConfig;
import ca.gc.cra.hvcbox.domain.hevc.Hvc1SampleEntry;
import ca.gc.cra.hvcbox.domain.io.BoxInput;
import ca.gc.cra.hvcbox.domain.io.BoxOutput;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> File-level workflows around the {@code hvc1} codec.
 * <p><strong>Why:</strong> Keeps CLI commands free of stream plumbing.</p>
 * <p><strong>Role:</strong> Application service invoked by {@code inspect} and {@code build}.</p>
 * <p><strong>Thread-safety:</strong> Stateless; each call opens and closes its own file.</p>
 *
 * @since 0.1.0
 */
public final class SampleEntryUseCase {
  private static final Logger log = LoggerFactory.getLogger(SampleEntryUseCase.class);

  /**
   * Reads one {@code hvc1} box starting at {@code offset} of {@code file}.
   *
   * @param file file holding the box
   * @param offset byte offset of the box header
   * @return decoded sample entry
   * @throws ca.gc.cra.hvcbox.domain.box.MalformedBoxException if the bytes are not a valid {@code hvc1} box
   * @throws IOException if the file cannot be read
   */
  public Hvc1SampleEntry inspect(Path file, long offset) throws IOException {
    Objects.requireNonNull(file, "file");
    try (BoxInput in = BoxInput.open(file)) {
      in.skipTo(offset);
      Hvc1SampleEntry entry = Hvc1SampleEntry.readBox(in);
      log.debug("Decoded {} byte hvc1 box from {} at offset {}", entry.boxSize(), file, offset);
      return entry;
    }
  }

  /**
   * Builds an {@code hvc1} box from {@code config} and writes it to {@code file}, replacing any existing content.
   *
   * <p>The box is written to a sibling {@code .tmp} file first and moved into place, so a failed write leaves
   * {@code file} untouched and removes the temporary file.</p>
   *
   * @param config sample entry configuration
   * @param file destination file
   * @return number of bytes written
   * @throws IOException if the file cannot be written
   */
  public long build(HevcConfig config, Path file) throws IOException {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(file, "file");
    Hvc1SampleEntry entry = Hvc1SampleEntry.fromConfig(config);
    Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
    long written;
    try {
      try (BoxOutput out = new BoxOutput(new BufferedOutputStream(Files.newOutputStream(tmp,
          StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)))) {
        written = entry.write(out);
      }
      moveIntoPlace(tmp, file);
    } catch (IOException ex) {
      try {
        Files.deleteIfExists(tmp);
      } catch (IOException cleanup) {
        ex.addSuppressed(cleanup);
      }
      throw ex;
    }
    log.info("Wrote {} byte hvc1 box ({}x{}) to {}", written, entry.width(), entry.height(), file);
    return written;
  }

  private static void moveIntoPlace(Path tmp, Path file) throws IOException {
    try {
      Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      log.debug("Atomic move unsupported for {}; replacing non-atomically", file);
      Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
