package ca.gc.cra.hvcbox.domain.io;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * <strong>What:</strong> Big-endian reader over a seekable byte channel used by box decoders.
 * <p><strong>Why:</strong> Box decoders need position capture and skip-to-offset in addition to plain reads.</p>
 * <p><strong>Role:</strong> Domain I/O primitive consumed by {@code read} operations of every box.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one decode call owns the cursor for its duration.</p>
 * <p><strong>Performance:</strong> Reuses an 8-byte scratch buffer for scalar reads.</p>
 *
 * @since 0.1.0
 */
public final class BoxInput implements Closeable {
  private final SeekableByteChannel channel;
  private final ByteBuffer scratch = ByteBuffer.allocate(Long.BYTES);

  /**
   * Wraps an existing channel. Closing this input closes the channel.
   *
   * @param channel positioned channel to read from; never {@code null}
   */
  public BoxInput(SeekableByteChannel channel) {
    this.channel = Objects.requireNonNull(channel, "channel");
  }

  /**
   * Creates an input over an in-memory copy of {@code bytes}.
   *
   * @param bytes source bytes; copied
   * @return input positioned at offset 0
   */
  public static BoxInput wrap(byte[] bytes) {
    return new BoxInput(new ByteArrayChannel(bytes));
  }

  /**
   * Opens a read-only file channel.
   *
   * @param path file to read
   * @return input positioned at offset 0
   * @throws IOException if the file cannot be opened
   */
  public static BoxInput open(Path path) throws IOException {
    return new BoxInput(Files.newByteChannel(path, StandardOpenOption.READ));
  }

  public long position() throws IOException {
    return channel.position();
  }

  public long size() throws IOException {
    return channel.size();
  }

  /**
   * Returns the offset of the first header byte of the box whose header was just consumed.
   *
   * @param headerSize number of header bytes already read for the current box
   * @return absolute start offset of the box
   * @throws IOException if the channel position cannot be queried
   */
  public long boxStart(long headerSize) throws IOException {
    return channel.position() - headerSize;
  }

  /**
   * Moves the cursor to {@code offset} regardless of where the previous decoder stopped.
   *
   * @param offset absolute target offset, usually box start plus declared box size
   * @throws EOFException if {@code offset} lies beyond the end of the stream
   * @throws IOException if seeking fails
   */
  public void skipTo(long offset) throws IOException {
    if (offset < 0) {
      throw new IOException("Negative seek offset: " + offset);
    }
    long size = channel.size();
    if (offset > size) {
      throw new EOFException("Seek to " + offset + " past end of stream (" + size + " bytes)");
    }
    channel.position(offset);
  }

  /**
   * Advances the cursor by {@code count} bytes.
   *
   * @param count bytes to skip
   * @throws IOException if the target lies past the end of the stream
   */
  public void skip(long count) throws IOException {
    skipTo(channel.position() + count);
  }

  public int readU8() throws IOException {
    return fill(Byte.BYTES).get() & 0xFF;
  }

  public int readU16() throws IOException {
    return fill(Short.BYTES).getShort() & 0xFFFF;
  }

  public short readI16() throws IOException {
    return fill(Short.BYTES).getShort();
  }

  public long readU32() throws IOException {
    return fill(Integer.BYTES).getInt() & 0xFFFF_FFFFL;
  }

  public long readU64() throws IOException {
    return fill(Long.BYTES).getLong();
  }

  /**
   * Reads exactly {@code length} bytes.
   *
   * @param length number of bytes to read
   * @return newly allocated array holding the bytes
   * @throws EOFException if the stream ends before {@code length} bytes were read
   * @throws IOException if reading fails
   */
  public byte[] readFully(int length) throws IOException {
    byte[] out = new byte[length];
    readFully(ByteBuffer.wrap(out));
    return out;
  }

  private ByteBuffer fill(int length) throws IOException {
    scratch.clear().limit(length);
    readFully(scratch);
    scratch.flip();
    return scratch;
  }

  private void readFully(ByteBuffer target) throws IOException {
    int wanted = target.remaining();
    while (target.hasRemaining()) {
      if (channel.read(target) < 0) {
        throw new EOFException(
            "Unexpected end of stream: needed " + wanted + " bytes, got " + (wanted - target.remaining()));
      }
    }
  }

  @Override
  public void close() throws IOException {
    channel.close();
  }
}
