package ca.gc.cra.hvcbox.domain.io;

import java.io.Closeable;
import java.io.DataOutputStream;
import java.io.FilterOutputStream;
import java.io.Flushable;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * Big-endian writer used by box encoders; tracks the number of bytes written.
 * <p>Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class BoxOutput implements Closeable, Flushable {
  private static final int ZERO_CHUNK = 64;

  private final CountingOutputStream countingOut;
  private final DataOutputStream dataOut;

  /**
   * Wraps {@code out}; closing this output closes {@code out}.
   *
   * @param out destination stream; never {@code null}
   */
  public BoxOutput(OutputStream out) {
    this.countingOut = new CountingOutputStream(Objects.requireNonNull(out, "out"));
    this.dataOut = new DataOutputStream(countingOut);
  }

  /**
   * Returns the number of bytes written through this output.
   *
   * @return cumulative byte count
   */
  public long count() {
    return countingOut.getCount();
  }

  public void writeU8(int value) throws IOException {
    dataOut.writeByte(value);
  }

  public void writeU16(int value) throws IOException {
    dataOut.writeShort(value);
  }

  public void writeI16(short value) throws IOException {
    dataOut.writeShort(value);
  }

  public void writeU32(long value) throws IOException {
    dataOut.writeInt((int) value);
  }

  public void writeU64(long value) throws IOException {
    dataOut.writeLong(value);
  }

  public void write(byte[] bytes) throws IOException {
    dataOut.write(bytes, 0, bytes.length);
  }

  /**
   * Writes {@code count} zero bytes.
   *
   * @param count number of zero bytes
   * @throws IOException if writing fails
   */
  public void writeZeros(int count) throws IOException {
    byte[] zeros = new byte[Math.min(count, ZERO_CHUNK)];
    int remaining = count;
    while (remaining > 0) {
      int len = Math.min(remaining, zeros.length);
      dataOut.write(zeros, 0, len);
      remaining -= len;
    }
  }

  @Override
  public void flush() throws IOException {
    dataOut.flush();
  }

  @Override
  public void close() throws IOException {
    try {
      dataOut.flush();
    } finally {
      dataOut.close();
    }
  }

  private static final class CountingOutputStream extends FilterOutputStream {
    private long count;

    CountingOutputStream(OutputStream out) {
      super(out);
    }

    long getCount() {
      return count;
    }

    @Override
    public void write(int b) throws IOException {
      out.write(b);
      count++;
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
      out.write(b, off, len);
      count += len;
    }
  }
}
