package ca.gc.cra.hvcbox.domain.hevc;

import ca.gc.cra.hvcbox.domain.box.BoxHeader;
import ca.gc.cra.hvcbox.domain.box.BoxReader;
import ca.gc.cra.hvcbox.domain.box.BoxType;
import ca.gc.cra.hvcbox.domain.box.FixedPointU16;
import ca.gc.cra.hvcbox.domain.box.MalformedBoxException;
import ca.gc.cra.hvcbox.domain.box.Mp4Box;
import ca.gc.cra.hvcbox.domain.io.BoxInput;
import ca.gc.cra.hvcbox.domain.io.BoxOutput;
import ca.gc.cra.hvcbox.validation.Numbers;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> HEVC visual sample entry ({@code hvc1}, ISO/IEC 14496-12 8.5.2 and 14496-15 8.4.1).
 * <p><strong>Why:</strong> Describes the coded dimensions of a track's samples and carries the decoder
 * configuration record.</p>
 * <p><strong>Role:</strong> Entry point of the codec; owns exactly one {@link HevcConfigurationBox}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param dataReferenceIndex index into the data reference table
 * @param width coded width in pixels
 * @param height coded height in pixels
 * @param horizontalResolution horizontal resolution in pixels per inch
 * @param verticalResolution vertical resolution in pixels per inch
 * @param frameCount frames per sample
 * @param depth colour depth, {@code 0x0018} for colour without alpha
 * @param hvcC decoder configuration record
 * @since 0.1.0
 */
public record Hvc1SampleEntry(
    int dataReferenceIndex,
    int width,
    int height,
    FixedPointU16 horizontalResolution,
    FixedPointU16 verticalResolution,
    int frameCount,
    int depth,
    HevcConfigurationBox hvcC) implements Mp4Box {

  /** Decoder for use after the caller has read an {@code hvc1} header. */
  public static final BoxReader<Hvc1SampleEntry> READER = Hvc1SampleEntry::read;
  /** 72 dots per inch. */
  public static final FixedPointU16 DEFAULT_RESOLUTION = FixedPointU16.of(0x48);
  /** Colour images without alpha. */
  public static final int DEFAULT_DEPTH = 0x0018;
  public static final int DEFAULT_FRAME_COUNT = 1;

  // 6 reserved bytes + data_reference_index
  static final int SAMPLE_ENTRY_FIELDS_SIZE = 8;
  // pre_defined/reserved through the trailing pre_defined, see write()
  static final int VISUAL_FIELDS_SIZE = 70;

  private static final int COMPRESSOR_NAME_SIZE = 32;
  private static final short PRE_DEFINED = -1;

  /**
   * Validates the 16-bit fields.
   */
  public Hvc1SampleEntry {
    Numbers.requireUnsigned("data_reference_index", dataReferenceIndex, 16);
    Numbers.requireUnsigned("width", width, 16);
    Numbers.requireUnsigned("height", height, 16);
    Numbers.requireUnsigned("frame_count", frameCount, 16);
    Numbers.requireUnsigned("depth", depth, 16);
    Objects.requireNonNull(horizontalResolution, "horizontalResolution");
    Objects.requireNonNull(verticalResolution, "verticalResolution");
    Objects.requireNonNull(hvcC, "hvcC");
  }

  /**
   * Builds a sample entry from a configuration descriptor.
   *
   * <p>Uses data reference index 1, 72 dpi resolution, one frame per sample and 24-bit depth; every payload of
   * the descriptor becomes a {@link NalUnit} of the matching role, in input order.</p>
   *
   * @param config width, height and raw parameter sets
   * @return new sample entry
   */
  public static Hvc1SampleEntry fromConfig(HevcConfig config) {
    Objects.requireNonNull(config, "config");
    return new Hvc1SampleEntry(
        1,
        config.width(),
        config.height(),
        DEFAULT_RESOLUTION,
        DEFAULT_RESOLUTION,
        DEFAULT_FRAME_COUNT,
        DEFAULT_DEPTH,
        HevcConfigurationBox.fromConfig(config));
  }

  /**
   * Reads a complete {@code hvc1} box, header included, at the current position.
   *
   * @param in input positioned at the first header byte
   * @return decoded sample entry
   * @throws MalformedBoxException if the box at the cursor is not {@code hvc1} or its payload is malformed
   * @throws IOException if reading fails
   */
  public static Hvc1SampleEntry readBox(BoxInput in) throws IOException {
    long offset = in.position();
    BoxHeader header = BoxHeader.read(in);
    if (!header.is(BoxType.HVC1)) {
      throw new MalformedBoxException(
          "Expected '" + BoxType.HVC1 + "' box at offset " + offset + " but found '" + header.type() + "'");
    }
    return read(in, header);
  }

  /**
   * Decodes an {@code hvc1} payload and its nested {@code hvcC} box.
   *
   * @param in input positioned immediately after the {@code hvc1} header
   * @param header header that was just read
   * @return decoded sample entry
   * @throws MalformedBoxException if the box following the fixed fields is not {@code hvcC}
   * @throws IOException if reading fails
   */
  public static Hvc1SampleEntry read(BoxInput in, BoxHeader header) throws IOException {
    long start = in.boxStart(header.headerSize());

    in.readU32(); // reserved
    in.readU16(); // reserved
    int dataReferenceIndex = in.readU16();

    in.readU32(); // pre_defined, reserved
    in.readU64(); // pre_defined
    in.readU32(); // pre_defined
    int width = in.readU16();
    int height = in.readU16();
    FixedPointU16 horizontalResolution = FixedPointU16.ofRaw(in.readU32());
    FixedPointU16 verticalResolution = FixedPointU16.ofRaw(in.readU32());
    in.readU32(); // reserved
    int frameCount = in.readU16();
    in.skip(COMPRESSOR_NAME_SIZE);
    int depth = in.readU16();
    in.readI16(); // pre_defined

    long nestedOffset = in.position();
    BoxHeader nested = BoxHeader.read(in);
    if (!nested.is(BoxType.HVCC)) {
      throw new MalformedBoxException("Expected '" + BoxType.HVCC + "' box at offset " + nestedOffset
          + " inside '" + header.type() + "' but found '" + nested.type() + "'");
    }
    HevcConfigurationBox hvcC = HevcConfigurationBox.read(in, nested);

    in.skipTo(start + header.size());

    return new Hvc1SampleEntry(
        dataReferenceIndex,
        width,
        height,
        horizontalResolution,
        verticalResolution,
        frameCount,
        depth,
        hvcC);
  }

  @Override
  public BoxType boxType() {
    return BoxType.HVC1;
  }

  @Override
  public long boxSize() {
    return BoxHeader.HEADER_SIZE + SAMPLE_ENTRY_FIELDS_SIZE + VISUAL_FIELDS_SIZE + hvcC.boxSize();
  }

  @Override
  public long write(BoxOutput out) throws IOException {
    long start = out.count();
    BoxHeader.of(boxType().fourcc(), boxSize()).write(out);

    out.writeU32(0); // reserved
    out.writeU16(0); // reserved
    out.writeU16(dataReferenceIndex);

    out.writeU32(0); // pre_defined, reserved
    out.writeU64(0); // pre_defined
    out.writeU32(0); // pre_defined
    out.writeU16(width);
    out.writeU16(height);
    out.writeU32(horizontalResolution.raw());
    out.writeU32(verticalResolution.raw());
    out.writeU32(0); // reserved
    out.writeU16(frameCount);
    out.writeZeros(COMPRESSOR_NAME_SIZE);
    out.writeU16(depth);
    out.writeI16(PRE_DEFINED);

    hvcC.write(out);
    return out.count() - start;
  }

  @Override
  public Map<String, Object> describe() {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("type", boxType().fourcc());
    out.put("size", boxSize());
    out.put("data_reference_index", dataReferenceIndex);
    out.put("width", width);
    out.put("height", height);
    out.put("horizresolution", horizontalResolution.raw());
    out.put("vertresolution", verticalResolution.raw());
    out.put("frame_count", frameCount);
    out.put("depth", depth);
    out.put("hvcc", hvcC.describe());
    return out;
  }

  @Override
  public String summary() {
    return "data_reference_index=" + dataReferenceIndex
        + " width=" + width
        + " height=" + height
        + " frame_count=" + frameCount;
  }
}
