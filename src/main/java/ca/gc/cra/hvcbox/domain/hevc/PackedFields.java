package ca.gc.cra.hvcbox.domain.hevc;

import ca.gc.cra.hvcbox.validation.Numbers;

/**
 * <strong>What:</strong> Reserved-bit constants and pack/unpack helpers for the bit-packed bytes of {@code hvcC}.
 * <p><strong>Why:</strong> Some decoders inspect reserved bits, so encoders must write them exactly; decoders mask
 * them away.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * <p>Packing validates the field width; unpacking masks and never rejects.</p>
 *
 * @since 0.1.0
 */
public final class PackedFields {
  /** configurationVersion. */
  public static final int CONFIGURATION_VERSION = 0x01;
  /** Length of the general profile/tier/level block. */
  public static final int GENERAL_CONFIGURATION_LENGTH = 12;
  /** reserved (4 bits, all ones) + min_spatial_segmentation_idc (12 bits, zero). */
  public static final int MIN_SPATIAL_SEGMENTATION = 0xF000;
  /** reserved (6 bits, all ones) + parallelismType (2 bits, zero). */
  public static final int PARALLELISM_TYPE = 0xFC;
  /** avgFrameRate; zero means unspecified. */
  public static final int AVG_FRAME_RATE = 0x0000;

  static final int CHROMA_FORMAT_RESERVED = 0xFC;
  static final int CHROMA_FORMAT_MASK = 0x03;
  static final int BIT_DEPTH_RESERVED = 0xF8;
  static final int BIT_DEPTH_MASK = 0x07;
  static final int TEMPORAL_LAYERS_SHIFT = 3;
  static final int TEMPORAL_LAYERS_MASK = 0x07;
  static final int TEMPORAL_ID_NESTED_BIT = 0x04;
  // lengthSizeMinusOne = 3, i.e. 4-byte sample NAL length prefixes.
  static final int LENGTH_SIZE_MINUS_ONE = 0x03;

  private PackedFields() {
    // Utility
  }

  /** Packs {@code chroma_format_idc} behind its six reserved one-bits. */
  public static int packChromaFormat(int chromaIdc) {
    return CHROMA_FORMAT_RESERVED | Numbers.requireUnsigned("chroma_idc", chromaIdc, 2);
  }

  /** Extracts {@code chroma_format_idc}, ignoring the reserved bits. */
  public static int unpackChromaFormat(int packed) {
    return packed & CHROMA_FORMAT_MASK;
  }

  /**
   * Packs a {@code bit_depth_*_minus8} value behind its five reserved one-bits.
   *
   * @param name field name used in diagnostics
   * @param bitDepthMinus8 value in {@code [0, 7]}
   * @return packed byte
   */
  public static int packBitDepth(String name, int bitDepthMinus8) {
    return BIT_DEPTH_RESERVED | Numbers.requireUnsigned(name, bitDepthMinus8, 3);
  }

  /** Extracts a {@code bit_depth_*_minus8} value, ignoring the reserved bits. */
  public static int unpackBitDepth(int packed) {
    return packed & BIT_DEPTH_MASK;
  }

  /**
   * Packs numTemporalLayers (bits 5..3), temporalIdNested (bit 2) and lengthSizeMinusOne (bits 1..0).
   *
   * @param numTemporalLayers value in {@code [0, 7]}
   * @param temporalIdNested temporal id nesting flag
   * @return packed byte
   */
  public static int packTemporalLayers(int numTemporalLayers, boolean temporalIdNested) {
    int layers = Numbers.requireUnsigned("num_temporal_layers", numTemporalLayers, 3);
    return (layers << TEMPORAL_LAYERS_SHIFT)
        | (temporalIdNested ? TEMPORAL_ID_NESTED_BIT : 0)
        | LENGTH_SIZE_MINUS_ONE;
  }

  /** Extracts {@code numTemporalLayers} from bits 5..3. */
  public static int unpackNumTemporalLayers(int packed) {
    return (packed >> TEMPORAL_LAYERS_SHIFT) & TEMPORAL_LAYERS_MASK;
  }

  /** Extracts {@code temporalIdNested} from bit 2. */
  public static boolean unpackTemporalIdNested(int packed) {
    return (packed & TEMPORAL_ID_NESTED_BIT) != 0;
  }
}
