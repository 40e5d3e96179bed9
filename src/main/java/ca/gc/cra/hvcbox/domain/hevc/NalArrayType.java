package ca.gc.cra.hvcbox.domain.hevc;

import java.util.Optional;

/**
 * Roles of the NAL unit arrays stored in an {@code hvcC} record, in wire order.
 *
 * @since 0.1.0
 */
public enum NalArrayType {
  /** Video parameter set. */
  VPS(32, "video_parameter_sets"),
  /** Sequence parameter set. */
  SPS(33, "sequence_parameter_sets"),
  /** Picture parameter set. */
  PPS(34, "picture_parameter_sets"),
  /** Prefix supplemental enhancement information. */
  SEI(39, "supplementary_enhancement_information");

  // array_completeness (1 bit) + reserved (1 bit) precede the 6-bit NAL unit type.
  private static final int NAL_TYPE_MASK = 0x3F;

  private final int id;
  private final String label;

  NalArrayType(int id, String label) {
    this.id = id;
    this.label = label;
  }

  /**
   * Returns the NAL unit type written in the array sub-header.
   *
   * @return role id
   */
  public int id() {
    return id;
  }

  /**
   * Returns the key used for this role in structural dumps.
   *
   * @return snake_case label
   */
  public String label() {
    return label;
  }

  /**
   * Resolves the role of an array sub-header byte.
   *
   * @param headerByte first byte of the array sub-header; only the low 6 bits are significant
   * @return matching role, or empty for NAL unit types this record does not keep
   */
  public static Optional<NalArrayType> fromId(int headerByte) {
    int type = headerByte & NAL_TYPE_MASK;
    for (NalArrayType role : values()) {
      if (role.id == type) {
        return Optional.of(role);
      }
    }
    return Optional.empty();
  }
}
