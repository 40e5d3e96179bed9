package ca.gc.cra.hvcbox.domain.box;

/**
 * Four-character codes of the boxes handled by this codec.
 *
 * @since 0.1.0
 */
public enum BoxType {
  /** HEVC visual sample entry. */
  HVC1("hvc1"),
  /** HEVC decoder configuration record. */
  HVCC("hvcC");

  private final String fourcc;

  BoxType(String fourcc) {
    this.fourcc = fourcc;
  }

  public String fourcc() {
    return fourcc;
  }

  @Override
  public String toString() {
    return fourcc;
  }
}
