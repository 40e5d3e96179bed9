package ca.gc.cra.hvcbox.domain.hevc;

import ca.gc.cra.hvcbox.validation.Numbers;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Configuration descriptor for building an {@code hvc1} sample entry from scratch.
 *
 * <p>Each list holds raw NAL unit payloads for one role, in the order they should be written.</p>
 *
 * @param width coded width in pixels, {@code [0, 65535]}
 * @param height coded height in pixels, {@code [0, 65535]}
 * @param videoParameterSets VPS payloads; copied
 * @param sequenceParameterSets SPS payloads; copied
 * @param pictureParameterSets PPS payloads; copied
 * @param seiUnits SEI payloads; copied
 * @since 0.1.0
 */
public record HevcConfig(
    int width,
    int height,
    List<byte[]> videoParameterSets,
    List<byte[]> sequenceParameterSets,
    List<byte[]> pictureParameterSets,
    List<byte[]> seiUnits) {

  /**
   * Validates dimensions and copies every payload.
   */
  public HevcConfig {
    Numbers.requireUnsigned("width", width, 16);
    Numbers.requireUnsigned("height", height, 16);
    videoParameterSets = copy("videoParameterSets", videoParameterSets);
    sequenceParameterSets = copy("sequenceParameterSets", sequenceParameterSets);
    pictureParameterSets = copy("pictureParameterSets", pictureParameterSets);
    seiUnits = copy("seiUnits", seiUnits);
  }

  @Override
  public List<byte[]> videoParameterSets() {
    return copy("videoParameterSets", videoParameterSets);
  }

  @Override
  public List<byte[]> sequenceParameterSets() {
    return copy("sequenceParameterSets", sequenceParameterSets);
  }

  @Override
  public List<byte[]> pictureParameterSets() {
    return copy("pictureParameterSets", pictureParameterSets);
  }

  @Override
  public List<byte[]> seiUnits() {
    return copy("seiUnits", seiUnits);
  }

  /**
   * Returns the payloads configured for {@code role}.
   *
   * @param role NAL array role
   * @return unmodifiable list of payload copies
   */
  public List<byte[]> parameterSets(NalArrayType role) {
    List<byte[]> source = switch (role) {
      case VPS -> videoParameterSets;
      case SPS -> sequenceParameterSets;
      case PPS -> pictureParameterSets;
      case SEI -> seiUnits;
    };
    return copy(role.label(), source);
  }

  private static List<byte[]> copy(String name, List<byte[]> source) {
    if (source == null) {
      return List.of();
    }
    List<byte[]> out = new ArrayList<>(source.size());
    for (byte[] bytes : source) {
      out.add(Objects.requireNonNull(bytes, name + " element").clone());
    }
    return List.copyOf(out);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof HevcConfig that)) {
      return false;
    }
    return width == that.width
        && height == that.height
        && sameContent(videoParameterSets, that.videoParameterSets)
        && sameContent(sequenceParameterSets, that.sequenceParameterSets)
        && sameContent(pictureParameterSets, that.pictureParameterSets)
        && sameContent(seiUnits, that.seiUnits);
  }

  @Override
  public int hashCode() {
    int result = Integer.hashCode(width);
    result = 31 * result + Integer.hashCode(height);
    for (List<byte[]> list : List.of(videoParameterSets, sequenceParameterSets, pictureParameterSets, seiUnits)) {
      for (byte[] bytes : list) {
        result = 31 * result + Arrays.hashCode(bytes);
      }
    }
    return result;
  }

  @Override
  public String toString() {
    return "HevcConfig{"
        + "width=" + width
        + ", height=" + height
        + ", vps=" + videoParameterSets.size()
        + ", sps=" + sequenceParameterSets.size()
        + ", pps=" + pictureParameterSets.size()
        + ", sei=" + seiUnits.size()
        + '}';
  }

  private static boolean sameContent(List<byte[]> a, List<byte[]> b) {
    if (a.size() != b.size()) {
      return false;
    }
    for (int i = 0; i < a.size(); i++) {
      if (!Arrays.equals(a.get(i), b.get(i))) {
        return false;
      }
    }
    return true;
  }
}
