package ca.gc.cra.hvcbox.domain.hevc;

import ca.gc.cra.hvcbox.domain.box.BoxHeader;
import ca.gc.cra.hvcbox.domain.box.BoxReader;
import ca.gc.cra.hvcbox.domain.box.BoxType;
import ca.gc.cra.hvcbox.domain.box.MalformedBoxException;
import ca.gc.cra.hvcbox.domain.box.Mp4Box;
import ca.gc.cra.hvcbox.domain.io.BoxInput;
import ca.gc.cra.hvcbox.domain.io.BoxOutput;
import ca.gc.cra.hvcbox.validation.Numbers;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> HEVC decoder configuration record ({@code hvcC}, ISO/IEC 14496-15 8.3.3).
 * <p><strong>Why:</strong> Carries the profile block, chroma and bit-depth parameters, and the parameter sets a
 * decoder needs before the first sample.</p>
 * <p><strong>Role:</strong> Nested box owned by {@link Hvc1SampleEntry}; owns four ordered NAL unit arrays.</p>
 * <p><strong>Thread-safety:</strong> Immutable value; lists and arrays are copied.</p>
 *
 * <p>Wire layout after the header: version, 12-byte general configuration, {@code 0xF000}, {@code 0xFC}, packed
 * chroma format, packed luma and chroma bit depths, average frame rate, packed temporal layer byte, total unit
 * count, then one {@code (type, u16 count, units...)} array per non-empty role in VPS, SPS, PPS, SEI order.</p>
 *
 * @param generalConfiguration profile/tier/level block, exactly 12 bytes, stored verbatim
 * @param numTemporalLayers {@code [0, 7]}
 * @param chromaIdc {@code [0, 3]}
 * @param bitDepthLumaMinus8 {@code [0, 7]}
 * @param bitDepthChromaMinus8 {@code [0, 7]}
 * @param temporalIdNested temporal id nesting flag
 * @param videoParameterSets VPS units in wire order
 * @param sequenceParameterSets SPS units in wire order
 * @param pictureParameterSets PPS units in wire order
 * @param seiUnits SEI units in wire order
 * @since 0.1.0
 */
public record HevcConfigurationBox(
    byte[] generalConfiguration,
    int numTemporalLayers,
    int chromaIdc,
    int bitDepthLumaMinus8,
    int bitDepthChromaMinus8,
    boolean temporalIdNested,
    List<NalUnit> videoParameterSets,
    List<NalUnit> sequenceParameterSets,
    List<NalUnit> pictureParameterSets,
    List<NalUnit> seiUnits) implements Mp4Box {

  /** Decoder for use after the caller has read an {@code hvcC} header. */
  public static final BoxReader<HevcConfigurationBox> READER = HevcConfigurationBox::read;
  /** Largest total unit count the 8-bit counter can express. */
  public static final int MAX_TOTAL_UNITS = 0xFF;

  // version(1) + general(12) + segmentation(2) + parallelism(1) + chroma(1) + depths(2) + frame rate(2)
  // + temporal layers(1) + total count(1)
  static final int FIXED_FIELDS_SIZE = 23;
  // type(1) + u16 count
  static final int ARRAY_HEADER_SIZE = 3;

  private static final Logger log = LoggerFactory.getLogger(HevcConfigurationBox.class);

  /**
   * Validates narrow fields and copies mutable inputs.
   */
  public HevcConfigurationBox {
    Objects.requireNonNull(generalConfiguration, "generalConfiguration");
    if (generalConfiguration.length != PackedFields.GENERAL_CONFIGURATION_LENGTH) {
      throw new IllegalArgumentException("general configuration must be "
          + PackedFields.GENERAL_CONFIGURATION_LENGTH + " bytes (was " + generalConfiguration.length + ")");
    }
    generalConfiguration = generalConfiguration.clone();
    Numbers.requireUnsigned("num_temporal_layers", numTemporalLayers, 3);
    Numbers.requireUnsigned("chroma_idc", chromaIdc, 2);
    Numbers.requireUnsigned("bit_depth_luma_minus8", bitDepthLumaMinus8, 3);
    Numbers.requireUnsigned("bit_depth_chroma_minus8", bitDepthChromaMinus8, 3);
    videoParameterSets = copyUnits(NalArrayType.VPS, videoParameterSets);
    sequenceParameterSets = copyUnits(NalArrayType.SPS, sequenceParameterSets);
    pictureParameterSets = copyUnits(NalArrayType.PPS, pictureParameterSets);
    seiUnits = copyUnits(NalArrayType.SEI, seiUnits);
    int total = videoParameterSets.size() + sequenceParameterSets.size()
        + pictureParameterSets.size() + seiUnits.size();
    Numbers.requireRange("total NAL unit count", total, 0, MAX_TOTAL_UNITS);
  }

  /**
   * Builds a record with a zeroed general configuration and zeroed codec parameters around the given units.
   *
   * @param config descriptor supplying the raw payloads of each role
   * @return configuration record wrapping every payload as a {@link NalUnit}, in input order
   */
  public static HevcConfigurationBox fromConfig(HevcConfig config) {
    Objects.requireNonNull(config, "config");
    return new HevcConfigurationBox(
        new byte[PackedFields.GENERAL_CONFIGURATION_LENGTH],
        0,
        0,
        0,
        0,
        false,
        wrap(config.parameterSets(NalArrayType.VPS)),
        wrap(config.parameterSets(NalArrayType.SPS)),
        wrap(config.parameterSets(NalArrayType.PPS)),
        wrap(config.parameterSets(NalArrayType.SEI)));
  }

  @Override
  public byte[] generalConfiguration() {
    return generalConfiguration.clone();
  }

  /**
   * Returns the units stored for {@code role}.
   *
   * @param role array role
   * @return unmodifiable list in wire order
   */
  public List<NalUnit> units(NalArrayType role) {
    return switch (role) {
      case VPS -> videoParameterSets;
      case SPS -> sequenceParameterSets;
      case PPS -> pictureParameterSets;
      case SEI -> seiUnits;
    };
  }

  /**
   * Returns the number of units across all four roles.
   *
   * @return total unit count written in the count byte
   */
  public int totalUnits() {
    int total = 0;
    for (NalArrayType role : NalArrayType.values()) {
      total += units(role).size();
    }
    return total;
  }

  @Override
  public BoxType boxType() {
    return BoxType.HVCC;
  }

  @Override
  public long boxSize() {
    long size = BoxHeader.HEADER_SIZE + FIXED_FIELDS_SIZE;
    for (NalArrayType role : NalArrayType.values()) {
      List<NalUnit> units = units(role);
      if (units.isEmpty()) {
        continue;
      }
      size += ARRAY_HEADER_SIZE;
      for (NalUnit unit : units) {
        size += unit.size();
      }
    }
    return size;
  }

  @Override
  public long write(BoxOutput out) throws IOException {
    long start = out.count();
    BoxHeader.of(boxType().fourcc(), boxSize()).write(out);
    out.writeU8(PackedFields.CONFIGURATION_VERSION);
    out.write(generalConfiguration);
    out.writeU16(PackedFields.MIN_SPATIAL_SEGMENTATION);
    out.writeU8(PackedFields.PARALLELISM_TYPE);
    out.writeU8(PackedFields.packChromaFormat(chromaIdc));
    out.writeU8(PackedFields.packBitDepth("bit_depth_luma_minus8", bitDepthLumaMinus8));
    out.writeU8(PackedFields.packBitDepth("bit_depth_chroma_minus8", bitDepthChromaMinus8));
    out.writeU16(PackedFields.AVG_FRAME_RATE);
    out.writeU8(PackedFields.packTemporalLayers(numTemporalLayers, temporalIdNested));
    out.writeU8(totalUnits());
    for (NalArrayType role : NalArrayType.values()) {
      List<NalUnit> units = units(role);
      if (units.isEmpty()) {
        continue;
      }
      out.writeU8(role.id());
      out.writeU16(units.size());
      for (NalUnit unit : units) {
        unit.write(out);
      }
    }
    return out.count() - start;
  }

  /**
   * Decodes an {@code hvcC} payload.
   *
   * <p>Reserved bits of the packed bytes are masked away. Arrays are read until the number of units consumed
   * reaches the declared total; arrays of NAL unit types other than VPS, SPS, PPS, and SEI are consumed to keep the
   * stream aligned but their units are dropped. The cursor always ends at the declared end of the box.</p>
   *
   * @param in input positioned immediately after the {@code hvcC} header
   * @param header header that was just read
   * @return decoded record
   * @throws MalformedBoxException if an array header lies past the end of the box or more than
   *         {@value #MAX_TOTAL_UNITS} units would be kept
   * @throws IOException if reading fails, including short reads
   */
  public static HevcConfigurationBox read(BoxInput in, BoxHeader header) throws IOException {
    long start = in.boxStart(header.headerSize());
    long end = start + header.size();

    int version = in.readU8();
    if (version != PackedFields.CONFIGURATION_VERSION) {
      log.debug("hvcC at offset {} has configurationVersion {}", start, version);
    }
    byte[] generalConfiguration = in.readFully(PackedFields.GENERAL_CONFIGURATION_LENGTH);
    in.readU16(); // reserved + min_spatial_segmentation_idc
    in.readU8(); // reserved + parallelismType
    int chromaIdc = PackedFields.unpackChromaFormat(in.readU8());
    int bitDepthLumaMinus8 = PackedFields.unpackBitDepth(in.readU8());
    int bitDepthChromaMinus8 = PackedFields.unpackBitDepth(in.readU8());
    in.readU16(); // avgFrameRate
    int temporal = in.readU8();
    int numTemporalLayers = PackedFields.unpackNumTemporalLayers(temporal);
    boolean temporalIdNested = PackedFields.unpackTemporalIdNested(temporal);
    int declaredTotal = in.readU8();

    Map<NalArrayType, List<NalUnit>> arrays = new EnumMap<>(NalArrayType.class);
    for (NalArrayType role : NalArrayType.values()) {
      arrays.put(role, new ArrayList<>());
    }
    int consumed = 0;
    int kept = 0;
    while (consumed < declaredTotal) {
      long arrayOffset = in.position();
      if (arrayOffset >= end) {
        throw new MalformedBoxException("hvcC at offset " + start + " declares " + declaredTotal
            + " NAL units but only " + consumed + " fit before offset " + end);
      }
      int type = in.readU8();
      int count = in.readU16();
      Optional<NalArrayType> role = NalArrayType.fromId(type);
      if (role.isEmpty()) {
        log.debug("Skipping {} NAL units of unsupported type {} at offset {}", count, type & 0x3F, arrayOffset);
      }
      for (int i = 0; i < count; i++) {
        NalUnit unit = NalUnit.read(in);
        if (role.isPresent()) {
          arrays.get(role.get()).add(unit);
          kept++;
        }
      }
      consumed += count;
    }
    if (kept > MAX_TOTAL_UNITS) {
      throw new MalformedBoxException(
          "hvcC at offset " + start + " holds " + kept + " NAL units; at most " + MAX_TOTAL_UNITS + " are representable");
    }

    long trailing = end - in.position();
    if (trailing != 0) {
      log.debug("hvcC at offset {} realigning by {} bytes to declared end {}", start, trailing, end);
    }
    in.skipTo(end);

    return new HevcConfigurationBox(
        generalConfiguration,
        numTemporalLayers,
        chromaIdc,
        bitDepthLumaMinus8,
        bitDepthChromaMinus8,
        temporalIdNested,
        arrays.get(NalArrayType.VPS),
        arrays.get(NalArrayType.SPS),
        arrays.get(NalArrayType.PPS),
        arrays.get(NalArrayType.SEI));
  }

  @Override
  public Map<String, Object> describe() {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("type", boxType().fourcc());
    out.put("size", boxSize());
    out.put("general_configuration", generalConfiguration.clone());
    out.put("num_temporal_layers", numTemporalLayers);
    out.put("chroma_idc", chromaIdc);
    out.put("bit_depth_luma_minus8", bitDepthLumaMinus8);
    out.put("bit_depth_chroma_minus8", bitDepthChromaMinus8);
    out.put("temporal_id_nested", temporalIdNested);
    for (NalArrayType role : NalArrayType.values()) {
      List<Object> units = new ArrayList<>();
      for (NalUnit unit : units(role)) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("length", unit.length());
        entry.put("bytes", unit.bytes());
        units.add(entry);
      }
      out.put(role.label(), units);
    }
    return out;
  }

  @Override
  public String summary() {
    return "chroma_idc=" + chromaIdc;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof HevcConfigurationBox that)) {
      return false;
    }
    return numTemporalLayers == that.numTemporalLayers
        && chromaIdc == that.chromaIdc
        && bitDepthLumaMinus8 == that.bitDepthLumaMinus8
        && bitDepthChromaMinus8 == that.bitDepthChromaMinus8
        && temporalIdNested == that.temporalIdNested
        && Arrays.equals(generalConfiguration, that.generalConfiguration)
        && videoParameterSets.equals(that.videoParameterSets)
        && sequenceParameterSets.equals(that.sequenceParameterSets)
        && pictureParameterSets.equals(that.pictureParameterSets)
        && seiUnits.equals(that.seiUnits);
  }

  @Override
  public int hashCode() {
    int result = Arrays.hashCode(generalConfiguration);
    result = 31 * result + numTemporalLayers;
    result = 31 * result + chromaIdc;
    result = 31 * result + bitDepthLumaMinus8;
    result = 31 * result + bitDepthChromaMinus8;
    result = 31 * result + Boolean.hashCode(temporalIdNested);
    result = 31 * result + videoParameterSets.hashCode();
    result = 31 * result + sequenceParameterSets.hashCode();
    result = 31 * result + pictureParameterSets.hashCode();
    result = 31 * result + seiUnits.hashCode();
    return result;
  }

  @Override
  public String toString() {
    return "HevcConfigurationBox{"
        + "numTemporalLayers=" + numTemporalLayers
        + ", chromaIdc=" + chromaIdc
        + ", bitDepthLumaMinus8=" + bitDepthLumaMinus8
        + ", bitDepthChromaMinus8=" + bitDepthChromaMinus8
        + ", temporalIdNested=" + temporalIdNested
        + ", vps=" + videoParameterSets.size()
        + ", sps=" + sequenceParameterSets.size()
        + ", pps=" + pictureParameterSets.size()
        + ", sei=" + seiUnits.size()
        + '}';
  }

  private static List<NalUnit> copyUnits(NalArrayType role, List<NalUnit> units) {
    if (units == null) {
      return List.of();
    }
    List<NalUnit> copy = List.copyOf(units);
    Numbers.requireRange(role.label() + " count", copy.size(), 0, 0xFFFF);
    return copy;
  }

  private static List<NalUnit> wrap(List<byte[]> payloads) {
    List<NalUnit> units = new ArrayList<>(payloads.size());
    for (byte[] payload : payloads) {
      units.add(new NalUnit(payload));
    }
    return units;
  }
}
