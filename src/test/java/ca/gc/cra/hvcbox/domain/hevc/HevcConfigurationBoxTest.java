package ca.gc.cra.hvcbox.domain.hevc;

import static org.junit.jupiter.api.Assertions.*;

import ca.gc.cra.hvcbox.domain.box.BoxHeader;
import ca.gc.cra.hvcbox.domain.box.MalformedBoxException;
import ca.gc.cra.hvcbox.domain.io.BoxInput;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Test;

class HevcConfigurationBoxTest {
  private static final byte[] GENERAL = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12};

  @Test
  void writesExactLayout() {
    HevcConfigurationBox box = new HevcConfigurationBox(
        GENERAL, 1, 1, 2, 2, true,
        List.of(),
        List.of(new NalUnit(new byte[] {(byte) 0xAA, (byte) 0xBB})),
        List.of(new NalUnit(new byte[] {(byte) 0xCC})),
        List.of());

    byte[] expected = {
        0, 0, 0, 44, 'h', 'v', 'c', 'C',
        0x01,
        1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12,
        (byte) 0xF0, 0x00,
        (byte) 0xFC,
        (byte) 0xFD,
        (byte) 0xFA,
        (byte) 0xFA,
        0x00, 0x00,
        0x0F,
        0x02,
        0x21, 0x00, 0x01, 0x00, 0x02, (byte) 0xAA, (byte) 0xBB,
        0x22, 0x00, 0x01, 0x00, 0x01, (byte) 0xCC};

    assertEquals(44, box.boxSize());
    assertArrayEquals(expected, HevcFixtures.encode(box));
  }

  @Test
  void fullHdConfigurationIsSeventyOneBytes() {
    HevcConfigurationBox box = HevcConfigurationBox.fromConfig(HevcFixtures.fullHd());
    byte[] bytes = HevcFixtures.encode(box);

    assertEquals(71, box.boxSize());
    assertEquals(71, bytes.length);
    assertEquals(2, box.totalUnits());
    // only SPS and PPS arrays follow the count byte
    assertEquals(0x21, bytes[8 + 23]);
    assertEquals(0x22, bytes[8 + 23 + 3 + 26]);
  }

  @Test
  void emptyRecordHasNoArrays() {
    HevcConfigurationBox box = HevcConfigurationBox.fromConfig(
        new HevcConfig(16, 16, List.of(), List.of(), List.of(), List.of()));
    byte[] bytes = HevcFixtures.encode(box);
    assertEquals(31, bytes.length);
    assertEquals(0, bytes[30]);
  }

  @Test
  void decodesWhatItEncodes() throws Exception {
    Random random = new Random(7L);
    for (int round = 0; round < 20; round++) {
      byte[] general = new byte[12];
      random.nextBytes(general);
      HevcConfigurationBox box = new HevcConfigurationBox(
          general,
          random.nextInt(8),
          random.nextInt(4),
          random.nextInt(8),
          random.nextInt(8),
          random.nextBoolean(),
          randomUnits(random),
          randomUnits(random),
          randomUnits(random),
          randomUnits(random));

      byte[] bytes = HevcFixtures.encode(box);
      assertEquals(box.boxSize(), bytes.length);
      try (BoxInput in = BoxInput.wrap(bytes)) {
        HevcConfigurationBox decoded = HevcConfigurationBox.read(in, BoxHeader.read(in));
        assertEquals(box, decoded);
        assertEquals(bytes.length, in.position());
      }
    }
  }

  @Test
  void roundTripsAtCountAndLengthLimits() throws Exception {
    List<NalUnit> sps = new ArrayList<>();
    for (int i = 0; i < HevcConfigurationBox.MAX_TOTAL_UNITS - 1; i++) {
      sps.add(new NalUnit(new byte[] {(byte) i}));
    }
    byte[] largest = new byte[NalUnit.MAX_LENGTH];
    new Random(11L).nextBytes(largest);
    HevcConfigurationBox box = new HevcConfigurationBox(
        GENERAL, 7, 3, 7, 7, true, List.of(new NalUnit(largest)), sps, List.of(), List.of());

    byte[] bytes = HevcFixtures.encode(box);

    assertEquals(box.boxSize(), bytes.length);
    assertEquals((byte) 0xFF, bytes[8 + 22]);
    assertEquals((byte) 0xFF, bytes[8 + 23 + 3]);
    assertEquals((byte) 0xFF, bytes[8 + 23 + 4]);
    try (BoxInput in = BoxInput.wrap(bytes)) {
      HevcConfigurationBox decoded = HevcConfigurationBox.READER.read(in, BoxHeader.read(in));
      assertEquals(box, decoded);
      assertEquals(255, decoded.totalUnits());
      assertEquals(NalUnit.MAX_LENGTH, decoded.videoParameterSets().get(0).length());
      assertEquals(bytes.length, in.position());
    }
  }

  @Test
  void masksReservedBitsOnDecode() throws Exception {
    byte[] bytes = HevcFixtures.encode(HevcConfigurationBox.fromConfig(HevcFixtures.fullHd()));
    bytes[8 + 16] = (byte) 0xFF; // chroma
    bytes[8 + 17] = (byte) 0xFF; // luma depth
    bytes[8 + 18] = (byte) 0x7F; // chroma depth
    bytes[8 + 21] = (byte) 0xFF; // temporal layers

    try (BoxInput in = BoxInput.wrap(bytes)) {
      HevcConfigurationBox decoded = HevcConfigurationBox.read(in, BoxHeader.read(in));
      assertEquals(3, decoded.chromaIdc());
      assertEquals(7, decoded.bitDepthLumaMinus8());
      assertEquals(7, decoded.bitDepthChromaMinus8());
      assertEquals(7, decoded.numTemporalLayers());
      assertTrue(decoded.temporalIdNested());
    }
  }

  @Test
  void skipsUnknownArrayAndStaysAligned() throws Exception {
    byte[] bytes = HevcFixtures.concat(
        header(8 + 23 + 3 + 4 + 3 + 3),
        fixedFields(2),
        new byte[] {0x28, 0x00, 0x01, 0x00, 0x02, 0x55, 0x66},
        new byte[] {0x21, 0x00, 0x01, 0x00, 0x01, 0x77},
        new byte[] {0x7E});

    try (BoxInput in = BoxInput.wrap(bytes)) {
      HevcConfigurationBox decoded = HevcConfigurationBox.read(in, BoxHeader.read(in));
      assertEquals(List.of(new NalUnit(new byte[] {0x77})), decoded.sequenceParameterSets());
      assertTrue(decoded.videoParameterSets().isEmpty());
      assertTrue(decoded.seiUnits().isEmpty());
      assertEquals(bytes.length - 1, in.position());
      assertEquals(0x7E, in.readU8());
    }
  }

  @Test
  void completenessBitDoesNotHideRole() throws Exception {
    byte[] bytes = HevcFixtures.concat(
        header(8 + 23 + 3 + 3),
        fixedFields(1),
        new byte[] {(byte) 0xA2, 0x00, 0x01, 0x00, 0x01, 0x11});

    try (BoxInput in = BoxInput.wrap(bytes)) {
      HevcConfigurationBox decoded = HevcConfigurationBox.read(in, BoxHeader.read(in));
      assertEquals(1, decoded.pictureParameterSets().size());
    }
  }

  @Test
  void preservesOrderWithinRole() throws Exception {
    List<NalUnit> units = List.of(
        new NalUnit(new byte[] {3}), new NalUnit(new byte[] {1}), new NalUnit(new byte[] {2}));
    HevcConfigurationBox box = new HevcConfigurationBox(
        GENERAL, 0, 1, 0, 0, false, List.of(), List.of(), units, List.of());

    try (BoxInput in = BoxInput.wrap(HevcFixtures.encode(box))) {
      assertEquals(units, HevcConfigurationBox.read(in, BoxHeader.read(in)).pictureParameterSets());
    }
  }

  @Test
  void trailingBytesInsideBoxAreSkipped() throws Exception {
    byte[] bytes = HevcFixtures.concat(header(8 + 23 + 4), fixedFields(0), new byte[] {1, 2, 3, 4});
    try (BoxInput in = BoxInput.wrap(bytes)) {
      HevcConfigurationBox.read(in, BoxHeader.read(in));
      assertEquals(bytes.length, in.position());
    }
  }

  @Test
  void declaredTotalBeyondBoxEndIsMalformed() throws Exception {
    byte[] bytes = HevcFixtures.concat(
        header(8 + 23 + 3 + 3),
        fixedFields(3),
        new byte[] {0x21, 0x00, 0x01, 0x00, 0x01, 0x11},
        new byte[] {0x22, 0x00, 0x01, 0x00, 0x01, 0x22});

    try (BoxInput in = BoxInput.wrap(bytes)) {
      BoxHeader header = BoxHeader.read(in);
      assertThrows(MalformedBoxException.class, () -> HevcConfigurationBox.read(in, header));
    }
  }

  @Test
  void tooManyKeptUnitsIsMalformed() throws Exception {
    byte[] units = new byte[3 + 256 * 2];
    units[0] = 0x21;
    units[1] = 0x01;
    units[2] = 0x00;
    byte[] bytes = HevcFixtures.concat(header(8 + 23 + units.length), fixedFields(1), units);

    try (BoxInput in = BoxInput.wrap(bytes)) {
      BoxHeader header = BoxHeader.read(in);
      assertThrows(MalformedBoxException.class, () -> HevcConfigurationBox.read(in, header));
    }
  }

  @Test
  void constructorRejectsBadFields() {
    List<NalUnit> none = List.of();
    assertThrows(IllegalArgumentException.class,
        () -> new HevcConfigurationBox(new byte[11], 0, 0, 0, 0, false, none, none, none, none));
    assertThrows(IllegalArgumentException.class,
        () -> new HevcConfigurationBox(GENERAL, 8, 0, 0, 0, false, none, none, none, none));
    assertThrows(IllegalArgumentException.class,
        () -> new HevcConfigurationBox(GENERAL, 0, 4, 0, 0, false, none, none, none, none));

    List<NalUnit> many = new ArrayList<>();
    for (int i = 0; i < 256; i++) {
      many.add(new NalUnit(new byte[] {(byte) i}));
    }
    assertThrows(IllegalArgumentException.class,
        () -> new HevcConfigurationBox(GENERAL, 0, 0, 0, 0, false, none, many, none, none));
  }

  @Test
  @SuppressWarnings("unchecked")
  void describeListsRolesByLabel() {
    Map<String, Object> fields = HevcConfigurationBox.fromConfig(HevcFixtures.fullHd()).describe();
    assertEquals("hvcC", fields.get("type"));
    assertEquals(71L, fields.get("size"));
    List<Object> sps = (List<Object>) fields.get("sequence_parameter_sets");
    assertEquals(1, sps.size());
    assertEquals(24, ((Map<String, Object>) sps.get(0)).get("length"));
    assertTrue(((List<Object>) fields.get("video_parameter_sets")).isEmpty());
  }

  private static List<NalUnit> randomUnits(Random random) {
    List<NalUnit> units = new ArrayList<>();
    int count = random.nextInt(4);
    for (int i = 0; i < count; i++) {
      byte[] payload = new byte[random.nextInt(40)];
      random.nextBytes(payload);
      units.add(new NalUnit(payload));
    }
    return units;
  }

  private static byte[] header(int size) {
    byte[] header = {0, 0, 0, 0, 'h', 'v', 'c', 'C'};
    HevcFixtures.putU32(header, 0, size);
    return header;
  }

  private static byte[] fixedFields(int total) {
    byte[] fields = new byte[23];
    fields[0] = 0x01;
    fields[13] = (byte) 0xF0;
    fields[15] = (byte) 0xFC;
    fields[16] = (byte) 0xFD;
    fields[17] = (byte) 0xF8;
    fields[18] = (byte) 0xF8;
    fields[21] = 0x03;
    fields[22] = (byte) total;
    return fields;
  }
}
