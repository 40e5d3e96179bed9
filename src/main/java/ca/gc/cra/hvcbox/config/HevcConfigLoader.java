package ca.gc.cra.hvcbox.config;

import ca.gc.cra.hvcbox.domain.hevc.HevcConfig;
import ca.gc.cra.hvcbox.domain.hevc.NalArrayType;
import ca.gc.cra.hvcbox.validation.Strings;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads an {@link HevcConfig} from a YAML document.
 *
 * <p>Expected shape:</p>
 * <pre>
 * width: 1920
 * height: 1080
 * vps: ["40 01 0c 01 ..."]
 * sps: ["42 01 01 ..."]
 * pps: ["44 01 c1 ..."]
 * sei: []
 * </pre>
 * <p>NAL unit payloads are hex strings; whitespace and colons between digits are ignored. Missing role keys mean
 * no units for that role. Keys are matched case-insensitively; unknown keys are rejected.</p>
 */
public final class HevcConfigLoader {
  private static final Map<String, NalArrayType> ROLE_KEYS = Map.of(
      "vps", NalArrayType.VPS,
      "sps", NalArrayType.SPS,
      "pps", NalArrayType.PPS,
      "sei", NalArrayType.SEI);
  private static final Set<String> SCALAR_KEYS = Set.of("width", "height");

  private HevcConfigLoader() {}

  /**
   * Loads the configuration stored at {@code path}.
   *
   * @param path location of the YAML configuration
   * @return parsed configuration, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure or a value is invalid
   */
  public static Optional<HevcConfig> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        throw new IllegalArgumentException("Config at " + path + " is empty");
      }
      return Optional.of(fromMap(asMap(document, "root")));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  /**
   * Builds a configuration from an already parsed YAML mapping.
   *
   * @param root top-level mapping
   * @return parsed configuration
   * @throws IllegalArgumentException when a key is unknown or a value is invalid
   */
  static HevcConfig fromMap(Map<String, Object> root) {
    Map<String, Object> normalized = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      String key = entry.getKey().trim().toLowerCase(Locale.ROOT);
      if (!SCALAR_KEYS.contains(key) && !ROLE_KEYS.containsKey(key)) {
        throw new IllegalArgumentException("Unknown config key: " + entry.getKey());
      }
      normalized.put(key, entry.getValue());
    }

    int width = requireInt(normalized, "width");
    int height = requireInt(normalized, "height");

    Map<NalArrayType, List<byte[]>> units = new EnumMap<>(NalArrayType.class);
    for (Map.Entry<String, NalArrayType> role : ROLE_KEYS.entrySet()) {
      units.put(role.getValue(), hexList(role.getKey(), normalized.get(role.getKey())));
    }
    return new HevcConfig(
        width,
        height,
        units.get(NalArrayType.VPS),
        units.get(NalArrayType.SPS),
        units.get(NalArrayType.PPS),
        units.get(NalArrayType.SEI));
  }

  private static int requireInt(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (value == null) {
      throw new IllegalArgumentException("Missing required config key: " + key);
    }
    if (value instanceof Integer number) {
      return number;
    }
    try {
      return Integer.parseInt(Strings.requireNonBlank(key, value.toString()));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was '" + value + "')", ex);
    }
  }

  private static List<byte[]> hexList(String key, Object node) {
    if (node == null) {
      return List.of();
    }
    if (!(node instanceof List<?> raw)) {
      throw new IllegalArgumentException(key + " must be a list of hex strings");
    }
    List<byte[]> out = new ArrayList<>(raw.size());
    for (int i = 0; i < raw.size(); i++) {
      Object element = raw.get(i);
      if (!(element instanceof String hex)) {
        throw new IllegalArgumentException(key + "[" + i + "] must be a quoted hex string");
      }
      out.add(Strings.requireHex(key + "[" + i + "]", hex));
    }
    return out;
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }
}
