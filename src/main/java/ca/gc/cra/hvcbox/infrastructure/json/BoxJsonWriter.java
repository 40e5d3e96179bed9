package ca.gc.cra.hvcbox.infrastructure.json;

import ca.gc.cra.hvcbox.domain.box.Mp4Box;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renders {@link Mp4Box#describe()} dumps as JSON using the Jackson streaming generator.
 *
 * <p>Byte arrays are written as lowercase hex strings; nested maps and lists keep their iteration order.</p>
 *
 * @since 0.1.0
 */
public final class BoxJsonWriter {
  private final JsonFactory factory = new JsonFactory();
  private final boolean pretty;

  /**
   * Creates a writer producing compact JSON.
   */
  public BoxJsonWriter() {
    this(false);
  }

  /**
   * Creates a writer.
   *
   * @param pretty {@code true} to indent output with the default pretty printer
   */
  public BoxJsonWriter(boolean pretty) {
    this.pretty = pretty;
  }

  /**
   * Serializes the structural dump of {@code box}.
   *
   * @param box box to describe; never {@code null}
   * @return JSON document
   */
  public String toJson(Mp4Box box) {
    Objects.requireNonNull(box, "box");
    return toJson(box.describe());
  }

  /**
   * Serializes a key/value dump produced by {@link Mp4Box#describe()}.
   *
   * @param description ordered map of fields
   * @return JSON document
   * @throws IllegalArgumentException if a value has a type the dump format does not allow
   */
  public String toJson(Map<String, Object> description) {
    Objects.requireNonNull(description, "description");
    StringWriter out = new StringWriter(512);
    try (JsonGenerator gen = factory.createGenerator(out)) {
      if (pretty) {
        gen.useDefaultPrettyPrinter();
      }
      writeObject(gen, description);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render box JSON", ex);
    }
    return out.toString();
  }

  private void writeObject(JsonGenerator gen, Map<?, ?> map) throws IOException {
    gen.writeStartObject();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      gen.writeFieldName(String.valueOf(entry.getKey()));
      writeValue(gen, entry.getValue());
    }
    gen.writeEndObject();
  }

  private void writeValue(JsonGenerator gen, Object value) throws IOException {
    if (value == null) {
      gen.writeNull();
    } else if (value instanceof Map<?, ?> map) {
      writeObject(gen, map);
    } else if (value instanceof List<?> list) {
      gen.writeStartArray();
      for (Object element : list) {
        writeValue(gen, element);
      }
      gen.writeEndArray();
    } else if (value instanceof byte[] bytes) {
      gen.writeString(HexFormat.of().formatHex(bytes));
    } else if (value instanceof Boolean flag) {
      gen.writeBoolean(flag);
    } else if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      gen.writeNumber(((Number) value).intValue());
    } else if (value instanceof Long number) {
      gen.writeNumber(number);
    } else if (value instanceof BigInteger number) {
      gen.writeNumber(number);
    } else if (value instanceof BigDecimal number) {
      gen.writeNumber(number);
    } else if (value instanceof Number number) {
      gen.writeNumber(number.doubleValue());
    } else if (value instanceof CharSequence text) {
      gen.writeString(text.toString());
    } else {
      throw new IllegalArgumentException("Unsupported value type in box description: " + value.getClass().getName());
    }
  }
}
