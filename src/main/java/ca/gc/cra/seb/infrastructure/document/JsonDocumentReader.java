package ca.gc.cra.seb.infrastructure.document;

import ca.gc.cra.seb.domain.config.ConfigurationDocument;
import ca.gc.cra.seb.domain.value.ConfigValue;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Streams JSON documents straight into the tagged value model.
 * <p><strong>Why:</strong> Integral JSON numbers must stay integers and fractional ones reals, so the model tag
 * is taken from the token type rather than from a bound Java object.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; {@link JsonFactory} is thread-safe.</p>
 *
 * @implNote Integers beyond the {@code long} range become reals.
 * @since 0.1.0
 */
public final class JsonDocumentReader implements DocumentReader {
  private final JsonFactory factory = new JsonFactory();

  @Override
  public ConfigurationDocument parse(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        return new ConfigurationDocument(ConfigValue.MapValue.EMPTY);
      }
      if (token != JsonToken.START_OBJECT) {
        throw new IllegalArgumentException("JSON configuration must be an object but starts with " + token);
      }
      ConfigValue.MapValue root = readObject(parser);
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new IllegalArgumentException("JSON document contains trailing content");
      }
      return new ConfigurationDocument(root);
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON configuration", ex);
    }
  }

  private ConfigValue readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> new ConfigValue.Str(parser.getText());
      case VALUE_NUMBER_INT -> readInteger(parser);
      case VALUE_NUMBER_FLOAT -> new ConfigValue.Real(parser.getDoubleValue());
      case VALUE_TRUE -> ConfigValue.Bool.TRUE;
      case VALUE_FALSE -> ConfigValue.Bool.FALSE;
      case VALUE_NULL -> ConfigValue.Null.INSTANCE;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private static ConfigValue readInteger(JsonParser parser) throws IOException {
    if (parser.getNumberType() == JsonParser.NumberType.BIG_INTEGER) {
      return new ConfigValue.Real(parser.getDoubleValue());
    }
    return new ConfigValue.Int(parser.getLongValue());
  }

  private ConfigValue.MapValue readObject(JsonParser parser) throws IOException {
    Map<String, ConfigValue> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String fieldName = parser.getCurrentName();
      JsonToken valueToken = parser.nextToken();
      map.put(fieldName, readValue(parser, valueToken));
    }
    return new ConfigValue.MapValue(map);
  }

  private ConfigValue.ListValue readArray(JsonParser parser) throws IOException {
    List<ConfigValue> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      if (token == null) {
        throw new IllegalArgumentException("Unterminated JSON array");
      }
      list.add(readValue(parser, token));
    }
    return new ConfigValue.ListValue(list);
  }
}
