package ca.gc.cra.seb.domain.value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * <strong>What:</strong> Adapts plain Java object graphs into {@link ConfigValue} trees.
 * <p><strong>Why:</strong> JSON/YAML readers and embedding callers hand over maps, lists, numbers and strings;
 * the serializers only understand the tagged model.</p>
 * <p><strong>Role:</strong> Domain support factory.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @implNote Objects of unrecognized types become {@link ConfigValue.Null}. Hash compatibility with existing
 * verifying servers depends on this permissive fallback, so it is not tightened into an exception.
 * @since 0.1.0
 */
public final class ConfigValues {
  private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
  private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

  private ConfigValues() {}

  /**
   * Converts an arbitrary object into the tagged model.
   *
   * @param value source object; may be {@code null}
   * @return tagged value; never {@code null}
   */
  public static ConfigValue of(Object value) {
    if (value == null) {
      return ConfigValue.Null.INSTANCE;
    }
    if (value instanceof ConfigValue tagged) {
      return tagged;
    }
    if (value instanceof Boolean bool) {
      return ConfigValue.Bool.of(bool);
    }
    if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
      return new ConfigValue.Int(((Number) value).longValue());
    }
    if (value instanceof BigInteger big) {
      if (big.compareTo(LONG_MIN) >= 0 && big.compareTo(LONG_MAX) <= 0) {
        return new ConfigValue.Int(big.longValue());
      }
      return new ConfigValue.Real(big.doubleValue());
    }
    if (value instanceof Float || value instanceof Double || value instanceof BigDecimal) {
      return new ConfigValue.Real(((Number) value).doubleValue());
    }
    if (value instanceof CharSequence text) {
      return new ConfigValue.Str(text.toString());
    }
    if (value instanceof byte[] bytes) {
      return ConfigValue.Bytes.of(bytes);
    }
    if (value instanceof Instant instant) {
      return new ConfigValue.Timestamp(instant);
    }
    if (value instanceof Date date) {
      return new ConfigValue.Timestamp(date.toInstant());
    }
    if (value instanceof Map<?, ?> map) {
      return mapOf(map);
    }
    if (value instanceof Iterable<?> iterable) {
      List<ConfigValue> items = new ArrayList<>();
      for (Object item : iterable) {
        items.add(of(item));
      }
      return new ConfigValue.ListValue(items);
    }
    if (value instanceof Object[] array) {
      List<ConfigValue> items = new ArrayList<>(array.length);
      for (Object item : array) {
        items.add(of(item));
      }
      return new ConfigValue.ListValue(items);
    }
    return ConfigValue.Null.INSTANCE;
  }

  /**
   * Converts a Java map into a {@link ConfigValue.MapValue}, stringifying keys.
   *
   * @param map source map; {@code null} yields an empty map
   * @return tagged map
   */
  public static ConfigValue.MapValue mapOf(Map<?, ?> map) {
    if (map == null || map.isEmpty()) {
      return ConfigValue.MapValue.EMPTY;
    }
    Map<String, ConfigValue> entries = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      entries.put(String.valueOf(entry.getKey()), of(entry.getValue()));
    }
    return new ConfigValue.MapValue(entries);
  }

  /**
   * Starts an insertion-ordered map builder.
   *
   * @return new builder
   */
  public static MapBuilder map() {
    return new MapBuilder();
  }

  /** Fluent builder for {@link ConfigValue.MapValue}; not thread-safe. */
  public static final class MapBuilder {
    private final Map<String, ConfigValue> entries = new LinkedHashMap<>();

    private MapBuilder() {}

    public MapBuilder put(String key, Object value) {
      entries.put(key, of(value));
      return this;
    }

    public MapBuilder putInt(String key, long value) {
      entries.put(key, new ConfigValue.Int(value));
      return this;
    }

    public MapBuilder putReal(String key, double value) {
      entries.put(key, new ConfigValue.Real(value));
      return this;
    }

    public ConfigValue.MapValue build() {
      return new ConfigValue.MapValue(entries);
    }
  }
}
