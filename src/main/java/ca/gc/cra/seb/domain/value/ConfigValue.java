package ca.gc.cra.seb.domain.value;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Tagged value model for SEB configuration trees.
 * <p><strong>Why:</strong> Serializers need to distinguish integers from reals, byte sequences from strings and
 * timestamps from text without guessing from runtime types.</p>
 * <p><strong>Role:</strong> Domain value object consumed by the canonical serializer, the plist renderer and the
 * document readers.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Represent the nine configuration value kinds as immutable records.</li>
 *   <li>Keep map keys unique while preserving insertion order for diagnostics.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> All variants are immutable; safe to share across threads.</p>
 * <p><strong>Performance:</strong> Collections are copied once on construction; byte arrays are defensively copied
 * on the way in and out.</p>
 * <p><strong>Observability:</strong> {@link #kind()} names the variant for log messages.</p>
 *
 * @implNote Output ordering of map keys is never stored here; serializers compute it on demand.
 * @since 0.1.0
 * @see ConfigValues
 */
public sealed interface ConfigValue
    permits ConfigValue.Null,
        ConfigValue.Bool,
        ConfigValue.Int,
        ConfigValue.Real,
        ConfigValue.Str,
        ConfigValue.Bytes,
        ConfigValue.Timestamp,
        ConfigValue.ListValue,
        ConfigValue.MapValue {

  /**
   * Short lowercase name of the variant, e.g. {@code "int"} or {@code "map"}.
   *
   * @return variant name used in diagnostics
   */
  String kind();

  /** Absent or undefined value. */
  enum Null implements ConfigValue {
    INSTANCE;

    @Override
    public String kind() {
      return "null";
    }
  }

  /**
   * Boolean value.
   *
   * @param value wrapped flag
   */
  record Bool(boolean value) implements ConfigValue {
    public static final Bool TRUE = new Bool(true);
    public static final Bool FALSE = new Bool(false);

    public static Bool of(boolean value) {
      return value ? TRUE : FALSE;
    }

    @Override
    public String kind() {
      return "bool";
    }
  }

  /**
   * Signed 64-bit integer value.
   *
   * @param value wrapped integer
   */
  record Int(long value) implements ConfigValue {
    @Override
    public String kind() {
      return "int";
    }
  }

  /**
   * IEEE-754 double value; rendered as a real even when integral.
   *
   * @param value wrapped double
   */
  record Real(double value) implements ConfigValue {
    @Override
    public String kind() {
      return "real";
    }
  }

  /**
   * String value.
   *
   * @param value wrapped text; never {@code null}
   */
  record Str(String value) implements ConfigValue {
    public Str {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public String kind() {
      return "string";
    }
  }

  /** Opaque byte sequence, rendered as Base64. */
  final class Bytes implements ConfigValue {
    private final byte[] data;

    private Bytes(byte[] data) {
      this.data = data;
    }

    /**
     * Wraps a copy of the supplied bytes.
     *
     * @param data source bytes; {@code null} is treated as empty
     * @return immutable byte value
     */
    public static Bytes of(byte[] data) {
      return new Bytes(data == null ? new byte[0] : data.clone());
    }

    /**
     * Returns a copy of the wrapped bytes.
     *
     * @return defensive copy
     */
    public byte[] toByteArray() {
      return data.clone();
    }

    /**
     * Number of wrapped bytes.
     *
     * @return byte length
     */
    public int length() {
      return data.length;
    }

    @Override
    public String kind() {
      return "data";
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Bytes other && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(data);
    }

    @Override
    public String toString() {
      return "Bytes[length=" + data.length + "]";
    }
  }

  /**
   * Point in time.
   *
   * @param value wrapped instant; never {@code null}
   */
  record Timestamp(Instant value) implements ConfigValue {
    public Timestamp {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public String kind() {
      return "date";
    }
  }

  /**
   * Ordered sequence of values. Order is significant and preserved by every serializer.
   *
   * @param items immutable item list
   */
  record ListValue(List<ConfigValue> items) implements ConfigValue {
    public ListValue {
      items = List.copyOf(Objects.requireNonNull(items, "items"));
    }

    @Override
    public String kind() {
      return "array";
    }
  }

  /**
   * Mapping of unique string keys to values.
   *
   * @param entries immutable, insertion-ordered entries
   */
  record MapValue(Map<String, ConfigValue> entries) implements ConfigValue {
    public static final MapValue EMPTY = new MapValue(Map.of());

    public MapValue {
      Objects.requireNonNull(entries, "entries");
      Map<String, ConfigValue> copy = new LinkedHashMap<>();
      for (Map.Entry<String, ConfigValue> entry : entries.entrySet()) {
        copy.put(
            Objects.requireNonNull(entry.getKey(), "map key"),
            Objects.requireNonNull(entry.getValue(), "map value"));
      }
      entries = Collections.unmodifiableMap(copy);
    }

    public boolean isEmpty() {
      return entries.isEmpty();
    }

    public ConfigValue get(String key) {
      return entries.get(key);
    }

    /**
     * Returns a copy of this map without {@code key}; returns {@code this} when the key is absent.
     *
     * @param key key to drop
     * @return map without the key
     */
    public MapValue without(String key) {
      if (!entries.containsKey(key)) {
        return this;
      }
      Map<String, ConfigValue> copy = new LinkedHashMap<>(entries);
      copy.remove(key);
      return new MapValue(copy);
    }

    @Override
    public String kind() {
      return "dict";
    }
  }
}
