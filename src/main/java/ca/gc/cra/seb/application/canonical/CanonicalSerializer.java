package ca.gc.cra.seb.application.canonical;

import ca.gc.cra.seb.domain.config.ConfigurationDocument;
import ca.gc.cra.seb.domain.util.NumberText;
import ca.gc.cra.seb.domain.value.ConfigValue;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Produces the canonical SEB-JSON text of a configuration document.
 * <p><strong>Why:</strong> The Config Key is the SHA-256 of this text, so two parties holding equal configurations
 * must produce identical bytes regardless of field order, key case or producer metadata.</p>
 * <p><strong>Role:</strong> Application service feeding {@code ConfigKeyProtocol}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Drop the root {@code originatorVersion} key.</li>
 *   <li>Elide dictionaries that end up empty, at any depth.</li>
 *   <li>Sort keys with {@link KeyOrdering}; keep list order as given.</li>
 *   <li>Emit no whitespace.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Single pass over the tree; each map is sorted once.</p>
 * <p><strong>Observability:</strong> None; the output is secret-adjacent and must not be logged at INFO.</p>
 *
 * @since 0.1.0
 * @see <a href="https://safeexambrowser.org/developer/seb-config-key.html">SEB Config Key</a>
 */
public final class CanonicalSerializer {
  private static final String EMPTY_OBJECT = "{}";

  /**
   * Serializes a document into its canonical form.
   *
   * @param document configuration document; never {@code null}
   * @return single-line canonical text
   */
  public String serialize(ConfigurationDocument document) {
    Objects.requireNonNull(document, "document");
    ConfigValue.MapValue root = document.root().without(ConfigurationDocument.ORIGINATOR_VERSION_KEY);
    String rendered = renderMap(root);
    return rendered == null ? EMPTY_OBJECT : rendered;
  }

  /**
   * Serializes a standalone value with the same rules, without the root-key exclusion.
   *
   * @param value value to render
   * @return canonical text of the value
   */
  public String serializeValue(ConfigValue value) {
    StringBuilder out = new StringBuilder();
    appendValue(out, Objects.requireNonNull(value, "value"));
    return out.toString();
  }

  private void appendValue(StringBuilder out, ConfigValue value) {
    if (value instanceof ConfigValue.Bool bool) {
      out.append(bool.value() ? "true" : "false");
    } else if (value instanceof ConfigValue.Int integer) {
      out.append(integer.value());
    } else if (value instanceof ConfigValue.Real real) {
      out.append(NumberText.format(real.value()));
    } else if (value instanceof ConfigValue.Str str) {
      JsonText.appendQuoted(out, str.value());
    } else if (value instanceof ConfigValue.Bytes bytes) {
      JsonText.appendQuoted(out, Base64.getEncoder().encodeToString(bytes.toByteArray()));
    } else if (value instanceof ConfigValue.Timestamp timestamp) {
      JsonText.appendQuoted(out, JsonText.isoMillis(timestamp.value()));
    } else if (value instanceof ConfigValue.ListValue list) {
      out.append('[');
      boolean first = true;
      for (ConfigValue item : list.items()) {
        if (!first) {
          out.append(',');
        }
        first = false;
        appendValue(out, item);
      }
      out.append(']');
    } else if (value instanceof ConfigValue.MapValue map) {
      String rendered = renderMap(map);
      out.append(rendered == null ? EMPTY_OBJECT : rendered);
    } else {
      out.append("null");
    }
  }

  /**
   * Renders a map, or returns {@code null} when nothing survives the empty-dictionary filter.
   */
  private String renderMap(ConfigValue.MapValue map) {
    if (map.isEmpty()) {
      return null;
    }
    List<Map.Entry<String, ConfigValue>> entries = new ArrayList<>(map.entries().entrySet());
    entries.sort(Map.Entry.comparingByKey(KeyOrdering.instance()));

    StringBuilder out = new StringBuilder();
    out.append('{');
    boolean any = false;
    for (Map.Entry<String, ConfigValue> entry : entries) {
      String rendered;
      if (entry.getValue() instanceof ConfigValue.MapValue nested) {
        rendered = renderMap(nested);
        if (rendered == null) {
          continue;
        }
      } else {
        StringBuilder item = new StringBuilder();
        appendValue(item, entry.getValue());
        rendered = item.toString();
      }
      if (any) {
        out.append(',');
      }
      any = true;
      JsonText.appendQuoted(out, entry.getKey());
      out.append(':').append(rendered);
    }
    if (!any) {
      return null;
    }
    return out.append('}').toString();
  }
}
