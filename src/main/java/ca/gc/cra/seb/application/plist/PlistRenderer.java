package ca.gc.cra.seb.application.plist;

import ca.gc.cra.seb.application.canonical.KeyOrdering;
import ca.gc.cra.seb.domain.config.ConfigurationDocument;
import ca.gc.cra.seb.domain.util.NumberText;
import ca.gc.cra.seb.domain.value.ConfigValue;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Renders a configuration document as an Apple XML property list.
 * <p><strong>Why:</strong> The SEB client reads its settings from a plist; the file is also what administrators
 * inspect and diff, so its key order follows the canonical form.</p>
 * <p><strong>Role:</strong> Application service producing the payload of the {@code .seb} container.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Map each value kind to its plist element; integers and reals follow the model tag.</li>
 *   <li>Entity-escape {@code & < > " '} in keys and strings.</li>
 *   <li>Order dictionary keys with {@link KeyOrdering} at every depth.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Linear in the size of the tree.</p>
 *
 * @implNote Unlike the canonical form, {@code originatorVersion} and empty dictionaries are kept. Indentation is
 * cosmetic.
 * @since 0.1.0
 */
public final class PlistRenderer {
  static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";
  static final String DOCTYPE = "<!DOCTYPE plist PUBLIC \"-//Apple//DTD PLIST 1.0//EN\" "
      + "\"http://www.apple.com/DTDs/PropertyList-1.0.dtd\">";
  private static final DateTimeFormatter PLIST_DATE =
      DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

  /**
   * Renders the full plist document.
   *
   * @param document configuration document
   * @return XML text with {@code \n} line separators and no trailing newline
   */
  public String render(ConfigurationDocument document) {
    Objects.requireNonNull(document, "document");
    List<String> lines = new ArrayList<>();
    lines.add(XML_DECLARATION);
    lines.add(DOCTYPE);
    lines.add("<plist version=\"1.0\">");
    appendValue(lines, document.root(), 0);
    lines.add("</plist>");
    return String.join("\n", lines);
  }

  /**
   * Escapes the five predefined XML entities.
   *
   * @param text raw text
   * @return escaped text
   */
  public static String escapeXml(String text) {
    StringBuilder out = new StringBuilder(text.length() + 16);
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '&' -> out.append("&amp;");
        case '<' -> out.append("&lt;");
        case '>' -> out.append("&gt;");
        case '"' -> out.append("&quot;");
        case '\'' -> out.append("&apos;");
        default -> out.append(c);
      }
    }
    return out.toString();
  }

  private void appendValue(List<String> lines, ConfigValue value, int depth) {
    String indent = "\t".repeat(depth);
    if (value instanceof ConfigValue.Bool bool) {
      lines.add(indent + (bool.value() ? "<true/>" : "<false/>"));
    } else if (value instanceof ConfigValue.Int integer) {
      lines.add(indent + "<integer>" + integer.value() + "</integer>");
    } else if (value instanceof ConfigValue.Real real) {
      lines.add(indent + "<real>" + NumberText.format(real.value()) + "</real>");
    } else if (value instanceof ConfigValue.Str str) {
      lines.add(indent + "<string>" + escapeXml(str.value()) + "</string>");
    } else if (value instanceof ConfigValue.Bytes bytes) {
      lines.add(indent + "<data>" + Base64.getEncoder().encodeToString(bytes.toByteArray()) + "</data>");
    } else if (value instanceof ConfigValue.Timestamp timestamp) {
      lines.add(indent + "<date>" + PLIST_DATE.format(timestamp.value()) + "</date>");
    } else if (value instanceof ConfigValue.ListValue list) {
      if (list.items().isEmpty()) {
        lines.add(indent + "<array/>");
        return;
      }
      lines.add(indent + "<array>");
      for (ConfigValue item : list.items()) {
        appendValue(lines, item, depth + 1);
      }
      lines.add(indent + "</array>");
    } else if (value instanceof ConfigValue.MapValue map) {
      appendDict(lines, map, depth, indent);
    } else {
      lines.add(indent + "<string></string>");
    }
  }

  private void appendDict(List<String> lines, ConfigValue.MapValue map, int depth, String indent) {
    if (map.isEmpty()) {
      lines.add(indent + "<dict/>");
      return;
    }
    List<Map.Entry<String, ConfigValue>> entries = new ArrayList<>(map.entries().entrySet());
    entries.sort(Map.Entry.comparingByKey(KeyOrdering.instance()));
    String childIndent = indent + "\t";
    lines.add(indent + "<dict>");
    for (Map.Entry<String, ConfigValue> entry : entries) {
      lines.add(childIndent + "<key>" + escapeXml(entry.getKey()) + "</key>");
      appendValue(lines, entry.getValue(), depth + 1);
    }
    lines.add(indent + "</dict>");
  }
}
