package ca.gc.cra.seb.infrastructure.plist;

import ca.gc.cra.seb.domain.config.ConfigurationDocument;
import ca.gc.cra.seb.domain.value.ConfigValue;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * <strong>What:</strong> Parses Apple XML property lists into configuration documents.
 * <p><strong>Why:</strong> Decoded {@code .seb} containers carry a plist; servers need the document back to derive
 * its Config Key.</p>
 * <p><strong>Role:</strong> Infrastructure adapter, inverse of {@code PlistRenderer}.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; a builder is created per call.</p>
 *
 * @implNote External DTDs and entities are never resolved. {@code <string></string>} reads back as an empty
 * string, so a rendered null does not survive the round trip.
 * @since 0.1.0
 */
public final class PlistParser {
  private static final Logger log = LoggerFactory.getLogger(PlistParser.class);
  private static final String LOAD_EXTERNAL_DTD =
      "http://apache.org/xml/features/nonvalidating/load-external-dtd";
  private static final String EXTERNAL_GENERAL_ENTITIES = "http://xml.org/sax/features/external-general-entities";
  private static final String EXTERNAL_PARAMETER_ENTITIES =
      "http://xml.org/sax/features/external-parameter-entities";
  private static final ErrorHandler RETHROWING_HANDLER = new ErrorHandler() {
    @Override public void warning(SAXParseException e) {
      log.debug("Plist parser warning at line {}: {}", e.getLineNumber(), e.getMessage());
    }

    @Override public void error(SAXParseException e) throws SAXParseException {
      throw e;
    }

    @Override public void fatalError(SAXParseException e) throws SAXParseException {
      throw e;
    }
  };

  /**
   * Parses a plist whose top-level value is a dictionary.
   *
   * @param xml plist text
   * @return configuration document
   * @throws IllegalArgumentException when the XML is malformed, uses unknown elements or its root is not a dict
   */
  public ConfigurationDocument parse(String xml) {
    Objects.requireNonNull(xml, "xml");
    ConfigValue root = parseValue(xml);
    if (!(root instanceof ConfigValue.MapValue map)) {
      throw new IllegalArgumentException("plist root must be a dict but was " + root.kind());
    }
    return new ConfigurationDocument(map);
  }

  /**
   * Parses a plist with any top-level value.
   *
   * @param xml plist text
   * @return top-level value
   */
  public ConfigValue parseValue(String xml) {
    Document document = load(xml);
    Element plist = document.getDocumentElement();
    if (!"plist".equals(plist.getTagName())) {
      throw new IllegalArgumentException("Expected <plist> root element but found <" + plist.getTagName() + ">");
    }
    List<Element> children = childElements(plist);
    if (children.size() != 1) {
      throw new IllegalArgumentException("<plist> must contain exactly one value");
    }
    return readValue(children.get(0));
  }

  private static Document load(String xml) {
    try {
      DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      factory.setFeature(LOAD_EXTERNAL_DTD, false);
      factory.setFeature(EXTERNAL_GENERAL_ENTITIES, false);
      factory.setFeature(EXTERNAL_PARAMETER_ENTITIES, false);
      factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
      factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
      factory.setXIncludeAware(false);
      factory.setExpandEntityReferences(false);
      factory.setNamespaceAware(false);
      DocumentBuilder builder = factory.newDocumentBuilder();
      builder.setErrorHandler(RETHROWING_HANDLER);
      return builder.parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
    } catch (ParserConfigurationException e) {
      throw new IllegalStateException("XML parser cannot be configured securely", e);
    } catch (SAXException | IOException e) {
      throw new IllegalArgumentException("Malformed plist XML", e);
    }
  }

  private ConfigValue readValue(Element element) {
    String tag = element.getTagName();
    return switch (tag) {
      case "dict" -> readDict(element);
      case "array" -> readArray(element);
      case "string" -> new ConfigValue.Str(element.getTextContent());
      case "integer" -> readInteger(element);
      case "real" -> readReal(element);
      case "true" -> ConfigValue.Bool.TRUE;
      case "false" -> ConfigValue.Bool.FALSE;
      case "data" -> readData(element);
      case "date" -> readDate(element);
      default -> throw new IllegalArgumentException("Unsupported plist element <" + tag + ">");
    };
  }

  private ConfigValue.MapValue readDict(Element dict) {
    List<Element> children = childElements(dict);
    if (children.size() % 2 != 0) {
      throw new IllegalArgumentException("<dict> has a key without a value");
    }
    Map<String, ConfigValue> entries = new LinkedHashMap<>();
    for (int i = 0; i < children.size(); i += 2) {
      Element key = children.get(i);
      if (!"key".equals(key.getTagName())) {
        throw new IllegalArgumentException("Expected <key> in <dict> but found <" + key.getTagName() + ">");
      }
      String name = key.getTextContent();
      if (entries.containsKey(name)) {
        throw new IllegalArgumentException("Duplicate plist key: " + name);
      }
      entries.put(name, readValue(children.get(i + 1)));
    }
    return new ConfigValue.MapValue(entries);
  }

  private ConfigValue.ListValue readArray(Element array) {
    List<ConfigValue> items = new ArrayList<>();
    for (Element child : childElements(array)) {
      items.add(readValue(child));
    }
    return new ConfigValue.ListValue(items);
  }

  private static ConfigValue readInteger(Element element) {
    String text = element.getTextContent().trim();
    try {
      return new ConfigValue.Int(Long.parseLong(text));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid <integer>: " + text, e);
    }
  }

  private static ConfigValue readReal(Element element) {
    String text = element.getTextContent().trim();
    try {
      return new ConfigValue.Real(Double.parseDouble(text));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid <real>: " + text, e);
    }
  }

  private static ConfigValue readData(Element element) {
    try {
      return ConfigValue.Bytes.of(Base64.getMimeDecoder().decode(element.getTextContent().trim()));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid Base64 in <data>", e);
    }
  }

  private static ConfigValue readDate(Element element) {
    String text = element.getTextContent().trim();
    try {
      return new ConfigValue.Timestamp(Instant.parse(text));
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid <date>: " + text, e);
    }
  }

  private static List<Element> childElements(Element parent) {
    List<Element> out = new ArrayList<>();
    for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
      if (node.getNodeType() == Node.ELEMENT_NODE) {
        out.add((Element) node);
      } else if (node.getNodeType() == Node.TEXT_NODE && !node.getNodeValue().isBlank()) {
        throw new IllegalArgumentException("Unexpected text inside <" + parent.getTagName() + ">");
      }
    }
    return out;
  }
}
