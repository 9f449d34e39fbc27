package ca.gc.cra.seb.application.export;

import ca.gc.cra.seb.application.key.ConfigKeyProtocol;
import ca.gc.cra.seb.domain.config.ConfigKey;
import ca.gc.cra.seb.domain.config.ConfigurationDocument;
import ca.gc.cra.seb.infrastructure.container.ContainerCodec;
import ca.gc.cra.seb.infrastructure.container.ContainerException;
import ca.gc.cra.seb.infrastructure.container.DecodedContainer;
import ca.gc.cra.seb.infrastructure.plist.PlistParser;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Opens a {@code .seb} container and derives the Config Key of what it holds.
 * <p><strong>Why:</strong> Exam servers often receive the finished file rather than the source settings and need
 * its key to verify clients.</p>
 * <p><strong>Role:</strong> Application use case composing {@link ContainerCodec}, {@link PlistParser} and
 * {@link ConfigKeyProtocol}.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class ConfigImporter {
  private static final Logger log = LoggerFactory.getLogger(ConfigImporter.class);

  private final ContainerCodec codec;
  private final PlistParser parser;
  private final ConfigKeyProtocol protocol;

  public ConfigImporter(ContainerCodec codec, PlistParser parser, ConfigKeyProtocol protocol) {
    this.codec = Objects.requireNonNull(codec, "codec");
    this.parser = Objects.requireNonNull(parser, "parser");
    this.protocol = Objects.requireNonNull(protocol, "protocol");
  }

  /**
   * Decodes and parses a container.
   *
   * @param data container bytes
   * @param password password for encrypted containers
   * @return recovered payload, document and Config Key
   * @throws ContainerException when the container cannot be decoded
   * @throws IllegalArgumentException when the payload is not a plist dictionary
   */
  public ImportResult importFile(byte[] data, Optional<String> password) throws ContainerException {
    Objects.requireNonNull(data, "data");
    DecodedContainer decoded = codec.open(data, password);
    ConfigurationDocument document = parser.parse(decoded.xml());
    ConfigKey key = protocol.computeConfigKey(document);
    log.info("Imported {} SEB container with {} settings", decoded.tag().text(), document.size());
    return new ImportResult(decoded.tag(), decoded.xml(), document, key);
  }
}
