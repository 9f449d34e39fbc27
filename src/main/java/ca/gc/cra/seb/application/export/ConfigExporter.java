package ca.gc.cra.seb.application.export;

import ca.gc.cra.seb.application.plist.PlistRenderer;
import ca.gc.cra.seb.application.port.ConfigurationValidator;
import ca.gc.cra.seb.domain.config.ConfigurationDocument;
import ca.gc.cra.seb.infrastructure.container.ContainerCodec;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns a configuration document into a distributable {@code .seb} container.
 * <p><strong>Why:</strong> Exam authors hand students a single file; the same document also yields the Config Key
 * the exam server stores.</p>
 * <p><strong>Role:</strong> Application use case composing the validator, {@link PlistRenderer} and
 * {@link ContainerCodec}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Validate the document unless told not to.</li>
 *   <li>Render the plist and frame it plain or encrypted.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use when its collaborators are.</p>
 * <p><strong>Observability:</strong> Logs one INFO line per export; the codec emits the container metrics.</p>
 *
 * @since 0.1.0
 */
public final class ConfigExporter {
  private static final Logger log = LoggerFactory.getLogger(ConfigExporter.class);

  private final ConfigurationValidator validator;
  private final PlistRenderer renderer;
  private final ContainerCodec codec;

  /**
   * Creates an exporter.
   *
   * @param validator schema validator applied when {@link ExportOptions#validate()} is set
   * @param renderer plist renderer
   * @param codec container codec
   */
  public ConfigExporter(ConfigurationValidator validator, PlistRenderer renderer, ContainerCodec codec) {
    this.validator = Objects.requireNonNull(validator, "validator");
    this.renderer = Objects.requireNonNull(renderer, "renderer");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  /**
   * Exports a document.
   *
   * @param document configuration document
   * @param options export options
   * @return container bytes and plist
   * @throws ca.gc.cra.seb.application.port.ConfigValidationException when validation is on and fails
   */
  public ExportResult export(ConfigurationDocument document, ExportOptions options) {
    Objects.requireNonNull(document, "document");
    Objects.requireNonNull(options, "options");
    ConfigurationDocument checked = options.validate() ? validator.validate(document) : document;
    String xml = renderer.render(checked);
    byte[] data = options.encrypt()
        ? codec.encodeEncrypted(xml, options.password().orElseThrow())
        : codec.encodePlain(xml);
    log.info("Exported SEB configuration: {} settings, {} container, {} bytes",
        checked.size(), options.encrypt() ? "encrypted" : "plain", data.length);
    return new ExportResult(data, xml, data.length);
  }
}
