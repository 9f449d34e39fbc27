package ca.gc.cra.seb.config;

import ca.gc.cra.seb.application.export.ConfigExporter;
import ca.gc.cra.seb.application.export.ConfigImporter;
import ca.gc.cra.seb.application.key.ConfigKeyProtocol;
import ca.gc.cra.seb.application.plist.PlistRenderer;
import ca.gc.cra.seb.application.port.ConfigurationValidator;
import ca.gc.cra.seb.application.port.MetricsPort;
import ca.gc.cra.seb.infrastructure.container.ContainerCodec;
import ca.gc.cra.seb.infrastructure.crypto.JdkSha256DigestAdapter;
import ca.gc.cra.seb.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.seb.infrastructure.plist.PlistParser;
import ca.gc.cra.seb.infrastructure.validation.SettingsValidator;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires the toolkit's services to their adapters.
 * <p><strong>Role:</strong> Composition root used by the CLI; embedding applications may build services directly.
 * </p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Look up the SHA-256 capability once and build the Config Key protocol on it.</li>
 *   <li>Share one metrics adapter between the codec and the protocol.</li>
 *   <li>Close the metrics adapter, flushing pending exports.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Services are built eagerly and are themselves thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private final MetricsPort metrics;
  private final AutoCloseable metricsLifecycle;
  private final ConfigKeyProtocol protocol;
  private final ContainerCodec codec;
  private final ConfigurationValidator validator;

  /** Creates a root with OpenTelemetry metrics configured from system properties. */
  public CompositionRoot() {
    this(new OpenTelemetryMetricsAdapter());
  }

  private CompositionRoot(OpenTelemetryMetricsAdapter metrics) {
    this(metrics, metrics);
  }

  /**
   * Creates a root around an explicit metrics port.
   *
   * @param metrics metrics sink
   * @param metricsLifecycle closed by {@link #close()}
   */
  public CompositionRoot(MetricsPort metrics, AutoCloseable metricsLifecycle) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.metricsLifecycle = Objects.requireNonNull(metricsLifecycle, "metricsLifecycle");
    this.protocol = ConfigKeyProtocol.from(JdkSha256DigestAdapter.lookup(), metrics);
    this.codec = new ContainerCodec(metrics);
    this.validator = new SettingsValidator();
  }

  /**
   * Root with metrics disabled, for tests and embedding.
   *
   * @return composition root
   */
  public static CompositionRoot withoutMetrics() {
    return new CompositionRoot(MetricsPort.NO_OP, () -> {});
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public ConfigKeyProtocol configKeyProtocol() {
    return protocol;
  }

  public ContainerCodec containerCodec() {
    return codec;
  }

  public ConfigurationValidator validator() {
    return validator;
  }

  public PlistParser plistParser() {
    return new PlistParser();
  }

  public ConfigExporter exporter() {
    return new ConfigExporter(validator, new PlistRenderer(), codec);
  }

  public ConfigImporter importer() {
    return new ConfigImporter(codec, plistParser(), protocol);
  }

  @Override
  public void close() throws Exception {
    metricsLifecycle.close();
  }
}
