package ca.gc.cra.seb.infrastructure.metrics;

import ca.gc.cra.seb.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> {@link MetricsPort} backed by OpenTelemetry counters and histograms.
 * <p><strong>Role:</strong> Infrastructure adapter wired by {@code CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent updates; instruments are created once per key.</p>
 * <p><strong>Observability:</strong> Every point carries {@code seb.component}, the first segment of the dotted
 * metric key ({@code container}, {@code configkey}).</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  static final AttributeKey<String> COMPONENT = AttributeKey.stringKey("seb.component");
  private static final Pattern METRIC_NAME = Pattern.compile("[a-z][a-z0-9_]*(\\.[a-z0-9_]+)*");

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Attributes> attributes = new ConcurrentHashMap<>();

  /** Creates an adapter configured from system properties and environment. */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
  }

  /**
   * Whether metrics are actually exported.
   *
   * @return {@code false} when the exporter is {@code none}
   */
  public boolean enabled() {
    return !bootstrap.isNoop();
  }

  @Override
  public void increment(String key) {
    LongCounter counter = counters.computeIfAbsent(checkName(key), name -> bootstrap.meter()
        .counterBuilder(name)
        .setUnit("1")
        .setDescription("SEB toolkit counter " + name)
        .build());
    counter.add(1, attributesFor(key));
  }

  @Override
  public void observe(String key, long value) {
    LongHistogram histogram = histograms.computeIfAbsent(checkName(key), name -> bootstrap.meter()
        .histogramBuilder(name)
        .ofLongs()
        .setDescription("SEB toolkit observation " + name)
        .build());
    histogram.record(value, attributesFor(key));
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  /** Flushes and shuts down the meter provider. */
  @Override
  public void close() {
    bootstrap.close();
  }

  private Attributes attributesFor(String key) {
    return attributes.computeIfAbsent(key, k -> {
      int dot = k.indexOf('.');
      return Attributes.of(COMPONENT, dot < 0 ? k : k.substring(0, dot));
    });
  }

  private static String checkName(String key) {
    Objects.requireNonNull(key, "key");
    if (!METRIC_NAME.matcher(key).matches()) {
      throw new IllegalArgumentException("metric key must be dotted lowercase identifiers: " + key);
    }
    return key;
  }
}
