/**
 * Metrics adapters bridging {@code MetricsPort} to OpenTelemetry.
 * <p><strong>Metrics:</strong> Publishes under the {@code container.*} and {@code configkey.*} namespaces.</p>
 * <p><strong>Security:</strong> Only counts and sizes are exported; never keys, passwords or payloads.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.seb.infrastructure.metrics;
