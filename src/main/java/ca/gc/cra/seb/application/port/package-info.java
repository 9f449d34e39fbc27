/**
 * <strong>Purpose:</strong> Ports (capability handles) the application layer depends on: digest, client bridge,
 * schema validation and metrics.
 * <p><strong>Concurrency:</strong> Implementations must be thread-safe.
 * <p><strong>Observability:</strong> {@link ca.gc.cra.seb.application.port.MetricsPort} defines metric names.
 *
 * @since 0.1.0
 */
package ca.gc.cra.seb.application.port;
