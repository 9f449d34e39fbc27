/**
 * <strong>Purpose:</strong> Canonical SEB-JSON serialization, the input of every Config Key hash.
 * <p><strong>Concurrency:</strong> Stateless; thread-safe.
 * <p><strong>Security:</strong> The canonical text reveals the whole configuration; keep it out of INFO logs.
 *
 * @since 0.1.0
 */
package ca.gc.cra.seb.application.canonical;
