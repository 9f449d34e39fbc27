/**
 * <strong>Purpose:</strong> Config Key derivation and per-request hash verification.
 * <p><strong>Concurrency:</strong> Stateless services; async variants run on caller-supplied executors.
 * <p><strong>Security:</strong> Config Keys authenticate clients; log only truncated prefixes.
 *
 * @since 0.1.0
 */
package ca.gc.cra.seb.application.key;
