/**
 * <strong>Purpose:</strong> Configuration document and the key/hash value objects derived from it.
 * <p><strong>Concurrency:</strong> Immutable records; thread-safe.
 * <p><strong>Security:</strong> Config Keys are secret-adjacent; callers should redact them in logs.
 *
 * @since 0.1.0
 */
package ca.gc.cra.seb.domain.config;
