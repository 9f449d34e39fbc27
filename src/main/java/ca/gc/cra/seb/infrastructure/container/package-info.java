/**
 * <strong>Purpose:</strong> Binary {@code .seb} container codec: double gzip framing and optional password
 * encryption (PBKDF2-HMAC-SHA256, AES-256-CBC).
 * <p><strong>Concurrency:</strong> Codec instances are thread-safe.
 * <p><strong>Security:</strong> Passwords are never logged; derived key material is not retained.
 *
 * @since 0.1.0
 */
package ca.gc.cra.seb.infrastructure.container;
