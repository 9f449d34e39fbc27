/**
 * Logging configuration and log hygiene helpers.
 * <p><strong>Security:</strong> Passwords are never logged; keys and hashes only as fingerprints.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.seb.logging;
