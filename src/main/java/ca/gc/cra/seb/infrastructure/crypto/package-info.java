/**
 * JCA-backed digest adapters.
 *
 * @since 0.1.0
 */
package ca.gc.cra.seb.infrastructure.crypto;
