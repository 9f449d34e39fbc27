/**
 * Domain utility classes for hex and text helpers.
 * <p><strong>Concurrency:</strong> Utilities are stateless; safe to call concurrently.</p>
 */
package ca.gc.cra.seb.domain.util;
