/**
 * Secure DOM-based reading of Apple XML property lists.
 *
 * @since 0.1.0
 */
package ca.gc.cra.seb.infrastructure.plist;
