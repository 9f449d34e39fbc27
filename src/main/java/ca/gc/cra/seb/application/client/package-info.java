/**
 * Helpers for reading what a running SEB client exposes about itself.
 *
 * @since 0.1.0
 */
package ca.gc.cra.seb.application.client;
