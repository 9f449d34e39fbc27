/**
 * Value objects describing what an SEB client reports about itself through its JavaScript bridge.
 *
 * @since 0.1.0
 */
package ca.gc.cra.seb.domain.client;
