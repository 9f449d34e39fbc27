/**
 * SEB option schema checks behind the {@code ConfigurationValidator} port.
 *
 * @since 0.1.0
 */
package ca.gc.cra.seb.infrastructure.validation;
