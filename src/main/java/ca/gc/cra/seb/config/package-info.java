/**
 * CLI configuration: YAML loading, defaults, precedence merging, typed command settings and service wiring.
 *
 * @since 0.1.0
 */
package ca.gc.cra.seb.config;
