/**
 * Readers turning JSON, YAML and plist source files into configuration documents.
 *
 * @since 0.1.0
 */
package ca.gc.cra.seb.infrastructure.document;
