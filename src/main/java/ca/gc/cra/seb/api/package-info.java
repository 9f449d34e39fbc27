/**
 * Command-line adapters for the {@code seb} tool: the {@link ca.gc.cra.seb.api.Main} dispatcher and one class
 * per command. Results go to stdout through {@link ca.gc.cra.seb.api.CliPrinter}; diagnostics go to SLF4J.
 */
package ca.gc.cra.seb.api;
