/**
 * <strong>Purpose:</strong> Export and import use cases for {@code .seb} files.
 * <p><strong>Pipeline:</strong> document &rarr; validator &rarr; plist &rarr; container, and back.
 * <p><strong>Security:</strong> Passwords travel only inside {@link ca.gc.cra.seb.application.export.ExportOptions}
 * and are masked in its {@code toString}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.seb.application.export;
