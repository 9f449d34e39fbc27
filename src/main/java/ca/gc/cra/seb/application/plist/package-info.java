/**
 * Apple XML property-list rendering of SEB configuration documents.
 *
 * @since 0.1.0
 */
package ca.gc.cra.seb.application.plist;
