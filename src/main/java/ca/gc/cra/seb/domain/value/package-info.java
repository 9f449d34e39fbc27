/**
 * <strong>Purpose:</strong> Tagged value model for SEB configuration trees.
 * <p><strong>Role:</strong> Leaf of the domain; every serializer pattern-matches over {@link
 * ca.gc.cra.seb.domain.value.ConfigValue}.
 * <p><strong>Concurrency:</strong> Immutable values; safe to share.
 * <p><strong>Performance:</strong> Collections copied once at construction.
 *
 * @since 0.1.0
 */
package ca.gc.cra.seb.domain.value;
