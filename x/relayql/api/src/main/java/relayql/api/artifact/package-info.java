/**
 * The value that replaces an embedded GraphQL literal: the printed definition, its argument
 * definitions, and the initializers of the substitutions the printed tree refers to.
 *
 * <p>All types in this package are non-null by default unless explicitly annotated with {@link
 * org.jspecify.annotations.Nullable @Nullable}.
 */
@NullMarked
package relayql.api.artifact;

import org.jspecify.annotations.NullMarked;
