/**
 * Compiles GraphQL definitions embedded in application source into the concrete query tree read
 * by the classic Relay runtime.
 *
 * <p>The pipeline for one definition is {@link relayql.transform.DocumentNormalizer} (rewrite
 * spreads into substitution slots, collect variables), {@link relayql.transform.RelayQLPrinter}
 * (recursive descent over the typed view, gated by {@link
 * relayql.transform.StructuralValidator}), {@link relayql.transform.FragmentReferenceResolver}
 * (one initializer per slot) and {@link relayql.transform.ArtifactAssembler}. {@link
 * relayql.transform.RelayQLCompiler} drives it for a whole embedded literal.
 *
 * <p>All types in this package are non-null by default unless explicitly annotated with {@link
 * org.jspecify.annotations.Nullable @Nullable}.
 */
@NullMarked
package relayql.transform;

import org.jspecify.annotations.NullMarked;
