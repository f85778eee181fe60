/**
 * The concrete query tree emitted by the transform.
 *
 * <p>Every printed definition is a tree of {@link relayql.api.cqir.Concrete} values. The nine
 * {@link relayql.api.cqir.ConcreteNode} kinds describe what the client runtime fetches and caches;
 * the {@link relayql.api.cqir.RuntimeExpression} kinds are placeholders the runtime evaluates when
 * the artifact is loaded (fragment lookups, substituted variables, fragment ids).
 *
 * <p>Consumers dispatch with {@link relayql.api.cqir.ConcreteVisitor}, which names one method per
 * kind, so a new kind breaks every consumer at compile time instead of falling through.
 *
 * <p>All types in this package are non-null by default unless explicitly annotated with {@link
 * org.jspecify.annotations.Nullable @Nullable}.
 */
@NullMarked
package relayql.api.cqir;

import org.jspecify.annotations.NullMarked;
