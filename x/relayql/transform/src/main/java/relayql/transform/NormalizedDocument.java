package relayql.transform;

import graphql.language.Argument;
import graphql.language.AstPrinter;
import graphql.language.Definition;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A definition rewritten by the {@link DocumentNormalizer}, with what the rewrite collected.
 *
 * @param definition the rewritten definition; every fragment spread names its slot and carries
 *     no directives
 * @param slots the substitution slots by slot name, in spread order
 * @param variables every variable the definition references, in first-reference order
 * @param argumentDefinitions the arguments of {@code @argumentDefinitions}, or null when absent
 */
public record NormalizedDocument(
    Definition<?> definition,
    Map<String, SubstitutionSlot> slots,
    Set<String> variables,
    @Nullable List<Argument> argumentDefinitions) {

  public NormalizedDocument {
    slots = Collections.unmodifiableMap(new LinkedHashMap<>(slots));
    variables = Collections.unmodifiableSet(new LinkedHashSet<>(variables));
    argumentDefinitions = argumentDefinitions == null ? null : List.copyOf(argumentDefinitions);
  }

  /** The rewritten definition as query text; identical input prints identical text. */
  public String printedText() {
    return AstPrinter.printAst(definition);
  }
}
