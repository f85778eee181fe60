package relayql.transform;

import graphql.language.Argument;
import graphql.language.ArrayValue;
import graphql.language.BooleanValue;
import graphql.language.Definition;
import graphql.language.Directive;
import graphql.language.Field;
import graphql.language.FragmentDefinition;
import graphql.language.FragmentSpread;
import graphql.language.InlineFragment;
import graphql.language.ObjectField;
import graphql.language.ObjectValue;
import graphql.language.OperationDefinition;
import graphql.language.Selection;
import graphql.language.SelectionSet;
import graphql.language.Value;
import graphql.language.VariableDefinition;
import graphql.language.VariableReference;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import relayql.api.cqir.CallVariable;

/**
 * Rewrites a definition before printing.
 *
 * <ul>
 *   <li>{@code @argumentDefinitions} is removed and its arguments kept as the formal arguments.
 *   <li>{@code @connection} is removed.
 *   <li>Each fragment spread is renamed to a substitution slot and loses its directives. A plain
 *       spread or one with {@code @relay(mask: ...)} keeps the fragment's name; a spread with
 *       {@code @arguments(...)} becomes {@code <fragment>_args<N>}, numbered per fragment from 1.
 *   <li>Every referenced variable is recorded.
 * </ul>
 *
 * <p>Counters live in one {@link Pass} per call, so numbering never carries over between
 * definitions.
 */
public final class DocumentNormalizer {

  private static final Logger log = LoggerFactory.getLogger(DocumentNormalizer.class);

  static final String ARGUMENT_DEFINITIONS = "argumentDefinitions";
  static final String ARGUMENTS = "arguments";
  static final String CONNECTION = "connection";
  static final String RELAY = "relay";
  static final String MASK = "mask";

  private DocumentNormalizer() {}

  public static NormalizedDocument normalize(Definition<?> definition) {
    Pass pass = new Pass();
    Definition<?> rewritten = pass.rewriteDefinition(definition);
    NormalizedDocument document =
        new NormalizedDocument(rewritten, pass.slots, pass.variables, pass.argumentDefinitions);
    log.debug(
        "Normalized {} with {} substitution slots and {} variables",
        definitionName(definition),
        document.slots().size(),
        document.variables().size());
    return document;
  }

  private static String definitionName(Definition<?> definition) {
    if (definition instanceof FragmentDefinition fragment) {
      return "fragment " + fragment.getName();
    }
    if (definition instanceof OperationDefinition operation) {
      String operationName = operation.getOperation().name().toLowerCase(Locale.ROOT);
      return operationName + " " + operation.getName();
    }
    return definition.getClass().getSimpleName();
  }

  /** The state of one rewrite. */
  private static final class Pass {
    final Map<String, SubstitutionSlot> slots = new LinkedHashMap<>();
    final Set<String> variables = new LinkedHashSet<>();
    final Map<String, Integer> argumentSlotCounters = new HashMap<>();
    @Nullable List<Argument> argumentDefinitions;

    Definition<?> rewriteDefinition(Definition<?> definition) {
      if (definition instanceof OperationDefinition operation) {
        for (VariableDefinition variable : operation.getVariableDefinitions()) {
          variables.add(variable.getName());
        }
        List<Directive> directives = rewriteDirectives(operation.getDirectives());
        SelectionSet selectionSet = rewriteSelectionSet(operation.getSelectionSet());
        return operation.transform(
            builder -> builder.directives(directives).selectionSet(selectionSet));
      }
      if (definition instanceof FragmentDefinition fragment) {
        List<Directive> directives = rewriteDirectives(fragment.getDirectives());
        SelectionSet selectionSet = rewriteSelectionSet(fragment.getSelectionSet());
        return fragment.transform(
            builder -> builder.directives(directives).selectionSet(selectionSet));
      }
      throw new RelayTransformException(
          ErrorCode.UNSUPPORTED_DEFINITION,
          "Expected a fragment, mutation, query, or subscription, got `"
              + definition.getClass().getSimpleName()
              + "`.",
          definition.getSourceLocation());
    }

    List<Directive> rewriteDirectives(List<Directive> directives) {
      List<Directive> kept = new ArrayList<>();
      for (Directive directive : directives) {
        switch (directive.getName()) {
          case ARGUMENT_DEFINITIONS:
            if (argumentDefinitions != null) {
              throw new RelayTransformException(
                  ErrorCode.DUPLICATE_ARGUMENT_DEFINITIONS,
                  "Expected only one @argumentDefinitions directive.",
                  directive.getSourceLocation());
            }
            argumentDefinitions = directive.getArguments();
            break;
          case CONNECTION:
            break;
          default:
            recordVariables(directive.getArguments());
            kept.add(directive);
        }
      }
      return kept;
    }

    @Nullable SelectionSet rewriteSelectionSet(@Nullable SelectionSet selectionSet) {
      if (selectionSet == null) {
        return null;
      }
      List<Selection> selections = new ArrayList<>();
      for (Selection<?> selection : selectionSet.getSelections()) {
        selections.add(rewriteSelection(selection));
      }
      return selectionSet.transform(builder -> builder.selections(selections));
    }

    Selection<?> rewriteSelection(Selection<?> selection) {
      if (selection instanceof Field field) {
        recordVariables(field.getArguments());
        List<Directive> directives = rewriteDirectives(field.getDirectives());
        SelectionSet selectionSet = rewriteSelectionSet(field.getSelectionSet());
        return field.transform(
            builder -> builder.directives(directives).selectionSet(selectionSet));
      }
      if (selection instanceof InlineFragment inline) {
        List<Directive> directives = rewriteDirectives(inline.getDirectives());
        SelectionSet selectionSet = rewriteSelectionSet(inline.getSelectionSet());
        return inline.transform(
            builder -> builder.directives(directives).selectionSet(selectionSet));
      }
      if (selection instanceof FragmentSpread spread) {
        return rewriteSpread(spread);
      }
      throw new RelayTransformException(
          ErrorCode.UNSUPPORTED_DEFINITION,
          "Unsupported selection type `" + selection.getClass().getSimpleName() + "`.",
          selection.getSourceLocation());
    }

    FragmentSpread rewriteSpread(FragmentSpread spread) {
      String fragmentName = spread.getName();
      List<Directive> directives = spread.getDirectives();
      String substitutionName = fragmentName;
      Map<String, Object> arguments = null;
      boolean masked = true;

      if (directives.size() > 1) {
        throw new RelayTransformException(
            ErrorCode.CONFLICTING_SPREAD_DIRECTIVES,
            "Cannot use both `@arguments` and `@relay(mask: false)` on the same fragment "
                + "spread `..."
                + fragmentName
                + "`.",
            spread.getSourceLocation());
      }
      if (directives.size() == 1) {
        Directive directive = directives.get(0);
        switch (directive.getName()) {
          case ARGUMENTS:
            arguments = new LinkedHashMap<>();
            for (Argument argument : directive.getArguments()) {
              Value<?> value = argument.getValue();
              if (value instanceof VariableReference variable) {
                variables.add(variable.getName());
                arguments.put(argument.getName(), new CallVariable(variable.getName()));
              } else {
                arguments.put(
                    argument.getName(),
                    LiteralValues.toArgumentValue(value, argument.getSourceLocation()));
              }
            }
            int n = argumentSlotCounters.merge(fragmentName, 1, Integer::sum);
            substitutionName = fragmentName + "_args" + n;
            break;
          case RELAY:
            List<Argument> relayArguments = directive.getArguments();
            if (relayArguments.size() != 1 || !relayArguments.get(0).getName().equals(MASK)) {
              throw new RelayTransformException(
                  ErrorCode.INVALID_RELAY_SPREAD_DIRECTIVE,
                  String.format(
                      "Expected `@relay` directive to only have `mask` argument on fragment "
                          + "spread `...%s`, but got %s.",
                      fragmentName,
                      relayArguments.isEmpty()
                          ? "none"
                          : "`" + relayArguments.get(0).getName() + "`"),
                  directive.getSourceLocation());
            }
            Value<?> mask = relayArguments.get(0).getValue();
            masked = !(mask instanceof BooleanValue bool && !bool.isValue());
            break;
          default:
            throw new RelayTransformException(
                ErrorCode.UNSUPPORTED_SPREAD_DIRECTIVE,
                "Unsupported directive `"
                    + directive.getName()
                    + "` on fragment spread `..."
                    + fragmentName
                    + "`.",
                directive.getSourceLocation());
        }
      }

      slots.put(
          substitutionName,
          new SubstitutionSlot(fragmentName, arguments, masked, spread.getSourceLocation()));
      String slotName = substitutionName;
      return spread.transform(builder -> builder.name(slotName).directives(List.of()));
    }

    void recordVariables(List<Argument> arguments) {
      for (Argument argument : arguments) {
        recordVariables(argument.getValue());
      }
    }

    void recordVariables(Value<?> value) {
      if (value instanceof VariableReference variable) {
        variables.add(variable.getName());
      } else if (value instanceof ArrayValue array) {
        for (Value<?> item : array.getValues()) {
          recordVariables(item);
        }
      } else if (value instanceof ObjectValue object) {
        for (ObjectField field : object.getObjectFields()) {
          recordVariables(field.getValue());
        }
      }
    }
  }
}
