package relayql.transform;

import graphql.language.Definition;
import graphql.language.Directive;
import graphql.language.FragmentDefinition;
import graphql.language.OperationDefinition;
import graphql.language.SelectionSet;
import graphql.language.SourceLocation;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** A top-level definition: an operation or a fragment. */
public abstract sealed class RelayQLDefinition extends RelayQLNodeWithSelections
    permits RelayQLQuery, RelayQLMutation, RelayQLSubscription, RelayQLFragment {

  private final @Nullable String name;

  RelayQLDefinition(
      RelayQLContext context,
      @Nullable String name,
      List<Directive> directives,
      @Nullable SelectionSet selectionSet,
      @Nullable SourceLocation location) {
    super(context, directives, selectionSet, location);
    this.name = name;
  }

  /**
   * Wraps a parsed definition.
   *
   * @throws RelayTransformException with {@link ErrorCode#UNSUPPORTED_DEFINITION} for anything but
   *     an operation or a fragment
   */
  public static RelayQLDefinition of(RelayQLContext context, Definition<?> definition) {
    if (definition instanceof FragmentDefinition fragment) {
      return RelayQLFragment.fromDefinition(context, fragment);
    }
    if (definition instanceof OperationDefinition operation) {
      switch (operation.getOperation()) {
        case QUERY:
          return new RelayQLQuery(context, operation);
        case MUTATION:
          return new RelayQLMutation(context, operation);
        case SUBSCRIPTION:
          return new RelayQLSubscription(context, operation);
        default:
          break;
      }
    }
    throw new RelayTransformException(
        ErrorCode.UNSUPPORTED_DEFINITION,
        "Unsupported definition: " + definition.getClass().getSimpleName(),
        definition.getSourceLocation());
  }

  /** The declared name, or the type name for anonymous definitions. */
  public String getName() {
    return name != null ? name : getType().getName(false);
  }

  /** The top-level fields, skipping fragments. */
  public List<RelayQLField> getFields() {
    List<RelayQLField> fields = new ArrayList<>();
    for (RelayQLSelection selection : getSelections()) {
      if (selection instanceof RelayQLField field) {
        fields.add(field);
      }
    }
    return fields;
  }

  public abstract <R> R accept(Visitor<R> visitor);

  /** One method per definition kind. */
  public interface Visitor<R> {
    R visitQuery(RelayQLQuery query);

    R visitMutation(RelayQLMutation mutation);

    R visitSubscription(RelayQLSubscription subscription);

    R visitFragment(RelayQLFragment fragment);
  }
}
