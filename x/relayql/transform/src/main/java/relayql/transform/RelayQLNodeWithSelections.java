package relayql.transform;

import graphql.language.Directive;
import graphql.language.Field;
import graphql.language.FragmentSpread;
import graphql.language.InlineFragment;
import graphql.language.Selection;
import graphql.language.SelectionSet;
import graphql.language.SourceLocation;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** A field or definition: something with a type and a selection set on it. */
public abstract sealed class RelayQLNodeWithSelections extends RelayQLNode
    permits RelayQLField, RelayQLDefinition {

  private final @Nullable SelectionSet selectionSet;

  RelayQLNodeWithSelections(
      RelayQLContext context,
      List<Directive> directives,
      @Nullable SelectionSet selectionSet,
      @Nullable SourceLocation location) {
    super(context, directives, location);
    this.selectionSet = selectionSet;
  }

  public abstract RelayQLType getType();

  /** The selections in source order. Fields are resolved against this node's type. */
  public List<RelayQLSelection> getSelections() {
    if (selectionSet == null) {
      return List.of();
    }
    RelayQLType type = getType();
    List<RelayQLSelection> selections = new ArrayList<>();
    for (Selection<?> selection : selectionSet.getSelections()) {
      if (selection instanceof Field field) {
        selections.add(new RelayQLField(getContext(), field, type));
      } else if (selection instanceof FragmentSpread spread) {
        selections.add(new RelayQLFragmentSpread(getContext(), spread));
      } else if (selection instanceof InlineFragment inline) {
        selections.add(new RelayQLInlineFragment(getContext(), inline, type));
      } else {
        throw new RelayTransformException(
            ErrorCode.UNSUPPORTED_DEFINITION,
            "Unsupported selection type `" + selection.getClass().getSimpleName() + "`.",
            selection.getSourceLocation());
      }
    }
    return selections;
  }

  @Nullable SelectionSet getSelectionSet() {
    return selectionSet;
  }
}
