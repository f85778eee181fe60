package relayql.transform;

import graphql.language.Argument;
import graphql.language.BooleanValue;
import graphql.language.Directive;
import graphql.language.FragmentDefinition;
import graphql.language.InlineFragment;
import graphql.language.SelectionSet;
import graphql.language.SourceLocation;
import graphql.language.TypeName;
import graphql.schema.GraphQLType;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A fragment: a named fragment definition, an inline fragment, or a fragment the printer
 * generates. An inline fragment without a type condition takes the type it is selected on.
 */
public final class RelayQLFragment extends RelayQLDefinition {

  static final String RELAY_DIRECTIVE = "relay";
  static final String GENERATED_DIRECTIVE = "generated";

  private final @Nullable String typeCondition;
  private final @Nullable RelayQLType parentType;

  private RelayQLFragment(
      RelayQLContext context,
      @Nullable String name,
      @Nullable TypeName typeCondition,
      List<Directive> directives,
      @Nullable SelectionSet selectionSet,
      @Nullable SourceLocation location,
      @Nullable RelayQLType parentType) {
    super(
        context.withPattern(context.pattern() || isPattern(directives)),
        name,
        directives,
        selectionSet,
        location);
    this.typeCondition = typeCondition == null ? null : typeCondition.getName();
    this.parentType = parentType;
  }

  public static RelayQLFragment fromDefinition(RelayQLContext context, FragmentDefinition ast) {
    return new RelayQLFragment(
        context,
        ast.getName(),
        ast.getTypeCondition(),
        ast.getDirectives(),
        ast.getSelectionSet(),
        ast.getSourceLocation(),
        null);
  }

  static RelayQLFragment fromInlineFragment(
      RelayQLContext context, InlineFragment ast, RelayQLType parentType) {
    return new RelayQLFragment(
        context,
        null,
        ast.getTypeCondition(),
        ast.getDirectives(),
        ast.getSelectionSet(),
        ast.getSourceLocation(),
        parentType);
  }

  static RelayQLFragment generated(
      RelayQLContext context, String name, InlineFragment ast, RelayQLType parentType) {
    return new RelayQLFragment(
        context,
        name,
        ast.getTypeCondition(),
        ast.getDirectives(),
        ast.getSelectionSet(),
        ast.getSourceLocation(),
        parentType);
  }

  @Override
  public RelayQLType getType() {
    if (typeCondition != null) {
      GraphQLType type = getContext().schema().getType(typeCondition);
      if (type == null) {
        throw new RelayTransformException(
            ErrorCode.UNKNOWN_TYPE,
            String.format(
                "You supplied a type condition `%s`, but no such type exists in the schema.",
                typeCondition),
            getLocation());
      }
      return new RelayQLType(getContext(), type);
    }
    if (parentType == null) {
      throw new IllegalStateException("Fragment without a type condition has no parent type");
    }
    return parentType;
  }

  /** True for fragments marked {@code @generated}, whose fields skip structural validation. */
  public boolean isGenerated() {
    return hasDirective(GENERATED_DIRECTIVE);
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitFragment(this);
  }

  /** {@code @relay(pattern: true)}. Read from the syntax tree so the context can carry it. */
  private static boolean isPattern(List<Directive> directives) {
    for (Directive directive : directives) {
      if (!directive.getName().equals(RELAY_DIRECTIVE)) {
        continue;
      }
      Argument pattern = directive.getArgument("pattern");
      if (pattern != null
          && pattern.getValue() instanceof BooleanValue value
          && value.isValue()) {
        return true;
      }
    }
    return false;
  }
}
