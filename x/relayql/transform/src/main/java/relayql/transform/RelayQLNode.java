package relayql.transform;

import graphql.language.Directive;
import graphql.language.SourceLocation;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** A node of a definition, viewed together with the schema. */
public abstract sealed class RelayQLNode
    permits RelayQLNodeWithSelections, RelayQLFragmentSpread, RelayQLInlineFragment {

  private final RelayQLContext context;
  private final List<Directive> directives;
  private final @Nullable SourceLocation location;

  RelayQLNode(
      RelayQLContext context, List<Directive> directives, @Nullable SourceLocation location) {
    this.context = context;
    this.directives = List.copyOf(directives);
    this.location = location;
  }

  public RelayQLContext getContext() {
    return context;
  }

  public @Nullable SourceLocation getLocation() {
    return location;
  }

  public List<RelayQLDirective> getDirectives() {
    List<RelayQLDirective> result = new ArrayList<>();
    for (Directive directive : directives) {
      result.add(new RelayQLDirective(context, directive));
    }
    return result;
  }

  public boolean hasDirectives() {
    return !directives.isEmpty();
  }

  public boolean hasDirective(String name) {
    return directives.stream().anyMatch(directive -> directive.getName().equals(name));
  }

  public @Nullable RelayQLDirective findDirective(String name) {
    for (Directive directive : directives) {
      if (directive.getName().equals(name)) {
        return new RelayQLDirective(context, directive);
      }
    }
    return null;
  }
}
