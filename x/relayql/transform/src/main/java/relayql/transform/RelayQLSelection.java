package relayql.transform;

/** One entry of a selection set: a field, a named fragment spread or an inline fragment. */
public sealed interface RelayQLSelection
    permits RelayQLField, RelayQLFragmentSpread, RelayQLInlineFragment {

  <R> R accept(Visitor<R> visitor);

  /** One method per selection kind. */
  interface Visitor<R> {
    R visitField(RelayQLField field);

    R visitFragmentSpread(RelayQLFragmentSpread spread);

    R visitInlineFragment(RelayQLInlineFragment inlineFragment);
  }
}
