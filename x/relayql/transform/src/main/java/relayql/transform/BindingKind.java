package relayql.transform;

/** How a name is bound in the source around an embedded definition. */
public enum BindingKind {
  IMPORT,
  REQUIRE,
  /** Declared in the file itself: a variable, function, class or parameter. */
  LOCAL
}
