package relayql.transform;

/** Every way compiling a definition can fail, grouped by {@link Category}. */
public enum ErrorCode {
  TOO_MANY_ROOT_FIELDS(Category.STRUCTURAL_VIOLATION),
  INVALID_ROOT_FIELD_ARITY(Category.STRUCTURAL_VIOLATION),
  CONFLICTING_PAGINATION_ARGUMENTS(Category.STRUCTURAL_VIOLATION),
  MISSING_PAGINATION_ARGUMENT(Category.STRUCTURAL_VIOLATION),
  USE_EDGES_NODE_INSTEAD(Category.STRUCTURAL_VIOLATION),
  WRONG_MUTATION_ARGUMENT_SHAPE(Category.STRUCTURAL_VIOLATION),
  MISPLACED_NODE_FIELD(Category.STRUCTURAL_VIOLATION),

  DUPLICATE_ARGUMENT_DEFINITIONS(Category.UNSUPPORTED_CONSTRUCT),
  UNSUPPORTED_SPREAD_DIRECTIVE(Category.UNSUPPORTED_CONSTRUCT),
  CONFLICTING_SPREAD_DIRECTIVES(Category.UNSUPPORTED_CONSTRUCT),
  INVALID_RELAY_SPREAD_DIRECTIVE(Category.UNSUPPORTED_CONSTRUCT),
  UNSUPPORTED_LITERAL(Category.UNSUPPORTED_CONSTRUCT),
  UNSUPPORTED_DEFINITION(Category.UNSUPPORTED_CONSTRUCT),
  VARIABLE_IN_RELAY_DIRECTIVE(Category.UNSUPPORTED_CONSTRUCT),
  INVALID_RELAY_VARIABLES(Category.UNSUPPORTED_CONSTRUCT),

  UNRESOLVED_FRAGMENT_REFERENCE(Category.SCOPE_RESOLUTION_FAILURE),

  INVALID_SYNTAX(Category.MALFORMED_INPUT),
  MISSING_DEFINITION_NAME(Category.MALFORMED_INPUT),
  INVALID_FRAGMENT_NAME(Category.MALFORMED_INPUT),
  UNEXPECTED_DEFINITIONS(Category.MALFORMED_INPUT),
  MISSING_ROOT_TYPE(Category.MALFORMED_INPUT),
  UNKNOWN_TYPE(Category.MALFORMED_INPUT),
  UNKNOWN_FIELD(Category.MALFORMED_INPUT),
  UNKNOWN_ARGUMENT(Category.MALFORMED_INPUT),
  UNKNOWN_DIRECTIVE(Category.MALFORMED_INPUT),
  INVALID_ARGUMENT_DEFINITION(Category.MALFORMED_INPUT);

  /** The broad kind of failure. */
  public enum Category {
    /** The definition breaks a rule the runtime's conventions impose on queries. */
    STRUCTURAL_VIOLATION,
    /** A directive combination, selection or literal the transform cannot express. */
    UNSUPPORTED_CONSTRUCT,
    /** A fragment reference cannot be bound in the enclosing source scope. */
    SCOPE_RESOLUTION_FAILURE,
    /** The input is not a well-formed, schema-conforming definition. */
    MALFORMED_INPUT
  }

  private final Category category;

  ErrorCode(Category category) {
    this.category = category;
  }

  public Category category() {
    return category;
  }
}
