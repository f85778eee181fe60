package relayql.transform;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import relayql.api.cqir.CallArgument;
import relayql.api.cqir.CallValue;
import relayql.api.cqir.CallValueList;
import relayql.api.cqir.CallVariable;
import relayql.api.cqir.ConcreteCall;
import relayql.api.cqir.ConcreteDefinition;
import relayql.api.cqir.ConcreteDirective;
import relayql.api.cqir.ConcreteField;
import relayql.api.cqir.ConcreteFragment;
import relayql.api.cqir.ConcreteMutation;
import relayql.api.cqir.ConcreteQuery;
import relayql.api.cqir.ConcreteSelection;
import relayql.api.cqir.ConcreteSelections;
import relayql.api.cqir.ConcreteSubscription;
import relayql.api.cqir.FragmentReference;
import relayql.api.cqir.ParametrizedFragment;
import relayql.api.cqir.SubstitutionVariable;

/**
 * Prints a definition into the concrete query tree.
 *
 * <p>Each level of the descent computes the {@link RequisiteFields} its selections must contain:
 * the identity field for types that have one, {@code __typename} for abstract types, and the
 * pagination fields of connections, edges and page infos. Requisite fields missing from the
 * source are appended as generated fields. A type that only may implement {@code Node} gets a
 * generated {@code ... on Node { id }} fragment instead of an {@code id} field.
 *
 * <p>A printer holds no per-definition state; one instance can print any number of definitions.
 */
public final class RelayQLPrinter {

  static final String ID_FRAGMENT_TYPE = FieldNames.NODE_INTERFACE;

  private final TransformOptions options;
  private final FieldNames fieldNames;
  private final Set<String> substitutionNames;

  /**
   * @param substitutionNames variables with these names are read from the enclosing substitutions
   *     at run time instead of from the query variables
   */
  public RelayQLPrinter(TransformOptions options, Set<String> substitutionNames) {
    this.options = Objects.requireNonNull(options, "options");
    this.fieldNames = FieldNames.of(options.snakeCase());
    this.substitutionNames = Set.copyOf(substitutionNames);
  }

  public RelayQLPrinter(TransformOptions options) {
    this(options, Set.of());
  }

  public ConcreteDefinition print(RelayQLDefinition definition) {
    return print(definition, options.enableValidation());
  }

  /**
   * @param enableValidation whether operations must select exactly one root field; an operation
   *     without any root field is always rejected
   */
  public ConcreteDefinition print(RelayQLDefinition definition, boolean enableValidation) {
    return definition.accept(
        new RelayQLDefinition.Visitor<ConcreteDefinition>() {
          @Override
          public ConcreteDefinition visitQuery(RelayQLQuery query) {
            return printQuery(query, enableValidation);
          }

          @Override
          public ConcreteDefinition visitMutation(RelayQLMutation mutation) {
            return printMutation(mutation, enableValidation);
          }

          @Override
          public ConcreteDefinition visitSubscription(RelayQLSubscription subscription) {
            return printSubscription(subscription, enableValidation);
          }

          @Override
          public ConcreteDefinition visitFragment(RelayQLFragment fragment) {
            return printFragment(fragment).asDefinition();
          }
        });
  }

  ConcreteQuery printQuery(RelayQLQuery query, boolean enableValidation) {
    RelayQLField rootField = rootField(query, "query", enableValidation);
    RelayQLType rootFieldType = rootField.getType();
    List<RelayQLArgument> rootFieldArgs = rootField.getArguments();

    RequisiteFields requisiteFields = RequisiteFields.empty();
    List<RelayQLFragment> idFragments = List.of();
    RelayQLFieldDefinition identifyingFieldDef = rootFieldType.getIdentifyingFieldDefinition();
    if (identifyingFieldDef != null) {
      requisiteFields = requisiteFields.with(identifyingFieldDef.getName());
    } else if (shouldGenerateIdFragment(rootField)) {
      idFragments = List.of(rootFieldType.generateIdFragment());
    }
    if (rootFieldType.isAbstract()) {
      requisiteFields = requisiteFields.with(fieldNames.typename());
    }
    ConcreteSelections selections =
        printSelections(rootField, requisiteFields, idFragments, false);

    Map<String, Object> metadata = new LinkedHashMap<>();
    if (rootFieldType.isList()) {
      metadata.put("isPlural", true);
    }
    if (rootFieldType.isAbstract()) {
      metadata.put("isAbstract", true);
    }
    StructuralValidator.validateRootFieldArity(query, rootField);

    List<ConcreteCall> calls = null;
    if (rootFieldArgs.size() == 1) {
      // The lone argument of a root field is taken to be its identifying argument.
      RelayQLArgument identifyingArg = rootFieldArgs.get(0);
      String identifyingArgType = identifyingArg.getType().getName(true);
      metadata.put("identifyingArgName", identifyingArg.getName());
      metadata.put("identifyingArgType", identifyingArgType);
      calls =
          List.of(
              new ConcreteCall(
                  identifyingArg.getName(),
                  Map.of("type", identifyingArgType),
                  printArgumentValue(identifyingArg)));
    }

    return new ConcreteQuery(
        query.getName(),
        rootFieldType.getName(false),
        rootField.getName(),
        calls,
        selections,
        printDirectives(rootField.getDirectives()),
        metadata);
  }

  ConcreteMutation printMutation(RelayQLMutation mutation, boolean enableValidation) {
    RelayQLField rootField = rootField(mutation, "mutation", enableValidation);
    RelayQLType rootFieldType = rootField.getType();
    StructuralValidator.validateMutationField(rootField, options.inputArgumentName());

    RequisiteFields requisiteFields = RequisiteFields.empty();
    if (rootFieldType.hasField(fieldNames.clientMutationId())) {
      requisiteFields = requisiteFields.with(fieldNames.clientMutationId());
    }
    ConcreteSelections selections =
        printSelections(rootField, requisiteFields, List.of(), false);

    return new ConcreteMutation(
        mutation.getName(),
        rootFieldType.getName(false),
        List.of(inputCall(rootField)),
        selections,
        printDirectives(mutation.getDirectives()),
        inputTypeMetadata(rootField));
  }

  ConcreteSubscription printSubscription(
      RelayQLSubscription subscription, boolean enableValidation) {
    RelayQLField rootField = rootField(subscription, "subscription", enableValidation);
    RelayQLType rootFieldType = rootField.getType();
    StructuralValidator.validateMutationField(rootField, options.inputArgumentName());

    RequisiteFields requisiteFields = RequisiteFields.empty();
    if (rootFieldType.hasField(fieldNames.clientSubscriptionId())) {
      requisiteFields = requisiteFields.with(fieldNames.clientSubscriptionId());
    }
    if (rootFieldType.hasField(fieldNames.clientMutationId())) {
      requisiteFields = requisiteFields.with(fieldNames.clientMutationId());
    }
    ConcreteSelections selections =
        printSelections(rootField, requisiteFields, List.of(), false);

    return new ConcreteSubscription(
        subscription.getName(),
        rootFieldType.getName(false),
        List.of(inputCall(rootField)),
        selections,
        printDirectives(subscription.getDirectives()),
        inputTypeMetadata(rootField));
  }

  PrintedFragment printFragment(RelayQLFragment fragment) {
    RelayQLType fragmentType = fragment.getType();

    RequisiteFields requisiteFields = RequisiteFields.empty();
    List<RelayQLFragment> idFragments = List.of();
    if (fragmentType.hasField(FieldNames.ID)) {
      requisiteFields = requisiteFields.with(FieldNames.ID);
    } else if (shouldGenerateIdFragment(fragment)) {
      idFragments = List.of(fragmentType.generateIdFragment());
    }
    if (fragmentType.isAbstract()) {
      requisiteFields = requisiteFields.with(fieldNames.typename());
    }
    ConcreteSelections selections =
        printSelections(fragment, requisiteFields, idFragments, fragment.isGenerated());

    RelayQLDirective relayDirective = fragment.findDirective(RelayQLFragment.RELAY_DIRECTIVE);
    RelayQLArgument selectVariables =
        relayDirective == null ? null : relayDirective.findArgument("variables");

    Map<String, Object> computed = new LinkedHashMap<>();
    computed.put("isAbstract", fragmentType.isAbstract());
    computed.put("isTrackingEnabled", selectVariables != null);

    ConcreteFragment node =
        new ConcreteFragment(
            fragment.getName(),
            fragmentType.getName(false),
            selections,
            printDirectives(fragment.getDirectives()),
            printRelayDirectiveMetadata(fragment, computed));
    if (selectVariables == null) {
      return new PrintedFragment(node, null);
    }

    if (!selectVariables.isList()) {
      throw invalidRelayVariables(fragment);
    }
    Map<String, CallArgument> variables = new LinkedHashMap<>();
    for (RelayQLArgument item : selectVariables.getListElements()) {
      if (item.isVariable() || !(item.getLiteralValue() instanceof String name)) {
        throw invalidRelayVariables(fragment);
      }
      variables.put(name, printVariable(name));
    }
    return new PrintedFragment(node, new ParametrizedFragment(node, variables));
  }

  /**
   * Prints the selections of {@code parent}. Fields come first, then fragment references and
   * fragments in source order, then {@code extraFragments}.
   *
   * @return null when there is nothing to select
   */
  @Nullable ConcreteSelections printSelections(
      RelayQLNodeWithSelections parent,
      RequisiteFields requisiteFields,
      List<RelayQLFragment> extraFragments,
      boolean isGeneratedQuery) {
    SelectionPartition partition = new SelectionPartition();
    for (RelayQLSelection selection : parent.getSelections()) {
      selection.accept(partition);
    }
    for (RelayQLFragment fragment : extraFragments) {
      partition.fragments.add(printFragment(fragment).asSelection());
    }

    List<ConcreteSelection> selections = new ArrayList<>();
    selections.addAll(printFields(partition.fields, parent, requisiteFields, isGeneratedQuery));
    selections.addAll(partition.fragments);
    if (selections.isEmpty()) {
      return null;
    }
    return new ConcreteSelections(selections, partition.didPrintFragmentReference);
  }

  List<ConcreteField> printFields(
      List<RelayQLField> fields,
      RelayQLNodeWithSelections parent,
      RequisiteFields requisiteFields,
      boolean isGeneratedQuery) {
    RelayQLType parentType = parent.getType();
    RequisiteFields requisites = requisiteFields;
    if (parentType.isConnection()
        && parentType.hasField(fieldNames.pageInfo())
        && fields.stream().anyMatch(field -> field.getName().equals(fieldNames.edges()))) {
      requisites = requisites.with(fieldNames.pageInfo());
    }

    Set<String> generatedFields = new LinkedHashSet<>(requisites.names());
    for (RelayQLField field : fields) {
      generatedFields.remove(field.getName());
    }

    List<ConcreteField> printedFields = new ArrayList<>();
    for (RelayQLField field : fields) {
      printedFields.add(
          printField(
              field, parentType, requisites.contains(field.getName()), false, isGeneratedQuery));
    }
    for (String fieldName : generatedFields) {
      printedFields.add(
          printField(
              parentType.generateField(fieldName), parentType, true, true, isGeneratedQuery));
    }
    return printedFields;
  }

  ConcreteField printField(
      RelayQLField field,
      RelayQLType parentType,
      boolean isRequisite,
      boolean isGenerated,
      boolean isGeneratedQuery) {
    RelayQLType fieldType = field.getType();

    Map<String, Object> metadata = new LinkedHashMap<>();
    RequisiteFields requisiteFields = RequisiteFields.empty();
    List<RelayQLFragment> idFragments = List.of();
    if (fieldType.hasField(FieldNames.ID)) {
      requisiteFields = requisiteFields.with(FieldNames.ID);
    } else if (shouldGenerateIdFragment(field)) {
      idFragments = List.of(fieldType.generateIdFragment());
    }

    if (!isGeneratedQuery) {
      StructuralValidator.validateField(field, parentType);
    }

    if (fieldType.canHaveSubselections()) {
      metadata.put("canHaveSubselections", true);
    }
    if (fieldType.alwaysImplements(FieldNames.NODE_INTERFACE)) {
      metadata.put("inferredRootCallName", "node");
      metadata.put("inferredPrimaryKey", FieldNames.ID);
    }
    if (fieldType.isConnection()) {
      if (field.hasDeclaredArgument("first") || field.hasDeclaredArgument("last")) {
        if (!isGeneratedQuery) {
          StructuralValidator.validateConnectionField(field, fieldNames);
        }
        metadata.put("isConnection", true);
        if (field.hasDeclaredArgument("find")) {
          metadata.put("isFindable", true);
        }
      }
    } else if (fieldType.isConnectionPageInfo()) {
      requisiteFields =
          requisiteFields.with(fieldNames.hasNextPage()).with(fieldNames.hasPreviousPage());
    } else if (fieldType.isConnectionEdge()) {
      requisiteFields = requisiteFields.with(fieldNames.cursor()).with(fieldNames.node());
    }
    if (fieldType.isAbstract()) {
      metadata.put("isAbstract", true);
      requisiteFields = requisiteFields.with(fieldNames.typename());
    }
    if (fieldType.isList()) {
      metadata.put("isPlural", true);
    }
    if (isGenerated) {
      metadata.put("isGenerated", true);
    }
    if (isRequisite) {
      metadata.put("isRequisite", true);
    }

    ConcreteSelections selections =
        printSelections(field, requisiteFields, idFragments, isGeneratedQuery);
    List<RelayQLArgument> args = field.getArguments();
    List<ConcreteCall> calls = null;
    if (!args.isEmpty()) {
      calls = new ArrayList<>();
      for (RelayQLArgument arg : args) {
        calls.add(printArgument(arg));
      }
    }

    return new ConcreteField(
        field.getAlias(),
        field.getName(),
        fieldType.getName(false),
        calls,
        selections,
        printDirectives(field.getDirectives()),
        printRelayDirectiveMetadata(field, metadata));
  }

  ConcreteCall printArgument(RelayQLArgument arg) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    String inputType = printArgumentTypeForMetadata(arg.getType());
    if (inputType != null) {
      metadata.put("type", inputType);
    }
    return new ConcreteCall(arg.getName(), metadata, printArgumentValue(arg));
  }

  CallArgument printArgumentValue(RelayQLArgument arg) {
    if (arg.isVariable()) {
      return printVariable(arg.getVariableName());
    }
    if (arg.isList()) {
      List<CallArgument> values = new ArrayList<>();
      for (RelayQLArgument element : arg.getListElements()) {
        values.add(printArgumentValue(element));
      }
      return new CallValueList(values);
    }
    return new CallValue(arg.getLiteralValue());
  }

  /** Variables named like a substitution are taken to be that substitution. */
  CallArgument printVariable(String name) {
    if (substitutionNames.contains(name)) {
      return new SubstitutionVariable(name);
    }
    return new CallVariable(name);
  }

  /** Every directive but {@code @relay}, which only contributes metadata. */
  @Nullable List<ConcreteDirective> printDirectives(List<RelayQLDirective> directives) {
    List<ConcreteDirective> printed = new ArrayList<>();
    for (RelayQLDirective directive : directives) {
      if (directive.getName().equals(RelayQLFragment.RELAY_DIRECTIVE)) {
        continue;
      }
      List<ConcreteDirective.Argument> args = new ArrayList<>();
      for (RelayQLArgument arg : directive.getArguments()) {
        args.add(new ConcreteDirective.Argument(arg.getName(), printArgumentValue(arg)));
      }
      printed.add(new ConcreteDirective(directive.getName(), args));
    }
    return printed.isEmpty() ? null : printed;
  }

  /**
   * The {@code @relay} arguments of {@code node}, except {@code variables}, followed by the
   * computed metadata. A key present in both keeps the directive's value.
   */
  Map<String, Object> printRelayDirectiveMetadata(
      RelayQLNode node, Map<String, Object> computed) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    RelayQLDirective relayDirective = node.findDirective(RelayQLFragment.RELAY_DIRECTIVE);
    if (relayDirective != null) {
      for (RelayQLArgument arg : relayDirective.getArguments()) {
        if (arg.isVariable()) {
          throw new RelayTransformException(
              ErrorCode.VARIABLE_IN_RELAY_DIRECTIVE,
              String.format(
                  "You supplied `$%s` as the `%s` argument to the `@relay` directive, but "
                      + "`@relay` require scalar argument values.",
                  arg.getVariableName(),
                  arg.getName()),
              node.getLocation());
        }
        if (arg.getName().equals("variables")) {
          continue;
        }
        Object value = arg.getLiteralValue();
        if (value != null
            && !(value instanceof String || value instanceof Boolean || value instanceof Number)) {
          throw new RelayTransformException(
              ErrorCode.UNSUPPORTED_LITERAL,
              String.format(
                  "You supplied a non-scalar value as the `%s` argument to the `@relay` "
                      + "directive, but `@relay` require scalar argument values.",
                  arg.getName()),
              node.getLocation());
        }
        metadata.put(arg.getName(), value);
      }
    }
    computed.forEach(metadata::putIfAbsent);
    return metadata;
  }

  /**
   * The type the runtime needs to send an argument through a variable. Booleans, IDs and strings
   * can be inlined, which the runtime reads from the missing type.
   */
  static @Nullable String printArgumentTypeForMetadata(@Nullable RelayQLArgumentType argType) {
    if (argType == null || argType.isBoolean() || argType.isID() || argType.isString()) {
      return null;
    }
    return argType.getName(true);
  }

  private RelayQLField rootField(
      RelayQLDefinition definition, String operation, boolean enableValidation) {
    List<RelayQLField> rootFields = definition.getFields();
    if (enableValidation || rootFields.isEmpty()) {
      StructuralValidator.requireSingleRootField(definition, rootFields, operation);
    }
    return rootFields.get(0);
  }

  private ConcreteCall inputCall(RelayQLField rootField) {
    return new ConcreteCall(
        rootField.getName(), Map.of(), printVariable(TransformOptions.DEFAULT_INPUT_ARGUMENT_NAME));
  }

  private Map<String, Object> inputTypeMetadata(RelayQLField rootField) {
    String inputType =
        printArgumentTypeForMetadata(rootField.getDeclaredArgument(options.inputArgumentName()));
    return inputType == null ? Map.of() : Map.of("inputType", inputType);
  }

  /**
   * Whether to select {@code ... on Node { id }} so the record can be identified: the type may
   * implement {@code Node} and no fragment on {@code Node} is selected already. When the type has
   * {@code id} itself, that field is required instead.
   */
  private static boolean shouldGenerateIdFragment(RelayQLNodeWithSelections node) {
    if (!node.getType().mayImplement(ID_FRAGMENT_TYPE)) {
      return false;
    }
    for (RelayQLSelection selection : node.getSelections()) {
      if (selection instanceof RelayQLInlineFragment inline
          && inline.getFragment().getType().getName(false).equals(ID_FRAGMENT_TYPE)) {
        return false;
      }
    }
    return true;
  }

  private static RelayTransformException invalidRelayVariables(RelayQLFragment fragment) {
    return new RelayTransformException(
        ErrorCode.INVALID_RELAY_VARIABLES,
        "The variables argument to the @relay directive should be an array of strings.",
        fragment.getLocation());
  }

  /** Splits a selection set into fields and printed fragments, keeping source order. */
  private final class SelectionPartition implements RelayQLSelection.Visitor<Void> {
    final List<RelayQLField> fields = new ArrayList<>();
    final List<ConcreteSelection> fragments = new ArrayList<>();
    boolean didPrintFragmentReference;

    @Override
    public Void visitField(RelayQLField field) {
      fields.add(field);
      return null;
    }

    @Override
    public Void visitFragmentSpread(RelayQLFragmentSpread spread) {
      // Spreads are substitution slots by now; their directives were consumed upstream.
      if (spread.hasDirectives()) {
        throw new RelayTransformException(
            ErrorCode.UNSUPPORTED_SPREAD_DIRECTIVE,
            "Directives are not yet supported for `${fragment}`-style fragment references.",
            spread.getLocation());
      }
      fragments.add(new FragmentReference(spread.getName()));
      didPrintFragmentReference = true;
      return null;
    }

    @Override
    public Void visitInlineFragment(RelayQLInlineFragment inlineFragment) {
      fragments.add(printFragment(inlineFragment.getFragment()).asSelection());
      return null;
    }
  }

  /** A printed fragment, wrapped when it declares {@code @relay(variables: [...])}. */
  record PrintedFragment(ConcreteFragment node, @Nullable ParametrizedFragment parametrized) {

    ConcreteDefinition asDefinition() {
      return parametrized != null ? parametrized : node;
    }

    ConcreteSelection asSelection() {
      return parametrized != null ? parametrized : node;
    }
  }
}
