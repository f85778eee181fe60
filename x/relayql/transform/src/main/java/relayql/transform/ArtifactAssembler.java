package relayql.transform;

import graphql.language.Argument;
import graphql.language.Definition;
import graphql.language.FragmentDefinition;
import graphql.language.ObjectField;
import graphql.language.ObjectValue;
import graphql.language.OperationDefinition;
import graphql.language.TypeName;
import graphql.language.VariableDefinition;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLSchema;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import relayql.api.artifact.ArgumentDefinition;
import relayql.api.artifact.ArtifactKind;
import relayql.api.artifact.ConcreteArtifact;
import relayql.api.artifact.FragmentInitializer;
import relayql.api.cqir.ConcreteDefinition;

/**
 * Compiles one definition into the artifact that replaces it: normalize, resolve the
 * substitution slots, print, then attach the argument definitions.
 *
 * <p>Definitions compiled here are checked by a separate compiler, so root-field validation is
 * off. Queries are printed as a fragment on the query root type named after the query.
 */
public final class ArtifactAssembler {

  private static final Logger log = LoggerFactory.getLogger(ArtifactAssembler.class);

  static final String DEFAULT_VALUE = "defaultValue";

  private final GraphQLSchema schema;
  private final RelayQLContext context;
  private final RelayQLPrinter printer;

  public ArtifactAssembler(GraphQLSchema schema, TransformOptions options) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.context = RelayQLContext.of(schema, options);
    this.printer = new RelayQLPrinter(options, Set.of());
  }

  /**
   * @param scope the names bound where the definition appears, used to resolve unmasked spreads
   */
  public ConcreteArtifact assemble(Definition<?> definition, BindingScope scope) {
    if (definition instanceof FragmentDefinition fragment) {
      return assembleFragment(fragment, scope);
    }
    if (definition instanceof OperationDefinition operation) {
      return assembleOperation(operation, scope);
    }
    throw new RelayTransformException(
        ErrorCode.UNSUPPORTED_DEFINITION,
        "Expected a fragment, mutation, query, or subscription, got `"
            + definition.getClass().getSimpleName()
            + "`.",
        definition.getSourceLocation());
  }

  private ConcreteArtifact assembleFragment(FragmentDefinition fragment, BindingScope scope) {
    FragmentNameParts.parse(fragment.getName(), fragment.getSourceLocation());
    NormalizedDocument document = DocumentNormalizer.normalize(fragment);
    List<FragmentInitializer> initializers =
        FragmentReferenceResolver.resolve(document.slots(), scope);
    ConcreteDefinition node =
        printer.print(RelayQLDefinition.of(context, document.definition()), false);

    List<ArgumentDefinition> argumentDefinitions = new ArrayList<>();
    for (String variable : document.variables()) {
      Argument declared = findArgumentDefinition(document.argumentDefinitions(), variable);
      if (declared == null) {
        argumentDefinitions.add(new ArgumentDefinition.RootArgument(variable));
      } else {
        argumentDefinitions.add(
            new ArgumentDefinition.LocalArgument(variable, defaultValueOf(declared)));
      }
    }

    log.debug(
        "Assembled fragment {} with {} arguments and {} initializers",
        fragment.getName(),
        argumentDefinitions.size(),
        initializers.size());
    return new ConcreteArtifact(
        ArtifactKind.FRAGMENT_DEFINITION, null, null, argumentDefinitions, node, initializers);
  }

  private ConcreteArtifact assembleOperation(OperationDefinition operation, BindingScope scope) {
    String name = operation.getName();
    if (name == null) {
      throw new RelayTransformException(
          ErrorCode.MISSING_DEFINITION_NAME,
          "GraphQL operations must contain names.",
          operation.getSourceLocation());
    }
    NormalizedDocument document = DocumentNormalizer.normalize(operation);
    List<FragmentInitializer> initializers =
        FragmentReferenceResolver.resolve(document.slots(), scope);
    OperationDefinition normalized = (OperationDefinition) document.definition();

    Definition<?> printed = normalized;
    if (normalized.getOperation() == OperationDefinition.Operation.QUERY) {
      printed = asFragmentOnQueryType(normalized, name);
    }
    ConcreteDefinition node = printer.print(RelayQLDefinition.of(context, printed), false);

    List<ArgumentDefinition> argumentDefinitions = new ArrayList<>();
    for (VariableDefinition variable : operation.getVariableDefinitions()) {
      Object defaultValue =
          variable.getDefaultValue() == null
              ? null
              : LiteralValues.toArgumentValue(
                  variable.getDefaultValue(), variable.getSourceLocation());
      argumentDefinitions.add(
          new ArgumentDefinition.LocalArgument(variable.getName(), defaultValue));
    }

    String operationName = normalized.getOperation().name().toLowerCase(Locale.ROOT);
    log.debug(
        "Assembled {} {} with {} arguments and {} initializers",
        operationName,
        name,
        argumentDefinitions.size(),
        initializers.size());
    return new ConcreteArtifact(
        ArtifactKind.OPERATION_DEFINITION,
        name,
        operationName,
        argumentDefinitions,
        node,
        initializers);
  }

  private FragmentDefinition asFragmentOnQueryType(OperationDefinition query, String name) {
    GraphQLObjectType queryType = schema.getQueryType();
    if (queryType == null) {
      throw new RelayTransformException(
          ErrorCode.MISSING_ROOT_TYPE,
          "Schema does not contain a root query type.",
          query.getSourceLocation());
    }
    return FragmentDefinition.newFragmentDefinition()
        .name(name)
        .typeCondition(new TypeName(queryType.getName()))
        .directives(query.getDirectives())
        .selectionSet(query.getSelectionSet())
        .sourceLocation(query.getSourceLocation())
        .build();
  }

  private static @Nullable Argument findArgumentDefinition(
      @Nullable List<Argument> argumentDefinitions, String name) {
    if (argumentDefinitions == null) {
      return null;
    }
    for (Argument argument : argumentDefinitions) {
      if (argument.getName().equals(name)) {
        return argument;
      }
    }
    return null;
  }

  /**
   * The {@code defaultValue} of an {@code @argumentDefinitions} entry such as {@code {type:
   * "Int", defaultValue: 10}}.
   */
  private static @Nullable Object defaultValueOf(Argument declared) {
    if (!(declared.getValue() instanceof ObjectValue definition)) {
      throw new RelayTransformException(
          ErrorCode.INVALID_ARGUMENT_DEFINITION,
          String.format(
              "Expected the argument definition of `%s` to be an object like "
                  + "`{type: \"Int\", defaultValue: 10}`.",
              declared.getName()),
          declared.getSourceLocation());
    }
    for (ObjectField field : definition.getObjectFields()) {
      if (field.getName().equals(DEFAULT_VALUE)) {
        return LiteralValues.toArgumentValue(field.getValue(), field.getSourceLocation());
      }
    }
    return null;
  }
}
