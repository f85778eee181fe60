package relayql.transform;

import graphql.language.Definition;
import graphql.language.Document;
import graphql.language.FragmentDefinition;
import graphql.language.OperationDefinition;
import graphql.parser.InvalidSyntaxException;
import graphql.parser.Parser;
import graphql.schema.GraphQLSchema;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import relayql.api.artifact.ConcreteArtifact;
import relayql.api.cqir.ConcreteDefinition;

/**
 * Entry point for compiling embedded GraphQL literals against one schema.
 *
 * <p>A {@code graphql} literal may hold one operation or any number of fragments; {@link
 * #compileGraphQLTag} compiles each definition into a {@link ConcreteArtifact}. A classic {@code
 * Relay.QL} literal holds exactly one definition and is printed directly by {@link
 * #compileRelayQL}.
 *
 * <p>Instances are immutable and can be shared between threads.
 */
public final class RelayQLCompiler {

  private static final Logger log = LoggerFactory.getLogger(RelayQLCompiler.class);

  private final TransformOptions options;
  private final RelayQLContext context;
  private final ArtifactAssembler assembler;

  public RelayQLCompiler(GraphQLSchema schema, TransformOptions options) {
    Objects.requireNonNull(schema, "schema");
    this.options = Objects.requireNonNull(options, "options");
    this.context = RelayQLContext.of(schema, options);
    this.assembler = new ArtifactAssembler(schema, options);
  }

  public RelayQLCompiler(GraphQLSchema schema) {
    this(schema, TransformOptions.defaults());
  }

  public TransformOptions getOptions() {
    return options;
  }

  /**
   * Parses query text.
   *
   * @throws RelayTransformException with {@link ErrorCode#INVALID_SYNTAX} when the text does not
   *     parse
   */
  public static Document parse(String text) {
    try {
      return Parser.parse(text);
    } catch (InvalidSyntaxException e) {
      throw new RelayTransformException(
          ErrorCode.INVALID_SYNTAX, String.valueOf(e.getMessage()), e.getLocation(), e);
    }
  }

  /**
   * Compiles the text of a {@code graphql} literal.
   *
   * @param scope the names bound where the literal appears
   * @param assignedPropertyName the object property the literal is assigned to, if any
   */
  public TagReplacement compileGraphQLTag(
      String text, BindingScope scope, @Nullable String assignedPropertyName) {
    return compileGraphQLTag(parse(text), scope, assignedPropertyName);
  }

  /**
   * Compiles a parsed {@code graphql} literal. A literal assigned to an object property must hold
   * one fragment; otherwise it may hold several fragments, keyed by property name in the result.
   * An operation must be alone in its literal.
   */
  public TagReplacement compileGraphQLTag(
      Document document, BindingScope scope, @Nullable String assignedPropertyName) {
    List<Definition> definitions = document.getDefinitions();
    Definition<?> mainDefinition = definitions.get(0);

    if (mainDefinition instanceof FragmentDefinition) {
      if (assignedPropertyName != null) {
        if (definitions.size() != 1) {
          throw new RelayTransformException(
              ErrorCode.UNEXPECTED_DEFINITIONS,
              "Expected exactly one fragment in the graphql tag referenced by the property "
                  + assignedPropertyName
                  + ".",
              mainDefinition.getSourceLocation());
        }
        return new TagReplacement.Single(compileDefinition(mainDefinition, scope));
      }

      Map<String, ConcreteArtifact> artifacts = new LinkedHashMap<>();
      for (Definition<?> definition : definitions) {
        if (!(definition instanceof FragmentDefinition fragment)) {
          throw new RelayTransformException(
              ErrorCode.UNEXPECTED_DEFINITIONS,
              "Expected only fragments within this graphql tag.",
              definition.getSourceLocation());
        }
        String propertyName =
            FragmentNameParts.parse(fragment.getName(), fragment.getSourceLocation())
                .propertyName();
        artifacts.put(propertyName, compileDefinition(fragment, scope));
      }
      return new TagReplacement.FragmentMap(artifacts);
    }

    if (mainDefinition instanceof OperationDefinition) {
      if (definitions.size() != 1) {
        throw new RelayTransformException(
            ErrorCode.UNEXPECTED_DEFINITIONS,
            "Expected exactly one operation (query, mutation, or subscription) per graphql tag.",
            definitions.get(1).getSourceLocation());
      }
      return new TagReplacement.Single(compileDefinition(mainDefinition, scope));
    }

    throw new RelayTransformException(
        ErrorCode.UNSUPPORTED_DEFINITION,
        "Expected a fragment, mutation, query, or subscription, got `"
            + mainDefinition.getClass().getSimpleName()
            + "`.",
        mainDefinition.getSourceLocation());
  }

  /** Compiles one definition with fresh slot numbering. */
  public ConcreteArtifact compileDefinition(Definition<?> definition, BindingScope scope) {
    ConcreteArtifact artifact = assembler.assemble(definition, scope);
    log.debug(
        "Compiled {} {} with {} substitution slots",
        artifact.kind().wireName(),
        artifact.node().name(),
        artifact.initializers().size());
    return artifact;
  }

  /** Prints a {@code Relay.QL} literal with the configured validation setting. */
  public ConcreteDefinition compileRelayQL(String text, Set<String> substitutionNames) {
    return compileRelayQL(text, substitutionNames, options.enableValidation());
  }

  /**
   * Prints a {@code Relay.QL} literal.
   *
   * @param substitutionNames the names of the literal's substitutions; spreads and variables with
   *     these names are read from them at run time
   */
  public ConcreteDefinition compileRelayQL(
      String text, Set<String> substitutionNames, boolean enableValidation) {
    Document document = parse(text);
    List<Definition> definitions = document.getDefinitions();
    if (definitions.size() != 1) {
      throw new RelayTransformException(
          ErrorCode.UNEXPECTED_DEFINITIONS,
          String.format(
              "You supplied a GraphQL document with %d definitions, but `Relay.QL` expects "
                  + "exactly one.",
              definitions.size()),
          null);
    }
    RelayQLDefinition definition = RelayQLDefinition.of(context, definitions.get(0));
    ConcreteDefinition printed =
        new RelayQLPrinter(options, substitutionNames).print(definition, enableValidation);
    log.debug("Printed {} with validation {}", printed.name(), enableValidation);
    return printed;
  }
}
