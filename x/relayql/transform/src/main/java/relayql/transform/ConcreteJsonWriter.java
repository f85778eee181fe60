package relayql.transform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import relayql.api.artifact.ArgumentDefinition;
import relayql.api.artifact.ConcreteArtifact;
import relayql.api.artifact.FragmentInitializer;
import relayql.api.cqir.CallArgument;
import relayql.api.cqir.CallValue;
import relayql.api.cqir.CallValueList;
import relayql.api.cqir.CallVariable;
import relayql.api.cqir.Concrete;
import relayql.api.cqir.ConcreteCall;
import relayql.api.cqir.ConcreteDirective;
import relayql.api.cqir.ConcreteField;
import relayql.api.cqir.ConcreteFragment;
import relayql.api.cqir.ConcreteMutation;
import relayql.api.cqir.ConcreteQuery;
import relayql.api.cqir.ConcreteSelection;
import relayql.api.cqir.ConcreteSelections;
import relayql.api.cqir.ConcreteSubscription;
import relayql.api.cqir.ConcreteVisitor;
import relayql.api.cqir.FragmentReference;
import relayql.api.cqir.GeneratedFragmentId;
import relayql.api.cqir.ParametrizedFragment;
import relayql.api.cqir.SubstitutionVariable;

/**
 * Writes concrete trees and artifacts as JSON. Keys keep the order the printer produced them in,
 * so the same input always yields the same text.
 *
 * <p>Absent optional parts ({@code calls}, {@code children}, {@code directives}, {@code alias})
 * are omitted; a null call value is written as {@code null}. Run-time expressions are written as
 * objects tagged with their own {@code kind}: {@code FragmentReference}, {@code
 * SubstitutionVariable}, {@code GeneratedFragmentId}, {@code ParametrizedFragment}, and {@code
 * Flatten} for a selection array that contains fragment references.
 */
public final class ConcreteJsonWriter {

  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  private final ObjectMapper mapper;

  public ConcreteJsonWriter() {
    this.mapper = JsonMapper.builder().enable(SerializationFeature.INDENT_OUTPUT).build();
  }

  public JsonNode toJsonNode(Concrete value) {
    return value.accept(new TreeBuilder());
  }

  public ObjectNode toJsonNode(ConcreteArtifact artifact) {
    ObjectNode result = NODES.objectNode();
    result.put("kind", artifact.kind().wireName());
    ArrayNode arguments = result.putArray("argumentDefinitions");
    for (ArgumentDefinition argument : artifact.argumentDefinitions()) {
      ObjectNode definition = arguments.addObject();
      definition.put("kind", argument.kind());
      definition.put("name", argument.name());
      if (argument instanceof ArgumentDefinition.LocalArgument local) {
        definition.set("defaultValue", payload(local.defaultValue()));
      }
    }
    if (artifact.operation() != null) {
      result.putObject("params");
      result.put("name", artifact.name());
      result.put("operation", artifact.operation());
    }
    result.set("node", toJsonNode(artifact.node()));
    ArrayNode initializers = result.putArray("initializers");
    for (FragmentInitializer initializer : artifact.initializers()) {
      initializers.add(initializer(initializer));
    }
    return result;
  }

  public String write(Concrete value) {
    return serialize(toJsonNode(value));
  }

  public String write(ConcreteArtifact artifact) {
    return serialize(toJsonNode(artifact));
  }

  private String serialize(JsonNode node) {
    try {
      return mapper.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      // A tree of plain JSON nodes always serializes.
      throw new IllegalStateException(e);
    }
  }

  private ObjectNode initializer(FragmentInitializer initializer) {
    ObjectNode result = NODES.objectNode();
    if (initializer instanceof FragmentInitializer.Masked masked) {
      result.put("kind", "MaskedFragment");
      putNames(result, masked);
      result.put("containerCheck", masked.containerCheck());
      Map<String, Object> arguments = masked.arguments();
      if (arguments != null) {
        result.set("arguments", payload(arguments));
      }
    } else if (initializer instanceof FragmentInitializer.Unmasked unmasked) {
      result.put("kind", "UnmaskedFragment");
      putNames(result, unmasked);
      result.put("localPropertyBinding", unmasked.localPropertyBinding());
    }
    return result;
  }

  private static void putNames(ObjectNode result, FragmentInitializer initializer) {
    result.put("substitutionName", initializer.substitutionName());
    result.put("fragmentName", initializer.fragmentName());
    result.put("moduleName", initializer.moduleName());
    result.put("propertyName", initializer.propertyName());
  }

  /** Literal payloads: scalars, lists, input objects and fragment-argument variables. */
  private JsonNode payload(@Nullable Object value) {
    if (value == null) {
      return NODES.nullNode();
    }
    if (value instanceof String string) {
      return NODES.textNode(string);
    }
    if (value instanceof Boolean bool) {
      return NODES.booleanNode(bool);
    }
    if (value instanceof BigInteger integer) {
      return NODES.numberNode(integer);
    }
    if (value instanceof Double decimal) {
      return NODES.numberNode(decimal);
    }
    if (value instanceof Number number) {
      return NODES.numberNode(number.longValue());
    }
    if (value instanceof List<?> list) {
      ArrayNode array = NODES.arrayNode();
      for (Object item : list) {
        array.add(payload(item));
      }
      return array;
    }
    if (value instanceof Map<?, ?> map) {
      ObjectNode object = NODES.objectNode();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        object.set(String.valueOf(entry.getKey()), payload(entry.getValue()));
      }
      return object;
    }
    if (value instanceof Concrete concrete) {
      return toJsonNode(concrete);
    }
    throw new IllegalArgumentException("Not a literal payload: " + value.getClass().getName());
  }

  private final class TreeBuilder implements ConcreteVisitor<JsonNode> {

    @Override
    public JsonNode visitQuery(ConcreteQuery query) {
      ObjectNode result = tagged(query.kind().wireName());
      result.put("name", query.name());
      result.put("type", query.type());
      result.put("fieldName", query.fieldName());
      putCalls(result, query.calls());
      putChildren(result, query.children());
      putDirectives(result, query.directives());
      result.set("metadata", payload(query.metadata()));
      return result;
    }

    @Override
    public JsonNode visitMutation(ConcreteMutation mutation) {
      ObjectNode result = tagged(mutation.kind().wireName());
      result.put("name", mutation.name());
      result.put("responseType", mutation.responseType());
      putCalls(result, mutation.calls());
      putChildren(result, mutation.children());
      putDirectives(result, mutation.directives());
      result.set("metadata", payload(mutation.metadata()));
      return result;
    }

    @Override
    public JsonNode visitSubscription(ConcreteSubscription subscription) {
      ObjectNode result = tagged(subscription.kind().wireName());
      result.put("name", subscription.name());
      result.put("responseType", subscription.responseType());
      putCalls(result, subscription.calls());
      putChildren(result, subscription.children());
      putDirectives(result, subscription.directives());
      result.set("metadata", payload(subscription.metadata()));
      return result;
    }

    @Override
    public JsonNode visitFragment(ConcreteFragment fragment) {
      ObjectNode result = tagged(fragment.kind().wireName());
      result.put("name", fragment.name());
      result.put("type", fragment.type());
      result.set("id", fragment.id().accept(this));
      putChildren(result, fragment.children());
      putDirectives(result, fragment.directives());
      result.set("metadata", payload(fragment.metadata()));
      return result;
    }

    @Override
    public JsonNode visitField(ConcreteField field) {
      ObjectNode result = tagged(field.kind().wireName());
      if (field.alias() != null) {
        result.put("alias", field.alias());
      }
      result.put("fieldName", field.fieldName());
      result.put("type", field.type());
      putCalls(result, field.calls());
      putChildren(result, field.children());
      putDirectives(result, field.directives());
      result.set("metadata", payload(field.metadata()));
      return result;
    }

    @Override
    public JsonNode visitCall(ConcreteCall call) {
      ObjectNode result = tagged(call.kind().wireName());
      result.put("name", call.name());
      result.set("metadata", payload(call.metadata()));
      result.set("value", call.value().accept(this));
      return result;
    }

    @Override
    public JsonNode visitCallVariable(CallVariable variable) {
      ObjectNode result = tagged(variable.kind().wireName());
      result.put("callVariableName", variable.callVariableName());
      return result;
    }

    @Override
    public JsonNode visitCallValue(CallValue value) {
      ObjectNode result = tagged(value.kind().wireName());
      result.set("callValue", payload(value.callValue()));
      return result;
    }

    @Override
    public JsonNode visitCallValueList(CallValueList values) {
      ArrayNode result = NODES.arrayNode();
      for (CallArgument value : values.values()) {
        result.add(value.accept(this));
      }
      return result;
    }

    @Override
    public JsonNode visitDirective(ConcreteDirective directive) {
      ObjectNode result = tagged(directive.kind().wireName());
      result.put("name", directive.name());
      ArrayNode args = result.putArray("args");
      for (ConcreteDirective.Argument arg : directive.args()) {
        ObjectNode printed = args.addObject();
        printed.put("name", arg.name());
        printed.set("value", arg.value().accept(this));
      }
      return result;
    }

    @Override
    public JsonNode visitSelections(ConcreteSelections selections) {
      ArrayNode array = NODES.arrayNode();
      for (ConcreteSelection selection : selections.selections()) {
        array.add(selection.accept(this));
      }
      if (!selections.flatten()) {
        return array;
      }
      ObjectNode result = tagged("Flatten");
      result.set("selections", array);
      return result;
    }

    @Override
    public JsonNode visitFragmentReference(FragmentReference reference) {
      ObjectNode result = tagged("FragmentReference");
      result.put("substitutionName", reference.substitutionName());
      return result;
    }

    @Override
    public JsonNode visitSubstitutionVariable(SubstitutionVariable variable) {
      ObjectNode result = tagged("SubstitutionVariable");
      result.put("name", variable.name());
      return result;
    }

    @Override
    public JsonNode visitFragmentId(GeneratedFragmentId id) {
      return tagged("GeneratedFragmentId");
    }

    @Override
    public JsonNode visitParametrizedFragment(ParametrizedFragment fragment) {
      ObjectNode result = tagged("ParametrizedFragment");
      result.set("fragment", fragment.fragment().accept(this));
      ObjectNode variables = result.putObject("variables");
      fragment.variables().forEach((name, value) -> variables.set(name, value.accept(this)));
      return result;
    }

    private ObjectNode tagged(String kind) {
      ObjectNode result = NODES.objectNode();
      result.put("kind", kind);
      return result;
    }

    private void putCalls(ObjectNode result, @Nullable List<ConcreteCall> calls) {
      if (calls != null) {
        ArrayNode array = result.putArray("calls");
        for (ConcreteCall call : calls) {
          array.add(call.accept(this));
        }
      }
    }

    private void putChildren(ObjectNode result, @Nullable ConcreteSelections children) {
      if (children != null) {
        result.set("children", children.accept(this));
      }
    }

    private void putDirectives(ObjectNode result, @Nullable List<ConcreteDirective> directives) {
      if (directives != null) {
        ArrayNode array = result.putArray("directives");
        for (ConcreteDirective directive : directives) {
          array.add(directive.accept(this));
        }
      }
    }
  }
}
