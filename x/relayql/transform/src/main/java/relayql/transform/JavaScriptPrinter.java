package relayql.transform;

import com.fasterxml.jackson.core.io.JsonStringEncoder;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stringtemplate.v4.ST;
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
 * Prints compiled definitions as JavaScript that replaces the embedded literal.
 *
 * <p>An artifact becomes a function of the runtime helpers, named by {@link
 * TransformOptions#tagName()}. Each substitution slot is bound to a constant before the artifact
 * object is returned. In the printed tree, run-time values are calls on the helpers: {@code
 * __frag(slot)} for a fragment reference, {@code __var(name)} for a substitution variable, {@code
 * __id()} for a generated fragment id and {@code __createFragment(fragment, variables)} for a
 * parametrized fragment. A selection array that contains references is flattened with {@code
 * [].concat.apply([], ...)}.
 */
public final class JavaScriptPrinter {

  private static final Logger log = LoggerFactory.getLogger(JavaScriptPrinter.class);

  private static final Pattern IDENTIFIER = Pattern.compile("^[$a-zA-Z_][$a-z0-9A-Z_]*$");
  private static final String INDENT = "  ";

  private final String tagName;

  public JavaScriptPrinter(TransformOptions options) {
    this.tagName = options.tagName();
  }

  public String print(TagReplacement replacement) {
    if (replacement instanceof TagReplacement.Single single) {
      return print(single.artifact());
    }
    TagReplacement.FragmentMap map = (TagReplacement.FragmentMap) replacement;
    List<FragmentMapModel.Entry> entries = new ArrayList<>();
    map.artifacts()
        .forEach(
            (propertyName, artifact) ->
                entries.add(
                    new FragmentMapModel.Entry(propertyKey(propertyName), print(artifact))));
    return FragmentMapGenerator.generate(new FragmentMapModel(entries));
  }

  public String print(ConcreteArtifact artifact) {
    List<ArtifactModel.Initializer> initializers = new ArrayList<>();
    for (FragmentInitializer initializer : artifact.initializers()) {
      initializers.add(
          new ArtifactModel.Initializer(
              initializer.substitutionName(), render(initializerValue(initializer))));
    }
    String body = render(artifactValue(artifact));
    log.debug(
        "Printing {} {} with {} initializers",
        artifact.kind().wireName(),
        artifact.node().name(),
        initializers.size());
    return ArtifactGenerator.generate(new ArtifactModel(tagName, initializers, body));
  }

  /** Prints a tree as one JavaScript expression, as a classic {@code Relay.QL} literal needs. */
  public String printExpression(Concrete value) {
    return render(value.accept(new ExpressionBuilder()));
  }

  private Map<String, Object> artifactValue(ConcreteArtifact artifact) {
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("kind", artifact.kind().wireName());
    List<Object> arguments = new ArrayList<>();
    for (ArgumentDefinition argument : artifact.argumentDefinitions()) {
      Map<String, Object> definition = new LinkedHashMap<>();
      definition.put("kind", argument.kind());
      definition.put("name", argument.name());
      if (argument instanceof ArgumentDefinition.LocalArgument local) {
        definition.put("defaultValue", payload(local.defaultValue()));
      }
      arguments.add(definition);
    }
    result.put("argumentDefinitions", arguments);
    if (artifact.operation() != null) {
      result.put("params", new LinkedHashMap<>());
      result.put("name", artifact.name());
      result.put("operation", artifact.operation());
    }
    result.put("node", artifact.node().accept(new ExpressionBuilder()));
    return result;
  }

  private Object initializerValue(FragmentInitializer initializer) {
    String module = initializer.moduleName();
    String property = initializer.propertyName();
    if (initializer instanceof FragmentInitializer.Masked masked) {
      String container =
          masked.containerCheck() ? "(" + module + ".__container__ || " + module + ")" : module;
      List<Object> arguments = new ArrayList<>();
      arguments.add(property);
      if (masked.arguments() != null) {
        arguments.add(payload(masked.arguments()));
      }
      return new Call(container + ".getFragment", arguments);
    }
    FragmentInitializer.Unmasked unmasked = (FragmentInitializer.Unmasked) initializer;
    String source =
        unmasked.localPropertyBinding()
            ? property + "." + property
            : module + "." + property + "." + property + " || " + module + "." + property;
    return new Code(tagName + ".__getClassicFragment(" + source + ", true).node");
  }

  /** Literal payloads: scalars, lists, input objects and fragment-argument variables. */
  private @Nullable Object payload(@Nullable Object value) {
    if (value instanceof List<?> list) {
      List<Object> result = new ArrayList<>();
      for (Object item : list) {
        result.add(payload(item));
      }
      return result;
    }
    if (value instanceof Map<?, ?> map) {
      Map<String, Object> result = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        result.put(String.valueOf(entry.getKey()), payload(entry.getValue()));
      }
      return result;
    }
    if (value instanceof Concrete concrete) {
      return concrete.accept(new ExpressionBuilder());
    }
    return value;
  }

  static String propertyKey(String name) {
    return IDENTIFIER.matcher(name).matches() ? name : quote(name);
  }

  private static String quote(String text) {
    return '"' + new String(JsonStringEncoder.getInstance().quoteAsString(text)) + '"';
  }

  private static String render(@Nullable Object value) {
    StringBuilder out = new StringBuilder();
    write(out, value, "");
    return out.toString();
  }

  private static void write(StringBuilder out, @Nullable Object value, String indent) {
    if (value == null) {
      out.append("null");
    } else if (value instanceof String string) {
      out.append(quote(string));
    } else if (value instanceof Boolean || value instanceof BigInteger) {
      out.append(value);
    } else if (value instanceof Number number) {
      out.append(number instanceof Double ? number.toString() : Long.toString(number.longValue()));
    } else if (value instanceof Code code) {
      out.append(code.text());
    } else if (value instanceof Call call) {
      out.append(call.callee()).append('(');
      for (int i = 0; i < call.arguments().size(); i++) {
        if (i > 0) {
          out.append(", ");
        }
        write(out, call.arguments().get(i), indent);
      }
      out.append(')');
    } else if (value instanceof Map<?, ?> map) {
      if (map.isEmpty()) {
        out.append("{}");
        return;
      }
      String inner = indent + INDENT;
      out.append("{\n");
      int i = 0;
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        out.append(inner).append(propertyKey(String.valueOf(entry.getKey()))).append(": ");
        write(out, entry.getValue(), inner);
        out.append(++i < map.size() ? ",\n" : "\n");
      }
      out.append(indent).append('}');
    } else if (value instanceof List<?> list) {
      if (list.isEmpty()) {
        out.append("[]");
        return;
      }
      String inner = indent + INDENT;
      out.append("[\n");
      for (int i = 0; i < list.size(); i++) {
        out.append(inner);
        write(out, list.get(i), inner);
        out.append(i + 1 < list.size() ? ",\n" : "\n");
      }
      out.append(indent).append(']');
    } else {
      throw new IllegalArgumentException("Cannot print " + value.getClass().getName());
    }
  }

  /** Code printed as is. */
  private record Code(String text) {}

  /** A call whose arguments are printed as values. */
  private record Call(String callee, List<Object> arguments) {}

  /** Builds the printable value of a tree. Absent optional parts are left out. */
  private final class ExpressionBuilder implements ConcreteVisitor<Object> {

    @Override
    public Object visitQuery(ConcreteQuery query) {
      Map<String, Object> result = tagged(query.kind().wireName());
      result.put("name", query.name());
      result.put("type", query.type());
      result.put("fieldName", query.fieldName());
      putCalls(result, query.calls());
      putChildren(result, query.children());
      putDirectives(result, query.directives());
      result.put("metadata", payload(query.metadata()));
      return result;
    }

    @Override
    public Object visitMutation(ConcreteMutation mutation) {
      Map<String, Object> result = tagged(mutation.kind().wireName());
      result.put("name", mutation.name());
      result.put("responseType", mutation.responseType());
      putCalls(result, mutation.calls());
      putChildren(result, mutation.children());
      putDirectives(result, mutation.directives());
      result.put("metadata", payload(mutation.metadata()));
      return result;
    }

    @Override
    public Object visitSubscription(ConcreteSubscription subscription) {
      Map<String, Object> result = tagged(subscription.kind().wireName());
      result.put("name", subscription.name());
      result.put("responseType", subscription.responseType());
      putCalls(result, subscription.calls());
      putChildren(result, subscription.children());
      putDirectives(result, subscription.directives());
      result.put("metadata", payload(subscription.metadata()));
      return result;
    }

    @Override
    public Object visitFragment(ConcreteFragment fragment) {
      Map<String, Object> result = tagged(fragment.kind().wireName());
      result.put("name", fragment.name());
      result.put("type", fragment.type());
      result.put("id", fragment.id().accept(this));
      putChildren(result, fragment.children());
      putDirectives(result, fragment.directives());
      result.put("metadata", payload(fragment.metadata()));
      return result;
    }

    @Override
    public Object visitField(ConcreteField field) {
      Map<String, Object> result = tagged(field.kind().wireName());
      if (field.alias() != null) {
        result.put("alias", field.alias());
      }
      result.put("fieldName", field.fieldName());
      result.put("type", field.type());
      putCalls(result, field.calls());
      putChildren(result, field.children());
      putDirectives(result, field.directives());
      result.put("metadata", payload(field.metadata()));
      return result;
    }

    @Override
    public Object visitCall(ConcreteCall call) {
      Map<String, Object> result = tagged(call.kind().wireName());
      result.put("name", call.name());
      result.put("metadata", payload(call.metadata()));
      result.put("value", call.value().accept(this));
      return result;
    }

    @Override
    public Object visitCallVariable(CallVariable variable) {
      Map<String, Object> result = tagged(variable.kind().wireName());
      result.put("callVariableName", variable.callVariableName());
      return result;
    }

    @Override
    public Object visitCallValue(CallValue value) {
      Map<String, Object> result = tagged(value.kind().wireName());
      result.put("callValue", payload(value.callValue()));
      return result;
    }

    @Override
    public Object visitCallValueList(CallValueList values) {
      List<Object> result = new ArrayList<>();
      for (CallArgument value : values.values()) {
        result.add(value.accept(this));
      }
      return result;
    }

    @Override
    public Object visitDirective(ConcreteDirective directive) {
      Map<String, Object> result = tagged(directive.kind().wireName());
      result.put("name", directive.name());
      List<Object> args = new ArrayList<>();
      for (ConcreteDirective.Argument arg : directive.args()) {
        Map<String, Object> printed = new LinkedHashMap<>();
        printed.put("name", arg.name());
        printed.put("value", arg.value().accept(this));
        args.add(printed);
      }
      result.put("args", args);
      return result;
    }

    @Override
    public Object visitSelections(ConcreteSelections selections) {
      List<Object> array = new ArrayList<>();
      for (ConcreteSelection selection : selections.selections()) {
        array.add(selection.accept(this));
      }
      if (!selections.flatten()) {
        return array;
      }
      return new Call("[].concat.apply", List.of(new Code("[]"), array));
    }

    @Override
    public Object visitFragmentReference(FragmentReference reference) {
      return new Call(tagName + ".__frag", List.of(new Code(reference.substitutionName())));
    }

    @Override
    public Object visitSubstitutionVariable(SubstitutionVariable variable) {
      return new Call(tagName + ".__var", List.of(new Code(variable.name())));
    }

    @Override
    public Object visitFragmentId(GeneratedFragmentId id) {
      return new Call(tagName + ".__id", List.of());
    }

    @Override
    public Object visitParametrizedFragment(ParametrizedFragment fragment) {
      Map<String, Object> variables = new LinkedHashMap<>();
      fragment.variables().forEach((name, value) -> variables.put(name, value.accept(this)));
      return new Call(
          tagName + ".__createFragment",
          List.of(fragment.fragment().accept(this), variables));
    }

    private Map<String, Object> tagged(String kind) {
      Map<String, Object> result = new LinkedHashMap<>();
      result.put("kind", kind);
      return result;
    }

    private void putCalls(Map<String, Object> result, @Nullable List<ConcreteCall> calls) {
      if (calls != null) {
        List<Object> printed = new ArrayList<>();
        for (ConcreteCall call : calls) {
          printed.add(call.accept(this));
        }
        result.put("calls", printed);
      }
    }

    private void putChildren(Map<String, Object> result, @Nullable ConcreteSelections children) {
      if (children != null) {
        result.put("children", children.accept(this));
      }
    }

    private void putDirectives(
        Map<String, Object> result, @Nullable List<ConcreteDirective> directives) {
      if (directives != null) {
        List<Object> printed = new ArrayList<>();
        for (ConcreteDirective directive : directives) {
          printed.add(directive.accept(this));
        }
        result.put("directives", printed);
      }
    }
  }

  /** Generator for the function that returns one artifact. */
  static class ArtifactGenerator {
    private ArtifactGenerator() {}

    private static final String TEMPLATE =
        """
        function (<mdl.tagName>) {
          <if(mdl.hasInitializers)>
          <mdl.initializers: {i | const <i.name> = <i.expression>;}; separator="\\n">
          <endif>
          return <mdl.body>;
        }""";

    static String generate(ArtifactModel model) {
      ST st = new ST(TEMPLATE, '<', '>');
      st.add("mdl", model);
      return st.render();
    }
  }

  /** Generator for the object that holds the artifacts of several fragments. */
  static class FragmentMapGenerator {
    private FragmentMapGenerator() {}

    private static final String TEMPLATE =
        """
        {
          <mdl.entries: {e | <e.key>: <e.value>}; separator=",\\n">
        }""";

    static String generate(FragmentMapModel model) {
      ST st = new ST(TEMPLATE, '<', '>');
      st.add("mdl", model);
      return st.render();
    }
  }
}
