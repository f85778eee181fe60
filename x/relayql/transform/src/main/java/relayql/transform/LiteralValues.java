package relayql.transform;

import graphql.language.ArrayValue;
import graphql.language.BooleanValue;
import graphql.language.EnumValue;
import graphql.language.FloatValue;
import graphql.language.IntValue;
import graphql.language.NullValue;
import graphql.language.ObjectField;
import graphql.language.ObjectValue;
import graphql.language.SourceLocation;
import graphql.language.StringValue;
import graphql.language.Value;
import graphql.language.VariableReference;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** Converts literal AST values into the plain payloads written to the output. */
final class LiteralValues {

  private LiteralValues() {}

  /**
   * The payload of a literal call value: scalars, lists, null and input objects (field order
   * kept). Enum values become their names.
   */
  static @Nullable Object toPayload(Value<?> value, @Nullable SourceLocation location) {
    if (value instanceof ArrayValue array) {
      List<@Nullable Object> items = new ArrayList<>();
      for (Value<?> item : array.getValues()) {
        items.add(toPayload(item, location));
      }
      return items;
    }
    if (value instanceof ObjectValue object) {
      Map<String, @Nullable Object> fields = new LinkedHashMap<>();
      for (ObjectField field : object.getObjectFields()) {
        fields.put(field.getName(), toPayload(field.getValue(), location));
      }
      return fields;
    }
    if (value instanceof NullValue) {
      return null;
    }
    if (value instanceof VariableReference variable) {
      throw new RelayTransformException(
          ErrorCode.UNSUPPORTED_LITERAL,
          String.format(
              "Unexpected nested variable `%s`; variables are supported as top-level "
                  + "arguments - `node(id: $id)` - or directly within lists - "
                  + "`nodes(ids: [$id])`.",
              variable.getName()),
          location);
    }
    return toScalar(value, location);
  }

  /**
   * The value of a fragment argument or variable default: scalars, enum names and lists of them.
   * Null and input object literals are rejected.
   */
  static Object toArgumentValue(Value<?> value, @Nullable SourceLocation location) {
    if (value instanceof ArrayValue array) {
      List<Object> items = new ArrayList<>();
      for (Value<?> item : array.getValues()) {
        items.add(toArgumentValue(item, location));
      }
      return items;
    }
    return toScalar(value, location);
  }

  private static Object toScalar(Value<?> value, @Nullable SourceLocation location) {
    if (value instanceof BooleanValue bool) {
      return bool.isValue();
    }
    if (value instanceof IntValue integer) {
      return toNumber(integer.getValue());
    }
    if (value instanceof FloatValue decimal) {
      return decimal.getValue().doubleValue();
    }
    if (value instanceof StringValue string) {
      return string.getValue();
    }
    if (value instanceof EnumValue enumValue) {
      return enumValue.getName();
    }
    throw new RelayTransformException(
        ErrorCode.UNSUPPORTED_LITERAL,
        "Unsupported literal type `" + value.getClass().getSimpleName() + "`.",
        location);
  }

  private static Number toNumber(BigInteger value) {
    if (value.bitLength() < Long.SIZE) {
      return Long.valueOf(value.longValue());
    }
    return value;
  }
}
