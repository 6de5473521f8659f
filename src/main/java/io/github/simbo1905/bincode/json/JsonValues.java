// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BinaryNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Converts a [Value] tree to and from Jackson's JSON tree model. Going to JSON always succeeds:
/// a `Blob` becomes base64 text and a non-finite `Float` becomes its `Double.toString` text.
/// Coming back, integral numbers that fit 64 bits become `Integer`, unsigned numbers up to
/// 2^64-1 become the `Integer` with the same bit pattern, and every other number becomes `Float`.
/// The trip is therefore lossy for `Blob` and non-finite `Float`, which come back as `String`.
public final class JsonValues {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
  private static final BigInteger TWO_TO_THE_64 = BigInteger.ONE.shiftLeft(64);

  private JsonValues() {
  }

  public static JsonNode toJson(Value value) {
    return toJson(value, ValueConfig.current());
  }

  public static JsonNode toJson(Value value, ValueConfig config) {
    Objects.requireNonNull(value, "value must not be null");
    Objects.requireNonNull(config, "config must not be null");
    return toJson(value, config, 0);
  }

  private static JsonNode toJson(Value value, ValueConfig config, int depth) {
    return switch (value.tag()) {
      case NULL -> NODES.nullNode();
      case BOOLEAN -> NODES.booleanNode(((Value.BooleanValue) value).value());
      case BLOB -> NODES.textNode(Base64.getEncoder().encodeToString(((Value.BlobValue) value).unsafeBytes()));
      case ARRAY -> {
        config.checkDepth(depth + 1);
        final ArrayNode array = NODES.arrayNode();
        ((Value.ArrayValue) value).elements().forEach(element -> array.add(toJson(element, config, depth + 1)));
        yield array;
      }
      case INTEGER -> NODES.numberNode(((Value.IntegerValue) value).value());
      case FLOAT -> {
        final double d = ((Value.FloatValue) value).value();
        yield Double.isFinite(d) ? NODES.numberNode(d) : NODES.textNode(Double.toString(d));
      }
      case OBJECT -> {
        config.checkDepth(depth + 1);
        final ObjectNode object = NODES.objectNode();
        ((Value.ObjectValue) value).fields().forEach((k, v) -> object.set(k, toJson(v, config, depth + 1)));
        yield object;
      }
      case STRING -> NODES.textNode(((Value.StringValue) value).value());
    };
  }

  public static Value fromJson(JsonNode node) {
    return fromJson(node, ValueConfig.current());
  }

  public static Value fromJson(JsonNode node, ValueConfig config) {
    Objects.requireNonNull(node, "node must not be null");
    Objects.requireNonNull(config, "config must not be null");
    return fromJson(node, config, 0);
  }

  private static Value fromJson(JsonNode node, ValueConfig config, int depth) {
    if (node.isNull() || node.isMissingNode()) {
      return Value.NULL;
    }
    if (node.isBoolean()) {
      return new Value.BooleanValue(node.booleanValue());
    }
    if (node instanceof BinaryNode binary) {
      return new Value.BlobValue(binary.binaryValue());
    }
    if (node.isIntegralNumber()) {
      if (node.canConvertToLong()) {
        return new Value.IntegerValue(node.longValue());
      }
      final BigInteger big = node.bigIntegerValue();
      if (big.signum() > 0 && big.compareTo(TWO_TO_THE_64) < 0) {
        return new Value.IntegerValue(big.longValue());
      }
      return new Value.FloatValue(node.doubleValue());
    }
    if (node.isNumber()) {
      return new Value.FloatValue(node.doubleValue());
    }
    if (node.isTextual()) {
      return new Value.StringValue(node.textValue());
    }
    if (node.isArray()) {
      config.checkDepth(depth + 1);
      final List<Value> elements = new ArrayList<>(node.size());
      for (JsonNode element : node) {
        elements.add(fromJson(element, config, depth + 1));
      }
      return new Value.ArrayValue(elements);
    }
    if (node.isObject()) {
      config.checkDepth(depth + 1);
      final Map<String, Value> fields = config.keyOrder().newMap(node.size());
      final Iterator<Map.Entry<String, JsonNode>> iterator = node.fields();
      while (iterator.hasNext()) {
        final Map.Entry<String, JsonNode> entry = iterator.next();
        fields.put(entry.getKey(), fromJson(entry.getValue(), config, depth + 1));
      }
      return new Value.ObjectValue(fields);
    }
    throw new IllegalArgumentException("Unsupported JSON node type " + node.getNodeType());
  }

  /// Compact JSON text of a tree.
  public static String toJsonString(Value value) {
    try {
      return MAPPER.writeValueAsString(toJson(value));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to write JSON for " + value.errorDescription(), e);
    }
  }

  /// Parses JSON text into a tree.
  /// @throws JsonProcessingException if the text is not valid JSON
  public static Value parseJson(String json) throws JsonProcessingException {
    Objects.requireNonNull(json, "json must not be null");
    return fromJson(MAPPER.readTree(json));
  }
}
