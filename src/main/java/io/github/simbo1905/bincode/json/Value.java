// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

import org.jetbrains.annotations.NotNull;

import java.util.*;

/// A loosely typed, self-describing tree that any typed value passes through on its way to bytes.
/// Every node is immutable once built. Containers take a defensive copy of their children so a
/// subtree handed to a parent can never be changed behind its back.
public sealed interface Value permits
    Value.NullValue, Value.BooleanValue, Value.BlobValue, Value.ArrayValue,
    Value.IntegerValue, Value.FloatValue, Value.ObjectValue, Value.StringValue {

  NullValue NULL = new NullValue();

  /// The variant of a node. The ordinal is the discriminant used by [BincodeCodec].
  enum Tag {
    NULL("type null"),
    BOOLEAN("type boolean"),
    BLOB("type blob"),
    ARRAY("type array"),
    INTEGER("type integer"),
    FLOAT("type float"),
    OBJECT("type object"),
    STRING("type string");

    private final String label;

    Tag(String label) {
      this.label = label;
    }

    /// Fixed human-readable label used only when building error messages.
    public String label() {
      return label;
    }
  }

  Tag tag();

  /// The fixed type label of this node, e.g. `type integer`. Never use it for control flow.
  default String errorDescription() {
    return tag().label();
  }

  static Value of(boolean value) {
    return new BooleanValue(value);
  }

  static Value of(long value) {
    return new IntegerValue(value);
  }

  static Value of(double value) {
    return new FloatValue(value);
  }

  static Value of(@NotNull String value) {
    return new StringValue(value);
  }

  static Value of(byte @NotNull [] value) {
    return new BlobValue(value);
  }

  static Value array(Value... elements) {
    return new ArrayValue(Arrays.asList(elements));
  }

  static Value array(@NotNull List<? extends Value> elements) {
    return new ArrayValue(List.copyOf(elements));
  }

  static Value object(@NotNull Map<String, ? extends Value> fields) {
    return new ObjectValue(new LinkedHashMap<String, Value>(fields));
  }

  /// Single-entry object, the shape a tagged-union case with a payload encodes to.
  static Value object(@NotNull String key, @NotNull Value value) {
    return new ObjectValue(Map.of(key, value));
  }

  default boolean isNull() {
    return tag() == Tag.NULL;
  }

  default boolean isBoolean() {
    return tag() == Tag.BOOLEAN;
  }

  default boolean isBlob() {
    return tag() == Tag.BLOB;
  }

  default boolean isArray() {
    return tag() == Tag.ARRAY;
  }

  default boolean isInteger() {
    return tag() == Tag.INTEGER;
  }

  default boolean isFloat() {
    return tag() == Tag.FLOAT;
  }

  default boolean isObject() {
    return tag() == Tag.OBJECT;
  }

  default boolean isString() {
    return tag() == Tag.STRING;
  }

  default Optional<Boolean> asBoolean() {
    return this instanceof BooleanValue b ? Optional.of(b.value()) : Optional.empty();
  }

  /// Returns a copy of the blob bytes.
  default Optional<byte[]> asBlob() {
    return this instanceof BlobValue b ? Optional.of(b.bytes()) : Optional.empty();
  }

  default Optional<List<Value>> asArray() {
    return this instanceof ArrayValue a ? Optional.of(a.elements()) : Optional.empty();
  }

  default OptionalLong asInteger() {
    return this instanceof IntegerValue i ? OptionalLong.of(i.value()) : OptionalLong.empty();
  }

  default OptionalDouble asFloat() {
    return this instanceof FloatValue f ? OptionalDouble.of(f.value()) : OptionalDouble.empty();
  }

  default Optional<Map<String, Value>> asObject() {
    return this instanceof ObjectValue o ? Optional.of(o.fields()) : Optional.empty();
  }

  default Optional<String> asString() {
    return this instanceof StringValue s ? Optional.of(s.value()) : Optional.empty();
  }

  record NullValue() implements Value {
    @Override
    public Tag tag() {
      return Tag.NULL;
    }

    @Override
    public String toString() {
      return "Null";
    }
  }

  record BooleanValue(boolean value) implements Value {
    @Override
    public Tag tag() {
      return Tag.BOOLEAN;
    }

    @Override
    public String toString() {
      return "Boolean(" + value + ")";
    }
  }

  /// Opaque bytes. The array is copied in and out so the node stays immutable.
  record BlobValue(byte[] bytes) implements Value {
    public BlobValue {
      bytes = Objects.requireNonNull(bytes, "Blob bytes cannot be null").clone();
    }

    @Override
    public byte[] bytes() {
      return bytes.clone();
    }

    int length() {
      return bytes.length;
    }

    /// Package-private view that skips the copy, for the codec.
    byte[] unsafeBytes() {
      return bytes;
    }

    @Override
    public Tag tag() {
      return Tag.BLOB;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof BlobValue other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
      return "Blob(" + HexFormat.of().formatHex(bytes) + ")";
    }
  }

  record ArrayValue(List<Value> elements) implements Value {
    public ArrayValue {
      Objects.requireNonNull(elements, "Array elements cannot be null");
      elements = List.copyOf(elements);
    }

    @Override
    public Tag tag() {
      return Tag.ARRAY;
    }

    @Override
    public String toString() {
      return "Array" + elements;
    }
  }

  record IntegerValue(long value) implements Value {
    @Override
    public Tag tag() {
      return Tag.INTEGER;
    }

    @Override
    public String toString() {
      return "Integer(" + value + ")";
    }
  }

  record FloatValue(double value) implements Value {
    @Override
    public Tag tag() {
      return Tag.FLOAT;
    }

    @Override
    public String toString() {
      return "Float(" + value + ")";
    }
  }

  /// String-keyed fields. Iteration follows the order of the map it was built from, which is
  /// the [KeyOrder] of whoever produced it. Equality ignores order.
  record ObjectValue(Map<String, Value> fields) implements Value {
    public ObjectValue {
      Objects.requireNonNull(fields, "Object fields cannot be null");
      final var copy = new LinkedHashMap<String, Value>(Math.max(4, fields.size() * 2));
      fields.forEach((k, v) -> copy.put(
          Objects.requireNonNull(k, "Object keys cannot be null"),
          Objects.requireNonNull(v, "Object values cannot be null")));
      fields = Collections.unmodifiableMap(copy);
    }

    public int size() {
      return fields.size();
    }

    @Override
    public Tag tag() {
      return Tag.OBJECT;
    }

    @Override
    public String toString() {
      return "Object" + fields;
    }
  }

  record StringValue(String value) implements Value {
    public StringValue {
      Objects.requireNonNull(value, "String value cannot be null");
    }

    @Override
    public Tag tag() {
      return Tag.STRING;
    }

    @Override
    public String toString() {
      return "String(\"" + value + "\")";
    }
  }
}
