// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Builds a [Value] tree from what shapes describe. The mapping is fixed: every integer width is
/// widened to a signed 64-bit `Integer`, every float width to a 64-bit `Float`, a present
/// optional is its payload, the unit value is an empty `Array` and a tagged-union case with a
/// payload is an `Object` with exactly one entry keyed by the case name.
///
/// Children are built before the node that holds them. The only failure is a map key that does
/// not describe itself as a string, plus [ValueException.DepthExceeded] on runaway nesting.
final class ValueSerializer implements Serializer {
  final ValueConfig config;
  final int depth;

  ValueSerializer(ValueConfig config) {
    this(config, 0);
  }

  private ValueSerializer(ValueConfig config, int depth) {
    this.config = Objects.requireNonNull(config);
    this.depth = depth;
  }

  /// Describes `value` with `shape` at this depth. A null reference has nothing to describe
  /// and becomes `Null`, the same as an absent optional.
  <T> Value describe(@Nullable T value, Shape<T> shape) {
    if (value == null) {
      return Value.NULL;
    }
    return shape.serialize(value, this);
  }

  ValueSerializer nested() {
    config.checkDepth(depth + 1);
    return new ValueSerializer(config, depth + 1);
  }

  @Override
  public boolean isHumanReadable() {
    return false;
  }

  @Override
  public Value serializeBool(boolean v) {
    return new Value.BooleanValue(v);
  }

  @Override
  public Value serializeLong(long v) {
    return new Value.IntegerValue(v);
  }

  @Override
  public Value serializeDouble(double v) {
    return new Value.FloatValue(v);
  }

  @Override
  public Value serializeChar(char v) {
    return serializeString(String.valueOf(v));
  }

  @Override
  public Value serializeString(String v) {
    return new Value.StringValue(v);
  }

  @Override
  public Value serializeBytes(byte[] v) {
    return new Value.BlobValue(v);
  }

  @Override
  public Value serializeNone() {
    return Value.NULL;
  }

  @Override
  public <T> Value serializeSome(T value, Shape<T> shape) {
    return describe(value, shape);
  }

  @Override
  public Value serializeUnit() {
    return new Value.ArrayValue(List.of());
  }

  @Override
  public Value serializeUnitStruct(String name) {
    return serializeUnit();
  }

  @Override
  public <T> Value serializeNewtypeStruct(String name, T value, Shape<T> shape) {
    return describe(value, shape);
  }

  @Override
  public Value serializeUnitVariant(String name, int index, String variant) {
    return serializeString(variant);
  }

  @Override
  public <T> Value serializeNewtypeVariant(String name, int index, String variant, T value, Shape<T> shape) {
    return variantObject(variant, nested().describe(value, shape));
  }

  @Override
  public SerializeSeq serializeSeq(int lengthHint) {
    return new SeqSerializer(nested(), null, Math.max(0, lengthHint));
  }

  @Override
  public SerializeSeq serializeTuple(int length) {
    return serializeSeq(length);
  }

  @Override
  public SerializeSeq serializeTupleStruct(String name, int length) {
    return serializeTuple(length);
  }

  @Override
  public SerializeSeq serializeTupleVariant(String name, int index, String variant, int length) {
    // the variant object is one level and its array another
    return new SeqSerializer(nested().nested(), Objects.requireNonNull(variant), length);
  }

  @Override
  public SerializeMap serializeMap(int lengthHint) {
    return new MapSerializer(nested(), Math.max(0, lengthHint));
  }

  @Override
  public SerializeStruct serializeStruct(String name, int length) {
    return new StructSerializer(nested(), null, length);
  }

  @Override
  public SerializeStruct serializeStructVariant(String name, int index, String variant, int length) {
    return new StructSerializer(nested().nested(), Objects.requireNonNull(variant), length);
  }

  /// Wraps `inner` as the single entry of a tagged-union case object.
  private Value variantObject(String variant, Value inner) {
    final Map<String, Value> map = config.keyOrder().newMap(1);
    map.put(variant, inner);
    return new Value.ObjectValue(map);
  }

  private final class SeqSerializer implements SerializeSeq {
    final ValueSerializer children;
    final @Nullable String variant;
    final List<Value> inner;

    SeqSerializer(ValueSerializer children, @Nullable String variant, int lengthHint) {
      this.children = children;
      this.variant = variant;
      this.inner = new ArrayList<>(Math.max(0, lengthHint));
    }

    @Override
    public <T> void element(T value, Shape<T> shape) {
      inner.add(children.describe(value, shape));
    }

    @Override
    public Value end() {
      final var array = new Value.ArrayValue(inner);
      return variant == null ? array : variantObject(variant, array);
    }
  }

  private final class MapSerializer implements SerializeMap {
    final ValueSerializer children;
    final Map<String, Value> inner;
    @Nullable String nextKey;

    MapSerializer(ValueSerializer children, int lengthHint) {
      this.children = children;
      this.inner = config.keyOrder().newMap(lengthHint);
    }

    @Override
    public <K> void key(K key, Shape<K> shape) {
      final Value encoded = children.describe(key, shape);
      if (encoded instanceof Value.StringValue s) {
        nextKey = s.value();
      } else {
        throw new ValueException.Expected("type str", encoded.errorDescription());
      }
    }

    @Override
    public <V> void value(V value, Shape<V> shape) {
      if (nextKey == null) {
        throw new IllegalStateException("SerializeMap.value() called without a preceding key()");
      }
      final String key = nextKey;
      nextKey = null;
      inner.put(key, children.describe(value, shape));
    }

    @Override
    public Value end() {
      return new Value.ObjectValue(inner);
    }
  }

  private final class StructSerializer implements SerializeStruct {
    final ValueSerializer children;
    final @Nullable String variant;
    final Map<String, Value> inner;

    StructSerializer(ValueSerializer children, @Nullable String variant, int length) {
      this.children = children;
      this.variant = variant;
      this.inner = config.keyOrder().newMap(Math.max(0, length));
    }

    @Override
    public <T> void field(String name, T value, Shape<T> shape) {
      inner.put(Objects.requireNonNull(name), children.describe(value, shape));
    }

    @Override
    public Value end() {
      final var object = new Value.ObjectValue(inner);
      return variant == null ? object : variantObject(variant, object);
    }
  }
}
