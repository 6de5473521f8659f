// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

/// The sink a [Shape] describes a value into. There is one method per shape a value can have;
/// the compound ones return a builder that takes the children one at a time.
public interface Serializer {

  /// Whether this serializer targets a human-readable form. Shapes may use this to pick a
  /// compact or verbose encoding of their own primitives.
  boolean isHumanReadable();

  Value serializeBool(boolean v);

  Value serializeLong(long v);

  default Value serializeByte(byte v) {
    return serializeLong(v);
  }

  default Value serializeShort(short v) {
    return serializeLong(v);
  }

  default Value serializeInt(int v) {
    return serializeLong(v);
  }

  /// Unsigned 8-bit value held in a Java byte.
  default Value serializeUnsignedByte(byte v) {
    return serializeLong(Byte.toUnsignedLong(v));
  }

  /// Unsigned 16-bit value held in a Java short.
  default Value serializeUnsignedShort(short v) {
    return serializeLong(Short.toUnsignedLong(v));
  }

  /// Unsigned 32-bit value held in a Java int.
  default Value serializeUnsignedInt(int v) {
    return serializeLong(Integer.toUnsignedLong(v));
  }

  /// Unsigned 64-bit value; the bit pattern is kept as is.
  default Value serializeUnsignedLong(long v) {
    return serializeLong(v);
  }

  Value serializeDouble(double v);

  default Value serializeFloat(float v) {
    return serializeDouble(v);
  }

  Value serializeChar(char v);

  Value serializeString(String v);

  Value serializeBytes(byte[] v);

  /// An absent optional.
  Value serializeNone();

  /// A present optional. No marker wraps the payload.
  <T> Value serializeSome(T value, Shape<T> shape);

  /// The unit value, a type with no fields.
  Value serializeUnit();

  Value serializeUnitStruct(String name);

  /// A single-field wrapper that encodes as its payload.
  <T> Value serializeNewtypeStruct(String name, T value, Shape<T> shape);

  Value serializeUnitVariant(String name, int index, String variant);

  <T> Value serializeNewtypeVariant(String name, int index, String variant, T value, Shape<T> shape);

  SerializeSeq serializeSeq(int lengthHint);

  SerializeSeq serializeTuple(int length);

  SerializeSeq serializeTupleStruct(String name, int length);

  SerializeSeq serializeTupleVariant(String name, int index, String variant, int length);

  SerializeMap serializeMap(int lengthHint);

  SerializeStruct serializeStruct(String name, int length);

  SerializeStruct serializeStructVariant(String name, int index, String variant, int length);

  /// Builder for sequences, tuples, tuple structs and tuple variants.
  interface SerializeSeq {
    <T> void element(T value, Shape<T> shape);

    Value end();
  }

  /// Builder for maps. Every key must describe itself as a string.
  interface SerializeMap {
    <K> void key(K key, Shape<K> shape);

    <V> void value(V value, Shape<V> shape);

    default <K, V> void entry(K key, Shape<K> keyShape, V value, Shape<V> valueShape) {
      key(key, keyShape);
      value(value, valueShape);
    }

    Value end();
  }

  /// Builder for structs and struct variants.
  interface SerializeStruct {
    <T> void field(String name, T value, Shape<T> shape);

    Value end();
  }
}
