// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

/// Receives whatever a [Deserializer] actually found. A shape overrides the `visit` methods for
/// the data it can build from; every other one fails with [ValueException.Expected] naming
/// [#expecting()] and the type label of what was found.
public interface Visitor<T> {

  /// What this visitor wants, used as the expected side of error messages, e.g. `i32`.
  String expecting();

  default T visitBool(boolean v) {
    throw new ValueException.Expected(expecting(), Value.Tag.BOOLEAN.label());
  }

  default T visitLong(long v) {
    throw new ValueException.Expected(expecting(), Value.Tag.INTEGER.label());
  }

  default T visitDouble(double v) {
    throw new ValueException.Expected(expecting(), Value.Tag.FLOAT.label());
  }

  default T visitString(String v) {
    throw new ValueException.Expected(expecting(), Value.Tag.STRING.label());
  }

  default T visitBytes(byte[] v) {
    throw new ValueException.Expected(expecting(), Value.Tag.BLOB.label());
  }

  default T visitNone() {
    throw new ValueException.Expected(expecting(), Value.Tag.NULL.label());
  }

  default T visitSome(Deserializer deserializer) {
    throw new ValueException.Expected(expecting(), "optional value");
  }

  default T visitUnit() {
    throw new ValueException.Expected(expecting(), "unit value");
  }

  default T visitNewtypeStruct(Deserializer deserializer) {
    throw new ValueException.Expected(expecting(), "newtype struct");
  }

  default T visitSeq(SeqAccess seq) {
    throw new ValueException.Expected(expecting(), Value.Tag.ARRAY.label());
  }

  default T visitMap(MapAccess map) {
    throw new ValueException.Expected(expecting(), Value.Tag.OBJECT.label());
  }

  default T visitEnum(EnumAccess data) {
    throw new ValueException.Expected(expecting(), "enum");
  }
}
