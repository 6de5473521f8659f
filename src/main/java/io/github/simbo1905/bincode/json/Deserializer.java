// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

import java.util.List;

/// The source a [Shape] builds itself from. A shape says what it wants by calling one of the
/// `deserialize` methods; the deserializer calls back into the [Visitor] with what the data
/// really is. The hints are advisory: a self-describing source dispatches on its own data for
/// everything except optionals, enums and newtype structs, so most methods default to
/// [#deserializeAny(Visitor)].
public interface Deserializer {

  /// Whether the source is a human-readable form.
  boolean isHumanReadable();

  /// Dispatch purely on what the data is.
  <T> T deserializeAny(Visitor<T> visitor);

  /// `Null` is absent, anything else is present.
  <T> T deserializeOption(Visitor<T> visitor);

  /// A bare string is a unit case, an object with exactly one key is a case with a payload.
  <T> T deserializeEnum(String name, List<String> variants, Visitor<T> visitor);

  <T> T deserializeNewtypeStruct(String name, Visitor<T> visitor);

  /// The unit value. Both the unit value and an empty array are accepted.
  <T> T deserializeUnit(Visitor<T> visitor);

  default <T> T deserializeUnitStruct(String name, Visitor<T> visitor) {
    return deserializeUnit(visitor);
  }

  default <T> T deserializeBool(Visitor<T> visitor) {
    return deserializeAny(visitor);
  }

  default <T> T deserializeLong(Visitor<T> visitor) {
    return deserializeAny(visitor);
  }

  default <T> T deserializeDouble(Visitor<T> visitor) {
    return deserializeAny(visitor);
  }

  default <T> T deserializeChar(Visitor<T> visitor) {
    return deserializeAny(visitor);
  }

  default <T> T deserializeString(Visitor<T> visitor) {
    return deserializeAny(visitor);
  }

  default <T> T deserializeBytes(Visitor<T> visitor) {
    return deserializeAny(visitor);
  }

  default <T> T deserializeSeq(Visitor<T> visitor) {
    return deserializeAny(visitor);
  }

  default <T> T deserializeTuple(int length, Visitor<T> visitor) {
    return deserializeSeq(visitor);
  }

  default <T> T deserializeTupleStruct(String name, int length, Visitor<T> visitor) {
    return deserializeTuple(length, visitor);
  }

  default <T> T deserializeMap(Visitor<T> visitor) {
    return deserializeAny(visitor);
  }

  default <T> T deserializeStruct(String name, List<String> fields, Visitor<T> visitor) {
    return deserializeMap(visitor);
  }

  default <T> T deserializeIdentifier(Visitor<T> visitor) {
    return deserializeString(visitor);
  }
}
