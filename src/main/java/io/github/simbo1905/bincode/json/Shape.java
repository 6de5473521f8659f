// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

/// Describes how one Java type maps to and from the [Value] model.
///
/// Encoding is "describe yourself": the shape calls exactly one of the [Serializer] methods for
/// the shape the value has and returns what that call returned. Decoding is "build yourself":
/// the shape asks the [Deserializer] for the shape it wants, passing a [Visitor] that
/// receives whatever the data actually holds.
///
/// Shapes for records, enums, sealed interfaces, optionals, lists, maps, arrays and the common
/// scalar types are derived by [ValueMapper#forClass(Class)]. Implement this interface directly
/// for anything else and register it with a [ShapeHandler].
public interface Shape<T> {

  Value serialize(T value, Serializer serializer);

  T deserialize(Deserializer deserializer);
}
