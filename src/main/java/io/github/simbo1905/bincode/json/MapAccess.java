// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

/// Hands the entries of a map to a [Visitor] one at a time. Keys are always presented to the
/// key shape as string values. Each [#nextKey(Shape)] must be followed by exactly one
/// [#nextValue(Shape)].
public interface MapAccess {

  boolean hasNext();

  /// @throws ValueException.Eof if there are no entries left
  <K> K nextKey(Shape<K> shape);

  /// @throws ValueException.Eof if the value of the current entry was already taken
  <V> V nextValue(Shape<V> shape);

  /// Entries not yet consumed.
  int remaining();
}
