// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

/// Hands the elements of a sequence to a [Visitor] one at a time.
public interface SeqAccess {

  boolean hasNext();

  /// Decodes the next element with `shape`.
  /// @throws ValueException.Eof if there are no elements left
  <T> T nextElement(Shape<T> shape);

  /// Elements not yet consumed.
  int remaining();
}
