// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

import java.util.List;

/// Hands a tagged-union case to a [Visitor]. Call [#variant(Shape)] first to learn the case,
/// then exactly one of the payload methods matching that case's shape.
public interface EnumAccess {

  /// Decodes the case tag, which is always a string value.
  <K> K variant(Shape<K> shape);

  default String variantName() {
    return variant(Shapes.string());
  }

  /// The case carries no payload. A payload that is present anyway is decoded and discarded.
  void unitVariant();

  /// The case carries a single unnamed payload.
  <T> T newtypeVariant(Shape<T> shape);

  /// The case carries positional payloads encoded as an array.
  <T> T tupleVariant(int length, Visitor<T> visitor);

  /// The case carries named payloads encoded as an object.
  <T> T structVariant(List<String> fields, Visitor<T> visitor);
}
