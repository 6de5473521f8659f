// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

import java.util.Objects;

/// Registers a hand-written [Shape] for a class the reflective derivation does not cover,
/// typically a value-based class such as `java.time.Instant` or a final class of your own.
/// A handler takes precedence over every built-in rule for exactly its class.
public record ShapeHandler<T>(Class<T> valueBasedLike, Shape<T> shape) {
  public ShapeHandler {
    Objects.requireNonNull(valueBasedLike, "valueBasedLike must not be null");
    Objects.requireNonNull(shape, "shape must not be null");
    if (valueBasedLike.isPrimitive()) {
      throw new IllegalArgumentException("Custom handlers cannot replace primitive types: " + valueBasedLike);
    }
  }
}
