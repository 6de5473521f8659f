// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Converts one Java type to and from the [Value] tree and the bincode bytes of that tree.
/// Mappers hold no mutable state once built and may be shared between threads.
///
/// ```java
/// record Point(int x, int y) {}
/// final var mapper = ValueMapper.forClass(Point.class);
/// final Value value = mapper.toValue(new Point(1, 2)); // Object{"x": Integer(1), "y": Integer(2)}
/// final Point back = mapper.fromBytes(mapper.toBytes(new Point(1, 2)));
/// ```
public sealed interface ValueMapper<T> permits ShapeMapper {

  Logger LOGGER = Logger.getLogger(ValueMapper.class.getName());

  /// Describe a typed value as a tree. A `null` value becomes `Null`.
  /// @throws ValueException.Expected if a map key does not encode as a string
  Value toValue(T value);

  /// Build a typed value from a tree.
  /// @throws ValueException if the tree does not have the shape of `T`
  T fromValue(Value value);

  /// `toValue` followed by the binary codec.
  byte[] toBytes(T value);

  /// The binary codec followed by `fromValue`. Bytes after the first complete value are ignored.
  /// @throws ValueException.BinaryCodec if the bytes are not a valid encoding of a [Value]
  T fromBytes(byte[] bytes);

  Shape<T> shape();

  ValueConfig config();

  /// Mapper for a record, enum, sealed interface or any other supported class, configured by
  /// [ValueConfig#current()].
  static <T> ValueMapper<T> forClass(Class<T> type) {
    return forClass(type, ValueConfig.current(), List.of());
  }

  /// @param type the root class
  /// @param config settings captured by the mapper
  /// @param handlers shapes for classes the derivation does not cover
  static <T> ValueMapper<T> forClass(Class<T> type, ValueConfig config, List<ShapeHandler<?>> handlers) {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(config, "config must not be null");
    Objects.requireNonNull(handlers, "handlers must not be null");
    final var graph = new ShapeGraph(config, handlers);
    // fails fast on any unsupported type reachable from the root
    final var reachable = Companion.recordClassHierarchy(type, graph.customShapes.keySet());
    LOGGER.fine(() -> "Reachable types for " + type.getName() + ": " +
        reachable.stream().map(Class::getSimpleName).collect(Collectors.joining(",")));
    graph.prepare(reachable);
    @SuppressWarnings("unchecked") final Shape<T> shape = (Shape<T>) graph.shapeFor(type);
    return new ShapeMapper<>(shape, config);
  }

  /// Mapper for a generic type such as `List<Point>`.
  static <T> ValueMapper<T> forType(TypeToken<T> type) {
    return forType(type, ValueConfig.current(), List.of());
  }

  static <T> ValueMapper<T> forType(TypeToken<T> type, ValueConfig config, List<ShapeHandler<?>> handlers) {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(config, "config must not be null");
    Objects.requireNonNull(handlers, "handlers must not be null");
    final var graph = new ShapeGraph(config, handlers);
    LOGGER.fine(() -> "Creating mapper for " + type.type().getTypeName());
    @SuppressWarnings("unchecked") final Shape<T> shape = (Shape<T>) graph.shapeFor(type.type());
    return new ShapeMapper<>(shape, config);
  }

  /// Mapper for a hand-written shape.
  static <T> ValueMapper<T> forShape(Shape<T> shape) {
    return forShape(shape, ValueConfig.current());
  }

  static <T> ValueMapper<T> forShape(Shape<T> shape, ValueConfig config) {
    return new ShapeMapper<>(shape, config);
  }
}
