// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Type;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static io.github.simbo1905.bincode.json.ValueMapper.LOGGER;

/// Builds and remembers the shapes of the user types reachable from one mapper. A type that is
/// still being built when it is reached again (a record holding a list of itself) is handed out
/// as a [Deferred] placeholder that is bound once the real shape exists.
final class ShapeGraph {
  final ValueConfig config;
  final Map<Class<?>, Shape<?>> customShapes;
  private final Map<Class<?>, Shape<?>> resolved = new HashMap<>();
  private final DynamicShape dynamic;

  ShapeGraph(ValueConfig config, List<ShapeHandler<?>> handlers) {
    this.config = Objects.requireNonNull(config);
    final Map<Class<?>, Shape<?>> custom = new HashMap<>();
    for (ShapeHandler<?> handler : handlers) {
      if (custom.put(handler.valueBasedLike(), handler.shape()) != null) {
        throw new IllegalArgumentException("Duplicate ShapeHandler for " + handler.valueBasedLike());
      }
    }
    this.customShapes = Map.copyOf(custom);
    this.dynamic = new DynamicShape(this);
  }

  /// The shape of a declared type, generic or not.
  Shape<?> shapeFor(Type type) {
    final TypeExpr typeExpr = TypeExpr.analyzeType(type, customShapes.keySet());
    return Companion.shapeFor(typeExpr, this);
  }

  /// The shape of a record, enum, sealed interface or custom type.
  synchronized Shape<?> resolve(Class<?> type) {
    final Shape<?> custom = customShapes.get(type);
    if (custom != null) {
      return custom;
    }
    final Shape<?> existing = resolved.get(type);
    if (existing != null) {
      if (existing instanceof Deferred<?> deferred && !deferred.isBound()) {
        LOGGER.info(() -> "Recursive type " + type.getName() + " resolved through a deferred shape");
      }
      return existing;
    }
    final var deferred = new Deferred<>(type);
    resolved.put(type, deferred);
    final Shape<?> built;
    try {
      built = build(type);
    } catch (RuntimeException e) {
      resolved.remove(type);
      throw e;
    }
    deferred.bind(Companion.erase(built));
    resolved.put(type, built);
    LOGGER.fine(() -> "Built " + built + " for " + type.getName());
    return built;
  }

  /// Builds the shape of every record, enum and sealed interface in `types` ahead of first use.
  /// The [Value] types keep their identity shape.
  synchronized void prepare(Collection<Class<?>> types) {
    for (Class<?> type : types) {
      if (Value.class.isAssignableFrom(type)) {
        continue;
      }
      if (type.isRecord() || type.isEnum() || (type.isSealed() && type.isInterface()) || customShapes.containsKey(type)) {
        resolve(type);
      }
    }
  }

  synchronized boolean isResolved(Class<?> type) {
    final Shape<?> shape = resolved.get(type);
    return customShapes.containsKey(type) || (shape != null && !(shape instanceof Deferred<?>));
  }

  Shape<Object> dynamic() {
    return dynamic;
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private Shape<?> build(Class<?> type) {
    if (type.isEnum()) {
      return new EnumShape(type);
    }
    if (type.isRecord()) {
      return new RecordShape<>(type, this);
    }
    if (type.isInterface() && type.isSealed()) {
      return new SealedShape<>(type, this);
    }
    throw new IllegalArgumentException("Not a record, enum or sealed interface: " + type.getName());
  }

  /// Stands in for a shape that is still being built.
  static final class Deferred<T> implements Shape<T> {
    final Class<?> type;
    private volatile @Nullable Shape<T> target;

    Deferred(Class<?> type) {
      this.type = type;
    }

    boolean isBound() {
      return target != null;
    }

    void bind(Shape<Object> shape) {
      @SuppressWarnings("unchecked") final Shape<T> typed = (Shape<T>) (Shape<?>) shape;
      this.target = typed;
    }

    Shape<T> target() {
      final Shape<T> bound = target;
      if (bound == null) {
        throw new IllegalStateException("Shape for " + type.getName() + " used before it was built");
      }
      return bound;
    }

    @Override
    public Value serialize(T value, Serializer serializer) {
      return target().serialize(value, serializer);
    }

    @Override
    public T deserialize(Deserializer deserializer) {
      return target().deserialize(deserializer);
    }

    @Override
    public String toString() {
      return "Deferred[" + type.getSimpleName() + "]";
    }
  }
}
