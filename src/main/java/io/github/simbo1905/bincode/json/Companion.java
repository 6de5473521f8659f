// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static io.github.simbo1905.bincode.json.ValueMapper.LOGGER;

/// This is the static helpers of the shape derivation
sealed interface Companion permits Companion.Nothing {

  record Nothing() implements Companion {
  }

  /// Discover all reachable types from a root class including sealed hierarchies and record components
  static Set<Class<?>> recordClassHierarchy(final Class<?> current, final Collection<Class<?>> customTypes) {
    return recordClassHierarchyInner(current, customTypes, new HashSet<>())
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }

  private static Stream<Class<?>> recordClassHierarchyInner(final Class<?> current,
                                                            final Collection<Class<?>> customTypes,
                                                            final Set<Class<?>> visited) {
    if (!visited.add(current)) {
      return Stream.empty();
    }
    if (customTypes.contains(current) || Value.class.isAssignableFrom(current)) {
      return Stream.of(current);
    }

    if (current.isArray()) {
      final Class<?> componentType = current.getComponentType();
      LOGGER.finer(() -> "Root is array type: " + current.getSimpleName() + " with component type: " + componentType.getSimpleName());
      return Stream.concat(Stream.of(current), recordClassHierarchyInner(componentType, customTypes, visited));
    }

    return Stream.concat(
        Stream.of(current),
        Stream.concat(
            current.isSealed() && current.isInterface()
                ? Arrays.stream(current.getPermittedSubclasses())
                : Stream.empty(),
            current.isRecord()
                ? Arrays.stream(current.getRecordComponents())
                .flatMap(component -> {
                  final TypeExpr structure = TypeExpr.analyzeType(component.getGenericType(), customTypes);
                  LOGGER.finer(() -> "Component " + component.getName() + " discovered types: " +
                      structure.toTreeString());
                  return TypeExpr.classesInAST(structure);
                })
                : Stream.empty()
        ).flatMap(child -> recordClassHierarchyInner(child, customTypes, visited))
    );
  }

  /// The records and enums a sealed interface permits, nested sealed interfaces flattened,
  /// in declaration order.
  static List<Class<?>> permittedLeaves(Class<?> sealedInterface) {
    final Set<Class<?>> leaves = new LinkedHashSet<>();
    collectLeaves(sealedInterface, leaves);
    return List.copyOf(leaves);
  }

  private static void collectLeaves(Class<?> current, Set<Class<?>> leaves) {
    for (Class<?> permitted : current.getPermittedSubclasses()) {
      if (permitted.isInterface() && permitted.isSealed()) {
        collectLeaves(permitted, leaves);
      } else if (permitted.isRecord() || permitted.isEnum()) {
        leaves.add(permitted);
      } else {
        throw new IllegalArgumentException("Sealed interface " + current.getName() +
            " permits " + permitted.getName() + " which is not a record, an enum or a sealed interface");
      }
    }
  }

  /// Builds the shape for an analysed type, resolving user types through the graph.
  static Shape<?> shapeFor(TypeExpr typeExpr, ShapeGraph graph) {
    if (typeExpr instanceof TypeExpr.PrimitiveValueNode primitive) {
      return primitiveShape(primitive.type());
    }
    if (typeExpr instanceof TypeExpr.RefValueNode ref) {
      return refShape(ref.type(), ref.javaType(), graph);
    }
    if (typeExpr instanceof TypeExpr.PrimitiveArrayNode primitiveArray) {
      if (primitiveArray.primitiveType() == TypeExpr.PrimitiveValueType.BYTE) {
        return Shapes.bytes();
      }
      return new ArrayShape(primitiveArray.arrayType().getComponentType(), primitiveShape(primitiveArray.primitiveType()));
    }
    if (typeExpr instanceof TypeExpr.ArrayNode array) {
      return new ArrayShape(array.componentType(), shapeFor(array.element(), graph));
    }
    if (typeExpr instanceof TypeExpr.ListNode list) {
      return Shapes.list(erase(shapeFor(list.element(), graph)));
    }
    if (typeExpr instanceof TypeExpr.OptionalNode optional) {
      return Shapes.optional(erase(shapeFor(optional.wrapped(), graph)));
    }
    final var map = (TypeExpr.MapNode) typeExpr;
    return Shapes.map(erase(shapeFor(map.key(), graph)), erase(shapeFor(map.value(), graph)));
  }

  static Shape<?> primitiveShape(TypeExpr.PrimitiveValueType primitiveType) {
    return switch (primitiveType) {
      case BOOLEAN -> Shapes.bool();
      case BYTE -> Shapes.i8();
      case SHORT -> Shapes.i16();
      case CHARACTER -> Shapes.character();
      case INTEGER -> Shapes.i32();
      case LONG -> Shapes.i64();
      case FLOAT -> Shapes.f32();
      case DOUBLE -> Shapes.f64();
    };
  }

  static Shape<?> refShape(TypeExpr.RefValueType refValueType, Class<?> javaType, ShapeGraph graph) {
    return switch (refValueType) {
      case BOOLEAN -> Shapes.bool();
      case BYTE -> Shapes.i8();
      case SHORT -> Shapes.i16();
      case CHARACTER -> Shapes.character();
      case INTEGER -> Shapes.i32();
      case LONG -> Shapes.i64();
      case FLOAT -> Shapes.f32();
      case DOUBLE -> Shapes.f64();
      case STRING -> Shapes.string();
      case UUID -> Shapes.uuid();
      case LOCAL_DATE -> Shapes.localDate();
      case LOCAL_DATE_TIME -> Shapes.localDateTime();
      case VALUE -> javaType == Value.class ? Shapes.value() : valueNodeShape(javaType);
      case OBJECT -> graph.dynamic();
      case RECORD, INTERFACE, ENUM, CUSTOM -> graph.resolve(javaType);
    };
  }

  /// A single kind of [Value] node such as `Value.IntegerValue`.
  private static Shape<Value> valueNodeShape(Class<?> nodeType) {
    return Shapes.convert(Shapes.value(), v -> v, v -> {
      if (!nodeType.isInstance(v)) {
        throw new ValueException.Expected(Value.Tag.valueOf(nodeTag(nodeType)).label(), v.errorDescription());
      }
      return v;
    });
  }

  private static String nodeTag(Class<?> nodeType) {
    // e.g. IntegerValue -> INTEGER
    return nodeType.getSimpleName().replace("Value", "").toUpperCase(Locale.ROOT);
  }

  /// Reads through a placeholder left by recursive resolution.
  static Shape<?> unwrap(Shape<?> shape) {
    return shape instanceof ShapeGraph.Deferred<?> deferred ? deferred.target() : shape;
  }

  @SuppressWarnings("unchecked")
  static Shape<Object> erase(Shape<?> shape) {
    return (Shape<Object>) shape;
  }

  /// A `null` reference of `type` travels as `Null` and comes back as `null`. Primitives,
  /// `Optional`, `Value` and `Object` keep their own reading of `Null`.
  static Shape<Object> nullSafe(Class<?> type, Shape<?> shape) {
    final Shape<Object> erased = erase(shape);
    if (type.isPrimitive() || type == Optional.class || type == Object.class || Value.class.isAssignableFrom(type)) {
      return erased;
    }
    return Shapes.nullable(erased);
  }

  /// Positional records: `@Tuple` with at least one component.
  static boolean isTuple(Class<?> recordClass) {
    return recordClass.isAnnotationPresent(Tuple.class) && recordClass.getRecordComponents().length > 0;
  }

  /// The value a missing component takes when compatibility mode fills it in.
  static Object defaultValue(Class<?> type) {
    if (type == Optional.class) {
      return Optional.empty();
    }
    if (!type.isPrimitive()) {
      return null;
    }
    if (type == boolean.class) {
      return false;
    }
    if (type == char.class) {
      return '\u0000';
    }
    if (type == byte.class) {
      return (byte) 0;
    }
    if (type == short.class) {
      return (short) 0;
    }
    if (type == int.class) {
      return 0;
    }
    if (type == long.class) {
      return 0L;
    }
    if (type == float.class) {
      return 0.0f;
    }
    return 0.0d;
  }

  /// Canonical constructor of a record, opened for reflective access.
  static MethodHandle canonicalConstructor(Class<?> recordClass) {
    final Class<?>[] parameterTypes = Arrays.stream(recordClass.getRecordComponents())
        .map(RecordComponent::getType)
        .toArray(Class<?>[]::new);
    try {
      final Constructor<?> constructor = recordClass.getDeclaredConstructor(parameterTypes);
      constructor.setAccessible(true);
      return MethodHandles.lookup().unreflectConstructor(constructor);
    } catch (NoSuchMethodException | IllegalAccessException e) {
      throw new IllegalArgumentException("Failed to create constructor handle for " + recordClass, e);
    }
  }

  /// Resolve getters for record components
  static MethodHandle[] resolveGetters(Class<?> recordClass, RecordComponent[] components) {
    final MethodHandles.Lookup lookup = MethodHandles.lookup();
    return IntStream.range(0, components.length)
        .mapToObj(i -> {
          try {
            final Method accessor = components[i].getAccessor();
            accessor.setAccessible(true);
            return lookup.unreflect(accessor);
          } catch (IllegalAccessException e) {
            throw new IllegalArgumentException("Cannot access component " + i + " of " + recordClass, e);
          }
        })
        .toArray(MethodHandle[]::new);
  }
}
