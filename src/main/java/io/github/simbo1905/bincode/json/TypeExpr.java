// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

import org.jetbrains.annotations.NotNull;

import java.lang.reflect.*;
import java.util.Collection;
import java.util.Objects;
import java.util.stream.Stream;

import static io.github.simbo1905.bincode.json.ValueMapper.LOGGER;

/// Type Expression tree for a declared Java type. Leaves are the value-like types that a shape
/// exists for; inner nodes are the containers.
sealed interface TypeExpr permits
    TypeExpr.ArrayNode, TypeExpr.ListNode, TypeExpr.OptionalNode, TypeExpr.MapNode,
    TypeExpr.RefValueNode, TypeExpr.PrimitiveValueNode, TypeExpr.PrimitiveArrayNode {

  /// Recursive descent parser for Java types - builds tree bottom-up
  static TypeExpr analyzeType(Type type, Collection<Class<?>> customTypes) {
    final var result = analyzeTypeInner(type, customTypes);
    LOGGER.finer(() -> "Got TypeExpr: " + result.toTreeString());
    return result;
  }

  private static @NotNull TypeExpr analyzeTypeInner(Type type, Collection<Class<?>> customTypes) {
    LOGGER.finer(() -> "Analyzing type: " + type);

    if (type instanceof Class<?> clazz) {
      // custom handlers win over every built-in rule, arrays included
      if (customTypes.contains(clazz)) {
        return new RefValueNode(RefValueType.CUSTOM, clazz);
      }
      if (clazz.isArray()) {
        final Class<?> componentType = clazz.getComponentType();
        if (componentType.isPrimitive()) {
          return new PrimitiveArrayNode(classifyPrimitiveClass(componentType), clazz);
        }
        final TypeExpr elementTypeExpr = analyzeType(componentType, customTypes);
        LOGGER.finer(() -> "Created array node for: " + clazz + " with element type: " + elementTypeExpr.toTreeString());
        return new ArrayNode(elementTypeExpr, componentType);
      }
      if (clazz.isPrimitive()) {
        return new PrimitiveValueNode(classifyPrimitiveClass(clazz), clazz);
      }
      return new RefValueNode(classifyReferenceClass(clazz), clazz);
    }

    // e.g. Optional<String>[] or T[] where T is bound
    if (type instanceof GenericArrayType genericArrayType) {
      final Type componentType = genericArrayType.getGenericComponentType();
      final TypeExpr elementTypeExpr = analyzeType(componentType, customTypes);
      return new ArrayNode(elementTypeExpr, getRawClass(componentType));
    }

    if (type instanceof ParameterizedType paramType && paramType.getRawType() instanceof Class<?> rawClass) {
      final Type[] typeArgs = paramType.getActualTypeArguments();

      if (java.util.List.class.isAssignableFrom(rawClass)) {
        if (typeArgs.length == 1) {
          return new ListNode(analyzeType(typeArgs[0], customTypes));
        }
        throw new IllegalArgumentException("List must have exactly one type argument: " + type);
      }

      if (java.util.Optional.class.isAssignableFrom(rawClass)) {
        if (typeArgs.length == 1) {
          return new OptionalNode(analyzeType(typeArgs[0], customTypes));
        }
        throw new IllegalArgumentException("Optional must have exactly one type argument: " + type);
      }

      if (java.util.Map.class.isAssignableFrom(rawClass)) {
        if (typeArgs.length == 2) {
          final TypeExpr keyTypeExpr = analyzeType(typeArgs[0], customTypes);
          final TypeExpr valueTypeExpr = analyzeType(typeArgs[1], customTypes);
          return new MapNode(keyTypeExpr, valueTypeExpr);
        }
        throw new IllegalArgumentException("Map must have exactly two type arguments: " + type);
      }
    }

    if (type instanceof TypeVariable<?>) {
      throw new IllegalArgumentException("Type variables are not supported: " + type);
    }

    if (type instanceof WildcardType) {
      throw new IllegalArgumentException("Wildcard types are not supported: " + type);
    }

    throw new IllegalArgumentException("Unsupported type: " + type + " of class " + type.getClass());
  }

  private static Class<?> getRawClass(Type type) {
    if (type instanceof Class<?> cls) {
      return cls;
    }
    if (type instanceof ParameterizedType pt) {
      return (Class<?>) pt.getRawType();
    }
    if (type instanceof GenericArrayType gat) {
      final Class<?> componentRawClass = getRawClass(gat.getGenericComponentType());
      return java.lang.reflect.Array.newInstance(componentRawClass, 0).getClass();
    }
    throw new IllegalArgumentException("Cannot determine raw class for type: " + type);
  }

  static PrimitiveValueType classifyPrimitiveClass(Class<?> clazz) {
    if (clazz == boolean.class) {
      return PrimitiveValueType.BOOLEAN;
    }
    if (clazz == byte.class) {
      return PrimitiveValueType.BYTE;
    }
    if (clazz == short.class) {
      return PrimitiveValueType.SHORT;
    }
    if (clazz == char.class) {
      return PrimitiveValueType.CHARACTER;
    }
    if (clazz == int.class) {
      return PrimitiveValueType.INTEGER;
    }
    if (clazz == long.class) {
      return PrimitiveValueType.LONG;
    }
    if (clazz == float.class) {
      return PrimitiveValueType.FLOAT;
    }
    if (clazz == double.class) {
      return PrimitiveValueType.DOUBLE;
    }
    throw new IllegalArgumentException("Unsupported primitive class type: " + clazz);
  }

  /// Classifies a reference class. Custom handler types are matched before this is called.
  static RefValueType classifyReferenceClass(Class<?> clazz) {
    if (clazz == Boolean.class) {
      return RefValueType.BOOLEAN;
    }
    if (clazz == Byte.class) {
      return RefValueType.BYTE;
    }
    if (clazz == Short.class) {
      return RefValueType.SHORT;
    }
    if (clazz == Character.class) {
      return RefValueType.CHARACTER;
    }
    if (clazz == Integer.class) {
      return RefValueType.INTEGER;
    }
    if (clazz == Long.class) {
      return RefValueType.LONG;
    }
    if (clazz == Float.class) {
      return RefValueType.FLOAT;
    }
    if (clazz == Double.class) {
      return RefValueType.DOUBLE;
    }
    if (clazz == String.class) {
      return RefValueType.STRING;
    }
    if (clazz == java.util.UUID.class) {
      return RefValueType.UUID;
    }
    if (clazz == java.time.LocalDate.class) {
      return RefValueType.LOCAL_DATE;
    }
    if (clazz == java.time.LocalDateTime.class) {
      return RefValueType.LOCAL_DATE_TIME;
    }
    // the tree and its node records pass through as they are
    if (Value.class.isAssignableFrom(clazz)) {
      return RefValueType.VALUE;
    }
    if (clazz == Object.class) {
      return RefValueType.OBJECT;
    }
    if (clazz.isEnum()) {
      return RefValueType.ENUM;
    }
    if (clazz.isRecord()) {
      return RefValueType.RECORD;
    }
    if (clazz.isInterface() && clazz.isSealed()) {
      return RefValueType.INTERFACE;
    }
    throw new IllegalArgumentException("Unsupported reference class type: " + clazz +
        ". Register a ShapeHandler for it.");
  }

  /// The classes named anywhere in the tree.
  static Stream<Class<?>> classesInAST(TypeExpr structure) {
    if (structure instanceof ArrayNode array) {
      return Stream.concat(Stream.of(array.componentType()), classesInAST(array.element()));
    }
    if (structure instanceof PrimitiveArrayNode primitiveArray) {
      return Stream.of(primitiveArray.arrayType());
    }
    if (structure instanceof ListNode list) {
      return classesInAST(list.element());
    }
    if (structure instanceof OptionalNode optional) {
      return classesInAST(optional.wrapped());
    }
    if (structure instanceof MapNode map) {
      return Stream.concat(classesInAST(map.key()), classesInAST(map.value()));
    }
    if (structure instanceof RefValueNode ref) {
      return Stream.of(ref.javaType());
    }
    return Stream.of(((PrimitiveValueNode) structure).javaType());
  }

  /// Helper method to get a string representation for debugging
  /// Example: LIST(STRING) or MAP(STRING, INTEGER)
  String toTreeString();

  record ArrayNode(TypeExpr element, Class<?> componentType) implements TypeExpr {
    public ArrayNode {
      Objects.requireNonNull(element, "Array element type cannot be null");
      Objects.requireNonNull(componentType, "Array component type cannot be null");
    }

    @Override
    public String toTreeString() {
      return "ARRAY(" + element.toTreeString() + ")";
    }
  }

  record PrimitiveArrayNode(PrimitiveValueType primitiveType, Class<?> arrayType) implements TypeExpr {
    public PrimitiveArrayNode {
      Objects.requireNonNull(primitiveType, "Primitive type cannot be null");
      Objects.requireNonNull(arrayType, "Array type cannot be null");
      if (!arrayType.isArray() || !arrayType.getComponentType().isPrimitive()) {
        throw new IllegalArgumentException("PrimitiveArrayNode requires a primitive array type");
      }
    }

    @Override
    public String toTreeString() {
      return "ARRAY(" + arrayType.getComponentType().getSimpleName() + ")";
    }
  }

  record ListNode(TypeExpr element) implements TypeExpr {
    public ListNode {
      Objects.requireNonNull(element, "List element type cannot be null");
    }

    @Override
    public String toTreeString() {
      return "LIST(" + element.toTreeString() + ")";
    }
  }

  record OptionalNode(TypeExpr wrapped) implements TypeExpr {
    public OptionalNode {
      Objects.requireNonNull(wrapped, "Optional wrapped type cannot be null");
    }

    @Override
    public String toTreeString() {
      return "OPTIONAL(" + wrapped.toTreeString() + ")";
    }
  }

  record MapNode(TypeExpr key, TypeExpr value) implements TypeExpr {
    public MapNode {
      Objects.requireNonNull(key, "Map key type cannot be null");
      Objects.requireNonNull(value, "Map value type cannot be null");
    }

    @Override
    public String toTreeString() {
      return "MAP(" + key.toTreeString() + "," + value.toTreeString() + ")";
    }
  }

  /// Leaf node for all reference types
  record RefValueNode(RefValueType type, Class<?> javaType) implements TypeExpr {
    public RefValueNode {
      Objects.requireNonNull(type, "Reference type cannot be null");
      Objects.requireNonNull(javaType, "Java type cannot be null");
    }

    @Override
    public String toTreeString() {
      return javaType.getSimpleName();
    }
  }

  enum RefValueType {
    RECORD, INTERFACE, ENUM,
    BOOLEAN, BYTE, SHORT, CHARACTER,
    INTEGER, LONG, FLOAT, DOUBLE,
    STRING, UUID, LOCAL_DATE, LOCAL_DATE_TIME,
    VALUE, OBJECT,
    CUSTOM // registered through a ShapeHandler
  }

  record PrimitiveValueNode(PrimitiveValueType type, Class<?> javaType) implements TypeExpr {
    public PrimitiveValueNode {
      Objects.requireNonNull(type, "Primitive type cannot be null");
      Objects.requireNonNull(javaType, "Java type cannot be null");
    }

    @Override
    public String toTreeString() {
      return javaType.getSimpleName();
    }
  }

  enum PrimitiveValueType {
    BOOLEAN, BYTE, SHORT, CHARACTER,
    INTEGER, LONG, FLOAT, DOUBLE
  }
}
