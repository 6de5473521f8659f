// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

import java.lang.invoke.MethodHandle;
import java.lang.reflect.RecordComponent;
import java.util.*;
import java.util.stream.Collectors;

import static io.github.simbo1905.bincode.json.ValueMapper.LOGGER;

/// Describes and builds a record through method handles on its accessors and canonical
/// constructor. How the record travels depends on its declaration:
///
/// - no components: the unit value, an empty `Array`
/// - `@Tuple` with one component: the component alone
/// - `@Tuple` with several components: an `Array` in component order
/// - otherwise: an `Object` keyed by component name
///
/// When [CompatibilityMode] is ENABLED unknown fields are skipped and missing components are
/// filled with defaults rather than failing.
final class RecordShape<T> implements Shape<T> {

  enum Kind {UNIT, NEWTYPE, TUPLE, STRUCT}

  final Class<T> userType;
  final Kind kind;
  final String name;
  final List<String> fieldNames;
  final Class<?>[] componentTypes;
  final Shape<Object>[] componentShapes;
  final MethodHandle recordConstructor;
  final MethodHandle[] componentAccessors;
  final Map<String, Integer> fieldIndex;
  final boolean compatibilityMode;

  @SuppressWarnings("unchecked")
  RecordShape(Class<T> userType, ShapeGraph graph) {
    assert userType.isRecord() : "User type must be a record: " + userType;
    this.userType = Objects.requireNonNull(userType);
    this.name = userType.getSimpleName();
    this.compatibilityMode = graph.config.compatibility() == CompatibilityMode.ENABLED;

    final RecordComponent[] components = userType.getRecordComponents();
    if (components.length == 0) {
      kind = Kind.UNIT;
    } else if (Companion.isTuple(userType)) {
      kind = components.length == 1 ? Kind.NEWTYPE : Kind.TUPLE;
    } else {
      kind = Kind.STRUCT;
    }

    this.fieldNames = Arrays.stream(components).map(RecordComponent::getName).toList();
    this.componentTypes = Arrays.stream(components).map(RecordComponent::getType).toArray(Class<?>[]::new);
    this.fieldIndex = new HashMap<>();
    for (int i = 0; i < components.length; i++) {
      fieldIndex.put(components[i].getName(), i);
    }
    this.recordConstructor = Companion.canonicalConstructor(userType);
    this.componentAccessors = Companion.resolveGetters(userType, components);

    // component shapes may be deferred when the record reaches itself
    this.componentShapes = Arrays.stream(components)
        .map(component -> Companion.nullSafe(component.getType(), graph.shapeFor(component.getGenericType())))
        .toArray(Shape[]::new);
    LOGGER.fine(() -> "RecordShape " + name + " kind " + kind + " components " + fieldNames);
  }

  @Override
  public Value serialize(T record, Serializer serializer) {
    return switch (kind) {
      case UNIT -> serializer.serializeUnitStruct(name);
      case NEWTYPE -> serializer.serializeNewtypeStruct(name, component(record, 0), componentShapes[0]);
      case TUPLE -> writeElements(record, serializer.serializeTupleStruct(name, componentShapes.length));
      case STRUCT -> writeFields(record, serializer.serializeStruct(name, componentShapes.length));
    };
  }

  /// Describes the record as case `tag` of the tagged union `enumName`.
  Value serializeVariant(T record, Serializer serializer, String enumName, int index, String tag) {
    return switch (kind) {
      case UNIT -> serializer.serializeUnitVariant(enumName, index, tag);
      case NEWTYPE ->
          serializer.serializeNewtypeVariant(enumName, index, tag, component(record, 0), componentShapes[0]);
      case TUPLE -> writeElements(record,
          serializer.serializeTupleVariant(enumName, index, tag, componentShapes.length));
      case STRUCT -> writeFields(record,
          serializer.serializeStructVariant(enumName, index, tag, componentShapes.length));
    };
  }

  @Override
  public T deserialize(Deserializer deserializer) {
    return switch (kind) {
      case UNIT -> deserializer.deserializeUnitStruct(name, new UnitVisitor());
      case NEWTYPE -> deserializer.deserializeNewtypeStruct(name, new NewtypeVisitor());
      case TUPLE -> deserializer.deserializeTupleStruct(name, componentShapes.length, new TupleVisitor());
      case STRUCT -> deserializer.deserializeStruct(name, fieldNames, new StructVisitor());
    };
  }

  /// Builds the record from the payload of a tagged-union case.
  T deserializeVariant(EnumAccess data) {
    return switch (kind) {
      case UNIT -> {
        data.unitVariant();
        yield construct();
      }
      case NEWTYPE -> construct(data.newtypeVariant(componentShapes[0]));
      case TUPLE -> data.tupleVariant(componentShapes.length, new TupleVisitor());
      case STRUCT -> data.structVariant(fieldNames, new StructVisitor());
    };
  }

  private Value writeElements(T record, Serializer.SerializeSeq seq) {
    for (int i = 0; i < componentShapes.length; i++) {
      seq.element(component(record, i), componentShapes[i]);
    }
    return seq.end();
  }

  private Value writeFields(T record, Serializer.SerializeStruct struct) {
    for (int i = 0; i < componentShapes.length; i++) {
      struct.field(fieldNames.get(i), component(record, i), componentShapes[i]);
    }
    return struct.end();
  }

  private Object component(T record, int i) {
    try {
      return componentAccessors[i].invoke(record);
    } catch (Throwable e) {
      throw new IllegalStateException("Failed to read component " + fieldNames.get(i) + " of " + name, e);
    }
  }

  private T construct(Object... components) {
    try {
      return userType.cast(recordConstructor.invokeWithArguments(components));
    } catch (ValueException e) {
      throw e;
    } catch (RuntimeException e) {
      // the record's own constructor rejected the values
      throw new ValueException.Custom(name + ": " + e.getMessage(), e);
    } catch (Throwable e) {
      throw new IllegalStateException("Failed to construct " + name, e);
    }
  }

  private final class UnitVisitor implements Visitor<T> {
    @Override
    public String expecting() {
      return "unit struct " + name;
    }

    @Override
    public T visitUnit() {
      return construct();
    }

    @Override
    public T visitSeq(SeqAccess seq) {
      if (seq.hasNext()) {
        throw new ValueException.Expected(expecting(), "array of length " + seq.remaining());
      }
      return construct();
    }
  }

  private final class NewtypeVisitor implements Visitor<T> {
    @Override
    public String expecting() {
      return "tuple struct " + name;
    }

    @Override
    public T visitNewtypeStruct(Deserializer deserializer) {
      return construct(componentShapes[0].deserialize(deserializer));
    }
  }

  private final class TupleVisitor implements Visitor<T> {
    @Override
    public String expecting() {
      return "tuple of length " + componentShapes.length;
    }

    @Override
    public T visitUnit() {
      throw new ValueException.Expected(expecting(), "array of length 0");
    }

    @Override
    public T visitSeq(SeqAccess seq) {
      if (seq.remaining() != componentShapes.length) {
        throw new ValueException.Expected(expecting(), "array of length " + seq.remaining());
      }
      final Object[] components = new Object[componentShapes.length];
      for (int i = 0; i < components.length; i++) {
        components[i] = seq.nextElement(componentShapes[i]);
      }
      return construct(components);
    }
  }

  private final class StructVisitor implements Visitor<T> {
    @Override
    public String expecting() {
      return "struct " + name;
    }

    @Override
    public T visitMap(MapAccess map) {
      final Object[] components = new Object[componentShapes.length];
      final boolean[] seen = new boolean[componentShapes.length];
      while (map.hasNext()) {
        final String key = map.nextKey(Shapes.string());
        final Integer i = fieldIndex.get(key);
        if (i == null) {
          if (!compatibilityMode) {
            throw new ValueException.Unknown(key);
          }
          LOGGER.fine(() -> "Skipping unknown field " + key + " of " + name + " in compatibility mode");
          map.nextValue(Shapes.value());
          continue;
        }
        if (seen[i]) {
          throw new ValueException.Duplicated(key);
        }
        components[i] = map.nextValue(componentShapes[i]);
        seen[i] = true;
      }
      for (int i = 0; i < components.length; i++) {
        if (!seen[i]) {
          components[i] = missing(i);
        }
      }
      return construct(components);
    }

    private Object missing(int i) {
      if (componentTypes[i] == Optional.class) {
        return Optional.empty();
      }
      if (!compatibilityMode) {
        throw new ValueException.Missing(fieldNames.get(i));
      }
      LOGGER.fine(() -> "Filling missing field " + fieldNames.get(i) + " of " + name + " with a default value");
      return Companion.defaultValue(componentTypes[i]);
    }
  }

  @Override
  public String toString() {
    return "RecordShape[" + name + " " + kind + " " +
        fieldNames.stream().collect(Collectors.joining(",", "(", ")")) + "]";
  }
}
