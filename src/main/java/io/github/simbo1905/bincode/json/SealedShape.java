// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

import org.jetbrains.annotations.Nullable;

import java.util.*;

import static io.github.simbo1905.bincode.json.ValueMapper.LOGGER;

/// A sealed interface is a tagged union over the records and enum constants it permits, with
/// nested sealed interfaces flattened. A record case is tagged by its simple name and an enum
/// constant by its name. Two cases with the same tag are rejected when the shape is built.
final class SealedShape<T> implements Shape<T> {

  /// One case. Exactly one of `constant` and `shape` is set.
  record Case(String tag, int index, @Nullable Enum<?> constant, @Nullable Shape<?> shape) {
  }

  final Class<T> sealedType;
  final String name;
  final List<String> tags;
  final Map<String, Case> byTag;
  final Map<Class<?>, Case> byRecordType;

  SealedShape(Class<T> sealedType, ShapeGraph graph) {
    this.sealedType = Objects.requireNonNull(sealedType);
    this.name = sealedType.getSimpleName();
    final Map<String, Case> cases = new LinkedHashMap<>();
    final Map<Class<?>, Case> records = new HashMap<>();
    for (Class<?> leaf : Companion.permittedLeaves(sealedType)) {
      if (leaf.isEnum()) {
        for (Object constant : leaf.getEnumConstants()) {
          final Enum<?> e = (Enum<?>) constant;
          addCase(cases, new Case(e.name(), cases.size(), e, null));
        }
      } else {
        final Case c = new Case(leaf.getSimpleName(), cases.size(), null, graph.resolve(leaf));
        addCase(cases, c);
        records.put(leaf, c);
      }
    }
    this.byTag = Collections.unmodifiableMap(cases);
    this.byRecordType = Map.copyOf(records);
    this.tags = List.copyOf(cases.keySet());
    LOGGER.fine(() -> "SealedShape " + name + " with cases " + tags);
  }

  private void addCase(Map<String, Case> cases, Case c) {
    if (cases.putIfAbsent(c.tag(), c) != null) {
      throw new IllegalArgumentException("Duplicate case tag " + c.tag() + " in sealed interface " + sealedType.getName());
    }
  }

  @Override
  public Value serialize(T value, Serializer serializer) {
    if (value instanceof Enum<?> e) {
      final Case c = byTag.get(e.name());
      if (c == null || c.constant() != e) {
        throw new IllegalArgumentException(e + " is not a case of " + sealedType.getName());
      }
      return serializer.serializeUnitVariant(name, c.index(), c.tag());
    }
    final Case c = byRecordType.get(value.getClass());
    if (c == null) {
      throw new IllegalArgumentException(value.getClass().getName() + " is not a case of " + sealedType.getName());
    }
    final Shape<Object> shape = caseShape(c);
    if (shape instanceof RecordShape<Object> record) {
      return record.serializeVariant(value, serializer, name, c.index(), c.tag());
    }
    // a case with a custom shape carries that shape as its single payload
    return serializer.serializeNewtypeVariant(name, c.index(), c.tag(), value, shape);
  }

  @Override
  public T deserialize(Deserializer deserializer) {
    return deserializer.deserializeEnum(name, tags, new Visitor<T>() {
      @Override
      public String expecting() {
        return "enum " + name;
      }

      @Override
      public T visitEnum(EnumAccess data) {
        final String tag = data.variantName();
        final Case c = byTag.get(tag);
        if (c == null) {
          throw new ValueException.Unknown(tag);
        }
        if (c.constant() != null) {
          data.unitVariant();
          return sealedType.cast(c.constant());
        }
        final Shape<Object> shape = caseShape(c);
        if (shape instanceof RecordShape<Object> record) {
          return sealedType.cast(record.deserializeVariant(data));
        }
        return sealedType.cast(data.newtypeVariant(shape));
      }
    });
  }

  private static Shape<Object> caseShape(Case c) {
    return Companion.erase(Companion.unwrap(Objects.requireNonNull(c.shape())));
  }

  @Override
  public String toString() {
    return "SealedShape[" + name + " " + tags + "]";
  }
}
