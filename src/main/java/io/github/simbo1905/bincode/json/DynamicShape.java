// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

import java.lang.reflect.Array;
import java.util.*;

/// Shape of a value declared as `Object`. Encoding looks at the runtime class; decoding
/// produces plain JDK types: `null`, `Boolean`, `byte[]`, `List<Object>`, `Long`, `Double`,
/// `Map<String, Object>` and `String`.
final class DynamicShape implements Shape<Object> {
  final ShapeGraph graph;

  DynamicShape(ShapeGraph graph) {
    this.graph = Objects.requireNonNull(graph);
  }

  @Override
  public Value serialize(Object value, Serializer serializer) {
    if (value == null) {
      return serializer.serializeNone();
    }
    final Class<?> type = value.getClass();
    if (graph.customShapes.containsKey(type)) {
      return Companion.erase(graph.customShapes.get(type)).serialize(value, serializer);
    }
    if (value instanceof Boolean b) {
      return serializer.serializeBool(b);
    }
    if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
      return serializer.serializeLong(((Number) value).longValue());
    }
    if (value instanceof Float || value instanceof Double) {
      return serializer.serializeDouble(((Number) value).doubleValue());
    }
    if (value instanceof Character c) {
      return serializer.serializeChar(c);
    }
    if (value instanceof String s) {
      return serializer.serializeString(s);
    }
    if (value instanceof byte[] bytes) {
      return serializer.serializeBytes(bytes);
    }
    if (value instanceof Value v) {
      return Shapes.value().serialize(v, serializer);
    }
    if (value instanceof Optional<?> optional) {
      return optional.isPresent() ? serializer.serializeSome(optional.get(), this) : serializer.serializeNone();
    }
    if (value instanceof Map<?, ?> map) {
      final var builder = serializer.serializeMap(map.size());
      map.forEach((k, v) -> builder.entry(k, this, v, this));
      return builder.end();
    }
    if (value instanceof Collection<?> collection) {
      final var seq = serializer.serializeSeq(collection.size());
      collection.forEach(element -> seq.element(element, this));
      return seq.end();
    }
    if (type.isArray()) {
      final int length = Array.getLength(value);
      final var seq = serializer.serializeSeq(length);
      for (int i = 0; i < length; i++) {
        seq.element(Array.get(value, i), this);
      }
      return seq.end();
    }
    if (value instanceof Enum<?> e) {
      return Companion.erase(graph.resolve(e.getDeclaringClass())).serialize(value, serializer);
    }
    return Companion.erase(graph.shapeFor(type)).serialize(value, serializer);
  }

  @Override
  public Object deserialize(Deserializer deserializer) {
    return deserializer.deserializeAny(new Visitor<Object>() {
      @Override
      public String expecting() {
        return "any value";
      }

      @Override
      public Object visitBool(boolean v) {
        return v;
      }

      @Override
      public Object visitLong(long v) {
        return v;
      }

      @Override
      public Object visitDouble(double v) {
        return v;
      }

      @Override
      public Object visitString(String v) {
        return v;
      }

      @Override
      public Object visitBytes(byte[] v) {
        return v;
      }

      @Override
      public Object visitNone() {
        return null;
      }

      @Override
      public Object visitSome(Deserializer some) {
        return DynamicShape.this.deserialize(some);
      }

      @Override
      public Object visitUnit() {
        return List.of();
      }

      @Override
      public Object visitNewtypeStruct(Deserializer inner) {
        return DynamicShape.this.deserialize(inner);
      }

      @Override
      public Object visitSeq(SeqAccess seq) {
        final List<Object> elements = new ArrayList<>(seq.remaining());
        while (seq.hasNext()) {
          elements.add(seq.nextElement(DynamicShape.this));
        }
        return Collections.unmodifiableList(elements);
      }

      @Override
      public Object visitMap(MapAccess map) {
        final Map<String, Object> fields = new LinkedHashMap<>(Math.max(4, map.remaining() * 2));
        while (map.hasNext()) {
          final String key = map.nextKey(Shapes.string());
          fields.put(key, map.nextValue(DynamicShape.this));
        }
        return Collections.unmodifiableMap(fields);
      }
    });
  }

  @Override
  public String toString() {
    return "Shape[Object]";
  }
}
