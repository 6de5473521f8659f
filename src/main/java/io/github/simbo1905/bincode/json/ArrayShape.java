// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Java arrays, object or primitive, as an ordered sequence. `byte[]` is not handled here as
/// it encodes as a `Blob`.
final class ArrayShape implements Shape<Object> {
  final Class<?> componentType;
  final Shape<Object> element;

  ArrayShape(Class<?> componentType, Shape<?> element) {
    this.componentType = Objects.requireNonNull(componentType);
    this.element = Companion.nullSafe(componentType, Objects.requireNonNull(element));
  }

  @Override
  public Value serialize(Object array, Serializer serializer) {
    final int length = Array.getLength(array);
    final var seq = serializer.serializeSeq(length);
    for (int i = 0; i < length; i++) {
      seq.element(Array.get(array, i), element);
    }
    return seq.end();
  }

  @Override
  public Object deserialize(Deserializer deserializer) {
    return deserializer.deserializeSeq(new Visitor<Object>() {
      @Override
      public String expecting() {
        return "an array of " + componentType.getSimpleName();
      }

      @Override
      public Object visitSeq(SeqAccess seq) {
        final List<Object> elements = new ArrayList<>(seq.remaining());
        while (seq.hasNext()) {
          elements.add(seq.nextElement(element));
        }
        final Object result = Array.newInstance(componentType, elements.size());
        for (int i = 0; i < elements.size(); i++) {
          Array.set(result, i, elements.get(i));
        }
        return result;
      }
    });
  }

  @Override
  public String toString() {
    return "Shape[" + componentType.getSimpleName() + "[]]";
  }
}
