// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Rebuilds a [Value] from whatever the data says it is. Objects keep the order in which the
/// source yields their keys.
final class ValueVisitor implements Visitor<Value> {
  static final ValueVisitor INSTANCE = new ValueVisitor();

  private ValueVisitor() {
  }

  @Override
  public String expecting() {
    return "any valid value";
  }

  @Override
  public Value visitBool(boolean v) {
    return new Value.BooleanValue(v);
  }

  @Override
  public Value visitLong(long v) {
    return new Value.IntegerValue(v);
  }

  @Override
  public Value visitDouble(double v) {
    return new Value.FloatValue(v);
  }

  @Override
  public Value visitString(String v) {
    return new Value.StringValue(v);
  }

  @Override
  public Value visitBytes(byte[] v) {
    return new Value.BlobValue(v);
  }

  @Override
  public Value visitNone() {
    return Value.NULL;
  }

  @Override
  public Value visitSome(Deserializer deserializer) {
    return deserializer.deserializeAny(this);
  }

  @Override
  public Value visitUnit() {
    return new Value.ArrayValue(List.of());
  }

  @Override
  public Value visitNewtypeStruct(Deserializer deserializer) {
    return deserializer.deserializeAny(this);
  }

  @Override
  public Value visitSeq(SeqAccess seq) {
    final List<Value> elements = new ArrayList<>(seq.remaining());
    while (seq.hasNext()) {
      elements.add(seq.nextElement(Shapes.value()));
    }
    return new Value.ArrayValue(elements);
  }

  @Override
  public Value visitMap(MapAccess map) {
    final Map<String, Value> fields = new LinkedHashMap<>(Math.max(4, map.remaining() * 2));
    while (map.hasNext()) {
      final String key = map.nextKey(Shapes.string());
      fields.put(key, map.nextValue(Shapes.value()));
    }
    return new Value.ObjectValue(fields);
  }
}
