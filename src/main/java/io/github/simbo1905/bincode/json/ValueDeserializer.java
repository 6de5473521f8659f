// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

import org.jetbrains.annotations.Nullable;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static io.github.simbo1905.bincode.json.ValueMapper.LOGGER;

/// Drives a [Visitor] from a [Value] tree, top down. Each node is handed out exactly once;
/// asking for it again fails with [ValueException.Eof].
final class ValueDeserializer implements Deserializer {
  final ValueConfig config;
  final int depth;
  @Nullable Value value;

  ValueDeserializer(Value value, ValueConfig config) {
    this(value, config, 0);
  }

  ValueDeserializer(@Nullable Value value, ValueConfig config, int depth) {
    this.value = value;
    this.config = Objects.requireNonNull(config);
    this.depth = depth;
  }

  private Value take() {
    final Value taken = value;
    if (taken == null) {
      throw new ValueException.Eof();
    }
    value = null;
    return taken;
  }

  private Value peek() {
    if (value == null) {
      throw new ValueException.Eof();
    }
    return value;
  }

  @Override
  public boolean isHumanReadable() {
    return false;
  }

  @Override
  public <T> T deserializeAny(Visitor<T> visitor) {
    final Value taken = take();
    return switch (taken.tag()) {
      case NULL -> visitor.visitNone();
      case BOOLEAN -> visitor.visitBool(((Value.BooleanValue) taken).value());
      case BLOB -> visitor.visitBytes(((Value.BlobValue) taken).bytes());
      case ARRAY -> visitor.visitSeq(new SeqDeserializer(((Value.ArrayValue) taken).elements(), config, depth + 1));
      case INTEGER -> visitor.visitLong(((Value.IntegerValue) taken).value());
      case FLOAT -> visitor.visitDouble(((Value.FloatValue) taken).value());
      case OBJECT -> visitor.visitMap(new MapDeserializer(((Value.ObjectValue) taken).fields(), config, depth + 1));
      case STRING -> visitor.visitString(((Value.StringValue) taken).value());
    };
  }

  @Override
  public <T> T deserializeOption(Visitor<T> visitor) {
    if (peek().isNull()) {
      take();
      return visitor.visitNone();
    }
    return visitor.visitSome(this);
  }

  @Override
  public <T> T deserializeEnum(String name, List<String> variants, Visitor<T> visitor) {
    final Value taken = take();
    if (taken instanceof Value.StringValue s) {
      return visitor.visitEnum(new EnumDeserializer(s.value(), null, config, depth + 1));
    }
    if (!(taken instanceof Value.ObjectValue object)) {
      throw ValueException.invalidType("an enum", taken);
    }
    final Iterator<Map.Entry<String, Value>> iterator = object.fields().entrySet().iterator();
    if (!iterator.hasNext()) {
      throw new ValueException.Expected("variant name", "empty object");
    }
    final var entry = iterator.next();
    if (iterator.hasNext()) {
      throw new ValueException.Expected("map with a single key", "extra key \"" + iterator.next().getKey() + "\"");
    }
    LOGGER.finer(() -> "Decoding " + name + " case " + entry.getKey() + " at depth " + depth);
    return visitor.visitEnum(new EnumDeserializer(entry.getKey(), entry.getValue(), config, depth + 1));
  }

  @Override
  public <T> T deserializeNewtypeStruct(String name, Visitor<T> visitor) {
    return visitor.visitNewtypeStruct(this);
  }

  @Override
  public <T> T deserializeUnit(Visitor<T> visitor) {
    final Value current = peek();
    if (current instanceof Value.ArrayValue array && array.elements().isEmpty()) {
      take();
      return visitor.visitUnit();
    }
    return deserializeAny(visitor);
  }

  @Override
  public <T> T deserializeTuple(int length, Visitor<T> visitor) {
    if (length == 0) {
      return deserializeUnit(visitor);
    }
    return deserializeAny(visitor);
  }

  static final class SeqDeserializer implements SeqAccess {
    final Iterator<Value> iterator;
    final ValueConfig config;
    final int depth;
    int remaining;

    SeqDeserializer(List<Value> elements, ValueConfig config, int depth) {
      config.checkDepth(depth);
      this.iterator = elements.iterator();
      this.remaining = elements.size();
      this.config = config;
      this.depth = depth;
    }

    @Override
    public boolean hasNext() {
      return iterator.hasNext();
    }

    @Override
    public <T> T nextElement(Shape<T> shape) {
      if (!iterator.hasNext()) {
        throw new ValueException.Eof();
      }
      remaining--;
      return shape.deserialize(new ValueDeserializer(iterator.next(), config, depth));
    }

    @Override
    public int remaining() {
      return remaining;
    }
  }

  static final class MapDeserializer implements MapAccess {
    final Iterator<Map.Entry<String, Value>> iterator;
    final ValueConfig config;
    final int depth;
    int remaining;
    @Nullable Value pending;

    MapDeserializer(Map<String, Value> fields, ValueConfig config, int depth) {
      config.checkDepth(depth);
      this.iterator = fields.entrySet().iterator();
      this.remaining = fields.size();
      this.config = config;
      this.depth = depth;
    }

    @Override
    public boolean hasNext() {
      return iterator.hasNext();
    }

    @Override
    public <K> K nextKey(Shape<K> shape) {
      if (!iterator.hasNext()) {
        throw new ValueException.Eof();
      }
      remaining--;
      final var entry = iterator.next();
      pending = entry.getValue();
      return shape.deserialize(new ValueDeserializer(new Value.StringValue(entry.getKey()), config, depth));
    }

    @Override
    public <V> V nextValue(Shape<V> shape) {
      final Value taken = pending;
      if (taken == null) {
        throw new ValueException.Eof();
      }
      pending = null;
      return shape.deserialize(new ValueDeserializer(taken, config, depth));
    }

    @Override
    public int remaining() {
      return remaining;
    }
  }

  /// A decoded case: its tag and, for a single-key object, the payload.
  static final class EnumDeserializer implements EnumAccess {
    final String tag;
    final ValueConfig config;
    final int depth;
    @Nullable Value payload;

    EnumDeserializer(String tag, @Nullable Value payload, ValueConfig config, int depth) {
      config.checkDepth(depth);
      this.tag = tag;
      this.payload = payload;
      this.config = config;
      this.depth = depth;
    }

    private Value takePayload() {
      final Value taken = payload;
      if (taken == null) {
        throw new ValueException.Eof();
      }
      payload = null;
      return taken;
    }

    @Override
    public <K> K variant(Shape<K> shape) {
      return shape.deserialize(new ValueDeserializer(new Value.StringValue(tag), config, depth));
    }

    @Override
    public void unitVariant() {
      if (payload != null) {
        Shapes.value().deserialize(new ValueDeserializer(takePayload(), config, depth));
      }
    }

    @Override
    public <T> T newtypeVariant(Shape<T> shape) {
      return shape.deserialize(new ValueDeserializer(takePayload(), config, depth));
    }

    @Override
    public <T> T tupleVariant(int length, Visitor<T> visitor) {
      final Value taken = takePayload();
      if (taken instanceof Value.ArrayValue array) {
        if (array.elements().isEmpty()) {
          return visitor.visitUnit();
        }
        return visitor.visitSeq(new SeqDeserializer(array.elements(), config, depth + 1));
      }
      throw ValueException.invalidType("a tuple", taken);
    }

    @Override
    public <T> T structVariant(List<String> fields, Visitor<T> visitor) {
      final Value taken = takePayload();
      if (taken instanceof Value.ObjectValue object) {
        return visitor.visitMap(new MapDeserializer(object.fields(), config, depth + 1));
      }
      throw ValueException.invalidType("a struct", taken);
    }
  }
}
