// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

import org.jetbrains.annotations.Nullable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.*;
import java.util.function.BiFunction;
import java.util.function.Function;

/// Built-in shapes for the JDK types and combinators to compose them. Shapes for records, enums
/// and sealed interfaces are derived by [ValueMapper#forClass(Class)]; use these to write a
/// [ShapeHandler] for a type the derivation does not cover.
public final class Shapes {

  private Shapes() {
  }

  private static final Shape<Boolean> BOOL = new Simple<>(
      (v, s) -> s.serializeBool(v),
      d -> d.deserializeBool(new Visitor<Boolean>() {
        @Override
        public String expecting() {
          return "a boolean";
        }

        @Override
        public Boolean visitBool(boolean v) {
          return v;
        }
      }));

  private static final Shape<Byte> I8 = new Simple<>(
      (v, s) -> s.serializeByte(v),
      d -> (byte) (long) d.deserializeLong(new IntegerVisitor("i8", Byte.MIN_VALUE, Byte.MAX_VALUE)));

  private static final Shape<Short> I16 = new Simple<>(
      (v, s) -> s.serializeShort(v),
      d -> (short) (long) d.deserializeLong(new IntegerVisitor("i16", Short.MIN_VALUE, Short.MAX_VALUE)));

  private static final Shape<Integer> I32 = new Simple<>(
      (v, s) -> s.serializeInt(v),
      d -> (int) (long) d.deserializeLong(new IntegerVisitor("i32", Integer.MIN_VALUE, Integer.MAX_VALUE)));

  private static final Shape<Long> I64 = new Simple<>(
      (v, s) -> s.serializeLong(v),
      d -> d.deserializeLong(new IntegerVisitor("i64", Long.MIN_VALUE, Long.MAX_VALUE)));

  private static final Shape<Byte> U8 = new Simple<>(
      (v, s) -> s.serializeUnsignedByte(v),
      d -> (byte) (long) d.deserializeLong(new IntegerVisitor("u8", 0, 0xFFL)));

  private static final Shape<Short> U16 = new Simple<>(
      (v, s) -> s.serializeUnsignedShort(v),
      d -> (short) (long) d.deserializeLong(new IntegerVisitor("u16", 0, 0xFFFFL)));

  private static final Shape<Integer> U32 = new Simple<>(
      (v, s) -> s.serializeUnsignedInt(v),
      d -> (int) (long) d.deserializeLong(new IntegerVisitor("u32", 0, 0xFFFF_FFFFL)));

  // the 64-bit pattern is kept as is, so any Integer is in range
  private static final Shape<Long> U64 = new Simple<>(
      (v, s) -> s.serializeUnsignedLong(v),
      d -> d.deserializeLong(new IntegerVisitor("u64", Long.MIN_VALUE, Long.MAX_VALUE)));

  private static final Shape<Float> F32 = new Simple<>(
      (v, s) -> s.serializeFloat(v),
      d -> (float) (double) d.deserializeDouble(new FloatVisitor("f32")));

  private static final Shape<Double> F64 = new Simple<>(
      (v, s) -> s.serializeDouble(v),
      d -> d.deserializeDouble(new FloatVisitor("f64")));

  private static final Shape<Character> CHAR = new Simple<>(
      (v, s) -> s.serializeChar(v),
      d -> d.deserializeChar(new Visitor<Character>() {
        @Override
        public String expecting() {
          return "a character";
        }

        @Override
        public Character visitString(String v) {
          if (v.length() != 1) {
            throw new ValueException.Expected(expecting(), "string \"" + v + "\"");
          }
          return v.charAt(0);
        }
      }));

  private static final Shape<String> STRING = new Simple<>(
      (v, s) -> s.serializeString(v),
      d -> d.deserializeString(new Visitor<String>() {
        @Override
        public String expecting() {
          return "a string";
        }

        @Override
        public String visitString(String v) {
          return v;
        }
      }));

  private static final Shape<byte[]> BYTES = new Simple<>(
      (v, s) -> s.serializeBytes(v),
      d -> d.deserializeBytes(new Visitor<byte[]>() {
        @Override
        public String expecting() {
          return "byte array";
        }

        @Override
        public byte[] visitBytes(byte[] v) {
          return v;
        }

        /// Accepts an array of integers that each fit a signed or unsigned byte.
        @Override
        public byte[] visitSeq(SeqAccess seq) {
          final byte[] result = new byte[seq.remaining()];
          int i = 0;
          while (seq.hasNext()) {
            final long v = seq.nextElement(I64);
            if (v < Byte.MIN_VALUE || v > 0xFF) {
              throw new ValueException.Expected("u8", "integer `" + v + "`");
            }
            result[i++] = (byte) v;
          }
          return result;
        }
      }));

  private static final Shape<UUID> UUID_SHAPE = convert(STRING, UUID::toString, UUID::fromString);

  private static final Shape<LocalDate> LOCAL_DATE = convert(STRING, LocalDate::toString, LocalDate::parse);

  private static final Shape<LocalDateTime> LOCAL_DATE_TIME =
      convert(STRING, LocalDateTime::toString, LocalDateTime::parse);

  private static final Shape<Value> VALUE = new Shape<Value>() {
    @Override
    public Value serialize(Value value, Serializer serializer) {
      return switch (value.tag()) {
        case NULL -> serializer.serializeNone();
        case BOOLEAN -> serializer.serializeBool(((Value.BooleanValue) value).value());
        case BLOB -> serializer.serializeBytes(((Value.BlobValue) value).unsafeBytes());
        case INTEGER -> serializer.serializeLong(((Value.IntegerValue) value).value());
        case FLOAT -> serializer.serializeDouble(((Value.FloatValue) value).value());
        case STRING -> serializer.serializeString(((Value.StringValue) value).value());
        case ARRAY -> {
          final var elements = ((Value.ArrayValue) value).elements();
          final var seq = serializer.serializeSeq(elements.size());
          elements.forEach(element -> seq.element(element, this));
          yield seq.end();
        }
        case OBJECT -> {
          final var fields = ((Value.ObjectValue) value).fields();
          final var map = serializer.serializeMap(fields.size());
          fields.forEach((k, v) -> map.entry(k, STRING, v, this));
          yield map.end();
        }
      };
    }

    @Override
    public Value deserialize(Deserializer deserializer) {
      return deserializer.deserializeAny(ValueVisitor.INSTANCE);
    }

    @Override
    public String toString() {
      return "Shape[Value]";
    }
  };

  public static Shape<Boolean> bool() {
    return BOOL;
  }

  public static Shape<Byte> i8() {
    return I8;
  }

  public static Shape<Short> i16() {
    return I16;
  }

  public static Shape<Integer> i32() {
    return I32;
  }

  public static Shape<Long> i64() {
    return I64;
  }

  /// Unsigned 8-bit values held in a Java byte, 0 to 255 on the wire.
  public static Shape<Byte> u8() {
    return U8;
  }

  public static Shape<Short> u16() {
    return U16;
  }

  public static Shape<Integer> u32() {
    return U32;
  }

  /// Unsigned 64-bit values. Values above `Long.MAX_VALUE` travel as the negative `Integer`
  /// with the same bit pattern.
  public static Shape<Long> u64() {
    return U64;
  }

  public static Shape<Float> f32() {
    return F32;
  }

  public static Shape<Double> f64() {
    return F64;
  }

  public static Shape<Character> character() {
    return CHAR;
  }

  public static Shape<String> string() {
    return STRING;
  }

  public static Shape<byte[]> bytes() {
    return BYTES;
  }

  public static Shape<UUID> uuid() {
    return UUID_SHAPE;
  }

  public static Shape<LocalDate> localDate() {
    return LOCAL_DATE;
  }

  public static Shape<LocalDateTime> localDateTime() {
    return LOCAL_DATE_TIME;
  }

  /// The tree itself, passed through unchanged.
  public static Shape<Value> value() {
    return VALUE;
  }

  /// Any Java value, encoded according to its runtime class and decoded into plain JDK types.
  public static Shape<Object> dynamic() {
    return new ShapeGraph(ValueConfig.current(), List.of()).dynamic();
  }

  /// `Null` when empty, otherwise the payload with no wrapper.
  public static <T> Shape<Optional<T>> optional(Shape<T> inner) {
    Objects.requireNonNull(inner);
    return new Shape<Optional<T>>() {
      @Override
      public Value serialize(Optional<T> value, Serializer serializer) {
        return value.isPresent() ? serializer.serializeSome(value.get(), inner) : serializer.serializeNone();
      }

      @Override
      public Optional<T> deserialize(Deserializer deserializer) {
        return deserializer.deserializeOption(new Visitor<Optional<T>>() {
          @Override
          public String expecting() {
            return "option";
          }

          @Override
          public Optional<T> visitNone() {
            return Optional.empty();
          }

          @Override
          public Optional<T> visitSome(Deserializer some) {
            return Optional.ofNullable(inner.deserialize(some));
          }
        });
      }

      @Override
      public String toString() {
        return "Shape[Optional<" + inner + ">]";
      }
    };
  }

  /// Like `inner` but `null` stands for `Null`.
  public static <T> Shape<T> nullable(Shape<T> inner) {
    Objects.requireNonNull(inner);
    return new Shape<T>() {
      @Override
      public Value serialize(@Nullable T value, Serializer serializer) {
        return value == null ? serializer.serializeNone() : serializer.serializeSome(value, inner);
      }

      @Override
      public @Nullable T deserialize(Deserializer deserializer) {
        return deserializer.deserializeOption(new Visitor<T>() {
          @Override
          public String expecting() {
            return "option";
          }

          @Override
          public @Nullable T visitNone() {
            return null;
          }

          @Override
          public T visitSome(Deserializer some) {
            return inner.deserialize(some);
          }
        });
      }
    };
  }

  public static <T> Shape<List<T>> list(Shape<T> element) {
    Objects.requireNonNull(element);
    return new Shape<List<T>>() {
      @Override
      public Value serialize(List<T> value, Serializer serializer) {
        final var seq = serializer.serializeSeq(value.size());
        value.forEach(e -> seq.element(e, element));
        return seq.end();
      }

      @Override
      public List<T> deserialize(Deserializer deserializer) {
        return Collections.unmodifiableList(deserializer.deserializeSeq(new Visitor<List<T>>() {
          @Override
          public String expecting() {
            return "a sequence";
          }

          @Override
          public List<T> visitSeq(SeqAccess seq) {
            final List<T> result = new ArrayList<>(seq.remaining());
            while (seq.hasNext()) {
              result.add(seq.nextElement(element));
            }
            return result;
          }
        }));
      }

      @Override
      public String toString() {
        return "Shape[List<" + element + ">]";
      }
    };
  }

  /// Object arrays of `componentType`.
  public static <T> Shape<T[]> array(Class<T> componentType, Shape<T> element) {
    if (componentType.isPrimitive()) {
      throw new IllegalArgumentException("Use a primitive array type for primitive components: " + componentType);
    }
    @SuppressWarnings("unchecked") final Shape<T[]> shape = (Shape<T[]>) (Shape<?>) new ArrayShape(componentType, element);
    return shape;
  }

  /// Maps whose keys describe themselves as strings: `String`, `char`, enums, `UUID` and dates.
  /// Decoded maps keep the key order of the source object.
  public static <K, V> Shape<Map<K, V>> map(Shape<K> key, Shape<V> value) {
    Objects.requireNonNull(key);
    Objects.requireNonNull(value);
    return new Shape<Map<K, V>>() {
      @Override
      public Value serialize(Map<K, V> map, Serializer serializer) {
        final var builder = serializer.serializeMap(map.size());
        map.forEach((k, v) -> builder.entry(k, key, v, value));
        return builder.end();
      }

      @Override
      public Map<K, V> deserialize(Deserializer deserializer) {
        return Collections.unmodifiableMap(deserializer.deserializeMap(new Visitor<Map<K, V>>() {
          @Override
          public String expecting() {
            return "a map";
          }

          @Override
          public Map<K, V> visitMap(MapAccess access) {
            final Map<K, V> result = new LinkedHashMap<>(Math.max(4, access.remaining() * 2));
            while (access.hasNext()) {
              final K k = access.nextKey(key);
              result.put(k, access.nextValue(value));
            }
            return result;
          }
        }));
      }

      @Override
      public String toString() {
        return "Shape[Map<" + key + "," + value + ">]";
      }
    };
  }

  /// Encodes `T` as the payload `to` maps it to. Failures of `from` surface as
  /// [ValueException.Custom].
  public static <T, P> Shape<T> convert(Shape<P> payload,
                                        Function<? super T, ? extends P> to,
                                        Function<? super P, ? extends T> from) {
    Objects.requireNonNull(payload);
    Objects.requireNonNull(to);
    Objects.requireNonNull(from);
    return new Shape<T>() {
      @Override
      public Value serialize(T value, Serializer serializer) {
        return payload.serialize(to.apply(value), serializer);
      }

      @Override
      public T deserialize(Deserializer deserializer) {
        final P decoded = payload.deserialize(deserializer);
        try {
          return from.apply(decoded);
        } catch (ValueException e) {
          throw e;
        } catch (RuntimeException e) {
          throw new ValueException.Custom(String.valueOf(e.getMessage()), e);
        }
      }
    };
  }

  /// Shapes whose two directions are plain functions.
  private record Simple<T>(BiFunction<T, Serializer, Value> writer,
                           Function<Deserializer, T> reader) implements Shape<T> {
    @Override
    public Value serialize(T value, Serializer serializer) {
      return writer.apply(value, serializer);
    }

    @Override
    public T deserialize(Deserializer deserializer) {
      return reader.apply(deserializer);
    }
  }

  /// Range-checked integer targets. Anything but an `Integer` is a type mismatch; `Float`
  /// is never narrowed.
  private record IntegerVisitor(String expecting, long min, long max) implements Visitor<Long> {
    @Override
    public Long visitLong(long v) {
      if (v < min || v > max) {
        throw new ValueException.Expected(expecting, "integer `" + v + "`");
      }
      return v;
    }
  }

  /// Float targets also take `Integer` values, widened.
  private record FloatVisitor(String expecting) implements Visitor<Double> {
    @Override
    public Double visitDouble(double v) {
      return v;
    }

    @Override
    public Double visitLong(long v) {
      return (double) v;
    }
  }
}
