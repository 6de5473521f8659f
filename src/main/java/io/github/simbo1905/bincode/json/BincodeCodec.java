// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static io.github.simbo1905.bincode.json.ValueMapper.LOGGER;

/// The bincode 2 "standard" layout of a [Value]: a varint discriminant (the [Value.Tag] ordinal)
/// followed by the payload. Integers are zig-zag varints, floats 8 bytes little-endian,
/// booleans one byte, blobs and strings a varint length then the bytes, arrays a varint count
/// then the elements, objects a varint count then string keys each followed by its value.
///
/// Encoding sizes the tree exactly and then writes it into a single buffer.
public final class BincodeCodec implements BinaryCodec {
  final ValueConfig config;

  public BincodeCodec(ValueConfig config) {
    this.config = Objects.requireNonNull(config, "config must not be null");
  }

  /// Codec configured by [ValueConfig#current()].
  public static BincodeCodec standard() {
    return new BincodeCodec(ValueConfig.current());
  }

  @Override
  public byte[] encode(Value value) {
    Objects.requireNonNull(value, "value must not be null");
    final long size = sizeOf(value, 0);
    if (size > Integer.MAX_VALUE - 8) {
      throw BincodeException.encode("encoded size " + size + " is too large for a byte array");
    }
    final ByteBuffer buffer = ByteBuffer.allocate((int) size).order(ByteOrder.LITTLE_ENDIAN);
    write(buffer, value);
    assert !buffer.hasRemaining() : "sized " + size + " but wrote " + buffer.position();
    LOGGER.finer(() -> "Encoded " + value.errorDescription() + " in " + size + " bytes");
    return buffer.array();
  }

  @Override
  public Decoded decode(byte[] bytes) {
    Objects.requireNonNull(bytes, "bytes must not be null");
    final ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    final Value value = read(buffer, 0);
    LOGGER.finer(() -> "Decoded " + value.errorDescription() + " from " + buffer.position() + " of " +
        bytes.length + " bytes");
    return new Decoded(value, buffer.position());
  }

  long sizeOf(Value value, int depth) {
    final int discriminant = ZigZagEncoding.sizeOfUnsigned(value.tag().ordinal());
    return discriminant + switch (value.tag()) {
      case NULL -> 0L;
      case BOOLEAN -> 1L;
      case BLOB -> {
        final int length = ((Value.BlobValue) value).length();
        yield ZigZagEncoding.sizeOfUnsigned(length) + (long) length;
      }
      case ARRAY -> {
        config.checkDepth(depth + 1);
        final List<Value> elements = ((Value.ArrayValue) value).elements();
        long size = ZigZagEncoding.sizeOfUnsigned(elements.size());
        for (Value element : elements) {
          size += sizeOf(element, depth + 1);
        }
        yield size;
      }
      case INTEGER -> ZigZagEncoding.sizeOf(((Value.IntegerValue) value).value());
      case FLOAT -> (long) Double.BYTES;
      case OBJECT -> {
        config.checkDepth(depth + 1);
        final Map<String, Value> fields = ((Value.ObjectValue) value).fields();
        long size = ZigZagEncoding.sizeOfUnsigned(fields.size());
        for (Map.Entry<String, Value> entry : fields.entrySet()) {
          size += sizeOfString(entry.getKey()) + sizeOf(entry.getValue(), depth + 1);
        }
        yield size;
      }
      case STRING -> sizeOfString(((Value.StringValue) value).value());
    };
  }

  private static long sizeOfString(String s) {
    final int length = utf8Length(s);
    return ZigZagEncoding.sizeOfUnsigned(length) + (long) length;
  }

  /// UTF-8 byte count without allocating. A string holding an unpaired surrogate has no UTF-8
  /// form and fails to encode.
  static int utf8Length(String s) {
    int count = 0;
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (c < 0x80) {
        count += 1;
      } else if (c < 0x800) {
        count += 2;
      } else if (Character.isHighSurrogate(c) && i + 1 < s.length() && Character.isLowSurrogate(s.charAt(i + 1))) {
        count += 4;
        i++;
      } else if (Character.isSurrogate(c)) {
        throw unpairedSurrogate(c, i);
      } else {
        count += 3;
      }
    }
    return count;
  }

  private static BincodeException unpairedSurrogate(char c, int index) {
    return BincodeException.encode("invalid utf-16: unpaired surrogate \\u" +
        Integer.toHexString(c).toUpperCase() + " at index " + index);
  }

  private void write(ByteBuffer buffer, Value value) {
    ZigZagEncoding.putUnsigned(buffer, value.tag().ordinal());
    switch (value.tag()) {
      case NULL -> {
      }
      case BOOLEAN -> buffer.put((byte) (((Value.BooleanValue) value).value() ? 1 : 0));
      case BLOB -> {
        final byte[] bytes = ((Value.BlobValue) value).unsafeBytes();
        ZigZagEncoding.putUnsigned(buffer, bytes.length);
        buffer.put(bytes);
      }
      case ARRAY -> {
        final List<Value> elements = ((Value.ArrayValue) value).elements();
        ZigZagEncoding.putUnsigned(buffer, elements.size());
        elements.forEach(element -> write(buffer, element));
      }
      case INTEGER -> ZigZagEncoding.putLong(buffer, ((Value.IntegerValue) value).value());
      case FLOAT -> buffer.putDouble(((Value.FloatValue) value).value());
      case OBJECT -> {
        final Map<String, Value> fields = ((Value.ObjectValue) value).fields();
        ZigZagEncoding.putUnsigned(buffer, fields.size());
        fields.forEach((k, v) -> {
          writeString(buffer, k);
          write(buffer, v);
        });
      }
      case STRING -> writeString(buffer, ((Value.StringValue) value).value());
    }
  }

  private static void writeString(ByteBuffer buffer, String s) {
    final ByteBuffer utf8;
    try {
      utf8 = StandardCharsets.UTF_8.newEncoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .encode(CharBuffer.wrap(s));
    } catch (CharacterCodingException e) {
      throw new BincodeException(BincodeException.Kind.ENCODE, "invalid utf-16 in string of length " + s.length(), e);
    }
    ZigZagEncoding.putUnsigned(buffer, utf8.remaining());
    buffer.put(utf8);
  }

  private Value read(ByteBuffer buffer, int depth) {
    final int position = buffer.position();
    final long discriminant = ZigZagEncoding.getUnsigned(buffer);
    final Value.Tag[] tags = Value.Tag.values();
    if (discriminant < 0 || discriminant >= tags.length) {
      throw BincodeException.decode("unexpected variant index " + Long.toUnsignedString(discriminant) +
          " for Value at position " + position);
    }
    return switch (tags[(int) discriminant]) {
      case NULL -> Value.NULL;
      case BOOLEAN -> {
        ZigZagEncoding.require(buffer, 1);
        final byte b = buffer.get();
        if (b != 0 && b != 1) {
          throw BincodeException.decode("invalid boolean value " + Byte.toUnsignedInt(b) +
              " at position " + (buffer.position() - 1));
        }
        yield new Value.BooleanValue(b == 1);
      }
      case BLOB -> {
        final byte[] bytes = new byte[length(buffer)];
        buffer.get(bytes);
        yield new Value.BlobValue(bytes);
      }
      case ARRAY -> {
        final int count = length(buffer);
        config.checkDepth(depth + 1);
        final List<Value> elements = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
          elements.add(read(buffer, depth + 1));
        }
        yield new Value.ArrayValue(elements);
      }
      case INTEGER -> new Value.IntegerValue(ZigZagEncoding.getLong(buffer));
      case FLOAT -> {
        ZigZagEncoding.require(buffer, Double.BYTES);
        yield new Value.FloatValue(buffer.getDouble());
      }
      case OBJECT -> {
        final int count = length(buffer);
        config.checkDepth(depth + 1);
        final Map<String, Value> fields = config.keyOrder().newMap(count);
        for (int i = 0; i < count; i++) {
          final String key = readString(buffer);
          fields.put(key, read(buffer, depth + 1));
        }
        yield new Value.ObjectValue(fields);
      }
      case STRING -> new Value.StringValue(readString(buffer));
    };
  }

  /// A length or count. Every element takes at least one byte so neither can exceed what is left.
  private static int length(ByteBuffer buffer) {
    final int position = buffer.position();
    final long length = ZigZagEncoding.getUnsigned(buffer);
    if (length < 0 || length > buffer.remaining()) {
      throw BincodeException.decode("length " + Long.toUnsignedString(length) + " at position " + position +
          " exceeds the " + buffer.remaining() + " bytes remaining");
    }
    return (int) length;
  }

  private static String readString(ByteBuffer buffer) {
    final int length = length(buffer);
    final ByteBuffer slice = buffer.slice().limit(length);
    buffer.position(buffer.position() + length);
    try {
      final CharBuffer chars = StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(slice);
      return chars.toString();
    } catch (CharacterCodingException e) {
      throw new BincodeException(BincodeException.Kind.DECODE,
          "invalid utf-8 in string of " + length + " bytes ending at position " + buffer.position(), e);
    }
  }

  @Override
  public String toString() {
    return "BincodeCodec{config=" + config + "}";
  }
}
