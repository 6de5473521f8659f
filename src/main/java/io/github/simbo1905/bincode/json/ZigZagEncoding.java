// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

import java.nio.ByteBuffer;

/// Variable length integers in the bincode "standard" layout. Values below 251 take one byte;
/// larger values take a marker byte followed by a little-endian u16, u32 or u64. Signed values
/// are zig-zag mapped first so that small negative numbers stay small.
///
/// The buffer must already be in little-endian order.
final class ZigZagEncoding {
  static final int SINGLE_BYTE_MAX = 250;
  static final int U16_MARKER = 251;
  static final int U32_MARKER = 252;
  static final int U64_MARKER = 253;
  static final int U128_MARKER = 254;

  private ZigZagEncoding() {
  }

  static long encode(long value) {
    return (value << 1) ^ (value >> 63);
  }

  static long decode(long zigzag) {
    return (zigzag >>> 1) ^ -(zigzag & 1);
  }

  /// Writes a signed value zig-zag encoded.
  static void putLong(ByteBuffer buffer, long value) {
    putUnsigned(buffer, encode(value));
  }

  /// Reads a signed value written by [#putLong(ByteBuffer, long)].
  static long getLong(ByteBuffer buffer) {
    return decode(getUnsigned(buffer));
  }

  static int sizeOf(long value) {
    return sizeOfUnsigned(encode(value));
  }

  /// Writes an unsigned 64-bit value held in a Java long.
  static void putUnsigned(ByteBuffer buffer, long value) {
    if (Long.compareUnsigned(value, SINGLE_BYTE_MAX) <= 0) {
      buffer.put((byte) value);
    } else if (Long.compareUnsigned(value, 0xFFFFL) <= 0) {
      buffer.put((byte) U16_MARKER);
      buffer.putShort((short) value);
    } else if (Long.compareUnsigned(value, 0xFFFF_FFFFL) <= 0) {
      buffer.put((byte) U32_MARKER);
      buffer.putInt((int) value);
    } else {
      buffer.put((byte) U64_MARKER);
      buffer.putLong(value);
    }
  }

  static int sizeOfUnsigned(long value) {
    if (Long.compareUnsigned(value, SINGLE_BYTE_MAX) <= 0) {
      return 1;
    } else if (Long.compareUnsigned(value, 0xFFFFL) <= 0) {
      return 1 + Short.BYTES;
    } else if (Long.compareUnsigned(value, 0xFFFF_FFFFL) <= 0) {
      return 1 + Integer.BYTES;
    }
    return 1 + Long.BYTES;
  }

  /// Reads an unsigned value. The result may be negative when read as a signed long.
  /// @throws BincodeException on truncated input or a marker this layout does not allow
  static long getUnsigned(ByteBuffer buffer) {
    require(buffer, 1);
    final int first = Byte.toUnsignedInt(buffer.get());
    if (first <= SINGLE_BYTE_MAX) {
      return first;
    }
    return switch (first) {
      case U16_MARKER -> {
        require(buffer, Short.BYTES);
        yield Short.toUnsignedLong(buffer.getShort());
      }
      case U32_MARKER -> {
        require(buffer, Integer.BYTES);
        yield Integer.toUnsignedLong(buffer.getInt());
      }
      case U64_MARKER -> {
        require(buffer, Long.BYTES);
        yield buffer.getLong();
      }
      case U128_MARKER -> throw BincodeException.decode("varint u128 is too large for a 64-bit value");
      default -> throw BincodeException.decode("invalid varint marker byte " + first);
    };
  }

  static void require(ByteBuffer buffer, int bytes) {
    if (buffer.remaining() < bytes) {
      throw BincodeException.decode("unexpected end of input: needed " + bytes + " bytes at position " +
          buffer.position() + " but only " + buffer.remaining() + " remain");
    }
  }
}
