// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

import java.util.Objects;

/// [ValueMapper] over a single root shape.
final class ShapeMapper<T> implements ValueMapper<T> {
  final Shape<T> shape;
  final ValueConfig config;
  final BinaryCodec codec;

  ShapeMapper(Shape<T> shape, ValueConfig config) {
    this.shape = Objects.requireNonNull(shape, "shape must not be null");
    this.config = Objects.requireNonNull(config, "config must not be null");
    this.codec = new BincodeCodec(config);
  }

  @Override
  public Value toValue(T value) {
    final Value result = new ValueSerializer(config).describe(value, shape);
    LOGGER.fine(() -> "toValue " + shape + " produced " + result.errorDescription());
    return result;
  }

  @Override
  public T fromValue(Value value) {
    Objects.requireNonNull(value, "value must not be null");
    LOGGER.fine(() -> "fromValue " + shape + " from " + value.errorDescription());
    return shape.deserialize(new ValueDeserializer(value, config));
  }

  @Override
  public byte[] toBytes(T value) {
    final Value tree = toValue(value);
    try {
      return codec.encode(tree);
    } catch (BincodeException e) {
      throw new ValueException.BinaryCodec(e);
    }
  }

  @Override
  public T fromBytes(byte[] bytes) {
    Objects.requireNonNull(bytes, "bytes must not be null");
    final BinaryCodec.Decoded decoded;
    try {
      decoded = codec.decode(bytes);
    } catch (BincodeException e) {
      throw new ValueException.BinaryCodec(e);
    }
    if (decoded.bytesRead() < bytes.length) {
      LOGGER.fine(() -> "Ignoring " + (bytes.length - decoded.bytesRead()) + " trailing bytes");
    }
    return fromValue(decoded.value());
  }

  @Override
  public Shape<T> shape() {
    return shape;
  }

  @Override
  public ValueConfig config() {
    return config;
  }

  @Override
  public String toString() {
    return "ShapeMapper{shape=" + shape + ", config=" + config + "}";
  }
}
