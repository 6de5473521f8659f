// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/// The four conversions between typed values, [Value] trees and bytes, configured by
/// [ValueConfig#current()]. Nothing is cached between calls; build a [ValueMapper] once to
/// convert the same type repeatedly.
///
/// The untyped overloads encode by runtime class. A record that is one case of a sealed
/// interface then encodes as the bare record; pass the sealed interface as the type to get the
/// tagged form.
public final class BincodeJson {

  private BincodeJson() {
  }

  public static Value toValue(@Nullable Object value) {
    return dynamicMapper().toValue(value);
  }

  public static <T> Value toValue(@Nullable T value, Class<T> type) {
    return ValueMapper.forClass(type).toValue(value);
  }

  public static <T> T fromValue(Value value, Class<T> type) {
    return ValueMapper.forClass(type).fromValue(value);
  }

  public static <T> T fromValue(Value value, TypeToken<T> type) {
    return ValueMapper.forType(type).fromValue(value);
  }

  public static byte[] toBytes(@Nullable Object value) {
    return dynamicMapper().toBytes(value);
  }

  public static <T> byte[] toBytes(@Nullable T value, Class<T> type) {
    return ValueMapper.forClass(type).toBytes(value);
  }

  public static <T> T fromBytes(byte[] bytes, Class<T> type) {
    return ValueMapper.forClass(type).fromBytes(bytes);
  }

  public static <T> T fromBytes(byte[] bytes, TypeToken<T> type) {
    return ValueMapper.forType(type).fromBytes(bytes);
  }

  private static ValueMapper<Object> dynamicMapper() {
    final var config = ValueConfig.current();
    return ValueMapper.forShape(new ShapeGraph(config, List.of()).dynamic(), config);
  }
}
