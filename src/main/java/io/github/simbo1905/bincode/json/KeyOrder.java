// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/// How an [Value.ObjectValue] orders its keys when the encoder, decoder, binary codec or text
/// converter builds one. Set via system property `bincode.json.KeyOrder`, default INSERTION.
/// The order is part of the bytes on the wire, so two peers that must produce identical bytes
/// for the same input need the same setting.
public enum KeyOrder {
  /// Keys iterate in the order they were added, e.g. record component order.
  INSERTION,

  /// Keys iterate in hash order. Callers must not rely on any particular order.
  HASHED;

  <V> Map<String, V> newMap(int expectedSize) {
    final int capacity = Math.max(4, (int) (expectedSize / 0.75f) + 1);
    return this == INSERTION ? new LinkedHashMap<>(capacity) : new HashMap<>(capacity);
  }
}
