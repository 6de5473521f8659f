// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

import java.util.List;

/// Mappers with default settings so tests do not depend on system properties.
final class BincodeJsonTestSupport {
  private BincodeJsonTestSupport() {
  }

  static <T> ValueMapper<T> mapper(Class<T> type) {
    return ValueMapper.forClass(type, ValueConfig.defaults(), List.of());
  }

  static <T> ValueMapper<T> mapper(TypeToken<T> type) {
    return ValueMapper.forType(type, ValueConfig.defaults(), List.of());
  }

  static <T> ValueMapper<T> mapper(Class<T> type, ValueConfig config) {
    return ValueMapper.forClass(type, config, List.of());
  }
}
