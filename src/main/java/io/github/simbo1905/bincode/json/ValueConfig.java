// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

import java.util.Arrays;
import java.util.Objects;

/// Settings shared by the encoder, decoder, binary codec and text converter.
/// @param keyOrder how objects built by this library order their keys
/// @param maxDepth the deepest nesting accepted before failing with [ValueException.DepthExceeded]
/// @param compatibility how strictly records match the fields of an object
public record ValueConfig(KeyOrder keyOrder, int maxDepth, CompatibilityMode compatibility) {

  public static final String KEY_ORDER_PROPERTY = "bincode.json.KeyOrder";
  public static final String MAX_DEPTH_PROPERTY = "bincode.json.MaxDepth";
  public static final String COMPATIBILITY_PROPERTY = "bincode.json.Compatibility";
  public static final int DEFAULT_MAX_DEPTH = 128;

  public ValueConfig {
    Objects.requireNonNull(keyOrder, "keyOrder must not be null");
    Objects.requireNonNull(compatibility, "compatibility must not be null");
    if (maxDepth <= 0) {
      throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
    }
  }

  /// INSERTION key order, depth 128, strict compatibility.
  public static ValueConfig defaults() {
    return new ValueConfig(KeyOrder.INSERTION, DEFAULT_MAX_DEPTH, CompatibilityMode.DISABLED);
  }

  /// Reads the settings from system properties, falling back to [#defaults()] for any not set.
  public static ValueConfig current() {
    return new ValueConfig(
        enumProperty(KEY_ORDER_PROPERTY, KeyOrder.class, KeyOrder.INSERTION),
        intProperty(MAX_DEPTH_PROPERTY, DEFAULT_MAX_DEPTH),
        enumProperty(COMPATIBILITY_PROPERTY, CompatibilityMode.class, CompatibilityMode.DISABLED));
  }

  public ValueConfig withKeyOrder(KeyOrder keyOrder) {
    return new ValueConfig(keyOrder, maxDepth, compatibility);
  }

  public ValueConfig withMaxDepth(int maxDepth) {
    return new ValueConfig(keyOrder, maxDepth, compatibility);
  }

  public ValueConfig withCompatibility(CompatibilityMode compatibility) {
    return new ValueConfig(keyOrder, maxDepth, compatibility);
  }

  /// Fails with [ValueException.DepthExceeded] when `depth` is past the limit.
  void checkDepth(int depth) {
    if (depth > maxDepth) {
      throw new ValueException.DepthExceeded(depth, maxDepth);
    }
  }

  private static <E extends Enum<E>> E enumProperty(String name, Class<E> type, E defaultValue) {
    final String mode = System.getProperty(name, defaultValue.name()).trim().toUpperCase();
    try {
      return Enum.valueOf(type, mode);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid " + name + ": " + mode + ". Must be one of: " +
          Arrays.toString(type.getEnumConstants()));
    }
  }

  private static int intProperty(String name, int defaultValue) {
    final String raw = System.getProperty(name);
    if (raw == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid " + name + ": " + raw + ". Must be a positive integer", e);
    }
  }
}
