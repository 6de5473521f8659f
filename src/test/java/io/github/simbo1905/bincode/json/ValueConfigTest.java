// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ValueConfigTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  @AfterEach
  void clearProperties() {
    System.clearProperty(ValueConfig.KEY_ORDER_PROPERTY);
    System.clearProperty(ValueConfig.MAX_DEPTH_PROPERTY);
    System.clearProperty(ValueConfig.COMPATIBILITY_PROPERTY);
  }

  @Test
  void defaultsAreInsertionOrderedAndStrict() {
    final ValueConfig config = ValueConfig.defaults();
    assertThat(config.keyOrder()).isEqualTo(KeyOrder.INSERTION);
    assertThat(config.maxDepth()).isEqualTo(128);
    assertThat(config.compatibility()).isEqualTo(CompatibilityMode.DISABLED);
    assertThat(ValueConfig.current()).isEqualTo(config);
  }

  @Test
  void systemPropertiesOverrideDefaults() {
    System.setProperty(ValueConfig.KEY_ORDER_PROPERTY, "hashed");
    System.setProperty(ValueConfig.MAX_DEPTH_PROPERTY, " 16 ");
    System.setProperty(ValueConfig.COMPATIBILITY_PROPERTY, "ENABLED");
    assertThat(ValueConfig.current())
        .isEqualTo(new ValueConfig(KeyOrder.HASHED, 16, CompatibilityMode.ENABLED));
  }

  @Test
  void invalidPropertiesAreRejected() {
    System.setProperty(ValueConfig.KEY_ORDER_PROPERTY, "sorted");
    assertThatThrownBy(ValueConfig::current)
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining(ValueConfig.KEY_ORDER_PROPERTY);
    System.clearProperty(ValueConfig.KEY_ORDER_PROPERTY);

    System.setProperty(ValueConfig.MAX_DEPTH_PROPERTY, "deep");
    assertThatThrownBy(ValueConfig::current).isInstanceOf(IllegalArgumentException.class);

    System.setProperty(ValueConfig.MAX_DEPTH_PROPERTY, "0");
    assertThatThrownBy(ValueConfig::current).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void withersReplaceOneSetting() {
    final ValueConfig config = ValueConfig.defaults().withMaxDepth(3).withKeyOrder(KeyOrder.HASHED);
    assertThat(config).isEqualTo(new ValueConfig(KeyOrder.HASHED, 3, CompatibilityMode.DISABLED));
    assertThatThrownBy(() -> config.checkDepth(4)).isInstanceOf(ValueException.DepthExceeded.class);
    config.checkDepth(3);
  }
}
