// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ShapeGraphTest {

  public enum Colour {RED, GREEN}

  public record Pen(Colour colour, Optional<Nib> nib) {
  }

  public record Nib(double width) {
  }

  public sealed interface Stroke permits Stroke.Line, Stroke.Dot {
    record Line(Pen pen, List<Stroke> children) implements Stroke {
    }

    record Dot(Value extra) implements Stroke {
    }
  }

  public record Sketch(Stroke first, Thread worker) {
  }

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  @Test
  void prepareBuildsEveryReachableUserType() {
    final ShapeGraph graph = new ShapeGraph(ValueConfig.defaults(), List.of());
    graph.prepare(Companion.recordClassHierarchy(Stroke.class, List.of()));
    assertThat(List.of(Stroke.class, Stroke.Line.class, Stroke.Dot.class, Pen.class, Nib.class, Colour.class))
        .allMatch(graph::isResolved);
    assertThat(graph.isResolved(Value.class)).isFalse();
  }

  @Test
  void preparedShapesAreReused() {
    final ShapeGraph graph = new ShapeGraph(ValueConfig.defaults(), List.of());
    graph.prepare(Companion.recordClassHierarchy(Pen.class, List.of()));
    assertThat(graph.resolve(Nib.class)).isSameAs(graph.resolve(Nib.class));
    assertThat(graph.isResolved(Stroke.class)).isFalse();
  }

  @Test
  void unsupportedComponentFailsWhenTheMapperIsBuilt() {
    assertThatThrownBy(() -> BincodeJsonTestSupport.mapper(Sketch.class))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("ShapeHandler");
  }

  @Test
  void mapperFromPreparedGraphRoundTrips() {
    final ValueMapper<Stroke> mapper = BincodeJsonTestSupport.mapper(Stroke.class);
    final Stroke stroke = new Stroke.Line(new Pen(Colour.GREEN, Optional.of(new Nib(0.5))),
        List.of(new Stroke.Dot(Value.of("x")), new Stroke.Line(new Pen(Colour.RED, Optional.empty()), List.of())));
    assertThat(mapper.fromBytes(mapper.toBytes(stroke))).isEqualTo(stroke);
  }
}
