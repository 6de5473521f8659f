// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SealedShapeTest {

  public sealed interface Shape2D permits Shape2D.Circle, Shape2D.Square, Shape2D.Empty, Shape2D.Unit {
    @Tuple
    record Circle(double radius) implements Shape2D {
    }

    record Square(double side, String label) implements Shape2D {
    }

    record Empty() implements Shape2D {
    }

    enum Unit implements Shape2D {ORIGIN, INFINITY}
  }

  /// Arithmetic expressions, recursive through the interface.
  public sealed interface Expr permits Expr.Num, Expr.Add, Expr.Neg {
    @Tuple
    record Num(long value) implements Expr {
    }

    @Tuple
    record Add(Expr left, Expr right) implements Expr {
    }

    @Tuple
    record Neg(Expr inner) implements Expr {
    }
  }

  public record TreeNode(String name, List<TreeNode> children) {
  }

  public sealed interface Animal permits Animal.Mammal, Animal.Bird {
    sealed interface Mammal extends Animal permits Animal.Dog {
    }

    record Dog(String name) implements Mammal {
    }

    record Bird(boolean flies) implements Animal {
    }
  }

  public interface Left {
    record Same() implements Dup {
    }
  }

  public interface Right {
    record Same() implements Dup {
    }
  }

  public sealed interface Dup permits Left.Same, Right.Same {
  }

  public record Drawing(String title, List<Shape2D> shapes) {
  }

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  @Test
  void enumAndUnitRecordCasesAreTagStrings() {
    final ValueMapper<Shape2D> mapper = BincodeJsonTestSupport.mapper(Shape2D.class);
    assertThat(mapper.toValue(Shape2D.Unit.ORIGIN)).isEqualTo(Value.of("ORIGIN"));
    assertThat(mapper.toValue(new Shape2D.Empty())).isEqualTo(Value.of("Empty"));
    assertThat(mapper.fromValue(Value.of("INFINITY"))).isEqualTo(Shape2D.Unit.INFINITY);
    assertThat(mapper.fromValue(Value.of("Empty"))).isEqualTo(new Shape2D.Empty());
  }

  @Test
  void everyCaseRoundTrips() {
    final ValueMapper<Shape2D> mapper = BincodeJsonTestSupport.mapper(Shape2D.class);
    for (Shape2D shape : List.of(new Shape2D.Circle(1.5), new Shape2D.Square(2.0, "sq"), new Shape2D.Empty(),
        Shape2D.Unit.ORIGIN, Shape2D.Unit.INFINITY)) {
      assertThat(mapper.fromValue(mapper.toValue(shape))).isEqualTo(shape);
      assertThat(mapper.fromBytes(mapper.toBytes(shape))).isEqualTo(shape);
    }
  }

  @Test
  void payloadCasesAreWrapped() {
    final ValueMapper<Shape2D> mapper = BincodeJsonTestSupport.mapper(Shape2D.class);
    assertThat(mapper.toValue(new Shape2D.Circle(1.5))).isEqualTo(Value.object("Circle", Value.of(1.5)));
    assertThat(mapper.toValue(new Shape2D.Square(2.0, "sq"))).isEqualTo(
        Value.object("Square", Value.object(Map.of("side", Value.of(2.0), "label", Value.of("sq")))));
  }

  @Test
  void recursiveInterfaceRoundTrips() {
    final Expr expr = new Expr.Add(new Expr.Num(1), new Expr.Neg(new Expr.Add(new Expr.Num(2), new Expr.Num(3))));
    final ValueMapper<Expr> mapper = BincodeJsonTestSupport.mapper(Expr.class);
    final Value value = mapper.toValue(expr);
    assertThat(value.asObject().orElseThrow()).containsOnlyKeys("Add");
    assertThat(mapper.fromValue(value)).isEqualTo(expr);
    assertThat(mapper.fromBytes(mapper.toBytes(expr))).isEqualTo(expr);
  }

  @Test
  void recursiveRecordRoundTrips() {
    final TreeNode tree = new TreeNode("root", List.of(
        new TreeNode("a", List.of()),
        new TreeNode("b", List.of(new TreeNode("c", List.of())))));
    final ValueMapper<TreeNode> mapper = BincodeJsonTestSupport.mapper(TreeNode.class);
    assertThat(mapper.fromValue(mapper.toValue(tree))).isEqualTo(tree);
  }

  @Test
  void nestedSealedInterfacesAreFlattened() {
    final ValueMapper<Animal> mapper = BincodeJsonTestSupport.mapper(Animal.class);
    assertThat(mapper.toValue(new Animal.Dog("rex")))
        .isEqualTo(Value.object("Dog", Value.object("name", Value.of("rex"))));
    assertThat(mapper.fromValue(Value.object("Bird", Value.object("flies", Value.of(true)))))
        .isEqualTo(new Animal.Bird(true));
  }

  @Test
  void duplicateCaseTagsAreRejected() {
    assertThatThrownBy(() -> BincodeJsonTestSupport.mapper(Dup.class))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Duplicate case tag Same");
  }

  @Test
  void listsOfCasesRoundTrip() {
    final Drawing drawing = new Drawing("d", List.of(new Shape2D.Circle(1), Shape2D.Unit.ORIGIN));
    final ValueMapper<Drawing> mapper = BincodeJsonTestSupport.mapper(Drawing.class);
    final Value value = mapper.toValue(drawing);
    assertThat(value.asObject().orElseThrow().get("shapes"))
        .isEqualTo(Value.array(Value.object("Circle", Value.of(1.0)), Value.of("ORIGIN")));
    assertThat(mapper.fromValue(value)).isEqualTo(drawing);
  }

  @Test
  void plainEnumRoundTrips() {
    final ValueMapper<Shape2D.Unit> mapper = BincodeJsonTestSupport.mapper(Shape2D.Unit.class);
    assertThat(mapper.toValue(Shape2D.Unit.INFINITY)).isEqualTo(Value.of("INFINITY"));
    assertThat(mapper.fromValue(Value.of("ORIGIN"))).isEqualTo(Shape2D.Unit.ORIGIN);
    assertThatThrownBy(() -> mapper.fromValue(Value.of("NOWHERE")))
        .isInstanceOfSatisfying(ValueException.Unknown.class, e -> assertThat(e.name()).isEqualTo("NOWHERE"));
  }
}
