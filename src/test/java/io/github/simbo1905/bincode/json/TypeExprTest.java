// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TypeExprTest {

  public record Leaf(int value) {
  }

  public enum Mode {ON, OFF}

  public record Holder(List<Optional<Leaf>> leaves, Map<String, Mode> modes, Leaf[] array) {
  }

  public sealed interface Node permits Node.Pair, Node.End {
    record Pair(Node head, Node tail) implements Node {
    }

    record End() implements Node {
    }
  }

  @Test
  void testPrimitiveTypes() {
    var intExpr = TypeExpr.analyzeType(int.class, List.of());
    assertThat(intExpr).isInstanceOf(TypeExpr.PrimitiveValueNode.class);
    assertThat(((TypeExpr.PrimitiveValueNode) intExpr).type()).isEqualTo(TypeExpr.PrimitiveValueType.INTEGER);
    assertThat(intExpr.toTreeString()).isEqualTo("int");
  }

  @Test
  void testReferenceTypes() {
    assertThat(((TypeExpr.RefValueNode) TypeExpr.analyzeType(Integer.class, List.of())).type())
        .isEqualTo(TypeExpr.RefValueType.INTEGER);
    assertThat(((TypeExpr.RefValueNode) TypeExpr.analyzeType(UUID.class, List.of())).type())
        .isEqualTo(TypeExpr.RefValueType.UUID);
    assertThat(((TypeExpr.RefValueNode) TypeExpr.analyzeType(Value.IntegerValue.class, List.of())).type())
        .isEqualTo(TypeExpr.RefValueType.VALUE);
    assertThat(((TypeExpr.RefValueNode) TypeExpr.analyzeType(Object.class, List.of())).type())
        .isEqualTo(TypeExpr.RefValueType.OBJECT);
    assertThat(((TypeExpr.RefValueNode) TypeExpr.analyzeType(Leaf.class, List.of())).type())
        .isEqualTo(TypeExpr.RefValueType.RECORD);
    assertThat(((TypeExpr.RefValueNode) TypeExpr.analyzeType(Mode.class, List.of())).type())
        .isEqualTo(TypeExpr.RefValueType.ENUM);
    assertThat(((TypeExpr.RefValueNode) TypeExpr.analyzeType(Node.class, List.of())).type())
        .isEqualTo(TypeExpr.RefValueType.INTERFACE);
  }

  @Test
  void testCustomTypeWinsOverBuiltIn() {
    var uuidExpr = TypeExpr.analyzeType(UUID.class, List.<Class<?>>of(UUID.class));
    assertThat(((TypeExpr.RefValueNode) uuidExpr).type()).isEqualTo(TypeExpr.RefValueType.CUSTOM);
  }

  @Test
  void testGenericComponents() throws NoSuchMethodException {
    var leaves = TypeExpr.analyzeType(Holder.class.getDeclaredMethod("leaves").getGenericReturnType(), List.of());
    assertThat(leaves.toTreeString()).isEqualTo("LIST(OPTIONAL(Leaf))");
    var modes = TypeExpr.analyzeType(Holder.class.getDeclaredMethod("modes").getGenericReturnType(), List.of());
    assertThat(modes.toTreeString()).isEqualTo("MAP(String,Mode)");
    var array = TypeExpr.analyzeType(Leaf[].class, List.of());
    assertThat(array.toTreeString()).isEqualTo("ARRAY(Leaf)");
    assertThat(TypeExpr.analyzeType(long[].class, List.of()).toTreeString()).isEqualTo("ARRAY(long)");
  }

  @Test
  void testClassesInAST() throws NoSuchMethodException {
    var modes = TypeExpr.analyzeType(Holder.class.getDeclaredMethod("modes").getGenericReturnType(), List.of());
    assertThat(TypeExpr.classesInAST(modes).toList()).containsExactly(String.class, Mode.class);
  }

  @Test
  void testUnsupportedTypes() {
    assertThatThrownBy(() -> TypeExpr.analyzeType(Thread.class, List.of()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("ShapeHandler");
    assertThatThrownBy(() -> TypeExpr.analyzeType(Set.class, List.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void testReachableClasses() {
    assertThat(Companion.recordClassHierarchy(Holder.class, List.of()))
        .contains(Holder.class, Leaf.class, Mode.class, String.class);
    assertThat(Companion.recordClassHierarchy(Node.class, List.of()))
        .containsExactlyInAnyOrder(Node.class, Node.Pair.class, Node.End.class);
  }

  @Test
  void testPermittedLeaves() {
    assertThat(Companion.permittedLeaves(Node.class)).containsExactly(Node.Pair.class, Node.End.class);
  }
}
