// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

public class ValueDeserializerTest {

  static final ValueConfig CONFIG = ValueConfig.defaults();

  public sealed interface Command permits Command.Quit, Command.Write, Command.ChangeColor, Command.Move {
    record Quit() implements Command {
    }

    @Tuple
    record Write(String text) implements Command {
    }

    @Tuple
    record ChangeColor(int r, int g, int b) implements Command {
    }

    record Move(int x, int y) implements Command {
    }
  }

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  static <T> T read(Value value, Shape<T> shape) {
    return shape.deserialize(new ValueDeserializer(value, CONFIG));
  }

  static void assertExpected(Throwable thrown, String expected, String found) {
    assertThat(thrown).isInstanceOf(ValueException.Expected.class);
    final var e = (ValueException.Expected) thrown;
    assertThat(e.expected()).isEqualTo(expected);
    assertThat(e.found()).isEqualTo(found);
  }

  @Test
  void anyValueRebuildsTheTree() {
    final Map<String, Value> fields = new LinkedHashMap<>();
    fields.put("b", Value.array(Value.of(1L), Value.of(2.5), Value.NULL));
    fields.put("a", Value.object("nested", Value.of(new byte[]{7})));
    fields.put("s", Value.of("text"));
    fields.put("t", Value.of(true));
    final Value tree = Value.object(fields);
    final Value copy = read(tree, Shapes.value());
    assertThat(copy).isEqualTo(tree);
    assertThat(copy.asObject().orElseThrow().keySet()).containsExactly("b", "a", "s", "t");
  }

  @Test
  void readingTwiceIsEof() {
    final var deserializer = new ValueDeserializer(Value.of(1L), CONFIG);
    assertThat(Shapes.i64().deserialize(deserializer)).isEqualTo(1L);
    assertThatThrownBy(() -> Shapes.i64().deserialize(deserializer)).isInstanceOf(ValueException.Eof.class);
  }

  @Test
  void optionReadsNullAsNone() {
    final Shape<Optional<Long>> shape = Shapes.optional(Shapes.i64());
    assertThat(read(Value.NULL, shape)).isEmpty();
    assertThat(read(Value.of(3L), shape)).contains(3L);
    assertThat(read(Value.NULL, Shapes.nullable(Shapes.string()))).isNull();
  }

  @Test
  void typeMismatchNamesBothSides() {
    assertExpected(catchThrowable(() -> read(Value.of(1L), Shapes.string())), "a string", "type integer");
    assertExpected(catchThrowable(() -> read(Value.of(1.5), Shapes.i64())), "i64", "type float");
    assertExpected(catchThrowable(() -> read(Value.of("x"), Shapes.bool())), "a boolean", "type string");
    assertExpected(catchThrowable(() -> read(Value.NULL, Shapes.i32())), "i32", "type null");
  }

  @Test
  void integersAreRangeChecked() {
    assertExpected(catchThrowable(() -> read(Value.of(300L), Shapes.i8())), "i8", "integer `300`");
    assertExpected(catchThrowable(() -> read(Value.of(-1L), Shapes.u8())), "u8", "integer `-1`");
    assertExpected(catchThrowable(() -> read(Value.of(1L << 40), Shapes.i32())), "i32",
        "integer `" + (1L << 40) + "`");
    assertThat(read(Value.of(255L), Shapes.u8())).isEqualTo((byte) -1);
    assertThat(read(Value.of(-1L), Shapes.u64())).isEqualTo(-1L);
  }

  @Test
  void floatsAcceptIntegers() {
    assertThat(read(Value.of(3L), Shapes.f64())).isEqualTo(3.0);
    assertThat(read(Value.of(2.5), Shapes.f32())).isEqualTo(2.5f);
  }

  @Test
  void characterNeedsExactlyOneChar() {
    assertThat(read(Value.of("q"), Shapes.character())).isEqualTo('q');
    assertExpected(catchThrowable(() -> read(Value.of("ab"), Shapes.character())), "a character", "string \"ab\"");
  }

  @Test
  void bytesAcceptBlobOrIntegerArray() {
    assertThat(read(Value.of(new byte[]{4, 5}), Shapes.bytes())).containsExactly(4, 5);
    assertThat(read(Value.array(Value.of(1L), Value.of(255L), Value.of(-128L)), Shapes.bytes()))
        .containsExactly(1, -1, -128);
    assertExpected(catchThrowable(() -> read(Value.array(Value.of(256L)), Shapes.bytes())), "u8", "integer `256`");
  }

  @Test
  void caseObjectMustHaveOneKey() {
    final ValueMapper<Command> mapper = BincodeJsonTestSupport.mapper(Command.class);
    final Map<String, Value> twoKeys = new LinkedHashMap<>();
    twoKeys.put("Move", Value.object(Map.of("x", Value.of(1L), "y", Value.of(2L))));
    twoKeys.put("Quit", Value.array());
    assertExpected(catchThrowable(() -> mapper.fromValue(Value.object(twoKeys))),
        "map with a single key", "extra key \"Quit\"");
    assertExpected(catchThrowable(() -> mapper.fromValue(Value.object(Map.of()))), "variant name", "empty object");
    assertExpected(catchThrowable(() -> mapper.fromValue(Value.of(1L))), "an enum", "type integer");
  }

  @Test
  void unknownCaseTag() {
    final ValueMapper<Command> mapper = BincodeJsonTestSupport.mapper(Command.class);
    assertThatThrownBy(() -> mapper.fromValue(Value.of("Jump")))
        .isInstanceOfSatisfying(ValueException.Unknown.class, e -> assertThat(e.name()).isEqualTo("Jump"));
  }

  @Test
  void payloadCaseWithoutPayloadIsEof() {
    final ValueMapper<Command> mapper = BincodeJsonTestSupport.mapper(Command.class);
    assertThatThrownBy(() -> mapper.fromValue(Value.of("Write"))).isInstanceOf(ValueException.Eof.class);
  }

  @Test
  void payloadMustMatchTheCaseKind() {
    final ValueMapper<Command> mapper = BincodeJsonTestSupport.mapper(Command.class);
    assertExpected(catchThrowable(() -> mapper.fromValue(Value.object("ChangeColor", Value.of("red")))),
        "a tuple", "type string");
    assertExpected(catchThrowable(() -> mapper.fromValue(Value.object("Move", Value.array(Value.of(1L))))),
        "a struct", "type array");
    assertExpected(catchThrowable(() -> mapper.fromValue(Value.object("ChangeColor", Value.array(Value.of(1L))))),
        "tuple of length 3", "array of length 1");
  }

  @Test
  void unitCaseIgnoresAnyPayload() {
    final ValueMapper<Command> mapper = BincodeJsonTestSupport.mapper(Command.class);
    assertThat(mapper.fromValue(Value.object("Quit", Value.of(1L)))).isEqualTo(new Command.Quit());
    assertThat(mapper.fromValue(Value.of("Quit"))).isEqualTo(new Command.Quit());
  }

  @Test
  void unitStructAcceptsOnlyAnEmptyArray() {
    final ValueMapper<Command.Quit> mapper = BincodeJsonTestSupport.mapper(Command.Quit.class);
    assertThat(mapper.fromValue(Value.array())).isEqualTo(new Command.Quit());
    assertExpected(catchThrowable(() -> mapper.fromValue(Value.array(Value.NULL))),
        "unit struct Quit", "array of length 1");
    assertExpected(catchThrowable(() -> mapper.fromValue(Value.NULL)), "unit struct Quit", "type null");
  }

  @Test
  void decoderIsNotHumanReadable() {
    assertThat(new ValueDeserializer(Value.NULL, CONFIG).isHumanReadable()).isFalse();
  }
}
