// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class BincodeJsonTest {

  public record Point(int x, int y) {
  }

  public enum Status {ACTIVE, RETIRED}

  public sealed interface Event permits Event.Started, Event.Stopped {
    record Started(long at, Point where) implements Event {
    }

    record Stopped() implements Event {
    }
  }

  public record Letter(char value) {
  }

  public record Account(String owner, Status status, List<Event> history, Map<String, Point> places,
                        Optional<Double> balance, Value extra) {
  }

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  static Account sampleAccount() {
    final Map<String, Point> places = new LinkedHashMap<>();
    places.put("home", new Point(1, 2));
    places.put("work", new Point(-3, 4));
    return new Account("ann", Status.ACTIVE,
        List.of(new Event.Started(1_700_000_000_000L, new Point(0, 0)), new Event.Stopped()),
        places, Optional.of(10.25), Value.object("note", Value.array(Value.of(true), Value.NULL)));
  }

  @Test
  void valueRoundTrip() {
    final Account account = sampleAccount();
    final Value value = BincodeJson.toValue(account, Account.class);
    assertThat(BincodeJson.fromValue(value, Account.class)).isEqualTo(account);
  }

  @Test
  void bytesRoundTrip() {
    final Account account = sampleAccount();
    final byte[] bytes = BincodeJson.toBytes(account, Account.class);
    assertThat(BincodeJson.fromBytes(bytes, Account.class)).isEqualTo(account);
  }

  @Test
  void bytesAreTheCodecOfTheValue() {
    final Account account = sampleAccount();
    final Value value = BincodeJson.toValue(account, Account.class);
    assertThat(BincodeJson.toBytes(account, Account.class))
        .containsExactly(new BincodeCodec(ValueConfig.defaults()).encode(value));
  }

  @Test
  void genericTargetsUseATypeToken() {
    final List<Point> points = List.of(new Point(1, 1), new Point(2, 2));
    final byte[] bytes = BincodeJson.toBytes(points);
    assertThat(BincodeJson.fromBytes(bytes, new TypeToken<List<Point>>() {
    })).isEqualTo(points);
    assertThat(BincodeJson.fromValue(BincodeJson.toValue(points), new TypeToken<List<Point>>() {
    })).isEqualTo(points);
  }

  @Test
  void dynamicValuesDescribeByRuntimeClass() {
    final Map<String, Object> source = new LinkedHashMap<>();
    source.put("n", 1);
    source.put("f", 2.5f);
    source.put("s", "text");
    source.put("l", List.of(true, 'c'));
    source.put("o", Optional.empty());
    source.put("p", new Point(3, 4));
    source.put("e", Status.RETIRED);
    source.put("b", new byte[]{1});
    source.put("a", new int[]{7});
    source.put("null", null);

    final Map<String, Value> expected = new LinkedHashMap<>();
    expected.put("n", Value.of(1L));
    expected.put("f", Value.of(2.5));
    expected.put("s", Value.of("text"));
    expected.put("l", Value.array(Value.of(true), Value.of("c")));
    expected.put("o", Value.NULL);
    expected.put("p", Value.object(Map.of("x", Value.of(3L), "y", Value.of(4L))));
    expected.put("e", Value.of("RETIRED"));
    expected.put("b", Value.of(new byte[]{1}));
    expected.put("a", Value.array(Value.of(7L)));
    expected.put("null", Value.NULL);
    assertThat(BincodeJson.toValue(source)).isEqualTo(Value.object(expected));
  }

  @Test
  void dynamicDecodeProducesPlainTypes() {
    final Value value = Value.object(Map.of(
        "i", Value.of(1L),
        "d", Value.of(0.5),
        "list", Value.array(Value.of("x"), Value.NULL),
        "blob", Value.of(new byte[]{2})));
    final Object decoded = BincodeJson.fromValue(value, Object.class);
    assertThat(decoded).isInstanceOf(Map.class);
    final Map<?, ?> map = (Map<?, ?>) decoded;
    assertThat(map.get("i")).isEqualTo(1L);
    assertThat(map.get("d")).isEqualTo(0.5);
    assertThat(map.get("list")).isEqualTo(Arrays.asList("x", null));
    assertThat((byte[]) map.get("blob")).containsExactly(2);
  }

  @Test
  void sealedCaseNeedsTheInterfaceForItsTag() {
    final Event stopped = new Event.Stopped();
    assertThat(BincodeJson.toValue(stopped)).isEqualTo(Value.array());
    assertThat(BincodeJson.toValue(stopped, Event.class)).isEqualTo(Value.of("Stopped"));
  }

  @Test
  void codecFailuresAreWrapped() {
    assertThatThrownBy(() -> BincodeJson.fromBytes(new byte[]{9}, Point.class))
        .isInstanceOfSatisfying(ValueException.BinaryCodec.class, e -> {
          assertThat(e.getCause().kind()).isEqualTo(BincodeException.Kind.DECODE);
          assertThat(e.getMessage()).startsWith("bincode error: decode: unexpected variant index 9");
        });
  }

  @Test
  void trailingBytesAreIgnored() {
    final byte[] bytes = BincodeJson.toBytes(new Point(5, 6), Point.class);
    final byte[] padded = Arrays.copyOf(bytes, bytes.length + 3);
    assertThat(BincodeJson.fromBytes(padded, Point.class)).isEqualTo(new Point(5, 6));
  }

  @Test
  void shapeErrorsAfterDecodingAreNotWrapped() {
    final byte[] bytes = BincodeJson.toBytes("not a point");
    assertThatThrownBy(() -> BincodeJson.fromBytes(bytes, Point.class))
        .isInstanceOf(ValueException.Expected.class);
  }

  @Test
  void nullDescribesAsNull() {
    assertThat(BincodeJson.toValue(null)).isEqualTo(Value.NULL);
    assertThat(BincodeJson.toBytes(null)).containsExactly(0);
  }

  @Test
  void unpairedSurrogatesFailToEncodeRatherThanChange() {
    final Letter letter = new Letter('\uD800');
    assertThat(BincodeJson.toValue(letter, Letter.class)).isEqualTo(Value.object("value", Value.of("\uD800")));
    assertThatThrownBy(() -> BincodeJson.toBytes(letter, Letter.class))
        .isInstanceOfSatisfying(ValueException.BinaryCodec.class,
            e -> assertThat(e.getMessage()).startsWith("bincode error: encode: invalid utf-16"));
    assertThatThrownBy(() -> BincodeJson.toBytes(Value.of("a\uDC00b")))
        .isInstanceOf(ValueException.BinaryCodec.class);
  }
}
