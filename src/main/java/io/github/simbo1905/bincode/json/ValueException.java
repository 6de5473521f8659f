// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

import java.util.Objects;

/// Everything that can go wrong while mapping typed values to and from a [Value] tree or bytes.
/// The set of kinds is closed. Each kind carries its context as plain strings and the whole
/// operation that raised it has failed; there are no partial results.
public abstract sealed class ValueException extends RuntimeException permits
    ValueException.BinaryCodec, ValueException.Custom, ValueException.Expected,
    ValueException.Duplicated, ValueException.Missing, ValueException.Unknown,
    ValueException.Eof, ValueException.DepthExceeded {

  ValueException(String message) {
    super(message);
  }

  ValueException(String message, Throwable cause) {
    super(message, cause);
  }

  /// The binary codec failed. The cause is passed through as is.
  public static final class BinaryCodec extends ValueException {
    public BinaryCodec(BincodeException cause) {
      super("bincode error: " + cause.getMessage(), Objects.requireNonNull(cause));
    }

    @Override
    public synchronized BincodeException getCause() {
      return (BincodeException) super.getCause();
    }
  }

  /// Escape hatch for shape descriptors reporting their own domain errors.
  public static final class Custom extends ValueException {
    public Custom(String message) {
      super("custom error: " + message);
    }

    public Custom(String message, Throwable cause) {
      super("custom error: " + message, cause);
    }
  }

  /// The data had a different shape or type than the target asked for.
  public static final class Expected extends ValueException {
    private final String expected;
    private final String found;

    public Expected(String expected, String found) {
      super("expected " + expected + ", found " + found);
      this.expected = expected;
      this.found = found;
    }

    public String expected() {
      return expected;
    }

    public String found() {
      return found;
    }
  }

  public static final class Duplicated extends ValueException {
    private final String field;

    public Duplicated(String field) {
      super("field " + field + " was duplicated");
      this.field = field;
    }

    public String field() {
      return field;
    }
  }

  public static final class Missing extends ValueException {
    private final String field;

    public Missing(String field) {
      super("field " + field + " was missing");
      this.field = field;
    }

    public String field() {
      return field;
    }
  }

  /// An unrecognised field or tagged-union case.
  public static final class Unknown extends ValueException {
    private final String name;

    public Unknown(String name) {
      super("field or variant " + name + " was unknown");
      this.name = name;
    }

    public String name() {
      return name;
    }
  }

  /// A value was required but none was left to read.
  public static final class Eof extends ValueException {
    public Eof() {
      super("unexpected eof");
    }
  }

  /// Nesting went deeper than [ValueConfig#maxDepth()].
  public static final class DepthExceeded extends ValueException {
    private final int depth;
    private final int maxDepth;

    public DepthExceeded(int depth, int maxDepth) {
      super("nesting depth " + depth + " exceeds the maximum of " + maxDepth);
      this.depth = depth;
      this.maxDepth = maxDepth;
    }

    public int depth() {
      return depth;
    }

    public int maxDepth() {
      return maxDepth;
    }
  }

  /// Type mismatch against the node the data actually had.
  static Expected invalidType(String expected, Value found) {
    return new Expected(expected, found.errorDescription());
  }
}
