// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

/// Failure raised by [BincodeCodec] while turning a [Value] into bytes or back.
public final class BincodeException extends RuntimeException {

  public enum Kind {ENCODE, DECODE}

  private final Kind kind;

  BincodeException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  BincodeException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  static BincodeException encode(String message) {
    return new BincodeException(Kind.ENCODE, message);
  }

  static BincodeException decode(String message) {
    return new BincodeException(Kind.DECODE, message);
  }

  public Kind kind() {
    return kind;
  }

  @Override
  public String getMessage() {
    return kind.name().toLowerCase() + ": " + super.getMessage();
  }
}
