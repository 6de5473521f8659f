// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

import java.util.Objects;

/// Byte-level encoding of a [Value] tree. Every tree must survive `decode(encode(v))` unchanged.
public interface BinaryCodec {

  /// @throws BincodeException if the tree cannot be encoded
  byte[] encode(Value value);

  /// Decodes the first value in `bytes`.
  /// @throws BincodeException if the bytes are not a valid encoding
  Decoded decode(byte[] bytes);

  /// A decoded value and how many bytes it took.
  record Decoded(Value value, int bytesRead) {
    public Decoded {
      Objects.requireNonNull(value, "value must not be null");
    }
  }
}
