// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;

/// Captures a generic type such as `List<Point>` that a class literal cannot express:
/// `new TypeToken<List<Point>>() {}`.
@SuppressWarnings("unused") // The type parameter is read only via reflection
public abstract class TypeToken<T> {
  private final Type type;

  protected TypeToken() {
    if (!(getClass().getGenericSuperclass() instanceof ParameterizedType parameterized)) {
      throw new IllegalStateException("TypeToken must be created with a type argument: " + getClass());
    }
    this.type = parameterized.getActualTypeArguments()[0];
  }

  public Type type() {
    return type;
  }

  @Override
  public String toString() {
    return "TypeToken{" + type.getTypeName() + "}";
  }
}
