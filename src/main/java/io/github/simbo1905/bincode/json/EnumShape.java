// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

import static io.github.simbo1905.bincode.json.ValueMapper.LOGGER;

/// An enum is a tagged union of unit cases. Each constant travels as a bare `String` of its name.
final class EnumShape<E extends Enum<E>> implements Shape<E> {
  final Class<E> enumType;
  final List<String> names;
  final Map<String, E> byName;

  EnumShape(Class<E> enumType) {
    this.enumType = Objects.requireNonNull(enumType);
    final E[] constants = enumType.getEnumConstants();
    this.names = Arrays.stream(constants).map(Enum::name).toList();
    this.byName = Arrays.stream(constants).collect(Collectors.toUnmodifiableMap(Enum::name, Function.identity()));
    LOGGER.fine(() -> "EnumShape " + enumType.getSimpleName() + " with constants " + names);
  }

  @Override
  public Value serialize(E value, Serializer serializer) {
    return serializer.serializeUnitVariant(enumType.getSimpleName(), value.ordinal(), value.name());
  }

  @Override
  public E deserialize(Deserializer deserializer) {
    return deserializer.deserializeEnum(enumType.getSimpleName(), names, new Visitor<E>() {
      @Override
      public String expecting() {
        return "enum " + enumType.getSimpleName();
      }

      @Override
      public E visitEnum(EnumAccess data) {
        final String tag = data.variantName();
        final E constant = byName.get(tag);
        if (constant == null) {
          throw new ValueException.Unknown(tag);
        }
        data.unitVariant();
        return constant;
      }
    });
  }

  @Override
  public String toString() {
    return "EnumShape[" + enumType.getSimpleName() + "]";
  }
}
