// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincode.json;

/// Compatibility mode for named-field targets. Set via system property `bincode.json.Compatibility`.
/// The default is DISABLED.
///
/// **DISABLED** a record decoded from an object:
/// - fails with [ValueException.Unknown] on a field that is not one of its components
/// - fails with [ValueException.Missing] when a non-optional component has no field
///
/// **ENABLED** (the opt-in) a record decoded from an object:
/// - skips fields it does not know
/// - defaults missing components to null for reference types, zero or false for primitives and
///   empty for `Optional`
///
/// This allows adding and removing components but not renaming them. `Optional` components that
/// are absent decode as empty in both modes.
public enum CompatibilityMode {
  DISABLED,
  ENABLED
}
