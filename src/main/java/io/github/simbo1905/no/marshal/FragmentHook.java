// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.util.function.Function;

/// Compile-time side of a [TypeHook]: called once per occurrence of the hooked type while a routine
/// is compiled, it returns the function the routine then calls for every value.
@FunctionalInterface
public interface FragmentHook {
  Function<Object, Object> emit(TypeDescriptor descriptor, MarshalConfig config);
}
