package io.nosqlbench.scandata.store;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */


import java.util.Set;

/// An opaque key to array store with slice support.
///
/// Implementations report exactly two distinguishable read failures, which callers rely on for
/// fallback handling:
/// - [MissingKeyException] when the key is not stored
/// - [SliceIndexException] when the slice rank differs from the stored rank, or a selection
///   exceeds a stored extent
public interface KeyedArrayStore {

  /// read a whole array
  /// @param key the array name
  /// @return the stored array
  NdArray read(String key);

  /// read part of an array
  /// @param key the array name
  /// @param slice a slice with one selector per stored dimension
  /// @return the selected values
  NdArray read(String key, SliceSpec slice);

  /// @return the names of the stored arrays
  Set<String> keys();

  /// @param key the array name
  /// @return true if the array is stored
  default boolean contains(String key) {
    return keys().contains(key);
  }
}
