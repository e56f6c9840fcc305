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


import java.util.Arrays;
import java.util.Set;

/// A [KeyedArrayStore] standing in for a scan which has no data yet.
///
/// Every array has the declared scan shape. `data` and `dark` read as zeros, `mask` and `flat`
/// read as ones. Only the requested slice is materialized.
public class SyntheticArrayStore implements KeyedArrayStore {

  /// the arrays this store provides
  public static final Set<String> KEYS = Set.of("data", "mask", "dark", "flat");

  private final int[] shape;

  /// create a synthetic store
  /// @param shape the declared `(frames, rows, columns)` shape
  public SyntheticArrayStore(int[] shape) {
    this.shape = shape.clone();
  }

  @Override
  public NdArray read(String key) {
    return NdArray.filled(fillFor(key), shape);
  }

  @Override
  public NdArray read(String key, SliceSpec slice) {
    float fill = fillFor(key);
    if (slice.rank() != shape.length) {
      throw new SliceIndexException(
          "slice " + slice.toData() + " of rank " + slice.rank() + " does not match shape "
          + Arrays.toString(shape));
    }
    int[] selected = new int[shape.length];
    for (int d = 0; d < shape.length; d++) {
      selected[d] = slice.dim(d).resolve(shape[d]).length;
    }
    return NdArray.filled(fill, selected);
  }

  private float fillFor(String key) {
    if (!KEYS.contains(key)) {
      throw new MissingKeyException(key, "synthetic store has no array named '" + key + "'");
    }
    return ("mask".equals(key) || "flat".equals(key)) ? 1.0f : 0.0f;
  }

  @Override
  public Set<String> keys() {
    return KEYS;
  }
}
