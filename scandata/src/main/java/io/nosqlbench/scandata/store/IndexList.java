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
import java.util.List;
import java.util.stream.Collectors;

/// An explicit, possibly non-contiguous, list of positions along one dimension.
/// @param indices the selected positions, in selection order
public record IndexList(int[] indices) implements DimSelector {

  /// create an index list
  /// @param indices the selected positions
  /// @return the index list
  public static IndexList of(List<Integer> indices) {
    return new IndexList(indices.stream().mapToInt(Integer::intValue).toArray());
  }

  @Override
  public int[] resolve(int extent) {
    for (int index : indices) {
      if (index < 0 || index >= extent) {
        throw new SliceIndexException(
            "index " + index + " is outside a dimension of extent " + extent);
      }
    }
    return indices.clone();
  }

  @Override
  public boolean isContiguous() {
    for (int i = 1; i < indices.length; i++) {
      if (indices[i] != indices[i - 1] + 1) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toData() {
    return Arrays.stream(indices).mapToObj(String::valueOf).collect(Collectors.joining(",", "(", ")"));
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof IndexList other && Arrays.equals(indices, other.indices);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(indices);
  }

  @Override
  public String toString() {
    return toData();
  }
}
