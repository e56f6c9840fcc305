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


/// A selection along one dimension of a stored array.
///
/// A selector is resolved against the extent of the dimension it is applied to. Resolution
/// fails with a [SliceIndexException] when the selection does not fit.
public interface DimSelector {

  /// Resolve the selected positions along a dimension
  /// @param extent
  ///     the size of the dimension
  /// @return the selected positions, in selection order
  /// @throws SliceIndexException
  ///     if any selected position is outside `0..extent`
  int[] resolve(int extent);

  /// Whether the selection is a single run of adjacent positions, which can be read in one
  /// request from a store.
  /// @return true if the selection is contiguous
  boolean isContiguous();

  /// @return a compact textual form for diagnostics
  String toData();

  /// Select a whole dimension
  DimSelector ALL = new DimSelector() {
    @Override
    public int[] resolve(int extent) {
      int[] positions = new int[extent];
      for (int i = 0; i < extent; i++) {
        positions[i] = i;
      }
      return positions;
    }

    @Override
    public boolean isContiguous() {
      return true;
    }

    @Override
    public String toData() {
      return ":";
    }

    @Override
    public String toString() {
      return toData();
    }
  };
}
