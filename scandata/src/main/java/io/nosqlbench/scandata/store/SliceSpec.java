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


import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.stream.Collectors;

/// A composite slice, one [DimSelector] per dimension, outermost first.
///
/// A slice of rank 3 is the usual frame selector crossed with region-of-interest rows and
/// columns. The slice may be narrower than the array it is applied to only by being rejected:
/// stores require the slice rank to match the stored rank exactly.
///
/// @param dims the per-dimension selectors, outermost first
public record SliceSpec(List<DimSelector> dims) {

  /// The empty slice, selecting nothing in particular, returned once all dimensions are dropped
  public static final @NotNull SliceSpec EMPTY = new SliceSpec(List.of());

  /// create a slice spec
  /// @param dims the per-dimension selectors, outermost first
  public SliceSpec {
    dims = List.copyOf(dims);
  }

  /// create a slice spec
  /// @param dims the per-dimension selectors, outermost first
  /// @return the slice
  public static SliceSpec of(DimSelector... dims) {
    return new SliceSpec(List.of(dims));
  }

  /// @return the number of dimensions this slice addresses
  public int rank() {
    return dims.size();
  }

  /// @return true when no dimension is left to select on
  public boolean isEmpty() {
    return dims.isEmpty();
  }

  /// @param dimension the dimension, outermost first
  /// @return the selector of the given dimension
  public DimSelector dim(int dimension) {
    return dims.get(dimension);
  }

  /// Drop the outermost dimension, which is normally the frame selector.
  /// @return a slice of rank one less than this one
  public SliceSpec dropOuter() {
    if (dims.isEmpty()) {
      throw new IllegalStateException("cannot drop a dimension from an empty slice");
    }
    return new SliceSpec(dims.subList(1, dims.size()));
  }

  /// @return a compact textual form for diagnostics
  public String toData() {
    return dims.stream().map(DimSelector::toData).collect(Collectors.joining(",", "[", "]"));
  }

  @Override
  public String toString() {
    return toData();
  }
}
