package io.nosqlbench.scandata.scan;

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


/// Parameters of [ScanContainer#load(LoadOptions)].
///
/// @param first the first frame of the range to load
/// @param last the end of the range, exclusive, or null for the declared frame count
/// @param roiSize the region of interest size as `(rows, columns)`, or null for whole frames
/// @param roiCenter the region of interest center, or null for the frame center
/// @param partition how frames are divided between workers
public record LoadOptions(
    int first,
    Integer last,
    int[] roiSize,
    double[] roiCenter,
    PartitionMode partition
) {

  /// load everything, splitting frames between workers
  public static final LoadOptions DEFAULT = new LoadOptions(0, null, null, null, PartitionMode.AUTO);

  public LoadOptions {
    if (partition == null) {
      partition = PartitionMode.AUTO;
    }
  }

  /// @param first the first frame
  /// @param last the end of the range, exclusive
  /// @return a copy with the frame range replaced
  public LoadOptions withRange(int first, Integer last) {
    return new LoadOptions(first, last, roiSize, roiCenter, partition);
  }

  /// @param size the window size, a number or a pair
  /// @param center the window center, a pair, or null for the frame center
  /// @return a copy with the region of interest replaced
  public LoadOptions withRoi(Object size, Object center) {
    double[] dims = RegionOfInterest.expect2(size);
    return new LoadOptions(first, last, new int[]{(int) dims[0], (int) dims[1]},
        center == null ? null : RegionOfInterest.expect2(center), partition);
  }

  /// @param mode the partition mode
  /// @return a copy with the partition mode replaced
  public LoadOptions withPartition(PartitionMode mode) {
    return new LoadOptions(first, last, roiSize, roiCenter, mode);
  }
}
