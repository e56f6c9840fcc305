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


import io.nosqlbench.scandata.errors.ConfigException;
import io.nosqlbench.scandata.store.Interval;

import java.util.List;

/// A rectangular window of a detector frame.
///
/// A window of `size` around `center` spans `[ceil(center - size/2), ceil(center + size/2))` on
/// each axis, so a size of 4 around 5 covers `[3,7)` and a size of 3 around 5 covers `[4,7)`.
///
/// @param rows the selected rows
/// @param cols the selected columns
public record RegionOfInterest(Interval rows, Interval cols) {

  /// @param frameRows the number of rows in a frame
  /// @param frameCols the number of columns in a frame
  /// @return the whole frame
  public static RegionOfInterest full(int frameRows, int frameCols) {
    return new RegionOfInterest(new Interval(0, frameRows), new Interval(0, frameCols));
  }

  /// Compute a window and check that it lies within the frame.
  /// @param frameRows the number of rows in a frame
  /// @param frameCols the number of columns in a frame
  /// @param size the window size as `(rows, columns)`
  /// @param center the window center, or null for the center of the frame
  /// @return the window
  public static RegionOfInterest of(int frameRows, int frameCols, int[] size, double[] center) {
    double ctrRow = center == null ? Math.floorDiv(frameRows, 2) : center[0];
    double ctrCol = center == null ? Math.floorDiv(frameCols, 2) : center[1];
    RegionOfInterest roi = new RegionOfInterest(
        window(ctrRow, size[0]), window(ctrCol, size[1]));
    if (roi.rows.minIncl() < 0 || roi.rows.maxExcl() > frameRows
        || roi.cols.minIncl() < 0 || roi.cols.maxExcl() > frameCols) {
      throw new ConfigException(
          "region of interest " + roi + " lies outside the " + frameRows + "x" + frameCols
          + " frame");
    }
    return roi;
  }

  private static Interval window(double center, int size) {
    if (size < 0) {
      throw new ConfigException("region of interest size must not be negative, but was " + size);
    }
    int start = (int) Math.ceil(center - size / 2.0);
    int end = (int) Math.ceil(center + size / 2.0);
    return new Interval(start, end);
  }

  /// Accept either a single number for both axes or a pair.
  /// @param value a number, a two element list, or an int or double array
  /// @return the pair
  public static double[] expect2(Object value) {
    if (value instanceof Number n) {
      return new double[]{n.doubleValue(), n.doubleValue()};
    } else if (value instanceof double[] pair && pair.length == 2) {
      return pair.clone();
    } else if (value instanceof int[] pair && pair.length == 2) {
      return new double[]{pair[0], pair[1]};
    } else if (value instanceof List<?> list && list.size() == 2
        && list.get(0) instanceof Number a && list.get(1) instanceof Number b) {
      return new double[]{a.doubleValue(), b.doubleValue()};
    }
    throw new ConfigException("expected a number or a pair of numbers, but got " + value);
  }

  /// @return the window shape as `(rows, columns)`
  public int[] shape() {
    return new int[]{rows.count(), cols.count()};
  }

  @Override
  public String toString() {
    return rows.toData() + "x" + cols.toData();
  }
}
