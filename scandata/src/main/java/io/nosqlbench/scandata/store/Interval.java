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


import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Represents an interval with inclusive minimum and exclusive maximum bounds.
///
/// Intervals select frame ranges and region-of-interest rows or columns. The textual form is
/// `start..end`, optionally wrapped in brackets, like `[10..20)`. A single number `n` is read
/// as `0..n`.
///
/// @param minIncl The inclusive minimum bound of the interval
/// @param maxExcl The exclusive maximum bound of the interval
public record Interval(int minIncl, int maxExcl) implements DimSelector {

  /// the pattern for parsing an interval spec
  public final static Pattern PATTERN = Pattern.compile(
      """
          [(\\[]? \\s*
          (?<start>-?\\d[\\d_]*) \\s*
          ((\\.\\.|→) \\s*
          (?<end>-?\\d[\\d_]*))? \\s*
          [)\\]]? \\s*
          """, Pattern.COMMENTS | Pattern.DOTALL
  );

  /// Parses an interval from a string representation.
  ///
  /// @param interval The string representation of the interval
  /// @return The parsed Interval
  public static Interval parse(String interval) {
    Matcher matcher = PATTERN.matcher(interval);
    if (matcher.matches()) {
      int start = Integer.parseInt(matcher.group("start").replaceAll("_", ""));
      if (matcher.group("end") == null) {
        return new Interval(0, start);
      }
      int end = Integer.parseInt(matcher.group("end").replaceAll("_", ""));
      return new Interval(start, end);
    }
    throw new IllegalArgumentException(
        "invalid interval format:" + interval + ", expected [start..end] or any similar pattern "
        + "with optional ( or [, digits, .. or →, digits, and optional ) or ], like '[10..1000)'");
  }

  /// @return The count of elements in this interval (maxExcl - minIncl)
  public int count() {
    return maxExcl - minIncl;
  }

  @Override
  public int[] resolve(int extent) {
    if (minIncl < 0 || maxExcl > extent || minIncl > maxExcl) {
      throw new SliceIndexException(
          "interval " + toData() + " does not fit a dimension of extent " + extent);
    }
    int[] positions = new int[count()];
    for (int i = 0; i < positions.length; i++) {
      positions[i] = minIncl + i;
    }
    return positions;
  }

  @Override
  public boolean isContiguous() {
    return true;
  }

  @Override
  public String toData() {
    return "[" + minIncl + ".." + maxExcl + ")";
  }

  @Override
  public String toString() {
    return toData();
  }
}
