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


import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class NdArrayTest {

  private static NdArray counting(int... shape) {
    NdArray zeros = NdArray.zeros(shape);
    float[] values = zeros.values();
    for (int i = 0; i < values.length; i++) {
      values[i] = i;
    }
    return zeros;
  }

  @Test
  public void testSelectFramesAndWindow() {
    NdArray stack = counting(4, 3, 3);
    NdArray selected = stack.select(
        SliceSpec.of(new Interval(1, 3), new Interval(1, 3), new Interval(0, 2)));
    assertThat(selected.shape()).containsExactly(2, 2, 2);
    assertThat(selected.values()).containsExactly(12, 13, 15, 16, 21, 22, 24, 25);
  }

  @Test
  public void testSelectIndexList() {
    NdArray stack = counting(4, 2, 2);
    NdArray selected = stack.select(
        SliceSpec.of(new IndexList(new int[]{3, 0}), DimSelector.ALL, DimSelector.ALL));
    assertThat(selected.plane(0)).isEqualTo(new float[][]{{12, 13}, {14, 15}});
    assertThat(selected.plane(1)).isEqualTo(new float[][]{{0, 1}, {2, 3}});
  }

  @Test
  public void testSelectRankMismatch() {
    NdArray plane = counting(3, 3);
    assertThatThrownBy(() -> plane.select(
        SliceSpec.of(new Interval(0, 1), DimSelector.ALL, DimSelector.ALL)))
        .isInstanceOf(SliceIndexException.class);
    assertThat(plane.select(SliceSpec.of(new Interval(0, 1), DimSelector.ALL, DimSelector.ALL)
        .dropOuter()).values()).containsExactly(0, 1, 2, 3, 4, 5, 6, 7, 8);
  }

  @Test
  public void testNestedConversion() {
    NdArray fromInts = NdArray.fromNested(new int[][]{{1, 2, 3}, {4, 5, 6}});
    assertThat(fromInts.shape()).containsExactly(2, 3);
    assertThat(fromInts.values()).containsExactly(1, 2, 3, 4, 5, 6);
    assertThat((float[][]) fromInts.toNested()).isEqualTo(new float[][]{{1, 2, 3}, {4, 5, 6}});

    NdArray fromBooleans = NdArray.fromNested(new boolean[]{true, false});
    assertThat(fromBooleans.values()).containsExactly(1, 0);
  }

  @Test
  public void testStackAndConcat() {
    NdArray stacked = NdArray.stack(List.of(new float[][]{{1, 2}}, new float[][]{{3, 4}}));
    assertThat(stacked.shape()).containsExactly(2, 1, 2);
    NdArray joined = NdArray.concat(List.of(stacked, stacked));
    assertThat(joined.shape()).containsExactly(4, 1, 2);
    assertThat(joined.values()).containsExactly(1, 2, 3, 4, 1, 2, 3, 4);
    assertThatThrownBy(() -> NdArray.stack(List.of(new float[][]{{1, 2}}, new float[][]{{3}})))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
