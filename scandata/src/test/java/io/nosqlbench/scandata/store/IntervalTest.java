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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class IntervalTest {

  @Test
  public void testParseForms() {
    assertThat(Interval.parse("2..5")).isEqualTo(new Interval(2, 5));
    assertThat(Interval.parse("7")).isEqualTo(new Interval(0, 7));
    assertThat(Interval.parse("[3..9)").count()).isEqualTo(6);
  }

  @Test
  public void testResolveWithinExtent() {
    assertThat(new Interval(1, 4).resolve(4)).containsExactly(1, 2, 3);
    assertThat(new Interval(2, 2).resolve(4)).isEmpty();
  }

  @Test
  public void testResolveBeyondExtent() {
    assertThatThrownBy(() -> new Interval(2, 6).resolve(5))
        .isInstanceOf(SliceIndexException.class);
    assertThatThrownBy(() -> new Interval(-1, 2).resolve(5))
        .isInstanceOf(SliceIndexException.class);
  }

  @Test
  public void testIndexListBounds() {
    IndexList list = new IndexList(new int[]{4, 1, 3});
    assertThat(list.resolve(5)).containsExactly(4, 1, 3);
    assertThat(list.isContiguous()).isFalse();
    assertThat(new IndexList(new int[]{2, 3, 4}).isContiguous()).isTrue();
    assertThatThrownBy(() -> list.resolve(4)).isInstanceOf(SliceIndexException.class);
  }
}
