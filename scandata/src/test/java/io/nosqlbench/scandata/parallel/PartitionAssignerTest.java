package io.nosqlbench.scandata.parallel;

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
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PartitionAssignerTest {

  private static List<FrameIdentity> identities(int count) {
    List<FrameIdentity> identities = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      identities.add(new FrameIdentity("scan", i));
    }
    return identities;
  }

  @Test
  public void testBlocksAreDisjointContiguousAndCovering() {
    PartitionAssigner assigner = new PartitionAssigner();
    for (int frames = 0; frames <= 40; frames++) {
      for (int workers = 1; workers <= 9; workers++) {
        List<List<Integer>> blocks = assigner.assign(identities(frames), workers);
        assertThat(blocks).hasSize(workers);

        Set<Integer> seen = new HashSet<>();
        int next = 0;
        int largest = 0;
        int smallest = Integer.MAX_VALUE;
        for (List<Integer> block : blocks) {
          Interval interval = PartitionAssigner.contiguous(block);
          if (!block.isEmpty()) {
            assertThat(interval.minIncl()).isEqualTo(next);
            next = interval.maxExcl();
          }
          for (int index : block) {
            assertThat(seen.add(index)).as("frame %d assigned twice", index).isTrue();
          }
          largest = Math.max(largest, block.size());
          smallest = Math.min(smallest, block.size());
        }
        assertThat(seen).hasSize(frames);
        assertThat(next).isEqualTo(frames);
        assertThat(largest - smallest).isLessThanOrEqualTo(1);
      }
    }
  }

  @Test
  public void testRemainderGoesToEarliestWorkers() {
    PartitionAssigner assigner = new PartitionAssigner();
    assertThat(assigner.assign(identities(11), 3))
        .containsExactly(List.of(0, 1, 2, 3), List.of(4, 5, 6, 7), List.of(8, 9, 10));
    assertThat(assigner.assign(identities(9), 3, 1)).isEqualTo(new Interval(3, 6));
    assertThat(assigner.assign(identities(2), 4, 3).count()).isZero();
  }

  @Test
  public void testAssignmentIsDeterministic() {
    PartitionAssigner assigner = new PartitionAssigner();
    assertThat(assigner.assign(identities(17), 4))
        .isEqualTo(new PartitionAssigner().assign(identities(17), 4));
  }

  @Test
  public void testInvalidArguments() {
    PartitionAssigner assigner = new PartitionAssigner();
    assertThatThrownBy(() -> assigner.assign(identities(4), 0))
        .isInstanceOf(ConfigException.class);
    assertThatThrownBy(() -> assigner.assign(identities(4), 2, 2))
        .isInstanceOf(ConfigException.class);
    assertThatThrownBy(() -> PartitionAssigner.contiguous(List.of(1, 3)))
        .isInstanceOf(ConfigException.class);
  }
}
