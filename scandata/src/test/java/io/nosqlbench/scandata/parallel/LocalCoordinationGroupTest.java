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


import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class LocalCoordinationGroupTest {

  @Test
  @Timeout(10)
  public void testOrderedExchangeWithBarriers() {
    LocalCoordinationGroup group = new LocalCoordinationGroup(3);
    List<List<Integer>> results = group.run(context -> {
      List<Integer> received = new ArrayList<>();
      for (int round = 0; round < 3; round++) {
        if (context.isCoordinator()) {
          if (round != 0) {
            received.add(context.receive());
          }
        } else if (context.rank() == round) {
          context.send(round * 10);
        }
        context.barrier();
      }
      return received;
    });
    assertThat(results.get(0)).containsExactly(10, 20);
    assertThat(results.get(1)).isEmpty();
    assertThat(results.get(2)).isEmpty();
  }

  @Test
  @Timeout(10)
  public void testFailurePropagatesAndReleasesOthers() {
    LocalCoordinationGroup group = new LocalCoordinationGroup(3);
    assertThatThrownBy(() -> group.run(context -> {
      if (context.rank() == 2) {
        throw new IllegalStateException("worker 2 broke");
      }
      context.barrier();
      return context.rank();
    })).isInstanceOf(IllegalStateException.class).hasMessage("worker 2 broke");
  }

  @Test
  public void testContexts() {
    LocalCoordinationGroup group = new LocalCoordinationGroup(2);
    assertThat(group.size()).isEqualTo(2);
    assertThat(group.context(0).isCoordinator()).isTrue();
    assertThat(group.context(1).isCoordinator()).isFalse();
    assertThat(group.context(1).isParallel()).isTrue();
    assertThatThrownBy(() -> new LocalCoordinationGroup(0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void testSingleProcessContext() {
    CoordinationContext context = SingleProcessContext.INSTANCE;
    assertThat(context.size()).isEqualTo(1);
    assertThat(context.isCoordinator()).isTrue();
    assertThat(context.isParallel()).isFalse();
    context.barrier();
    assertThatThrownBy(() -> context.send("x")).isInstanceOf(IllegalStateException.class);
  }
}
