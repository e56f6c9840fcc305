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

import java.util.ArrayList;
import java.util.List;

/// Splits an ordered list of frame identities into one contiguous block per worker.
///
/// The split depends only on the list and the worker count, so every worker computes the same
/// partition without communicating. Blocks follow list order; when the list does not divide
/// evenly, the earliest blocks take one extra identity each.
public class PartitionAssigner {

  /// Assign every position of the identity list to a worker.
  /// @param identities the frames to distribute, in order
  /// @param workerCount the number of workers
  /// @return for each rank, the positions in `identities` it owns
  public List<List<Integer>> assign(List<FrameIdentity> identities, int workerCount) {
    if (workerCount < 1) {
      throw new ConfigException("worker count must be at least 1, but was " + workerCount);
    }
    int total = identities.size();
    int base = total / workerCount;
    int remainder = total % workerCount;

    List<List<Integer>> blocks = new ArrayList<>(workerCount);
    int next = 0;
    for (int rank = 0; rank < workerCount; rank++) {
      int count = base + (rank < remainder ? 1 : 0);
      List<Integer> block = new ArrayList<>(count);
      for (int i = 0; i < count; i++) {
        block.add(next++);
      }
      blocks.add(block);
    }
    return blocks;
  }

  /// Assign the identity list and return the block of one worker as an interval.
  /// @param identities the frames to distribute, in order
  /// @param workerCount the number of workers
  /// @param rank the worker to return the block for
  /// @return the contiguous positions owned by `rank`, possibly empty
  public Interval assign(List<FrameIdentity> identities, int workerCount, int rank) {
    if (rank < 0 || rank >= workerCount) {
      throw new ConfigException("rank " + rank + " is outside a group of " + workerCount);
    }
    return contiguous(assign(identities, workerCount).get(rank));
  }

  /// Convert an assigned block into an interval. Downstream slicing reads one range per
  /// worker, so a block with gaps is a configuration error.
  /// @param block assigned positions in increasing order
  /// @return the interval `[first, last+1)`, or an empty interval for an empty block
  public static Interval contiguous(List<Integer> block) {
    if (block.isEmpty()) {
      return new Interval(0, 0);
    }
    int first = block.get(0);
    int last = block.get(block.size() - 1);
    if (last - first + 1 != block.size()) {
      throw new ConfigException("assigned frames " + block + " are not contiguous");
    }
    for (int i = 1; i < block.size(); i++) {
      if (block.get(i) != first + i) {
        throw new ConfigException("assigned frames " + block + " are not contiguous");
      }
    }
    return new Interval(first, last + 1);
  }
}
