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

import java.util.List;

/// How the frames of a load are divided between workers.
public sealed interface PartitionMode {

  /// every worker loads the whole requested range
  PartitionMode ALL_FRAMES = new AllFrames();
  /// the requested range is split into one contiguous block per worker
  PartitionMode AUTO = new Auto();

  /// @param indices absolute frame indices
  /// @return a mode loading exactly these frames on this worker
  static PartitionMode explicit(List<Integer> indices) {
    return new ExplicitIndices(indices);
  }

  /// Load the whole range on every worker.
  record AllFrames() implements PartitionMode {
  }

  /// Split the range with the partition assigner.
  record Auto() implements PartitionMode {
  }

  /// Load the listed frames, bypassing the assigner.
  /// @param indices absolute frame indices
  record ExplicitIndices(List<Integer> indices) implements PartitionMode {
    public ExplicitIndices {
      indices = List.copyOf(indices);
    }
  }
}
