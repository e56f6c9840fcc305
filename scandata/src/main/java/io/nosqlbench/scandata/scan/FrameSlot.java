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

/// One entry of a per-frame view list. A worker either holds the frame plane or does not.
public sealed interface FrameSlot {

  /// the shared marker for frames held elsewhere
  Absent ABSENT = new Absent();

  /// @return true if this worker holds the plane
  boolean isOwned();

  /// @return the plane
  /// @throws IllegalStateException if the frame is absent
  float[][] plane();

  /// @param plane a frame plane held by this worker
  /// @return an owned slot
  static FrameSlot owned(float[][] plane) {
    return new Owned(plane);
  }

  /// A frame held by this worker.
  /// @param plane the `(rows, columns)` frame values
  record Owned(float[][] plane) implements FrameSlot {
    @Override
    public boolean isOwned() {
      return true;
    }
  }

  /// A frame held by another worker, or not loaded at all.
  record Absent() implements FrameSlot {
    @Override
    public boolean isOwned() {
      return false;
    }

    @Override
    public float[][] plane() {
      throw new IllegalStateException("frame is not held by this worker");
    }
  }
}
