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


import io.nosqlbench.scandata.store.KeyedArrayStore;
import io.nosqlbench.scandata.store.SyntheticArrayStore;

import java.util.Map;

/// A scan with no recorded data. Frames are zeros, masks and flats are ones, in the declared
/// shape.
public final class EmptyScanSource implements ScanSource {

  /// the only instance
  public static final EmptyScanSource INSTANCE = new EmptyScanSource();

  private EmptyScanSource() {
  }

  @Override
  public Map<String, Object> metadataOverlay() {
    return Map.of();
  }

  @Override
  public KeyedArrayStore openStore(ScanMetadata metadata) {
    return new SyntheticArrayStore(metadata.shape());
  }

  @Override
  public String toString() {
    return "EmptyScanSource";
  }
}
