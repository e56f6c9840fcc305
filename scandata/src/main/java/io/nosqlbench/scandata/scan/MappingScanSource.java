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


import io.nosqlbench.scandata.store.InMemoryArrayStore;
import io.nosqlbench.scandata.store.KeyedArrayStore;
import io.nosqlbench.scandata.store.NdArray;

import java.util.LinkedHashMap;
import java.util.Map;

/// A scan held in memory by the caller.
public final class MappingScanSource implements ScanSource {

  private final Map<String, NdArray> arrays;
  private final Map<String, Object> scanInfo;

  /// @param arrays the scan arrays by key, such as `data` and `mask`
  /// @param scanInfo metadata by snake_case key; may be null
  public MappingScanSource(Map<String, NdArray> arrays, Map<String, ?> scanInfo) {
    this.arrays = Map.copyOf(arrays);
    this.scanInfo = scanInfo == null ? Map.of() : new LinkedHashMap<>(scanInfo);
  }

  @Override
  public Map<String, Object> metadataOverlay() {
    return scanInfo;
  }

  @Override
  public KeyedArrayStore openStore(ScanMetadata metadata) {
    return new InMemoryArrayStore(arrays);
  }

  @Override
  public String toString() {
    return "MappingScanSource{" + arrays.keySet() + "}";
  }
}
