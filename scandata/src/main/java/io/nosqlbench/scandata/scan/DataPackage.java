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
import java.util.Map;

/// A batch of frames of one scan, together with the scan-wide values a reconstruction model
/// needs.
///
/// @param common scan metadata in model vocabulary, plus the scan `label`
/// @param iterable the frames of the batch, in index order
public record DataPackage(Map<String, Object> common, List<FramePackage> iterable) {

  public DataPackage {
    common = Map.copyOf(common);
    iterable = List.copyOf(iterable);
  }

  /// @return the scan label
  public String label() {
    return (String) common.get("label");
  }

  /// @return the number of frames in the batch
  public int size() {
    return iterable.size();
  }
}
