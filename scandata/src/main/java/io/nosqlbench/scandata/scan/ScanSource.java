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

import java.util.Map;

/// Where the frames and metadata of a scan come from.
///
/// A source is chosen once, when the scan container is built, and then supplies both the
/// metadata found with the data and the store the frames are read from.
public sealed interface ScanSource permits EmptyScanSource, FileScanSource, MappingScanSource {

  /// @return metadata values found with the data, by snake_case key; laid over the caller's
  ///     overrides
  Map<String, Object> metadataOverlay();

  /// @param metadata the resolved scan metadata
  /// @return the store to read frames from
  KeyedArrayStore openStore(ScanMetadata metadata);
}
