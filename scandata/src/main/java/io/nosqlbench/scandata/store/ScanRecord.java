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


import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Everything persisted for one scan, written as a unit.
///
/// Array values may be null, meaning the scan has no such array. Attributes are written to the
/// root of the container.
///
/// @param arrays the arrays by name, in write order
/// @param attributes the root attributes by name
public record ScanRecord(Map<String, NdArray> arrays, Map<String, Object> attributes) {

  /// create a record; both maps are copied, keeping null array values
  /// @param arrays the arrays by name
  /// @param attributes the root attributes by name
  public ScanRecord {
    arrays = Collections.unmodifiableMap(new LinkedHashMap<>(arrays));
    attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }
}
