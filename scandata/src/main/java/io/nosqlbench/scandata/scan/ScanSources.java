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


import io.nosqlbench.scandata.errors.ConfigException;
import io.nosqlbench.scandata.store.NdArray;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/// Chooses a [ScanSource] for a loosely typed source description.
public class ScanSources {

  /// Choose a source.
  ///
  /// - `null` is an empty scan
  /// - a [String] or [Path] naming a `.h5` or `.ptyd` file is a scan container file
  /// - a [Map] holds arrays, as [NdArray] or nested Java arrays, and optionally a `scan_info`
  ///   map of metadata
  /// - a [ScanSource] is used as is
  ///
  /// @param source the source description
  /// @return the source
  public static ScanSource of(Object source) {
    if (source == null) {
      return EmptyScanSource.INSTANCE;
    } else if (source instanceof ScanSource scanSource) {
      return scanSource;
    } else if (source instanceof Path path) {
      return new FileScanSource(path);
    } else if (source instanceof String name) {
      if (!FileScanSource.isScanFile(name)) {
        throw new ConfigException("unsupported scan source '" + name + "'; expected one of "
            + FileScanSource.EXTENSIONS);
      }
      return new FileScanSource(Path.of(name));
    } else if (source instanceof Map<?, ?> map) {
      return fromMap(map);
    }
    throw new ConfigException("unsupported scan source type " + source.getClass().getName());
  }

  private static MappingScanSource fromMap(Map<?, ?> map) {
    Map<String, NdArray> arrays = new LinkedHashMap<>();
    Map<String, Object> scanInfo = null;
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      String key = String.valueOf(entry.getKey());
      Object value = entry.getValue();
      if (FileScanSource.SCAN_INFO.equals(key)) {
        if (!(value instanceof Map<?, ?> info)) {
          throw new ConfigException("scan_info must be a map, not " + value);
        }
        scanInfo = new LinkedHashMap<>();
        for (Map.Entry<?, ?> field : info.entrySet()) {
          scanInfo.put(String.valueOf(field.getKey()), field.getValue());
        }
      } else if (value instanceof NdArray array) {
        arrays.put(key, array);
      } else if (value != null && value.getClass().isArray()) {
        arrays.put(key, NdArray.fromNested(value));
      } else {
        throw new ConfigException("scan array '" + key + "' is not an array: " + value);
      }
    }
    return new MappingScanSource(arrays, scanInfo);
  }
}
