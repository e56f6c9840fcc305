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


import io.nosqlbench.scandata.SHARED;
import io.nosqlbench.scandata.errors.ConfigException;
import io.nosqlbench.scandata.errors.MissingDataException;
import io.nosqlbench.scandata.store.Hdf5ArrayStore;
import io.nosqlbench.scandata.store.KeyedArrayStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// A scan container file, as written by [ScanContainer#save(Path, OverwritePolicy, OverwriteConfirmation)].
///
/// The metadata is kept in the file as a JSON root attribute named `scan_info`. Older files keep
/// it as the attributes of a `scan_info` group instead; both are accepted. The recorded
/// `data_filename` is replaced by the path the file was actually opened from.
public final class FileScanSource implements ScanSource {

  private static final Logger logger = LogManager.getLogger(FileScanSource.class);

  /// file name extensions of scan container files
  public static final List<String> EXTENSIONS = List.of(".h5", ".ptyd");
  /// the attribute, or group, holding the scan metadata
  public static final String SCAN_INFO = "scan_info";

  private final Path path;
  private final Hdf5ArrayStore store;

  /// @param path a scan container file
  public FileScanSource(Path path) {
    if (!isScanFile(path.toString())) {
      throw new ConfigException(
          "'" + path + "' is not a scan container file; expected one of " + EXTENSIONS);
    }
    if (!Files.isRegularFile(path)) {
      throw new ConfigException("scan container file '" + path + "' does not exist");
    }
    this.path = path;
    this.store = new Hdf5ArrayStore(path);
  }

  /// @param name a file name
  /// @return true if the name has a scan container extension
  public static boolean isScanFile(String name) {
    return EXTENSIONS.stream().anyMatch(name::endsWith);
  }

  @Override
  public Map<String, Object> metadataOverlay() {
    Map<String, Object> overlay = new LinkedHashMap<>();
    Optional<String> json = store.readRootAttribute(SCAN_INFO);
    if (json.isPresent()) {
      overlay.putAll(SHARED.mapFromJson(json.get()));
    } else {
      Map<String, Object> legacy = store.readGroupAttributes(SCAN_INFO).orElseThrow(
          () -> new MissingDataException("'" + path + "' has no " + SCAN_INFO + " metadata"));
      logger.debug("reading {} group attributes {} from {}", SCAN_INFO, legacy.keySet(), path);
      overlay.putAll(legacy);
    }
    overlay.put("data_filename", path.toString());
    return overlay;
  }

  @Override
  public KeyedArrayStore openStore(ScanMetadata metadata) {
    return store;
  }

  @Override
  public String toString() {
    return "FileScanSource{" + path + "}";
  }
}
