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


import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/// Translates scan metadata keys into the names used by reconstruction models, and back.
///
/// A translator is immutable. Build it once and hand it to whatever produces data packages.
public class MetaTranslator {

  private final Map<String, String> toMeta;
  private final Map<String, String> toScanInfo;

  /// create a translator
  /// @param renames scan metadata keys which are known under another name; every other key of
  ///     [ScanMetadata#KEYS] keeps its name
  public MetaTranslator(Map<String, String> renames) {
    Map<String, String> forward = new LinkedHashMap<>();
    for (String key : ScanMetadata.KEYS) {
      forward.put(key, renames.getOrDefault(key, key));
    }
    Map<String, String> inverse = new LinkedHashMap<>();
    forward.forEach((scanKey, metaKey) -> {
      String previous = inverse.put(metaKey, scanKey);
      if (previous != null) {
        throw new IllegalArgumentException(
            "keys '" + previous + "' and '" + scanKey + "' both translate to '" + metaKey + "'");
      }
    });
    this.toMeta = Collections.unmodifiableMap(forward);
    this.toScanInfo = Collections.unmodifiableMap(inverse);
  }

  /// @return the translator for the standard model vocabulary
  public static MetaTranslator standard() {
    return new MetaTranslator(Map.of(
        "scan_label", "label_original",
        "wavelength", "lam",
        "detector_distance", "z",
        "detector_pixel_size", "psize_det"
    ));
  }

  /// @param scanKey a scan metadata key
  /// @return the model name of the key, or empty if the key is unknown
  public Optional<String> asMeta(String scanKey) {
    return Optional.ofNullable(toMeta.get(scanKey));
  }

  /// @param metaKey a model key
  /// @return the scan metadata name of the key, or empty if the key is unknown
  public Optional<String> asScanInfo(String metaKey) {
    return Optional.ofNullable(toScanInfo.get(metaKey));
  }

  /// @param scanInfo values by scan metadata key
  /// @return the known values by model key; unknown keys are dropped
  public Map<String, Object> asMeta(Map<String, ?> scanInfo) {
    return translate(scanInfo, toMeta);
  }

  /// @param meta values by model key
  /// @return the known values by scan metadata key; unknown keys are dropped
  public Map<String, Object> asScanInfo(Map<String, ?> meta) {
    return translate(meta, toScanInfo);
  }

  private static Map<String, Object> translate(Map<String, ?> values, Map<String, String> table) {
    Map<String, Object> translated = new LinkedHashMap<>();
    values.forEach((key, value) -> {
      String name = table.get(key);
      if (name != null) {
        translated.put(name, value);
      }
    });
    return translated;
  }
}
