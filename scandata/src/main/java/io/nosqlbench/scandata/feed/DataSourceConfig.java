package io.nosqlbench.scandata.feed;

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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/// A description of the scans to aggregate and how to deliver them.
///
/// In YAML form:
/// ```yaml
/// sources:
///   - scans/first.h5
///   - scans/second.ptyd
/// labels: [first, second]
/// overrides:
///   - {wavelength: 1.0e-10}
/// delivery: chunked
/// chunk_size: 5
/// ```
///
/// Only `sources` is required. A null source stands for an empty scan.
///
/// @param sources the scan sources, in delivery order
/// @param labels labels for the sources by position
/// @param overrides metadata overrides for the sources by position
/// @param delivery how scans are batched
/// @param chunkSize the frames per batch for chunked delivery
public record DataSourceConfig(
    List<Object> sources,
    List<String> labels,
    List<Map<String, Object>> overrides,
    Delivery delivery,
    int chunkSize
) {

  /// the batching modes
  public enum Delivery {
    /// one batch per scan
    WHOLE,
    /// a fixed number of frames per batch
    CHUNKED
  }

  public DataSourceConfig {
    sources = sources == null ? List.of() : new ArrayList<>(sources);
    labels = labels == null ? List.of() : new ArrayList<>(labels);
    overrides = overrides == null ? List.of() : List.copyOf(overrides);
    delivery = delivery == null ? Delivery.WHOLE : delivery;
    if (chunkSize < 1) {
      throw new ConfigException("chunk_size must be at least 1, but was " + chunkSize);
    }
  }

  /// @param path a YAML file
  /// @return the configuration it holds
  public static DataSourceConfig fromPath(Path path) {
    if (!Files.isRegularFile(path)) {
      throw new ConfigException("data source configuration not found: " + path);
    }
    try {
      return fromYaml(Files.readString(path));
    } catch (IOException e) {
      throw new RuntimeException("Failed to read data source configuration: " + path, e);
    }
  }

  /// @param yaml the YAML text
  /// @return the configuration it holds
  public static DataSourceConfig fromYaml(String yaml) {
    Object loaded = SHARED.yamlLoader.loadFromString(yaml);
    if (!(loaded instanceof Map<?, ?> map)) {
      throw new ConfigException("data source configuration must be a map, not " + loaded);
    }
    return fromMap(map);
  }

  /// @param map the configuration fields by name
  /// @return the configuration
  public static DataSourceConfig fromMap(Map<?, ?> map) {
    List<Object> sources = new ArrayList<>(listOf(map, "sources"));
    List<String> labels = new ArrayList<>();
    for (Object label : listOf(map, "labels")) {
      labels.add(label == null ? null : label.toString());
    }
    List<Map<String, Object>> overrides = new ArrayList<>();
    for (Object entry : listOf(map, "overrides")) {
      if (entry == null) {
        overrides.add(Map.of());
      } else if (entry instanceof Map<?, ?> pars) {
        Map<String, Object> converted = new LinkedHashMap<>();
        pars.forEach((k, v) -> converted.put(String.valueOf(k), v));
        overrides.add(converted);
      } else {
        throw new ConfigException("each of 'overrides' must be a map, not " + entry);
      }
    }

    Object deliveryName = map.get("delivery");
    Delivery delivery = Delivery.WHOLE;
    if (deliveryName != null) {
      try {
        delivery = Delivery.valueOf(deliveryName.toString().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("unknown delivery '" + deliveryName + "', expected whole or chunked",
            e);
      }
    }

    Object chunk = map.get("chunk_size");
    int chunkSize = ChunkedDelivery.DEFAULT_CHUNK_SIZE;
    if (chunk instanceof Number n) {
      chunkSize = n.intValue();
    } else if (chunk != null) {
      throw new ConfigException("chunk_size must be a number, not " + chunk);
    }
    return new DataSourceConfig(sources, labels, overrides, delivery, chunkSize);
  }

  private static List<?> listOf(Map<?, ?> map, String key) {
    Object value = map.get(key);
    if (value == null) {
      return List.of();
    }
    if (value instanceof List<?> list) {
      return list;
    }
    throw new ConfigException("'" + key + "' must be a list, not " + value);
  }

  /// @return a new strategy for the configured delivery mode
  public DeliveryStrategy newDeliveryStrategy() {
    return delivery == Delivery.CHUNKED ? new ChunkedDelivery(chunkSize) : new WholeScanDelivery();
  }
}
