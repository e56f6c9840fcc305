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


import io.jhdf.HdfFile;
import io.jhdf.WritableHdfFile;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.UUID;

/// Writes a [ScanRecord] as an HDF5 scan container with jhdf.
///
/// Each array becomes a top-level dataset and each attribute a root attribute. The file is
/// first written next to the destination and then moved into place.
public class Hdf5ScanWriter implements ScanRecordWriter {

  private static final Logger logger = LogManager.getLogger(Hdf5ScanWriter.class);

  @Override
  public void write(Path destination, ScanRecord record, WriteMode mode) {
    Path target = destination.toAbsolutePath();
    Path parent = target.getParent();
    Path staging = parent.resolve("." + target.getFileName() + "." + UUID.randomUUID() + ".tmp");
    try {
      Files.createDirectories(parent);
      try (WritableHdfFile writable = HdfFile.write(staging)) {
        for (Map.Entry<String, NdArray> entry : record.arrays().entrySet()) {
          if (entry.getValue() == null) {
            unsupported(mode, "array '" + entry.getKey() + "' is absent");
            continue;
          }
          writable.putDataset(entry.getKey(), entry.getValue().toNested());
        }
        for (Map.Entry<String, Object> entry : record.attributes().entrySet()) {
          Object value = entry.getValue();
          if (value instanceof String || value instanceof Number) {
            writable.putAttribute(entry.getKey(), value);
          } else {
            unsupported(mode, "attribute '" + entry.getKey() + "' has unsupported value " + value);
          }
        }
      }
      moveIntoPlace(staging, target);
      logger.debug("wrote {} arrays and {} attributes to {}", record.arrays().size(),
          record.attributes().size(), target);
    } catch (IOException e) {
      throw new UncheckedIOException("unable to write scan record to " + target, e);
    } finally {
      try {
        Files.deleteIfExists(staging);
      } catch (IOException e) {
        logger.warn("unable to remove staging file {}: {}", staging, e.getMessage());
      }
    }
  }

  private void unsupported(WriteMode mode, String what) {
    if (mode == WriteMode.STRICT) {
      throw new IllegalArgumentException("cannot write scan record: " + what);
    }
    logger.debug("skipping unsupported field: {}", what);
  }

  private static void moveIntoPlace(Path staging, Path target) throws IOException {
    try {
      Files.move(staging, target, StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(staging, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
