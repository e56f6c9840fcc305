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


import io.nosqlbench.scandata.errors.MissingDataException;
import io.nosqlbench.scandata.errors.SliceException;
import io.nosqlbench.scandata.parallel.CoordinationContext;
import io.nosqlbench.scandata.store.KeyedArrayStore;
import io.nosqlbench.scandata.store.MissingKeyException;
import io.nosqlbench.scandata.store.NdArray;
import io.nosqlbench.scandata.store.SliceIndexException;
import io.nosqlbench.scandata.store.SliceSpec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;

/// Reads one array of a scan from a store, tolerating the layouts scan files come in.
///
/// Calibration arrays such as masks and flats are often stored as a single 2-D plane even
/// though a 3-D frame stack slice is requested. When the store rejects a slice, the outermost
/// dimension is dropped and the read is tried again, until a read succeeds or no dimensions
/// are left. When a key is missing, an alternate key is tried once with the same slice.
public class FrameLoader {

  private static final Logger logger = LogManager.getLogger(FrameLoader.class);

  private final KeyedArrayStore store;
  private final CoordinationContext context;

  /// @param store the store to read from
  /// @param context the worker doing the reading, for log records
  public FrameLoader(KeyedArrayStore store, CoordinationContext context) {
    this.store = store;
    this.context = context;
  }

  /// Load an array.
  /// @param key the array name
  /// @param slice the selection to read
  /// @param altKey a name to try when `key` is missing; may be null
  /// @param required whether a missing array is an error
  /// @return the array, or empty when an optional array is missing
  /// @throws MissingDataException if a required array is missing
  /// @throws SliceException if no reduction of the slice fits the stored array
  public Optional<NdArray> load(String key, SliceSpec slice,
                                String altKey, boolean required) {
    return attempt(key, slice, slice, altKey, required);
  }

  private Optional<NdArray> attempt(String key, SliceSpec requested,
                                    SliceSpec slice, String altKey,
                                    boolean required) {
    try {
      NdArray array = store.read(key, slice);
      logger.debug("worker {} loaded '{}' with slice {}", context.rank(), key, slice.toData());
      return Optional.of(array);
    } catch (SliceIndexException e) {
      if (slice.isEmpty()) {
        throw new SliceException(
            "no reduction of slice " + requested.toData() + " fits array '" + key + "'", e);
      }
      logger.debug("worker {} could not slice '{}' with {}, reducing slice by one dimension",
          context.rank(), key, slice.toData());
      return attempt(key, requested, slice.dropOuter(), altKey, required);
    } catch (MissingKeyException e) {
      if (altKey != null) {
        logger.debug("worker {} found no '{}', trying alternate key '{}'", context.rank(), key,
            altKey);
        return attempt(altKey, requested, slice, null, required);
      }
      if (required) {
        throw new MissingDataException("required array '" + key + "' is missing from " + store, e);
      }
      logger.debug("worker {} found no '{}' frames", context.rank(), key);
      return Optional.empty();
    }
  }
}
